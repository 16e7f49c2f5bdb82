/**
 * The default guard vocabulary, registered through
 * {@link com.ryuqq.olympus.core.guard.builtin.BuiltinGuards#registerAll(com.ryuqq.olympus.core.guard.GuardRegistry)}.
 *
 * <p>Every guard here treats a null or wrong-kind value as unsatisfied, except
 * {@code required} whose whole purpose is the null check.</p>
 */
package com.ryuqq.olympus.core.guard.builtin;
