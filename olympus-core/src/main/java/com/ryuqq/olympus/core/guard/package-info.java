/**
 * Rule-string validation.
 *
 * <p>A rule string such as {@code "required|!empty|lt[18]"} is parsed by
 * {@link com.ryuqq.olympus.core.guard.RuleParser}, each rule is resolved to a
 * {@link com.ryuqq.olympus.core.guard.Guard} through an injected
 * {@link com.ryuqq.olympus.core.guard.GuardRegistry}, and
 * {@link com.ryuqq.olympus.core.guard.GuardEvaluator} runs the chains field by field.</p>
 *
 * <p>Validation failures are values ({@link com.ryuqq.olympus.core.guard.FailureReport}
 * inside {@code Result.Err}). Malformed rules and unknown guard names are
 * programmer errors and are thrown as {@link com.ryuqq.olympus.core.guard.GuardException}.</p>
 *
 * @author Olympus Team
 * @since 1.0.0
 */
package com.ryuqq.olympus.core.guard;
