/**
 * Error-propagation monads.
 *
 * <h2>Types</h2>
 * <ul>
 *   <li>{@link com.ryuqq.olympus.core.monad.Maybe} - Presence or absence of a value (Some / None)</li>
 *   <li>{@link com.ryuqq.olympus.core.monad.Result} - Success value or failure error (Ok / Err)</li>
 *   <li>{@link com.ryuqq.olympus.core.monad.Either} - One of two values (Left / Right)</li>
 *   <li>{@link com.ryuqq.olympus.core.monad.Unit} - Payload of a value-less success</li>
 * </ul>
 *
 * <h2>Chaining</h2>
 * <pre>
 * Result&lt;Email, FailureReport&gt; email = evaluator.evaluate(values, spec)
 *     .map(unit -&gt; new Email((String) values.get("email")));
 *
 * Email value = email.unwrapOrElse(report -&gt; Email.UNKNOWN);
 * </pre>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Immutability:</strong> Every variant is a record; chaining creates new instances</li>
 *   <li><strong>No null payloads:</strong> Absence is {@code Maybe.none()} or {@code Unit.UNIT}</li>
 *   <li><strong>Short-circuit:</strong> {@code bind} on a failure never calls the continuation</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Olympus Team
 */
package com.ryuqq.olympus.core.monad;
