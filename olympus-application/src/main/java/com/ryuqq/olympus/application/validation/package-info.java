/**
 * Validation facade over the core guard evaluator.
 *
 * @author Olympus Team
 * @since 1.0.0
 */
package com.ryuqq.olympus.application.validation;
