/**
 * Application use case contract and its error value.
 *
 * @author Olympus Team
 * @since 1.0.0
 */
package com.ryuqq.olympus.core.usecase;
