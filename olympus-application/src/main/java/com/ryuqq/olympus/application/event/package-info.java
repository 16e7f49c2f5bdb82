/**
 * Domain event dispatch.
 *
 * <p>{@link com.ryuqq.olympus.application.event.DomainEventDispatcher} binds handlers
 * through a {@link com.ryuqq.olympus.core.spi.HandlerRegistry} and drains aggregates
 * according to {@link com.ryuqq.olympus.application.event.DispatcherConfig}.</p>
 *
 * @author Olympus Team
 * @since 1.0.0
 */
package com.ryuqq.olympus.application.event;
