/**
 * Domain events and the aggregate root that records them.
 *
 * <p>An {@link com.ryuqq.olympus.core.event.AggregateRoot} queues events with
 * {@code remind}. A dispatcher drains the queue and passes each event to the
 * {@link com.ryuqq.olympus.core.event.EventHandler}s bound to the event's exact runtime class.</p>
 *
 * @since 1.0.0
 * @author Olympus Team
 */
package com.ryuqq.olympus.core.event;
