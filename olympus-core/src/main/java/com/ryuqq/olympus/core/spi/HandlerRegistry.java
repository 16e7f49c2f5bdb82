package com.ryuqq.olympus.core.spi;

import com.ryuqq.olympus.core.event.DomainEvent;
import com.ryuqq.olympus.core.event.EventHandler;

import java.util.List;

/**
 * Event handler storage SPI.
 *
 * <p>Maps an event class to the handlers bound to it, in binding order.
 * Lookups are by exact class: a handler bound to a supertype is not returned
 * for a subtype.</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: bind/unbind may run concurrently with lookups</li>
 *   <li>Snapshot reads: {@link #handlersFor(Class)} must not reflect later bindings</li>
 *   <li>Duplicates: binding the same handler twice appends it twice</li>
 * </ul>
 *
 * @author Olympus Team
 * @since 1.0.0
 */
public interface HandlerRegistry {

    /**
     * Appends a handler for an event type.
     *
     * @param type the event class
     * @param handler the handler
     * @param <E> event type
     * @throws IllegalArgumentException if type or handler is null
     */
    <E extends DomainEvent> void bind(Class<E> type, EventHandler<? super E> handler);

    /**
     * Removes the first binding of a handler for an event type.
     *
     * @param type the event class
     * @param handler the handler
     * @return true if a binding was removed
     * @throws IllegalArgumentException if type or handler is null
     */
    boolean unbind(Class<? extends DomainEvent> type, EventHandler<?> handler);

    /**
     * Returns the handlers bound to an event type.
     *
     * @param type the event class
     * @param <E> event type
     * @return immutable snapshot in binding order (empty if none)
     * @throws IllegalArgumentException if type is null
     */
    <E extends DomainEvent> List<EventHandler<? super E>> handlersFor(Class<E> type);

    /**
     * Removes every binding.
     */
    void clear();

    /**
     * @return total number of bindings across all event types
     */
    int size();
}
