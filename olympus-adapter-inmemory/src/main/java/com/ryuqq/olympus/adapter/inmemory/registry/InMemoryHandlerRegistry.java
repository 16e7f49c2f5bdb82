package com.ryuqq.olympus.adapter.inmemory.registry;

import com.ryuqq.olympus.core.event.DomainEvent;
import com.ryuqq.olympus.core.event.EventHandler;
import com.ryuqq.olympus.core.spi.HandlerRegistry;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory implementation of {@link HandlerRegistry} SPI.
 *
 * <p>This implementation keeps one {@link CopyOnWriteArrayList} of bindings per event
 * class inside a {@link ConcurrentHashMap}. A binding remembers the event class it was
 * registered for, so {@link #handlersFor(Class)} hands out handlers that deliver through
 * that class instead of the raw handler instances.</p>
 *
 * <p><strong>Architecture:</strong></p>
 * <ul>
 *   <li><strong>Bindings:</strong> ConcurrentHashMap&lt;Class, CopyOnWriteArrayList&lt;Binding&gt;&gt; - binding order per event class</li>
 * </ul>
 *
 * <p><strong>Performance Characteristics:</strong></p>
 * <ul>
 *   <li><strong>bind/unbind:</strong> O(N) where N = handlers of that event class (array copy)</li>
 *   <li><strong>handlersFor:</strong> O(N) - snapshot copy, no locking</li>
 * </ul>
 *
 * <p>Bindings are typically written once at startup and read on every dispatch, which
 * is the access pattern copy-on-write lists are built for.</p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * HandlerRegistry registry = new InMemoryHandlerRegistry();
 * registry.bind(OrderPlaced.class, event -&gt; mailer.send(event));
 *
 * for (EventHandler&lt;? super OrderPlaced&gt; handler : registry.handlersFor(OrderPlaced.class)) {
 *     handler.handle(event);
 * }
 * </pre>
 *
 * @author Olympus Team
 * @since 1.0.0
 */
public class InMemoryHandlerRegistry implements HandlerRegistry {

    private final Map<Class<? extends DomainEvent>, CopyOnWriteArrayList<Binding<?>>> bindings =
        new ConcurrentHashMap<>();

    @Override
    public <E extends DomainEvent> void bind(Class<E> type, EventHandler<? super E> handler) {
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        if (handler == null) {
            throw new IllegalArgumentException("handler cannot be null");
        }
        bindings.computeIfAbsent(type, key -> new CopyOnWriteArrayList<>()).add(new Binding<>(type, handler));
    }

    @Override
    public boolean unbind(Class<? extends DomainEvent> type, EventHandler<?> handler) {
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        if (handler == null) {
            throw new IllegalArgumentException("handler cannot be null");
        }
        CopyOnWriteArrayList<Binding<?>> handlers = bindings.get(type);
        if (handlers == null) {
            return false;
        }
        for (Binding<?> binding : handlers) {
            if (binding.handler().equals(handler)) {
                // 같은 handler의 binding은 서로 equals이므로 첫 번째 것이 제거됨
                return handlers.remove(binding);
            }
        }
        return false;
    }

    @Override
    public <E extends DomainEvent> List<EventHandler<? super E>> handlersFor(Class<E> type) {
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        CopyOnWriteArrayList<Binding<?>> handlers = bindings.get(type);
        if (handlers == null) {
            return List.of();
        }
        List<EventHandler<? super E>> snapshot = new ArrayList<>(handlers.size());
        for (Binding<?> binding : handlers) {
            snapshot.add(binding::deliver);
        }
        return List.copyOf(snapshot);
    }

    @Override
    public void clear() {
        bindings.clear();
    }

    @Override
    public int size() {
        int total = 0;
        for (CopyOnWriteArrayList<Binding<?>> handlers : bindings.values()) {
            total += handlers.size();
        }
        return total;
    }

    /**
     * Returns the number of handlers bound to one event class.
     *
     * <p>Testing support.</p>
     *
     * @param type the event class
     * @return handler count (0 if none)
     */
    public int sizeOf(Class<? extends DomainEvent> type) {
        CopyOnWriteArrayList<Binding<?>> handlers = bindings.get(type);
        return handlers == null ? 0 : handlers.size();
    }

    /**
     * One handler bound to one event class.
     */
    private record Binding<T extends DomainEvent>(Class<T> type, EventHandler<? super T> handler) {

        void deliver(DomainEvent event) {
            handler.handle(type.cast(event));
        }
    }
}
