package com.ryuqq.olympus.application.event;

import com.ryuqq.olympus.core.event.AggregateRoot;
import com.ryuqq.olympus.core.event.DomainEvent;
import com.ryuqq.olympus.core.event.EventBinder;
import com.ryuqq.olympus.core.event.EventHandler;
import com.ryuqq.olympus.core.event.EventSubscriber;
import com.ryuqq.olympus.core.spi.HandlerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * 도메인 이벤트 디스패처.
 *
 * <p>이벤트 타입(런타임 클래스)에 핸들러를 바인딩하고, Aggregate에 쌓인 이벤트를
 * 바인딩 순서대로 핸들러에 전달합니다. 전역 상태 없이 주입된 {@link HandlerRegistry}를
 * 사용하므로 여러 디스패처가 서로 간섭하지 않습니다.</p>
 *
 * <p><strong>처리 흐름 (trigger):</strong></p>
 * <pre>
 * 1. 대기 이벤트가 없으면 0 반환 (핸들러 호출 없음)
 * 2. EAGER: drainEvents()로 대기열을 비운 뒤 전달
 *    AFTER_DISPATCH: claimEvents()로 점유한 이벤트를 전달한 뒤 성공하면 그 이벤트만 제거,
 *    실패하면 점유 해제
 *    (핸들러 안에서 같은 Aggregate를 다시 trigger하면 아직 점유되지 않은 이벤트만 전달)
 * 3. 각 이벤트마다 정확히 같은 클래스에 바인딩된 핸들러를 바인딩 순서대로 호출
 * 4. 총 핸들러 호출 횟수 반환
 * </pre>
 *
 * <p><strong>예외:</strong> 핸들러 예외는 그대로 전파되며 남은 전달은 중단됩니다.
 * 대기열 상태는 {@link DrainPolicy}를 따릅니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * DomainEventDispatcher dispatcher =
 *     new DomainEventDispatcher(new InMemoryHandlerRegistry(), new DispatcherConfig());
 *
 * dispatcher.bind(OrderPlaced.class, event -&gt; mailer.sendReceipt(event));
 *
 * Order order = Order.place(...);      // remind(new OrderPlaced(...))
 * repository.save(order);
 * dispatcher.trigger(order);           // 핸들러 호출, 대기열 비움
 * </pre>
 *
 * @author Olympus Team
 * @since 1.0.0
 */
public final class DomainEventDispatcher implements EventBinder {

    private static final Logger log = LoggerFactory.getLogger(DomainEventDispatcher.class);
    private final HandlerRegistry registry;
    private final DispatcherConfig config;

    /**
     * 생성자.
     *
     * @param registry 핸들러 저장소
     * @param config 설정
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public DomainEventDispatcher(HandlerRegistry registry, DispatcherConfig config) {
        if (registry == null) {
            throw new IllegalArgumentException("registry cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.registry = registry;
        this.config = config;
    }

    @Override
    public <E extends DomainEvent> void bind(Class<E> type, EventHandler<? super E> handler) {
        registry.bind(type, handler);
        log.debug("Bound handler to {}", type.getSimpleName());
    }

    /**
     * 핸들러 바인딩 해제 (첫 번째 바인딩 하나만).
     *
     * @param type 이벤트 클래스
     * @param handler 핸들러
     * @return 해제 여부
     */
    public boolean unbind(Class<? extends DomainEvent> type, EventHandler<?> handler) {
        boolean removed = registry.unbind(type, handler);
        if (removed) {
            log.debug("Unbound handler from {}", type.getSimpleName());
        }
        return removed;
    }

    /**
     * subscriber가 자신의 핸들러를 바인딩하도록 함.
     *
     * @param subscriber 이벤트 구독자
     * @throws IllegalArgumentException subscriber가 null인 경우
     */
    public void subscribe(EventSubscriber subscriber) {
        if (subscriber == null) {
            throw new IllegalArgumentException("subscriber cannot be null");
        }
        subscriber.subscribe(this);
    }

    /**
     * Aggregate 대기열에 이벤트 추가. {@link AggregateRoot#remind(DomainEvent)}와 같습니다.
     *
     * @param aggregate 대상 Aggregate
     * @param event 도메인 이벤트
     */
    public void remind(AggregateRoot<?> aggregate, DomainEvent event) {
        if (aggregate == null) {
            throw new IllegalArgumentException("aggregate cannot be null");
        }
        aggregate.remind(event);
    }

    /**
     * Aggregate에 쌓인 이벤트를 전달.
     *
     * @param aggregate 대상 Aggregate
     * @return 핸들러 호출 횟수 (대기 이벤트가 없으면 0)
     * @throws IllegalArgumentException aggregate가 null인 경우
     * @throws RuntimeException 핸들러가 던진 예외
     */
    public int trigger(AggregateRoot<?> aggregate) {
        if (aggregate == null) {
            throw new IllegalArgumentException("aggregate cannot be null");
        }
        if (!aggregate.hasPendingEvents()) {
            return 0;
        }

        boolean eager = config.drainPolicy() == DrainPolicy.EAGER;
        List<DomainEvent> events = eager ? aggregate.drainEvents() : aggregate.claimEvents();
        if (events.isEmpty()) {
            return 0;
        }

        int invocations;
        try {
            invocations = dispatchAll(events);
        } catch (RuntimeException e) {
            if (!eager) {
                aggregate.releaseEvents(events);
            }
            log.warn("Trigger aborted for aggregate {} under {}: {} event(s) {}",
                aggregate.getId().getValue(), config.drainPolicy(), events.size(),
                eager ? "dropped" : "kept for retry");
            throw e;
        }

        if (!eager) {
            aggregate.acknowledgeEvents(events);
        }
        log.debug("Triggered aggregate {}: {} event(s), {} handler invocation(s)",
            aggregate.getId().getValue(), events.size(), invocations);
        return invocations;
    }

    /**
     * 이벤트 하나를 바인딩된 핸들러에 전달.
     *
     * @param event 도메인 이벤트
     * @return 핸들러 호출 횟수
     * @throws IllegalArgumentException event가 null인 경우
     */
    public int dispatch(DomainEvent event) {
        if (event == null) {
            throw new IllegalArgumentException("event cannot be null");
        }
        return dispatchAs(event.getClass(), event);
    }

    /**
     * 이벤트 목록을 순서대로 전달.
     *
     * @param events 도메인 이벤트 목록
     * @return 총 핸들러 호출 횟수
     */
    public int dispatchAll(List<? extends DomainEvent> events) {
        if (events == null) {
            throw new IllegalArgumentException("events cannot be null");
        }
        int invocations = 0;
        for (DomainEvent event : events) {
            invocations += dispatch(event);
        }
        return invocations;
    }

    private <E extends DomainEvent> int dispatchAs(Class<E> type, DomainEvent event) {
        E typed = type.cast(event);
        List<EventHandler<? super E>> handlers = registry.handlersFor(type);
        if (handlers.isEmpty() && config.warnOnUnhandled()) {
            log.warn("No handler bound to {}", type.getSimpleName());
        }
        for (EventHandler<? super E> handler : handlers) {
            handler.handle(typed);
        }
        return handlers.size();
    }
}
