package com.ryuqq.olympus.core.event;

/**
 * 초기화 시점에 여러 핸들러를 한 번에 바인딩하는 객체.
 *
 * <pre>
 * class AuditSubscriber implements EventSubscriber {
 *     public void subscribe(EventBinder binder) {
 *         binder.bind(OrderPlaced.class, this::onPlaced);
 *         binder.bind(OrderCancelled.class, this::onCancelled);
 *     }
 * }
 * </pre>
 *
 * @author Olympus Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface EventSubscriber {

    void subscribe(EventBinder binder);
}
