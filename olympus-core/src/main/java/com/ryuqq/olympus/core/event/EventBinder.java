package com.ryuqq.olympus.core.event;

/**
 * 이벤트 타입에 핸들러를 바인딩하는 능력.
 *
 * @author Olympus Team
 * @since 1.0.0
 * @see EventSubscriber
 */
public interface EventBinder {

    /**
     * 핸들러 바인딩. 같은 핸들러를 두 번 바인딩하면 두 번 호출됩니다.
     *
     * @param type 이벤트 클래스
     * @param handler 핸들러
     * @param <E> 이벤트 타입
     * @throws IllegalArgumentException type 또는 handler가 null인 경우
     */
    <E extends DomainEvent> void bind(Class<E> type, EventHandler<? super E> handler);
}
