package com.ryuqq.olympus.core.event;

/**
 * 도메인 이벤트 핸들러.
 *
 * <p>핸들러가 던진 예외는 디스패처를 통해 호출자에게 그대로 전파됩니다.</p>
 *
 * @param <E> 처리할 이벤트 타입
 *
 * @author Olympus Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface EventHandler<E extends DomainEvent> {

    void handle(E event);
}
