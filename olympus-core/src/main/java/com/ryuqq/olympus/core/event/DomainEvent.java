package com.ryuqq.olympus.core.event;

import com.ryuqq.olympus.core.model.Guid;

import java.time.Instant;

/**
 * 도메인에서 일어난 일을 기록하는 이벤트.
 *
 * <p>이벤트 타입은 이벤트의 런타임 클래스입니다. 핸들러는 정확히 같은 클래스에
 * 바인딩된 경우에만 호출되며, 상위 타입이나 인터페이스로는 전달되지 않습니다.</p>
 *
 * <p>구현체는 불변이어야 하며 record 사용을 권장합니다:</p>
 * <pre>
 * public record OrderPlaced(Guid aggregateId, Instant occurredAt) implements DomainEvent {
 *     public Guid getAggregateId() { return aggregateId; }
 *     public Instant getOccurredAt() { return occurredAt; }
 * }
 * </pre>
 *
 * @author Olympus Team
 * @since 1.0.0
 */
public interface DomainEvent {

    /**
     * @return 이벤트를 발생시킨 Aggregate의 식별자
     */
    Guid getAggregateId();

    /**
     * @return 이벤트 발생 시각
     */
    Instant getOccurredAt();

    /**
     * 이벤트 타입 이름 (로깅용).
     *
     * @return 런타임 클래스의 단순 이름
     */
    default String getEventType() {
        return getClass().getSimpleName();
    }
}
