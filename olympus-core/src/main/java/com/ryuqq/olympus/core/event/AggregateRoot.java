package com.ryuqq.olympus.core.event;

import com.ryuqq.olympus.core.model.Entity;
import com.ryuqq.olympus.core.model.Guid;
import com.ryuqq.olympus.core.monad.Maybe;

import java.util.ArrayList;
import java.util.List;

/**
 * 도메인 이벤트를 기록하는 Aggregate의 루트 Entity.
 *
 * <p>Aggregate는 상태 변경 시 {@link #remind(DomainEvent)}로 이벤트를 대기열에 추가하고,
 * 디스패처가 {@link #drainEvents()}로 꺼내어 핸들러에 전달합니다. 대기열은 추가 순서를
 * 유지하며, 꺼낸 이벤트는 다시 전달되지 않습니다.</p>
 *
 * <p>꺼내지 않고 전달하는 경우 {@link #claimEvents()}로 점유하고, 성공하면
 * {@link #acknowledgeEvents(List)}, 실패하면 {@link #releaseEvents(List)}를 호출합니다.
 * 이벤트는 equals가 아닌 동일 인스턴스로 구분합니다.</p>
 *
 * <p>스레드 안전하지 않습니다. Aggregate는 한 번에 하나의 스레드에서 변경되어야 합니다.</p>
 *
 * @param <P> 속성 타입
 *
 * @author Olympus Team
 * @since 1.0.0
 */
public abstract class AggregateRoot<P> extends Entity<P> {

    private final List<DomainEvent> pendingEvents = new ArrayList<>();
    private final List<DomainEvent> inFlight = new ArrayList<>();

    protected AggregateRoot(P props, Maybe<Guid> id) {
        super(props, id);
    }

    /**
     * 이벤트를 대기열 끝에 추가.
     *
     * @param event 도메인 이벤트
     * @throws IllegalArgumentException event가 null인 경우
     */
    public void remind(DomainEvent event) {
        if (event == null) {
            throw new IllegalArgumentException("event cannot be null");
        }
        pendingEvents.add(event);
    }

    /**
     * @return 대기 중인 이벤트의 스냅샷 (읽기 전용)
     */
    public List<DomainEvent> getPendingEvents() {
        return List.copyOf(pendingEvents);
    }

    public boolean hasPendingEvents() {
        return !pendingEvents.isEmpty();
    }

    /**
     * 대기 중인 이벤트를 모두 꺼냄. 호출 후 대기열은 비어 있습니다.
     *
     * @return 추가 순서대로의 이벤트 목록
     */
    public List<DomainEvent> drainEvents() {
        List<DomainEvent> drained = List.copyOf(pendingEvents);
        pendingEvents.clear();
        return drained;
    }

    /**
     * 전달 중이 아닌 대기 이벤트를 전달 중으로 표시하고 반환. 대기열에서는 제거하지 않습니다.
     *
     * <p>이미 다른 전달이 점유한 이벤트는 제외되므로, 핸들러 안에서 같은 Aggregate를 다시
     * 전달해도 같은 이벤트가 두 번 전달되지 않습니다.</p>
     *
     * @return 추가 순서대로의 점유된 이벤트 목록
     */
    public List<DomainEvent> claimEvents() {
        List<DomainEvent> unmatched = new ArrayList<>(inFlight);
        List<DomainEvent> claimed = new ArrayList<>();
        for (DomainEvent event : pendingEvents) {
            if (!removeSame(unmatched, event)) {
                claimed.add(event);
            }
        }
        inFlight.addAll(claimed);
        return List.copyOf(claimed);
    }

    /**
     * 점유한 이벤트의 전달 완료. 해당 이벤트를 (동일 인스턴스 기준으로) 대기열에서 제거합니다.
     *
     * <p>핸들러가 이미 대기열을 비웠거나 꺼낸 이벤트는 무시합니다. 전달 중에 추가된
     * 이벤트는 남습니다.</p>
     *
     * @param events {@link #claimEvents()}가 반환한 이벤트
     */
    public void acknowledgeEvents(List<DomainEvent> events) {
        if (events == null) {
            throw new IllegalArgumentException("events cannot be null");
        }
        for (DomainEvent event : events) {
            removeSame(inFlight, event);
            removeSame(pendingEvents, event);
        }
    }

    /**
     * 점유 해제. 이벤트는 대기열에 남아 다음 전달에서 다시 점유될 수 있습니다.
     *
     * @param events {@link #claimEvents()}가 반환한 이벤트
     */
    public void releaseEvents(List<DomainEvent> events) {
        if (events == null) {
            throw new IllegalArgumentException("events cannot be null");
        }
        for (DomainEvent event : events) {
            removeSame(inFlight, event);
        }
    }

    public void clearEvents() {
        pendingEvents.clear();
    }

    private static boolean removeSame(List<DomainEvent> events, DomainEvent target) {
        for (int i = 0; i < events.size(); i++) {
            if (events.get(i) == target) {
                events.remove(i);
                return true;
            }
        }
        return false;
    }
}
