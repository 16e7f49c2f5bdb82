package com.ryuqq.olympus.application.event;

/**
 * trigger 시 Aggregate 대기열을 비우는 시점.
 *
 * @author Olympus Team
 * @since 1.0.0
 */
public enum DrainPolicy {

    /**
     * 핸들러 실행 전에 대기열을 비움.
     *
     * <p>핸들러가 실패하면 남은 이벤트는 전달되지 않고 사라지며, 다음 trigger가 같은 이벤트를
     * 다시 전달하지 않습니다 (at-most-once).</p>
     */
    EAGER,

    /**
     * 모든 핸들러가 성공한 뒤에 전달한 이벤트만 대기열에서 제거.
     *
     * <p>핸들러가 실패하면 대기열이 그대로 남아 다음 trigger가 전체 이벤트를 다시
     * 전달합니다 (at-least-once). 이미 성공한 핸들러도 다시 호출되므로 멱등해야 합니다.</p>
     */
    AFTER_DISPATCH
}
