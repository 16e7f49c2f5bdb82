package com.ryuqq.olympus.application.event;

/**
 * DomainEventDispatcher 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>drainPolicy: 대기열을 비우는 시점 (기본 {@link DrainPolicy#EAGER})</li>
 *   <li>warnOnUnhandled: 바인딩된 핸들러가 없는 이벤트를 WARN으로 로깅 (기본 false)</li>
 * </ul>
 *
 * @author Olympus Team
 * @since 1.0.0
 * @param drainPolicy 대기열 비우기 정책 (null 불가)
 * @param warnOnUnhandled 핸들러 없는 이벤트 경고 여부
 */
public record DispatcherConfig(DrainPolicy drainPolicy, boolean warnOnUnhandled) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: drainPolicy=EAGER, warnOnUnhandled=false</p>
     */
    public DispatcherConfig() {
        this(DrainPolicy.EAGER, false);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException drainPolicy가 null인 경우
     */
    public DispatcherConfig {
        if (drainPolicy == null) {
            throw new IllegalArgumentException("drainPolicy cannot be null");
        }
    }

    /**
     * drainPolicy만 변경한 새 인스턴스 생성.
     *
     * @param drainPolicy 새로운 정책
     * @return 새 DispatcherConfig 인스턴스
     */
    public DispatcherConfig withDrainPolicy(DrainPolicy drainPolicy) {
        return new DispatcherConfig(drainPolicy, this.warnOnUnhandled);
    }

    /**
     * warnOnUnhandled만 변경한 새 인스턴스 생성.
     *
     * @param warnOnUnhandled 새로운 값
     * @return 새 DispatcherConfig 인스턴스
     */
    public DispatcherConfig withWarnOnUnhandled(boolean warnOnUnhandled) {
        return new DispatcherConfig(this.drainPolicy, warnOnUnhandled);
    }
}
