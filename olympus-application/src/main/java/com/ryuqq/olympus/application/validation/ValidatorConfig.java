package com.ryuqq.olympus.application.validation;

/**
 * Validator 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>freezeRegistry: Validator 생성 시 레지스트리를 freeze (기본 true)</li>
 *   <li>logFailures: 검증 실패를 DEBUG로 로깅 (기본 true)</li>
 * </ul>
 *
 * @author Olympus Team
 * @since 1.0.0
 * @param freezeRegistry 레지스트리 freeze 여부
 * @param logFailures 실패 로깅 여부
 */
public record ValidatorConfig(boolean freezeRegistry, boolean logFailures) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: freezeRegistry=true, logFailures=true</p>
     */
    public ValidatorConfig() {
        this(true, true);
    }

    public ValidatorConfig withFreezeRegistry(boolean freezeRegistry) {
        return new ValidatorConfig(freezeRegistry, this.logFailures);
    }

    public ValidatorConfig withLogFailures(boolean logFailures) {
        return new ValidatorConfig(this.freezeRegistry, logFailures);
    }
}
