package com.ryuqq.olympus.core.model;

/**
 * 도메인 규칙 위반 예외의 기반 클래스.
 *
 * <p>구체 Aggregate가 불변식 위반을 알릴 때 하위 클래스를 정의하여 사용합니다.
 * 입력 검증 실패는 예외가 아니라 {@code Result.Err}로 전달합니다.</p>
 *
 * @author Olympus Team
 * @since 1.0.0
 */
public abstract class DomainException extends RuntimeException {

    protected DomainException(String message) {
        super(message);
    }

    protected DomainException(String message, Throwable cause) {
        super(message, cause);
    }
}
