package com.ryuqq.olympus.core.guard;

/**
 * Guard 규칙 컴파일 중 발생하는 프로그래머 오류의 기반 클래스.
 *
 * <p>규칙 문자열 문법 오류, 등록되지 않은 guard 이름, 중복 등록은 모두 즉시 전파되어야 하며
 * 비즈니스 로직에서 복구하지 않습니다. 검증 실패 자체는 예외가 아니라
 * {@link FailureReport}로 {@code Result.Err}를 통해 전달됩니다.</p>
 *
 * @author Olympus Team
 * @since 1.0.0
 */
public abstract class GuardException extends RuntimeException {

    protected GuardException(String message) {
        super(message);
    }

    protected GuardException(String message, Throwable cause) {
        super(message, cause);
    }
}
