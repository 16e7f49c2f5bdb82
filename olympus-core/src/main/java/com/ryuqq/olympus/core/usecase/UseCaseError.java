package com.ryuqq.olympus.core.usecase;

import com.ryuqq.olympus.core.monad.Maybe;

/**
 * use case가 예상하지 못한 예외를 {@code Result.Err}로 변환할 때 사용하는 에러 값.
 *
 * @param message 에러 메시지
 * @param cause 원인 예외 (없으면 null)
 *
 * @author Olympus Team
 * @since 1.0.0
 */
public record UseCaseError(String message, Throwable cause) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException message가 null이거나 빈 문자열인 경우
     */
    public UseCaseError {
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message cannot be null or blank");
        }
    }

    public static UseCaseError of(String message) {
        return new UseCaseError(message, null);
    }

    /**
     * 예외에서 생성. 예외 메시지가 없으면 예외 클래스 이름을 사용합니다.
     *
     * @param cause 원인 예외
     * @return UseCaseError 인스턴스
     * @throws IllegalArgumentException cause가 null인 경우
     */
    public static UseCaseError from(Throwable cause) {
        if (cause == null) {
            throw new IllegalArgumentException("cause cannot be null");
        }
        String message = cause.getMessage();
        if (message == null || message.isBlank()) {
            message = cause.getClass().getSimpleName();
        }
        return new UseCaseError(message, cause);
    }

    public Maybe<Throwable> getCause() {
        return Maybe.ofNullable(cause);
    }

    @Override
    public String toString() {
        return "UseCaseError(" + message + ")";
    }
}
