package com.ryuqq.olympus.core.guard;

/**
 * 필드 하나의 검증 실패.
 *
 * @param field 필드 이름
 * @param message 사람이 읽을 수 있는 실패 메시지
 *
 * @author Olympus Team
 * @since 1.0.0
 */
public record FieldFailure(String field, String message) {

    public FieldFailure {
        if (field == null || field.isBlank()) {
            throw new IllegalArgumentException("field cannot be null or blank");
        }
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message cannot be null or blank");
        }
    }

    @Override
    public String toString() {
        return field + ": " + message;
    }
}
