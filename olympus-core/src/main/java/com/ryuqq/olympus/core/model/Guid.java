package com.ryuqq.olympus.core.model;

import java.util.UUID;

/**
 * Entity와 Aggregate의 전역 고유 식별자.
 *
 * <p>{@link #generate()}는 무작위 UUID(v4)로 값을 만들고, {@link #of(String)}은 저장소 등에서
 * 복원한 기존 값을 감쌉니다.</p>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~255자</li>
 *   <li>패턴: 영숫자, 하이픈(-), 언더스코어(_)만 허용</li>
 * </ul>
 *
 * @author Olympus Team
 * @since 1.0.0
 */
public final class Guid {

    private final String value;

    private Guid(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Guid cannot be null or blank");
        }
        if (value.length() > 255) {
            throw new IllegalArgumentException("Guid length cannot exceed 255 characters");
        }
        if (!value.matches("^[a-zA-Z0-9\\-_]+$")) {
            throw new IllegalArgumentException("Guid contains invalid characters. Only alphanumeric, hyphen, and underscore are allowed");
        }
        this.value = value;
    }

    /**
     * 새 Guid 생성 (UUID v4).
     *
     * @return Guid 인스턴스
     */
    public static Guid generate() {
        return new Guid(UUID.randomUUID().toString());
    }

    /**
     * 기존 값으로 Guid 생성.
     *
     * @param value Guid 값
     * @return Guid 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static Guid of(String value) {
        return new Guid(value);
    }

    /**
     * UUID로 Guid 생성.
     *
     * @param uuid UUID
     * @return Guid 인스턴스
     * @throws IllegalArgumentException uuid가 null인 경우
     */
    public static Guid of(UUID uuid) {
        if (uuid == null) {
            throw new IllegalArgumentException("uuid cannot be null");
        }
        return new Guid(uuid.toString());
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Guid guid = (Guid) o;
        return value.equals(guid.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "Guid{" + value + '}';
    }
}
