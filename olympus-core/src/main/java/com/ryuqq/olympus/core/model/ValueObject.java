package com.ryuqq.olympus.core.model;

import java.util.Objects;

/**
 * 식별자 없이 값으로만 비교되는 불변 도메인 객체.
 *
 * <p>같은 클래스이고 값이 같으면 같은 객체입니다. 하위 클래스는 생성자에서 값을 검증하고
 * 상태를 추가하지 않아야 합니다.</p>
 *
 * @param <T> 값 타입
 *
 * @author Olympus Team
 * @since 1.0.0
 */
public abstract class ValueObject<T> {

    private final T value;

    /**
     * @param value 값
     * @throws IllegalArgumentException value가 null인 경우
     */
    protected ValueObject(T value) {
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null");
        }
        this.value = value;
    }

    public T getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ValueObject<?> that = (ValueObject<?>) o;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(getClass(), value);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" + value + '}';
    }
}
