package com.ryuqq.olympus.core.guard.builtin;

import com.ryuqq.olympus.core.monad.Maybe;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Collection;
import java.util.Map;
import java.util.Objects;

/**
 * 필드 값 해석 유틸리티. 알 수 없는 종류의 값은 None으로 처리합니다.
 */
final class Values {

    private Values() {
    }

    /**
     * 문자열, 컬렉션, 맵, 배열의 길이.
     */
    static Maybe<Integer> lengthOf(Object value) {
        if (value instanceof CharSequence text) {
            return Maybe.some(text.length());
        }
        if (value instanceof Collection<?> collection) {
            return Maybe.some(collection.size());
        }
        if (value instanceof Map<?, ?> map) {
            return Maybe.some(map.size());
        }
        if (value instanceof Object[] array) {
            return Maybe.some(array.length);
        }
        return primitiveArrayLength(value);
    }

    private static Maybe<Integer> primitiveArrayLength(Object value) {
        if (value instanceof int[] array) {
            return Maybe.some(array.length);
        }
        if (value instanceof long[] array) {
            return Maybe.some(array.length);
        }
        if (value instanceof double[] array) {
            return Maybe.some(array.length);
        }
        if (value instanceof byte[] array) {
            return Maybe.some(array.length);
        }
        if (value instanceof char[] array) {
            return Maybe.some(array.length);
        }
        if (value instanceof boolean[] array) {
            return Maybe.some(array.length);
        }
        if (value instanceof short[] array) {
            return Maybe.some(array.length);
        }
        if (value instanceof float[] array) {
            return Maybe.some(array.length);
        }
        return Maybe.none();
    }

    /**
     * 숫자 값을 BigDecimal로. NaN, 무한대, 숫자가 아닌 값은 None.
     */
    static Maybe<BigDecimal> toDecimal(Object value) {
        if (value instanceof BigDecimal decimal) {
            return Maybe.some(decimal);
        }
        if (value instanceof BigInteger integer) {
            return Maybe.some(new BigDecimal(integer));
        }
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                return Maybe.none();
            }
            return Maybe.some(new BigDecimal(value.toString()));
        }
        if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return Maybe.some(BigDecimal.valueOf(((Number) value).longValue()));
        }
        return Maybe.none();
    }

    static boolean isIntegral(BigDecimal value) {
        return value.signum() == 0 || value.stripTrailingZeros().scale() <= 0;
    }

    /**
     * 규칙 인자와 값의 동등성. 숫자는 크기로, enum은 이름으로, 문자는 한 글자 문자열로 비교합니다.
     */
    static boolean isEqual(Object value, Object expected) {
        if (value == null || expected == null) {
            return false;
        }
        Maybe<BigDecimal> left = toDecimal(value);
        Maybe<BigDecimal> right = toDecimal(expected);
        if (left.isSome() && right.isSome()) {
            return left.get().compareTo(right.get()) == 0;
        }
        if (value instanceof Enum<?> constant && expected instanceof String name) {
            return constant.name().equals(name);
        }
        if (value instanceof Character c && expected instanceof String text) {
            return text.length() == 1 && text.charAt(0) == c;
        }
        return Objects.equals(value, expected);
    }

    /**
     * 값과 기준의 비교. 숫자끼리, 문자열끼리만 비교 가능합니다.
     *
     * @return 음수/0/양수, 비교할 수 없으면 None
     */
    static Maybe<Integer> compare(Object value, Object bound) {
        if (value == null || bound == null) {
            return Maybe.none();
        }
        Maybe<BigDecimal> left = toDecimal(value);
        Maybe<BigDecimal> right = toDecimal(bound);
        if (left.isSome() && right.isSome()) {
            return Maybe.some(left.get().compareTo(right.get()));
        }
        if (value instanceof CharSequence text && bound instanceof String other) {
            return Maybe.some(text.toString().compareTo(other));
        }
        return Maybe.none();
    }
}
