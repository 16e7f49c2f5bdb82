package com.ryuqq.olympus.core.monad;

/**
 * 값이 없는 성공을 표현하는 단일 값.
 *
 * <p>{@code Result<Unit, E>}는 "성공했지만 돌려줄 값은 없음"을 의미합니다.
 * null 대신 사용합니다.</p>
 *
 * @author Olympus Team
 * @since 1.0.0
 */
public enum Unit {

    UNIT;

    @Override
    public String toString() {
        return "()";
    }
}
