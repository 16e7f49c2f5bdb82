package com.ryuqq.olympus.core.guard.builtin;

import com.ryuqq.olympus.core.guard.Guard;
import com.ryuqq.olympus.core.guard.RuleArgument;
import com.ryuqq.olympus.core.monad.Maybe;

import java.util.List;

/**
 * {@code required}: 값이 존재하고 비어 있지 않음.
 *
 * <p>null, {@code Maybe.None}, 빈 문자열/컬렉션/맵/배열은 만족하지 않습니다.
 * {@code Maybe.Some}은 담긴 값으로 판단합니다.</p>
 */
final class RequiredGuard implements Guard {

    static final RequiredGuard INSTANCE = new RequiredGuard();

    private RequiredGuard() {
    }

    static Guard create(List<RuleArgument> args) {
        Arguments.requireCount(BuiltinGuards.REQUIRED, args, 0);
        return INSTANCE;
    }

    @Override
    public boolean isSatisfiedBy(Object value) {
        if (value == null || (value instanceof Maybe<?> maybe && maybe.isNone())) {
            return false;
        }
        if (value instanceof Maybe.Some<?> some) {
            return isSatisfiedBy(some.value());
        }
        return Values.lengthOf(value).map(length -> length > 0).getOrElse(true);
    }

    @Override
    public String messageTemplate() {
        return "{name} is {not}required";
    }
}
