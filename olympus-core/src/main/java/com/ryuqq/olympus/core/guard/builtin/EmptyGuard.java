package com.ryuqq.olympus.core.guard.builtin;

import com.ryuqq.olympus.core.guard.Guard;
import com.ryuqq.olympus.core.guard.RuleArgument;

import java.util.List;

/**
 * {@code empty}: 길이가 0인 문자열/컬렉션/맵/배열.
 */
final class EmptyGuard implements Guard {

    static final EmptyGuard INSTANCE = new EmptyGuard();

    private EmptyGuard() {
    }

    static Guard create(List<RuleArgument> args) {
        Arguments.requireCount(BuiltinGuards.EMPTY, args, 0);
        return INSTANCE;
    }

    @Override
    public boolean isSatisfiedBy(Object value) {
        return Values.lengthOf(value).map(length -> length == 0).getOrElse(false);
    }

    @Override
    public String messageTemplate() {
        return "{name} must {not}be empty";
    }
}
