package com.ryuqq.olympus.core.guard.builtin;

import com.ryuqq.olympus.core.guard.Guard;
import com.ryuqq.olympus.core.guard.RuleArgument;

import java.util.List;
import java.util.Map;

/**
 * {@code length[n]}: 길이가 정확히 n.
 */
final class LengthGuard implements Guard {

    private final int length;

    LengthGuard(int length) {
        this.length = length;
    }

    static Guard create(List<RuleArgument> args) {
        Arguments.requireCount(BuiltinGuards.LENGTH, args, 1);
        return new LengthGuard(Arguments.length(BuiltinGuards.LENGTH, args.get(0)));
    }

    @Override
    public boolean isSatisfiedBy(Object value) {
        return Values.lengthOf(value).map(actual -> actual == length).getOrElse(false);
    }

    @Override
    public String messageTemplate() {
        return "{name} must {not}have length {length}";
    }

    @Override
    public Map<String, String> placeholders() {
        return Map.of("length", Integer.toString(length));
    }
}
