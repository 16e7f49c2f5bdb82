package com.ryuqq.olympus.core.guard.builtin;

import com.ryuqq.olympus.core.guard.Guard;
import com.ryuqq.olympus.core.guard.RuleArgument;

import java.util.List;
import java.util.Map;

/**
 * {@code eq[expected]}: 값이 기대값과 같음. 숫자는 크기로 비교합니다 ({@code 18 == 18.0}).
 */
final class EqualGuard implements Guard {

    private final RuleArgument expected;

    EqualGuard(RuleArgument expected) {
        this.expected = expected;
    }

    static Guard create(List<RuleArgument> args) {
        Arguments.requireCount(BuiltinGuards.EQ, args, 1);
        return new EqualGuard(args.get(0));
    }

    @Override
    public boolean isSatisfiedBy(Object value) {
        return Values.isEqual(value, expected.toValue());
    }

    @Override
    public String messageTemplate() {
        return "{name} must {not}be equal to {value}";
    }

    @Override
    public Map<String, String> placeholders() {
        return Map.of("value", expected.text());
    }
}
