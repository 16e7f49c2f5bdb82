package com.ryuqq.olympus.core.guard.builtin;

import com.ryuqq.olympus.core.guard.Guard;
import com.ryuqq.olympus.core.guard.MalformedRuleException;
import com.ryuqq.olympus.core.guard.RuleArgument;

import java.util.List;
import java.util.Map;

/**
 * {@code between[min, max]}: min &lt;= 길이 &lt;= max.
 */
final class BetweenGuard implements Guard {

    private final int min;
    private final int max;

    BetweenGuard(int min, int max) {
        if (min > max) {
            throw new MalformedRuleException(
                BuiltinGuards.BETWEEN + " expects min <= max but got " + min + " > " + max
            );
        }
        this.min = min;
        this.max = max;
    }

    static Guard create(List<RuleArgument> args) {
        Arguments.requireCount(BuiltinGuards.BETWEEN, args, 2);
        return new BetweenGuard(
            Arguments.length(BuiltinGuards.BETWEEN, args.get(0)),
            Arguments.length(BuiltinGuards.BETWEEN, args.get(1))
        );
    }

    @Override
    public boolean isSatisfiedBy(Object value) {
        return Values.lengthOf(value).map(length -> length >= min && length <= max).getOrElse(false);
    }

    @Override
    public String messageTemplate() {
        return "{name} must {not}have length between {min} and {max}";
    }

    @Override
    public Map<String, String> placeholders() {
        return Map.of("min", Integer.toString(min), "max", Integer.toString(max));
    }
}
