package com.ryuqq.olympus.core.guard.builtin;

import com.ryuqq.olympus.core.guard.Guard;
import com.ryuqq.olympus.core.guard.RuleArgument;

import java.util.List;

/**
 * {@code positive} (&gt; 0), {@code negative} (&lt; 0). 0은 둘 다 만족하지 않습니다.
 */
final class SignGuard implements Guard {

    static final SignGuard POSITIVE = new SignGuard(1);
    static final SignGuard NEGATIVE = new SignGuard(-1);

    private final int signum;

    private SignGuard(int signum) {
        this.signum = signum;
    }

    static Guard positive(List<RuleArgument> args) {
        Arguments.requireCount(BuiltinGuards.POSITIVE, args, 0);
        return POSITIVE;
    }

    static Guard negative(List<RuleArgument> args) {
        Arguments.requireCount(BuiltinGuards.NEGATIVE, args, 0);
        return NEGATIVE;
    }

    @Override
    public boolean isSatisfiedBy(Object value) {
        return Values.toDecimal(value)
            .map(number -> number.signum() == signum)
            .getOrElse(false);
    }

    @Override
    public String messageTemplate() {
        return signum > 0 ? "{name} must {not}be positive" : "{name} must {not}be negative";
    }
}
