package com.ryuqq.olympus.core.guard.builtin;

import com.ryuqq.olympus.core.guard.Guard;
import com.ryuqq.olympus.core.guard.RuleArgument;

import java.math.BigDecimal;
import java.util.List;

/**
 * {@code odd}, {@code even}: 정수 값의 홀짝. 소수부가 있는 값은 만족하지 않습니다.
 */
final class ParityGuard implements Guard {

    private static final BigDecimal TWO = BigDecimal.valueOf(2);

    static final ParityGuard ODD = new ParityGuard(true);
    static final ParityGuard EVEN = new ParityGuard(false);

    private final boolean odd;

    private ParityGuard(boolean odd) {
        this.odd = odd;
    }

    static Guard odd(List<RuleArgument> args) {
        Arguments.requireCount(BuiltinGuards.ODD, args, 0);
        return ODD;
    }

    static Guard even(List<RuleArgument> args) {
        Arguments.requireCount(BuiltinGuards.EVEN, args, 0);
        return EVEN;
    }

    @Override
    public boolean isSatisfiedBy(Object value) {
        return Values.toDecimal(value)
            .filter(Values::isIntegral)
            .map(number -> (number.remainder(TWO).signum() != 0) == odd)
            .getOrElse(false);
    }

    @Override
    public String messageTemplate() {
        return odd ? "{name} must {not}be odd" : "{name} must {not}be even";
    }
}
