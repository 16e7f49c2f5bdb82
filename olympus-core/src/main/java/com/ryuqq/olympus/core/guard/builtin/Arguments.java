package com.ryuqq.olympus.core.guard.builtin;

import com.ryuqq.olympus.core.guard.MalformedRuleException;
import com.ryuqq.olympus.core.guard.RuleArgument;

import java.math.BigDecimal;
import java.util.List;

/**
 * 규칙 인자 검사. 개수나 종류가 맞지 않으면 {@link MalformedRuleException}.
 */
final class Arguments {

    private Arguments() {
    }

    static void requireCount(String guard, List<RuleArgument> args, int expected) {
        if (args.size() != expected) {
            throw new MalformedRuleException(
                guard + " expects " + expected + " argument(s) but got " + args.size()
            );
        }
    }

    static BigDecimal decimal(String guard, RuleArgument arg) {
        if (arg instanceof RuleArgument.Numeric numeric) {
            return numeric.value();
        }
        throw new MalformedRuleException(guard + " expects a number but got " + arg.text());
    }

    static int length(String guard, RuleArgument arg) {
        BigDecimal value = decimal(guard, arg);
        try {
            int length = value.intValueExact();
            if (length < 0) {
                throw new MalformedRuleException(guard + " expects a non-negative length but got " + arg.text());
            }
            return length;
        } catch (ArithmeticException e) {
            throw new MalformedRuleException(guard + " expects an integer length but got " + arg.text(), e);
        }
    }

    static String text(String guard, RuleArgument arg) {
        if (arg instanceof RuleArgument.Text text) {
            return text.value();
        }
        if (arg instanceof RuleArgument.RegexLiteral regex) {
            return regex.source();
        }
        throw new MalformedRuleException(guard + " expects a string but got " + arg.text());
    }
}
