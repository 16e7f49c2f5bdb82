package com.ryuqq.olympus.core.guard.builtin;

import com.ryuqq.olympus.core.guard.Guard;
import com.ryuqq.olympus.core.guard.MalformedRuleException;
import com.ryuqq.olympus.core.guard.RuleArgument;

import java.util.List;
import java.util.Map;
import java.util.function.IntPredicate;

/**
 * {@code lt}, {@code le}, {@code gt}, {@code ge}: 기준값과의 대소 비교.
 *
 * <p>숫자 기준은 숫자 값과, 문자열 기준은 문자열 값과만 비교합니다. 비교할 수 없는 값은
 * 만족하지 않습니다.</p>
 */
final class ComparisonGuard implements Guard {

    enum Operator {
        LT(BuiltinGuards.LT, "max", "{name} must {not}be less than {max}", c -> c < 0),
        LE(BuiltinGuards.LE, "max", "{name} must {not}be less than or equal to {max}", c -> c <= 0),
        GT(BuiltinGuards.GT, "min", "{name} must {not}be greater than {min}", c -> c > 0),
        GE(BuiltinGuards.GE, "min", "{name} must {not}be greater than or equal to {min}", c -> c >= 0);

        private final String guardName;
        private final String placeholder;
        private final String template;
        private final IntPredicate accepts;

        Operator(String guardName, String placeholder, String template, IntPredicate accepts) {
            this.guardName = guardName;
            this.placeholder = placeholder;
            this.template = template;
            this.accepts = accepts;
        }

        String guardName() {
            return guardName;
        }
    }

    private final Operator operator;
    private final RuleArgument bound;

    ComparisonGuard(Operator operator, RuleArgument bound) {
        if (!(bound instanceof RuleArgument.Numeric) && !(bound instanceof RuleArgument.Text)) {
            throw new MalformedRuleException(
                operator.guardName + " expects a number or a string but got " + bound.text()
            );
        }
        this.operator = operator;
        this.bound = bound;
    }

    static Guard create(Operator operator, List<RuleArgument> args) {
        Arguments.requireCount(operator.guardName, args, 1);
        return new ComparisonGuard(operator, args.get(0));
    }

    @Override
    public boolean isSatisfiedBy(Object value) {
        return Values.compare(value, bound.toValue())
            .map(operator.accepts::test)
            .getOrElse(false);
    }

    @Override
    public String messageTemplate() {
        return operator.template;
    }

    @Override
    public Map<String, String> placeholders() {
        return Map.of(operator.placeholder, bound.text());
    }
}
