package com.ryuqq.olympus.core.guard.builtin;

import com.ryuqq.olympus.core.guard.Guard;
import com.ryuqq.olympus.core.guard.MalformedRuleException;
import com.ryuqq.olympus.core.guard.RuleArgument;

import java.util.List;
import java.util.Map;

/**
 * {@code in[[a, b, c]]} 또는 {@code in[a, b, c]}: 값이 목록의 한 항목과 같음.
 */
final class InGuard implements Guard {

    private final List<RuleArgument> items;

    InGuard(List<RuleArgument> items) {
        if (items.isEmpty()) {
            throw new MalformedRuleException(BuiltinGuards.IN + " expects at least one item");
        }
        this.items = List.copyOf(items);
    }

    static Guard create(List<RuleArgument> args) {
        if (args.size() == 1 && args.get(0) instanceof RuleArgument.Sequence sequence) {
            return new InGuard(sequence.items());
        }
        return new InGuard(args);
    }

    @Override
    public boolean isSatisfiedBy(Object value) {
        for (RuleArgument item : items) {
            if (Values.isEqual(value, item.toValue())) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String messageTemplate() {
        return "{name} must {not}be in the list {list}";
    }

    @Override
    public Map<String, String> placeholders() {
        return Map.of("list", new RuleArgument.Sequence(items).text());
    }
}
