package com.ryuqq.olympus.core.guard.builtin;

import com.ryuqq.olympus.core.guard.Guard;
import com.ryuqq.olympus.core.guard.MalformedRuleException;
import com.ryuqq.olympus.core.guard.RuleArgument;

import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * {@code regex[r"..."]}: 값의 문자열 형태가 패턴과 앞에서부터 일치.
 *
 * <p>{@link java.util.regex.Matcher#lookingAt()}를 사용하므로 전체 일치가 필요하면
 * 패턴에 {@code $}를 붙여야 합니다.</p>
 */
final class RegexGuard implements Guard {

    private final Pattern pattern;

    RegexGuard(String source) {
        try {
            this.pattern = Pattern.compile(source);
        } catch (PatternSyntaxException e) {
            throw new MalformedRuleException(BuiltinGuards.REGEX + " has an invalid pattern: " + source, e);
        }
    }

    static Guard create(List<RuleArgument> args) {
        Arguments.requireCount(BuiltinGuards.REGEX, args, 1);
        return new RegexGuard(Arguments.text(BuiltinGuards.REGEX, args.get(0)));
    }

    @Override
    public boolean isSatisfiedBy(Object value) {
        if (value == null) {
            return false;
        }
        return pattern.matcher(value.toString()).lookingAt();
    }

    @Override
    public String messageTemplate() {
        return "{name} must {not}match the regular expression {regex}";
    }

    @Override
    public Map<String, String> placeholders() {
        return Map.of("regex", pattern.pattern());
    }
}
