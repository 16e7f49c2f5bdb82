package com.ryuqq.olympus.core.guard;

import java.util.Map;

/**
 * 레지스트리에서 해석된 규칙. 부정 처리와 메시지 렌더링을 담당.
 */
record CompiledGuard(GuardRule rule, Guard guard) {

    GuardResult check(String field, Object value) {
        if (guard.isSatisfiedBy(value) != rule.negate()) {
            return GuardResult.ok();
        }
        return GuardResult.fail(render(field));
    }

    private String render(String field) {
        String message = guard.messageTemplate()
            .replace("{name}", field)
            .replace("{not}", rule.negate() ? "not " : "");
        for (Map.Entry<String, String> placeholder : guard.placeholders().entrySet()) {
            message = message.replace("{" + placeholder.getKey() + "}", placeholder.getValue());
        }
        return message;
    }
}
