package com.ryuqq.olympus.core.guard;

import java.util.List;

/**
 * 규칙 인자로 {@link Guard}를 생성하는 팩토리.
 *
 * <p>{@link GuardRegistry}에 이름과 함께 등록됩니다. 인자 개수나 종류가 맞지 않으면
 * {@link MalformedRuleException}을 던져야 합니다.</p>
 *
 * <pre>
 * registry.register("startsWith", args -&gt; {
 *     String prefix = args.get(0).text();
 *     return new Guard() { ... };
 * });
 * </pre>
 *
 * @author Olympus Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface GuardFactory {

    /**
     * Guard 생성.
     *
     * @param args 규칙 인자 (순서 유지)
     * @return Guard 인스턴스 (null 불가)
     * @throws MalformedRuleException 인자가 올바르지 않은 경우
     */
    Guard create(List<RuleArgument> args);
}
