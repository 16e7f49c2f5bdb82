package com.ryuqq.olympus.core.guard;

import com.ryuqq.olympus.core.monad.Result;
import com.ryuqq.olympus.core.monad.Unit;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * 규칙 문자열로 필드 값을 검증하는 평가기.
 *
 * <p><strong>평가 순서:</strong></p>
 * <ol>
 *   <li>ValidationSpec의 모든 규칙 문자열을 먼저 컴파일 (파싱 + 레지스트리 해석).
 *       문법 오류나 등록되지 않은 guard는 어떤 guard도 실행되기 전에 예외로 전파됩니다.</li>
 *   <li>필드 선언 순서대로 평가. 없는 필드는 null로 평가합니다.</li>
 *   <li>필드 내부는 첫 번째 실패에서 중단, 필드 간에는 모든 필드를 검사합니다.</li>
 * </ol>
 *
 * <p>컴파일된 규칙 체인은 규칙 문자열 단위로 캐시됩니다. 같은 평가기에서 같은
 * 규칙 문자열은 한 번만 파싱됩니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * GuardEvaluator evaluator = new GuardEvaluator(GuardRegistry.withDefaults());
 *
 * Result&lt;Unit, FailureReport&gt; result = evaluator.evaluate(
 *     Map.of("name", "", "age", 20),
 *     ValidationSpec.builder().field("name", "required").field("age", "lt[18]").build()
 * );
 * // Err: ["name is required", "age must be less than 18"]
 * </pre>
 *
 * @author Olympus Team
 * @since 1.0.0
 */
public final class GuardEvaluator {

    private final GuardRegistry registry;
    private final ConcurrentMap<String, List<CompiledGuard>> compiled = new ConcurrentHashMap<>();

    /**
     * @param registry guard 레지스트리
     * @throws IllegalArgumentException registry가 null인 경우
     */
    public GuardEvaluator(GuardRegistry registry) {
        if (registry == null) {
            throw new IllegalArgumentException("registry cannot be null");
        }
        this.registry = registry;
    }

    /**
     * 모든 필드 검증.
     *
     * @param values 필드 이름 → 값
     * @param spec 필드 이름 → 규칙 문자열
     * @return 모두 통과하면 Ok(UNIT), 아니면 실패한 필드를 모은 Err
     * @throws MalformedRuleException 규칙 문자열 문법 오류
     * @throws UnknownGuardException 등록되지 않은 guard 이름
     */
    public Result<Unit, FailureReport> evaluate(Map<String, ?> values, ValidationSpec spec) {
        return evaluate(values, spec, Map.of());
    }

    /**
     * 모든 필드 검증. 실패한 필드에 사용자 메시지가 있으면 렌더링된 메시지 대신 사용합니다.
     *
     * @param values 필드 이름 → 값
     * @param spec 필드 이름 → 규칙 문자열
     * @param messages 필드 이름 → 실패 시 메시지
     * @return 모두 통과하면 Ok(UNIT), 아니면 실패한 필드를 모은 Err
     */
    public Result<Unit, FailureReport> evaluate(Map<String, ?> values, ValidationSpec spec, Map<String, String> messages) {
        if (values == null) {
            throw new IllegalArgumentException("values cannot be null");
        }
        if (spec == null) {
            throw new IllegalArgumentException("spec cannot be null");
        }
        if (messages == null) {
            throw new IllegalArgumentException("messages cannot be null");
        }

        Map<String, List<CompiledGuard>> chains = new LinkedHashMap<>();
        spec.rules().forEach((field, rule) -> chains.put(field, compile(rule)));

        List<FieldFailure> failures = new ArrayList<>();
        for (Map.Entry<String, List<CompiledGuard>> chain : chains.entrySet()) {
            String field = chain.getKey();
            GuardResult result = run(field, values.get(field), chain.getValue());
            if (!result.satisfied()) {
                failures.add(new FieldFailure(field, messages.getOrDefault(field, result.message())));
            }
        }

        if (failures.isEmpty()) {
            return Result.ok();
        }
        return Result.err(new FailureReport(failures));
    }

    /**
     * 단일 필드 검증.
     *
     * @param field 필드 이름 (메시지에 사용)
     * @param value 값 (null 허용)
     * @param rule 규칙 문자열
     * @return 첫 번째 실패 또는 성공
     */
    public GuardResult check(String field, Object value, String rule) {
        if (field == null) {
            throw new IllegalArgumentException("field cannot be null");
        }
        return run(field, value, compile(rule));
    }

    /**
     * 규칙 문자열을 미리 컴파일하여 캐시에 올림.
     *
     * @param rule 규칙 문자열
     * @return 규칙 개수
     */
    public int precompile(String rule) {
        return compile(rule).size();
    }

    int cachedRuleCount() {
        return compiled.size();
    }

    private List<CompiledGuard> compile(String rule) {
        if (rule == null) {
            throw new IllegalArgumentException("rule cannot be null");
        }
        return compiled.computeIfAbsent(rule, statement -> RuleParser.parse(statement).stream()
            .map(parsed -> new CompiledGuard(parsed, registry.resolve(parsed)))
            .toList());
    }

    private static GuardResult run(String field, Object value, List<CompiledGuard> chain) {
        for (CompiledGuard guard : chain) {
            GuardResult result = guard.check(field, value);
            if (!result.satisfied()) {
                return result;
            }
        }
        return GuardResult.ok();
    }
}
