package com.ryuqq.olympus.application.validation;

import com.ryuqq.olympus.core.guard.FailureReport;
import com.ryuqq.olympus.core.guard.GuardEvaluator;
import com.ryuqq.olympus.core.guard.GuardRegistry;
import com.ryuqq.olympus.core.guard.GuardResult;
import com.ryuqq.olympus.core.guard.ValidationSpec;
import com.ryuqq.olympus.core.monad.Result;
import com.ryuqq.olympus.core.monad.Unit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.function.Function;

/**
 * 검증 진입점.
 *
 * <p>초기화 단계에서 채운 {@link GuardRegistry}를 받아 (기본 설정이면) freeze하고,
 * 이후 검증 요청을 {@link GuardEvaluator}에 위임합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * GuardRegistry registry = GuardRegistry.withDefaults();
 * Validator validator = new Validator(registry, new ValidatorConfig());
 *
 * ValidationSpec spec = ValidationSpec.builder()
 *     .field("name", "required|between[1, 50]")
 *     .field("age", "ge[0]|lt[150]")
 *     .build();
 *
 * Result&lt;Person, FailureReport&gt; person = validator.construct(values, spec, Person::from);
 * </pre>
 *
 * <p>Thread-safe: registry가 freeze된 뒤에는 여러 스레드에서 동시에 사용할 수 있습니다.</p>
 *
 * @author Olympus Team
 * @since 1.0.0
 */
public final class Validator {

    private static final Logger log = LoggerFactory.getLogger(Validator.class);
    private final GuardRegistry registry;
    private final GuardEvaluator evaluator;
    private final ValidatorConfig config;

    /**
     * 기본 설정으로 생성.
     *
     * @param registry guard 레지스트리
     */
    public Validator(GuardRegistry registry) {
        this(registry, new ValidatorConfig());
    }

    /**
     * 생성자.
     *
     * @param registry guard 레지스트리
     * @param config 설정
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public Validator(GuardRegistry registry, ValidatorConfig config) {
        if (registry == null) {
            throw new IllegalArgumentException("registry cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.registry = registry;
        this.config = config;
        this.evaluator = new GuardEvaluator(registry);

        if (config.freezeRegistry() && !registry.isFrozen()) {
            registry.freeze();
            log.info("Guard registry frozen with {} guard(s): {}", registry.size(), registry.names());
        }
    }

    /**
     * 모든 필드 검증.
     *
     * @param values 필드 이름 → 값
     * @param spec 필드 이름 → 규칙 문자열
     * @return Ok(UNIT) 또는 실패 보고서를 담은 Err
     * @throws com.ryuqq.olympus.core.guard.GuardException 규칙 문자열 오류
     */
    public Result<Unit, FailureReport> validate(Map<String, ?> values, ValidationSpec spec) {
        return report(evaluator.evaluate(values, spec));
    }

    /**
     * 모든 필드 검증 (필드별 사용자 메시지).
     *
     * @param values 필드 이름 → 값
     * @param spec 필드 이름 → 규칙 문자열
     * @param messages 필드 이름 → 실패 시 메시지
     * @return Ok(UNIT) 또는 실패 보고서를 담은 Err
     */
    public Result<Unit, FailureReport> validate(Map<String, ?> values, ValidationSpec spec, Map<String, String> messages) {
        return report(evaluator.evaluate(values, spec, messages));
    }

    /**
     * 단일 값 검증.
     *
     * @param field 필드 이름
     * @param value 값
     * @param rule 규칙 문자열
     * @return 검증 결과
     */
    public GuardResult check(String field, Object value, String rule) {
        return evaluator.check(field, value, rule);
    }

    /**
     * 검증을 통과한 경우에만 객체를 생성.
     *
     * <p>검증이 실패하면 factory는 호출되지 않습니다.</p>
     *
     * @param values 필드 이름 → 값
     * @param spec 필드 이름 → 규칙 문자열
     * @param factory 검증된 값으로 객체를 만드는 함수 (null 반환 불가)
     * @param <T> 생성할 객체 타입
     * @return 생성된 객체 또는 실패 보고서
     */
    public <T> Result<T, FailureReport> construct(
        Map<String, ?> values,
        ValidationSpec spec,
        Function<? super Map<String, ?>, ? extends T> factory
    ) {
        if (factory == null) {
            throw new IllegalArgumentException("factory cannot be null");
        }
        return validate(values, spec).map(ignored -> factory.apply(values));
    }

    public GuardRegistry getRegistry() {
        return registry;
    }

    private Result<Unit, FailureReport> report(Result<Unit, FailureReport> result) {
        if (config.logFailures() && result.isErr() && log.isDebugEnabled()) {
            FailureReport failures = result.unwrapErr();
            log.debug("Validation failed for {} field(s): {}", failures.size(), failures);
        }
        return result;
    }
}
