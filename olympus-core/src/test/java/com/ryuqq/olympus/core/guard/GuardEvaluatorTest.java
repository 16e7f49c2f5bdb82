package com.ryuqq.olympus.core.guard;

import com.ryuqq.olympus.core.monad.Result;
import com.ryuqq.olympus.core.monad.Unit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * GuardEvaluator 테스트.
 *
 * @author Olympus Team
 * @since 1.0.0
 */
class GuardEvaluatorTest {

    private GuardRegistry registry;
    private GuardEvaluator evaluator;

    @BeforeEach
    void setUp() {
        registry = GuardRegistry.withDefaults();
        evaluator = new GuardEvaluator(registry);
    }

    @Test
    void evaluate_TwoFailingFields_ReportsBothInDeclarationOrder() {
        // Given
        ValidationSpec spec = ValidationSpec.builder()
            .field("name", "required")
            .field("age", "lt[18]")
            .build();

        // When
        Result<Unit, FailureReport> result = evaluator.evaluate(Map.of("name", "", "age", 20), spec);

        // Then
        assertThat(result.isErr()).isTrue();
        FailureReport report = result.unwrapErr();
        assertThat(report.fields()).containsExactly("name", "age");
        assertThat(report.messages()).containsExactly("name is required", "age must be less than 18");
    }

    @Test
    void evaluate_ValidEmail_ReturnsOk() {
        // Given
        ValidationSpec spec = ValidationSpec.builder()
            .field("email", "required|regex[r\"^[\\w.+-]+@[\\w-]+\\.[\\w.]+$\"]")
            .build();

        // When
        Result<Unit, FailureReport> result = evaluator.evaluate(Map.of("email", "a@b.com"), spec);

        // Then
        assertThat(result.isOk()).isTrue();
    }

    @Test
    void evaluate_InvalidEmail_ReportsRegexMessage() {
        ValidationSpec spec = ValidationSpec.builder()
            .field("email", "required|regex[r\"^[\\w.+-]+@[\\w-]+\\.[\\w.]+$\"]")
            .build();

        Result<Unit, FailureReport> result = evaluator.evaluate(Map.of("email", "not-an-email"), spec);

        assertThat(result.unwrapErr().messageFor("email").get())
            .startsWith("email must match the regular expression ^[\\w.+-]+@");
    }

    @Test
    void evaluate_UnknownGuard_ThrowsBeforeRunningAnyGuard() {
        // Given
        AtomicInteger calls = new AtomicInteger();
        registry.register("counting", args -> new Guard() {
            @Override
            public boolean isSatisfiedBy(Object value) {
                calls.incrementAndGet();
                return true;
            }

            @Override
            public String messageTemplate() {
                return "{name} counted";
            }
        });
        ValidationSpec spec = ValidationSpec.builder()
            .field("first", "counting")
            .field("second", "bogus_rule")
            .build();

        // When & Then
        assertThatThrownBy(() -> evaluator.evaluate(Map.of("first", 1, "second", 2), spec))
            .isInstanceOf(UnknownGuardException.class);
        assertThat(calls.get()).isZero();
    }

    @Test
    void evaluate_MalformedRule_ThrowsMalformedRuleException() {
        ValidationSpec spec = ValidationSpec.builder().field("age", "lt[18").build();

        assertThatThrownBy(() -> evaluator.evaluate(Map.of("age", 1), spec))
            .isInstanceOf(MalformedRuleException.class);
    }

    @Test
    void evaluate_WrongArgumentCount_ThrowsMalformedRuleException() {
        ValidationSpec spec = ValidationSpec.builder().field("age", "lt[1, 2]").build();

        assertThatThrownBy(() -> evaluator.evaluate(Map.of("age", 1), spec))
            .isInstanceOf(MalformedRuleException.class)
            .hasMessageContaining("lt expects 1 argument");
    }

    @Test
    void evaluate_StopsAtFirstFailurePerField() {
        // Given
        ValidationSpec spec = ValidationSpec.builder()
            .field("code", "required|length[3]|regex[r\"^[A-Z]+$\"]")
            .build();

        // When
        Result<Unit, FailureReport> result = evaluator.evaluate(Map.of("code", "ab"), spec);

        // Then
        assertThat(result.unwrapErr().messages()).containsExactly("code must have length 3");
    }

    @Test
    void evaluate_AbsentField_IsEvaluatedAsNull() {
        ValidationSpec spec = ValidationSpec.builder()
            .field("nickname", "required")
            .field("middle", "!required")
            .build();

        Result<Unit, FailureReport> result = evaluator.evaluate(Map.of(), spec);

        assertThat(result.unwrapErr().messages()).containsExactly("nickname is required");
    }

    @Test
    void evaluate_NullValueInMap_IsEvaluatedAsNull() {
        Map<String, Object> values = new HashMap<>();
        values.put("name", null);
        ValidationSpec spec = ValidationSpec.builder().field("name", "required").build();

        Result<Unit, FailureReport> result = evaluator.evaluate(values, spec);

        assertThat(result.unwrapErr().messages()).containsExactly("name is required");
    }

    @Test
    void evaluate_NegatedRule_PassesWhenGuardFails() {
        // Given
        ValidationSpec spec = ValidationSpec.builder()
            .field("tags", "!empty")
            .field("age", "!lt[18]")
            .build();

        // When
        Result<Unit, FailureReport> ok = evaluator.evaluate(Map.of("tags", List.of("a"), "age", 30), spec);
        Result<Unit, FailureReport> err = evaluator.evaluate(Map.of("tags", List.of(), "age", 10), spec);

        // Then
        assertThat(ok.isOk()).isTrue();
        assertThat(err.unwrapErr().messages())
            .containsExactly("tags must not be empty", "age must not be less than 18");
    }

    @Test
    void evaluate_CustomMessages_OverrideRenderedMessage() {
        // Given
        ValidationSpec spec = ValidationSpec.builder()
            .field("name", "required")
            .field("age", "ge[18]")
            .build();

        // When
        Result<Unit, FailureReport> result = evaluator.evaluate(
            Map.of("name", "", "age", 10),
            spec,
            Map.of("age", "You must be an adult")
        );

        // Then
        assertThat(result.unwrapErr().messages())
            .containsExactly("name is required", "You must be an adult");
    }

    @Test
    void evaluate_EmptyRuleString_AlwaysPasses() {
        ValidationSpec spec = ValidationSpec.builder().field("free", "").build();

        assertThat(evaluator.evaluate(Map.of(), spec).isOk()).isTrue();
    }

    @Test
    void check_SingleField_ReturnsGuardResult() {
        GuardResult passed = evaluator.check("age", 17, "required|lt[18]");
        GuardResult failed = evaluator.check("age", 18, "required|lt[18]");

        assertThat(passed.satisfied()).isTrue();
        assertThat(failed.satisfied()).isFalse();
        assertThat(failed.message()).isEqualTo("age must be less than 18");
        assertThat(failed.toResult().unwrapErr()).isEqualTo("age must be less than 18");
    }

    @Test
    void compile_SameRuleString_IsCachedOnce() {
        // When
        evaluator.check("a", 1, "required|lt[18]");
        evaluator.check("b", 2, "required|lt[18]");
        evaluator.precompile("required|lt[18]");
        int count = evaluator.precompile("positive");

        // Then
        assertThat(count).isEqualTo(1);
        assertThat(evaluator.cachedRuleCount()).isEqualTo(2);
    }

    @Test
    void combine_ReturnsFirstFailure() {
        GuardResult first = GuardResult.fail("first");
        GuardResult second = GuardResult.fail("second");

        assertThat(GuardResult.combine(List.of(GuardResult.ok(), first, second))).isSameAs(first);
        assertThat(GuardResult.combine(List.of(GuardResult.ok(), GuardResult.ok())).satisfied()).isTrue();
    }
}
