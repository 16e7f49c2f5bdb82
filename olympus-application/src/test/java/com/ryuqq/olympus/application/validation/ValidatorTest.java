package com.ryuqq.olympus.application.validation;

import com.ryuqq.olympus.core.guard.FailureReport;
import com.ryuqq.olympus.core.guard.Guard;
import com.ryuqq.olympus.core.guard.GuardFactory;
import com.ryuqq.olympus.core.guard.GuardRegistry;
import com.ryuqq.olympus.core.guard.UnknownGuardException;
import com.ryuqq.olympus.core.guard.ValidationSpec;
import com.ryuqq.olympus.core.monad.Result;
import com.ryuqq.olympus.core.monad.Unit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Validator 테스트.
 *
 * @author Olympus Team
 * @since 1.0.0
 */
class ValidatorTest {

    record Person(String name, int age) {
        static Person from(Map<String, ?> values) {
            return new Person((String) values.get("name"), (Integer) values.get("age"));
        }
    }

    private static final ValidationSpec PERSON = ValidationSpec.builder()
        .field("name", "required|between[1, 20]")
        .field("age", "ge[0]|lt[150]")
        .build();

    private static final GuardFactory LATE = args -> new Guard() {
        @Override
        public boolean isSatisfiedBy(Object value) {
            return true;
        }

        @Override
        public String messageTemplate() {
            return "{name} is late";
        }
    };

    private GuardRegistry registry;

    @BeforeEach
    void setUp() {
        registry = GuardRegistry.withDefaults();
    }

    // ============================================================
    // 1. 레지스트리 freeze
    // ============================================================

    @Test
    void 기본_설정이면_레지스트리를_freeze함() {
        // when
        new Validator(registry);

        // then
        assertThat(registry.isFrozen()).isTrue();
        assertThatThrownBy(() -> registry.register("late", LATE))
            .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void freeze를_끄면_계속_등록할_수_있음() {
        // when
        new Validator(registry, new ValidatorConfig().withFreezeRegistry(false));
        registry.register("late", LATE);

        // then
        assertThat(registry.isFrozen()).isFalse();
        assertThat(registry.has("late")).isTrue();
    }

    // ============================================================
    // 2. validate / check
    // ============================================================

    @Test
    void validate_모든_필드가_통과하면_Ok() {
        // when
        Result<Unit, FailureReport> result = new Validator(registry).validate(Map.of("name", "kim", "age", 30), PERSON);

        // then
        assertThat(result.isOk()).isTrue();
    }

    @Test
    void validate_실패한_필드를_선언_순서대로_모음() {
        // given
        Map<String, Object> values = new HashMap<>();
        values.put("name", "");
        values.put("age", 200);

        // when
        Result<Unit, FailureReport> result = new Validator(registry).validate(values, PERSON);

        // then
        assertThat(result.isErr()).isTrue();
        assertThat(result.unwrapErr().messages())
            .containsExactly("name is required", "age must be less than 150");
    }

    @Test
    void validate_사용자_메시지로_대체됨() {
        // when
        Result<Unit, FailureReport> result = new Validator(registry, new ValidatorConfig().withLogFailures(false))
            .validate(Map.of("name", "kim", "age", -1), PERSON, Map.of("age", "나이는 0 이상이어야 합니다"));

        // then
        assertThat(result.unwrapErr().messages()).containsExactly("나이는 0 이상이어야 합니다");
    }

    @Test
    void validate_등록되지_않은_guard는_예외() {
        // given
        ValidationSpec spec = ValidationSpec.builder().field("name", "required|bogus").build();
        Validator validator = new Validator(registry);

        // when & then
        assertThatThrownBy(() -> validator.validate(Map.of("name", "kim"), spec))
            .isInstanceOf(UnknownGuardException.class);
    }

    @Test
    void check_단일_값_검증() {
        Validator validator = new Validator(registry);

        assertThat(validator.check("age", 17, "lt[18]").satisfied()).isTrue();
        assertThat(validator.check("age", 20, "lt[18]").message()).isEqualTo("age must be less than 18");
    }

    // ============================================================
    // 3. construct
    // ============================================================

    @Test
    void construct_검증_통과시_객체를_생성함() {
        // when
        Result<Person, FailureReport> person = new Validator(registry)
            .construct(Map.of("name", "kim", "age", 30), PERSON, Person::from);

        // then
        assertThat(person.unwrap()).isEqualTo(new Person("kim", 30));
    }

    @Test
    void construct_검증_실패시_factory를_호출하지_않음() {
        // given
        AtomicInteger calls = new AtomicInteger();

        // when
        Result<Person, FailureReport> person = new Validator(registry)
            .construct(Map.of("name", "kim", "age", -5), PERSON, values -> {
                calls.incrementAndGet();
                return Person.from(values);
            });

        // then
        assertThat(person.isErr()).isTrue();
        assertThat(person.unwrapErr().fields()).containsExactly("age");
        assertThat(calls).hasValue(0);
    }

    @Test
    void null_의존성은_거부됨() {
        assertThatThrownBy(() -> new Validator(null))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new Validator(registry, null))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
