package com.ryuqq.olympus.core.guard;

import com.ryuqq.olympus.core.monad.Maybe;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * 필드 이름 → 규칙 문자열 매핑.
 *
 * <p>필드 선언 순서가 유지되며, 평가와 실패 보고도 이 순서를 따릅니다.</p>
 *
 * <pre>
 * ValidationSpec spec = ValidationSpec.builder()
 *     .field("name", "required|regex[r\"^[a-zA-Z0-9 ]+$\"]")
 *     .field("age", "lt[18]")
 *     .build();
 * </pre>
 *
 * @author Olympus Team
 * @since 1.0.0
 */
public final class ValidationSpec {

    private final Map<String, String> rules;

    private ValidationSpec(Map<String, String> rules) {
        this.rules = Collections.unmodifiableMap(new LinkedHashMap<>(rules));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * 맵에서 생성. 맵의 순회 순서를 필드 선언 순서로 사용합니다.
     *
     * @param rules 필드 이름 → 규칙 문자열
     * @return ValidationSpec 인스턴스
     * @throws IllegalArgumentException rules가 null이거나 null 키/값을 포함하는 경우
     */
    public static ValidationSpec of(Map<String, String> rules) {
        if (rules == null) {
            throw new IllegalArgumentException("rules cannot be null");
        }
        Builder builder = builder();
        rules.forEach(builder::field);
        return builder.build();
    }

    /**
     * @return 필드 이름 → 규칙 문자열 (선언 순서, 불변)
     */
    public Map<String, String> rules() {
        return rules;
    }

    public Set<String> fields() {
        return rules.keySet();
    }

    public Maybe<String> ruleFor(String field) {
        return Maybe.ofNullable(rules.get(field));
    }

    public boolean isEmpty() {
        return rules.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ValidationSpec that = (ValidationSpec) o;
        return rules.equals(that.rules);
    }

    @Override
    public int hashCode() {
        return Objects.hash(rules);
    }

    @Override
    public String toString() {
        return "ValidationSpec" + rules;
    }

    /**
     * ValidationSpec 빌더.
     */
    public static final class Builder {

        private final Map<String, String> rules = new LinkedHashMap<>();

        private Builder() {
        }

        /**
         * 필드 규칙 추가.
         *
         * @param name 필드 이름
         * @param rule 규칙 문자열
         * @return this
         * @throws IllegalArgumentException name/rule이 null이거나 name이 이미 선언된 경우
         */
        public Builder field(String name, String rule) {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("field name cannot be null or blank");
            }
            if (rule == null) {
                throw new IllegalArgumentException("rule cannot be null (field: " + name + ")");
            }
            if (rules.putIfAbsent(name, rule) != null) {
                throw new IllegalArgumentException("field already declared: " + name);
            }
            return this;
        }

        public ValidationSpec build() {
            return new ValidationSpec(rules);
        }
    }
}
