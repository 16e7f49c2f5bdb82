package com.ryuqq.olympus.core.guard;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 규칙 문자열에서 파싱된 guard 인자.
 *
 * <p>인자는 다음 중 하나입니다:</p>
 * <ul>
 *   <li>{@link Numeric}: 정수 또는 소수 ({@code 18}, {@code -2.5})</li>
 *   <li>{@link Text}: 따옴표 문자열 또는 일반 토큰 ({@code "a, b"}, {@code hello})</li>
 *   <li>{@link RegexLiteral}: 정규식 리터럴 ({@code r"^\d+$"})</li>
 *   <li>{@link Flag}: {@code true} / {@code false}</li>
 *   <li>{@link Nil}: {@code none} / {@code null}</li>
 *   <li>{@link Sequence}: 중첩 목록 ({@code [a, b]}, {@code (1, 2)})</li>
 * </ul>
 *
 * @author Olympus Team
 * @since 1.0.0
 */
public sealed interface RuleArgument
    permits RuleArgument.Numeric, RuleArgument.Text, RuleArgument.RegexLiteral,
            RuleArgument.Flag, RuleArgument.Nil, RuleArgument.Sequence {

    /**
     * guard가 비교에 사용하는 값.
     *
     * @return BigDecimal, String, Boolean, List 또는 null (Nil)
     */
    Object toValue();

    /**
     * 메시지에 표시되는 형태.
     *
     * @return 원문에 가까운 문자열
     */
    String text();

    /**
     * 규칙 문자열 표기. 다시 파싱하면 같은 인자가 됩니다.
     *
     * @return 구분자와 이스케이프를 포함한 문자열
     */
    String literal();

    /**
     * @param value 숫자 값
     * @param raw 규칙 문자열에 적힌 그대로의 표기
     */
    record Numeric(BigDecimal value, String raw) implements RuleArgument {

        public Numeric {
            if (value == null || raw == null) {
                throw new IllegalArgumentException("value and raw cannot be null");
            }
        }

        public static Numeric of(String raw) {
            return new Numeric(new BigDecimal(raw), raw);
        }

        @Override
        public Object toValue() {
            return value;
        }

        @Override
        public String text() {
            return raw;
        }

        @Override
        public String literal() {
            return raw;
        }
    }

    record Text(String value) implements RuleArgument {

        public Text {
            if (value == null) {
                throw new IllegalArgumentException("value cannot be null");
            }
        }

        @Override
        public Object toValue() {
            return value;
        }

        @Override
        public String text() {
            return value;
        }

        @Override
        public String literal() {
            return '"' + value.replace("\\", "\\\\").replace("\"", "\\\"") + '"';
        }
    }

    record RegexLiteral(String source) implements RuleArgument {

        public RegexLiteral {
            if (source == null) {
                throw new IllegalArgumentException("source cannot be null");
            }
        }

        @Override
        public Object toValue() {
            return source;
        }

        @Override
        public String text() {
            return source;
        }

        @Override
        public String literal() {
            return "r\"" + source.replace("\"", "\\\"") + '"';
        }
    }

    record Flag(boolean value) implements RuleArgument {

        @Override
        public Object toValue() {
            return value;
        }

        @Override
        public String text() {
            return Boolean.toString(value);
        }

        @Override
        public String literal() {
            return text();
        }
    }

    record Nil() implements RuleArgument {

        @Override
        public Object toValue() {
            return null;
        }

        @Override
        public String text() {
            return "none";
        }

        @Override
        public String literal() {
            return text();
        }
    }

    record Sequence(List<RuleArgument> items) implements RuleArgument {

        public Sequence {
            if (items == null) {
                throw new IllegalArgumentException("items cannot be null");
            }
            items = List.copyOf(items);
        }

        @Override
        public Object toValue() {
            // Nil 항목 때문에 List.copyOf 사용 불가
            List<Object> values = new ArrayList<>(items.size());
            for (RuleArgument item : items) {
                values.add(item.toValue());
            }
            return values;
        }

        @Override
        public String text() {
            return items.stream()
                .map(RuleArgument::text)
                .collect(Collectors.joining(", ", "[", "]"));
        }

        @Override
        public String literal() {
            return items.stream()
                .map(RuleArgument::literal)
                .collect(Collectors.joining(", ", "[", "]"));
        }
    }
}
