package com.ryuqq.olympus.core.guard.builtin;

import com.ryuqq.olympus.core.guard.GuardRegistry;

import java.util.List;

/**
 * 기본 guard 등록.
 *
 * <table>
 *   <caption>기본 guard</caption>
 *   <tr><th>이름</th><th>인자</th><th>조건</th></tr>
 *   <tr><td>required</td><td>-</td><td>null, None, 빈 값이 아님</td></tr>
 *   <tr><td>empty</td><td>-</td><td>길이 0</td></tr>
 *   <tr><td>length</td><td>n</td><td>길이 == n</td></tr>
 *   <tr><td>between</td><td>min, max</td><td>min &lt;= 길이 &lt;= max</td></tr>
 *   <tr><td>regex</td><td>pattern</td><td>앞에서부터 일치</td></tr>
 *   <tr><td>in</td><td>items</td><td>목록에 포함</td></tr>
 *   <tr><td>eq</td><td>expected</td><td>같음</td></tr>
 *   <tr><td>lt, le, gt, ge</td><td>bound</td><td>대소 비교</td></tr>
 *   <tr><td>odd, even</td><td>-</td><td>홀짝</td></tr>
 *   <tr><td>positive, negative</td><td>-</td><td>부호</td></tr>
 * </table>
 *
 * @author Olympus Team
 * @since 1.0.0
 */
public final class BuiltinGuards {

    public static final String REQUIRED = "required";
    public static final String EMPTY = "empty";
    public static final String LENGTH = "length";
    public static final String BETWEEN = "between";
    public static final String REGEX = "regex";
    public static final String IN = "in";
    public static final String EQ = "eq";
    public static final String LT = "lt";
    public static final String LE = "le";
    public static final String GT = "gt";
    public static final String GE = "ge";
    public static final String ODD = "odd";
    public static final String EVEN = "even";
    public static final String POSITIVE = "positive";
    public static final String NEGATIVE = "negative";

    public static final List<String> NAMES = List.of(
        REQUIRED, EMPTY, LENGTH, BETWEEN, REGEX, IN, EQ,
        LT, LE, GT, GE, ODD, EVEN, POSITIVE, NEGATIVE
    );

    private BuiltinGuards() {
    }

    /**
     * 모든 기본 guard를 등록.
     *
     * @param registry 대상 레지스트리
     * @throws com.ryuqq.olympus.core.guard.DuplicateGuardNameException 이미 같은 이름이 등록된 경우
     * @throws IllegalStateException 레지스트리가 freeze된 경우
     */
    public static void registerAll(GuardRegistry registry) {
        if (registry == null) {
            throw new IllegalArgumentException("registry cannot be null");
        }
        registry.register(REQUIRED, RequiredGuard::create);
        registry.register(EMPTY, EmptyGuard::create);
        registry.register(LENGTH, LengthGuard::create);
        registry.register(BETWEEN, BetweenGuard::create);
        registry.register(REGEX, RegexGuard::create);
        registry.register(IN, InGuard::create);
        registry.register(EQ, EqualGuard::create);
        for (ComparisonGuard.Operator operator : ComparisonGuard.Operator.values()) {
            registry.register(operator.guardName(), args -> ComparisonGuard.create(operator, args));
        }
        registry.register(ODD, ParityGuard::odd);
        registry.register(EVEN, ParityGuard::even);
        registry.register(POSITIVE, SignGuard::positive);
        registry.register(NEGATIVE, SignGuard::negative);
    }
}
