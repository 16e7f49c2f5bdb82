package com.ryuqq.olympus.core.guard;

import java.util.List;

/**
 * 규칙 문자열의 한 토큰: {@code ["!"] name ["[" args "]"]}.
 *
 * @param name guard 이름 (레지스트리 키)
 * @param negate 부정 여부 ({@code !} 접두사)
 * @param args 인자 목록 (순서 유지, 없으면 빈 목록)
 *
 * @author Olympus Team
 * @since 1.0.0
 */
public record GuardRule(
    String name,
    boolean negate,
    List<RuleArgument> args
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException name이 null이거나 빈 문자열인 경우
     */
    public GuardRule {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        args = args == null ? List.of() : List.copyOf(args);
    }

    /**
     * 인자 없는 규칙 생성.
     *
     * @param name guard 이름
     * @return GuardRule 인스턴스
     */
    public static GuardRule of(String name) {
        return new GuardRule(name, false, List.of());
    }

    /**
     * 규칙 문자열 표기. {@link RuleParser#parse(String)}로 다시 파싱하면 같은 규칙이 됩니다.
     */
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        if (negate) {
            sb.append('!');
        }
        sb.append(name);
        if (!args.isEmpty()) {
            sb.append('[');
            for (int i = 0; i < args.size(); i++) {
                if (i > 0) {
                    sb.append(", ");
                }
                sb.append(args.get(i).literal());
            }
            sb.append(']');
        }
        return sb.toString();
    }
}
