package com.ryuqq.olympus.core.guard;

import java.util.Map;

/**
 * 하나의 필드 값을 검증하는 조건.
 *
 * <p>Guard는 두 가지 능력만 가집니다:</p>
 * <ul>
 *   <li>{@link #isSatisfiedBy(Object)}: 값이 조건을 만족하는지</li>
 *   <li>{@link #messageTemplate()}: 실패 메시지 템플릿</li>
 * </ul>
 *
 * <p><strong>메시지 템플릿 치환자:</strong></p>
 * <ul>
 *   <li>{@code {name}}: 필드 이름</li>
 *   <li>{@code {not}}: 부정 규칙이면 {@code "not "}, 아니면 {@code ""}</li>
 *   <li>{@link #placeholders()}의 각 키 (예: {@code {max}})</li>
 * </ul>
 *
 * <pre>
 * "{name} must {not}be less than {max}"
 *   → "age must be less than 18"       (lt[18])
 *   → "age must not be less than 18"   (!lt[18])
 * </pre>
 *
 * <p><strong>부정:</strong> 부정은 평가기가 처리합니다. 구현체는 부정 여부를 알 필요 없이
 * 조건 자체만 판단합니다.</p>
 *
 * <p><strong>스레드 안전성:</strong> 컴파일된 guard는 캐시되어 여러 평가와 스레드에서
 * 재사용되므로 불변이어야 합니다.</p>
 *
 * @author Olympus Team
 * @since 1.0.0
 * @see GuardFactory
 * @see GuardRegistry
 */
public interface Guard {

    /**
     * 값이 조건을 만족하는지 판단.
     *
     * @param value 필드 값 (필드가 없으면 null)
     * @return 만족 여부
     */
    boolean isSatisfiedBy(Object value);

    /**
     * 실패 메시지 템플릿.
     *
     * @return {@code {name}}, {@code {not}} 치환자를 포함한 템플릿
     */
    String messageTemplate();

    /**
     * 템플릿에 추가로 치환할 값.
     *
     * @return 치환자 이름 → 값 (기본: 빈 맵)
     */
    default Map<String, String> placeholders() {
        return Map.of();
    }
}
