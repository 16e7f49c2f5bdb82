package com.ryuqq.olympus.core.guard;

import com.ryuqq.olympus.core.monad.Maybe;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 검증 실패 보고서.
 *
 * <p>예외가 아닌 예상 가능한 도메인 결과이며, {@code Result.Err}로 전달됩니다.
 * 실패한 필드마다 하나의 {@link FieldFailure}를 필드 선언 순서대로 담습니다.</p>
 *
 * @param failures 실패 목록 (비어 있을 수 없음)
 *
 * @author Olympus Team
 * @since 1.0.0
 */
public record FailureReport(List<FieldFailure> failures) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException failures가 null이거나 비어 있는 경우
     */
    public FailureReport {
        if (failures == null || failures.isEmpty()) {
            throw new IllegalArgumentException("failures cannot be null or empty");
        }
        failures = List.copyOf(failures);
    }

    public static FailureReport of(FieldFailure... failures) {
        return new FailureReport(List.of(failures));
    }

    /**
     * @return 실패 메시지 목록 (선언 순서)
     */
    public List<String> messages() {
        return failures.stream().map(FieldFailure::message).toList();
    }

    /**
     * @return 실패한 필드 이름 목록 (선언 순서)
     */
    public List<String> fields() {
        return failures.stream().map(FieldFailure::field).toList();
    }

    /**
     * 특정 필드의 실패 메시지.
     *
     * @param field 필드 이름
     * @return 메시지, 해당 필드가 실패하지 않았으면 None
     */
    public Maybe<String> messageFor(String field) {
        for (FieldFailure failure : failures) {
            if (failure.field().equals(field)) {
                return Maybe.some(failure.message());
            }
        }
        return Maybe.none();
    }

    /**
     * @return 첫 번째 실패
     */
    public FieldFailure first() {
        return failures.get(0);
    }

    public int size() {
        return failures.size();
    }

    @Override
    public String toString() {
        return failures.stream().map(FieldFailure::message).collect(Collectors.joining("; "));
    }
}
