package com.ryuqq.olympus.core.guard;

import com.ryuqq.olympus.core.monad.Result;
import com.ryuqq.olympus.core.monad.Unit;

import java.util.List;

/**
 * 단일 필드에 대한 guard 평가 결과.
 *
 * @param satisfied 모든 규칙을 만족했는지
 * @param message 실패 메시지 (성공이면 null)
 *
 * @author Olympus Team
 * @since 1.0.0
 */
public record GuardResult(boolean satisfied, String message) {

    private static final GuardResult OK = new GuardResult(true, null);

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 실패인데 message가 비어 있는 경우
     */
    public GuardResult {
        if (!satisfied && (message == null || message.isBlank())) {
            throw new IllegalArgumentException("message cannot be null or blank for a failed guard result");
        }
    }

    public static GuardResult ok() {
        return OK;
    }

    public static GuardResult fail(String message) {
        return new GuardResult(false, message);
    }

    /**
     * 여러 결과 중 첫 번째 실패를 반환. 모두 성공이면 성공.
     *
     * @param results 결과 목록
     * @return 첫 번째 실패 또는 성공
     */
    public static GuardResult combine(List<GuardResult> results) {
        for (GuardResult result : results) {
            if (!result.satisfied()) {
                return result;
            }
        }
        return OK;
    }

    /**
     * Result로 변환. 실패 메시지는 Err가 됩니다.
     *
     * @return Ok(UNIT) 또는 Err(message)
     */
    public Result<Unit, String> toResult() {
        return satisfied ? Result.ok() : Result.err(message);
    }
}
