package com.ryuqq.olympus.core.monad;

/**
 * 실패한 {@link Result}에 대해 {@link Result#unwrap()}을 호출했을 때 발생.
 *
 * <p>호출자가 Result 계약을 위반한 것이므로 복구 대상이 아닙니다.
 * 실패를 처리하려면 {@link Result#unwrapOrElse(java.util.function.Function)}를 사용하십시오.</p>
 *
 * <p>원래의 에러 값은 {@link #getError()}로 확인할 수 있습니다.</p>
 *
 * @author Olympus Team
 * @since 1.0.0
 */
public class UnwrapOnErrException extends IllegalStateException {

    private final transient Object error;

    public UnwrapOnErrException(Object error) {
        super("Cannot unwrap a failed result: " + error);
        this.error = error;
    }

    /**
     * Result에 담겨 있던 에러 값.
     *
     * @return 에러 값 (null 아님)
     */
    public Object getError() {
        return error;
    }
}
