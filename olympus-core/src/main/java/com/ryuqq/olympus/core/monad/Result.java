package com.ryuqq.olympus.core.monad;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * 성공 값 또는 실패 에러를 담는 결과.
 *
 * <p>Result는 두 가지 경우를 가집니다:</p>
 * <ul>
 *   <li>{@link Ok}: 성공, 값 T를 담음</li>
 *   <li>{@link Err}: 실패, 에러 E를 담음</li>
 * </ul>
 *
 * <p>값과 에러는 상호 배타적이며 생성 후 변경되지 않습니다. 체이닝 연산은 기존 Result를
 * 수정하지 않고 새 Result를 만듭니다.</p>
 *
 * <p><strong>Short-circuit:</strong> {@link #bind(Function)} 체인은 첫 번째 Err에서 멈추고,
 * 이후 단계는 평가되지 않습니다. Guard 실패가 부수효과 이전에 객체 생성을 중단시키는 방식입니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * Result&lt;Integer, String&gt; divide(int x, int y) {
 *     return y == 0 ? Result.err("Cannot divide by zero") : Result.ok(x / y);
 * }
 *
 * divide(4, 2).bind(v -&gt; divide(v, 0)).unwrapOrElse(e -&gt; -1); // -1
 * </pre>
 *
 * <p>모든 bind 체인은 {@link #unwrap()} (실패 시 예외) 또는
 * {@link #unwrapOrElse(Function)} (복구)로 끝나야 합니다.</p>
 *
 * @param <T> 성공 값 타입
 * @param <E> 에러 타입
 *
 * @author Olympus Team
 * @since 1.0.0
 */
public sealed interface Result<T, E> permits Result.Ok, Result.Err {

    /**
     * 성공 결과.
     *
     * @param value 성공 값 (null 불가, 값이 없으면 {@link Unit#UNIT})
     */
    record Ok<T, E>(T value) implements Result<T, E> {

        /**
         * Compact Constructor.
         *
         * @throws IllegalArgumentException value가 null인 경우
         */
        public Ok {
            if (value == null) {
                throw new IllegalArgumentException("value cannot be null, use Unit.UNIT for an empty success");
            }
        }
    }

    /**
     * 실패 결과.
     *
     * @param error 에러 (null 불가)
     */
    record Err<T, E>(E error) implements Result<T, E> {

        /**
         * Compact Constructor.
         *
         * @throws IllegalArgumentException error가 null인 경우
         */
        public Err {
            if (error == null) {
                throw new IllegalArgumentException("error cannot be null");
            }
        }
    }

    /**
     * 성공 결과 생성.
     *
     * @param value 값
     * @return Ok 인스턴스
     * @throws IllegalArgumentException value가 null인 경우
     */
    static <T, E> Result<T, E> ok(T value) {
        return new Ok<>(value);
    }

    /**
     * 값 없는 성공 결과 생성.
     *
     * @return Ok(UNIT)
     */
    static <E> Result<Unit, E> ok() {
        return new Ok<>(Unit.UNIT);
    }

    /**
     * 실패 결과 생성.
     *
     * @param error 에러
     * @return Err 인스턴스
     * @throws IllegalArgumentException error가 null인 경우
     */
    static <T, E> Result<T, E> err(E error) {
        return new Err<>(error);
    }

    /**
     * 조건에 따라 Ok(value) 또는 Err(error).
     *
     * @param condition 성공 조건
     * @param value 성공 값
     * @param error 실패 에러
     * @return Result 인스턴스
     */
    static <T, E> Result<T, E> fromBoolean(boolean condition, T value, E error) {
        return condition ? ok(value) : err(error);
    }

    /**
     * 여러 Result를 하나로 합침.
     *
     * <p>첫 번째 Err를 그대로 반환하고, 모두 성공이면 값들을 입력 순서대로 담은 Ok를 반환합니다.</p>
     *
     * @param results 합칠 Result 목록
     * @return 값 목록을 담은 Ok 또는 첫 번째 Err
     */
    static <T, E> Result<List<T>, E> combine(List<? extends Result<? extends T, ? extends E>> results) {
        List<T> values = new ArrayList<>(results.size());
        for (Result<? extends T, ? extends E> result : results) {
            if (result instanceof Err<? extends T, ? extends E> failure) {
                return err(failure.error());
            }
            values.add(result.unwrap());
        }
        return ok(Collections.unmodifiableList(values));
    }

    default boolean isOk() {
        return this instanceof Ok;
    }

    default boolean isErr() {
        return this instanceof Err;
    }

    /**
     * Ok이면 f(value)를 평가하여 그 결과를 반환하고, Err이면 f를 호출하지 않고 그대로 반환.
     *
     * @param f Result를 반환하는 함수
     * @param <U> 다음 성공 값 타입
     * @return f의 결과 또는 기존 Err
     */
    default <U> Result<U, E> bind(Function<? super T, ? extends Result<U, E>> f) {
        if (this instanceof Err<T, E> failure) {
            return err(failure.error());
        }
        return f.apply(((Ok<T, E>) this).value());
    }

    /**
     * {@link #bind(Function)}의 별칭.
     */
    default <U> Result<U, E> flatMap(Function<? super T, ? extends Result<U, E>> f) {
        return bind(f);
    }

    /**
     * 조건을 만족할 때만 bind.
     *
     * @param condition 성공 값에 대한 조건
     * @param f Result를 반환하는 함수 (T를 유지)
     * @return 조건을 만족하면 f의 결과, 아니면 this
     */
    default Result<T, E> bindIf(Predicate<? super T> condition, Function<? super T, ? extends Result<T, E>> f) {
        if (this instanceof Ok<T, E> ok && condition.test(ok.value())) {
            return f.apply(ok.value());
        }
        return this;
    }

    /**
     * Ok 값만 변환.
     *
     * @param f 변환 함수
     * @param <U> 결과 타입
     * @return 변환된 Ok 또는 기존 Err
     */
    default <U> Result<U, E> map(Function<? super T, ? extends U> f) {
        if (this instanceof Err<T, E> failure) {
            return err(failure.error());
        }
        return ok(f.apply(((Ok<T, E>) this).value()));
    }

    /**
     * Err 값만 변환.
     *
     * @param f 에러 변환 함수
     * @param <F> 새 에러 타입
     * @return 기존 Ok 또는 변환된 Err
     */
    default <F> Result<T, F> mapErr(Function<? super E, ? extends F> f) {
        if (this instanceof Err<T, E> failure) {
            return err(f.apply(failure.error()));
        }
        return ok(((Ok<T, E>) this).value());
    }

    /**
     * Err이면 f(error)로 복구.
     *
     * @param f 에러를 받아 새 Result를 만드는 함수
     * @return 기존 Ok 또는 f의 결과
     */
    default Result<T, E> recover(Function<? super E, ? extends Result<T, E>> f) {
        if (this instanceof Err<T, E> failure) {
            return f.apply(failure.error());
        }
        return this;
    }

    /**
     * 성공 값 조회.
     *
     * @return 성공 값
     * @throws UnwrapOnErrException Err인 경우
     */
    default T unwrap() {
        if (this instanceof Ok<T, E> ok) {
            return ok.value();
        }
        throw new UnwrapOnErrException(((Err<T, E>) this).error());
    }

    /**
     * 성공 값 또는 기본값.
     *
     * @param defaultValue 기본값
     * @return 성공 값 또는 기본값
     */
    default T unwrapOr(T defaultValue) {
        return this instanceof Ok<T, E> ok ? ok.value() : defaultValue;
    }

    /**
     * 성공 값 또는 handler(error)의 결과.
     *
     * @param handler 에러 처리 함수
     * @return 성공 값 또는 복구 값
     */
    default T unwrapOrElse(Function<? super E, ? extends T> handler) {
        if (this instanceof Ok<T, E> ok) {
            return ok.value();
        }
        return handler.apply(((Err<T, E>) this).error());
    }

    /**
     * 에러 조회.
     *
     * @return 에러
     * @throws IllegalStateException Ok인 경우
     */
    default E unwrapErr() {
        if (this instanceof Err<T, E> failure) {
            return failure.error();
        }
        throw new IllegalStateException("Cannot get error of a successful result");
    }

    /**
     * 성공 값을 Maybe로 변환 (에러는 버림).
     *
     * @return Ok이면 Some, Err이면 None
     */
    default Maybe<T> toMaybe() {
        return this instanceof Ok<T, E> ok ? Maybe.some(ok.value()) : Maybe.none();
    }
}
