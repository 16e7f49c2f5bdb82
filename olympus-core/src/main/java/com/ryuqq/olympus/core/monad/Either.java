package com.ryuqq.olympus.core.monad;

import java.util.NoSuchElementException;
import java.util.function.Function;

/**
 * 두 타입 중 하나의 값 (disjoint union).
 *
 * <p>관례상 {@link Right}가 정상 값, {@link Left}가 대안 값(보통 에러 정보)입니다.
 * 에러 의미가 분명할 때는 {@link Result}를 사용하십시오.</p>
 *
 * @param <L> Left 타입
 * @param <R> Right 타입
 *
 * @author Olympus Team
 * @since 1.0.0
 */
public sealed interface Either<L, R> permits Either.Left, Either.Right {

    record Left<L, R>(L value) implements Either<L, R> {
    }

    record Right<L, R>(R value) implements Either<L, R> {
    }

    static <L, R> Either<L, R> left(L value) {
        return new Left<>(value);
    }

    static <L, R> Either<L, R> right(R value) {
        return new Right<>(value);
    }

    default boolean isLeft() {
        return this instanceof Left;
    }

    default boolean isRight() {
        return this instanceof Right;
    }

    /**
     * Right 값 조회.
     *
     * @return Right 값
     * @throws NoSuchElementException Left인 경우
     */
    default R getRight() {
        if (this instanceof Right<L, R> right) {
            return right.value();
        }
        throw new NoSuchElementException("Cannot get right value of " + this);
    }

    default <S> Either<L, S> map(Function<? super R, ? extends S> f) {
        if (this instanceof Right<L, R> right) {
            return right(f.apply(right.value()));
        }
        return left(((Left<L, R>) this).value());
    }

    default <S> Either<L, S> bind(Function<? super R, ? extends Either<L, S>> f) {
        if (this instanceof Right<L, R> right) {
            return f.apply(right.value());
        }
        return left(((Left<L, R>) this).value());
    }

    /**
     * Either에 담긴 함수를 다른 Either의 값에 적용 (applicative).
     *
     * <p>fn이 Left면 fn의 Left, other가 Left면 other의 Left를 반환합니다.</p>
     *
     * @param fn 함수를 담은 Either
     * @param other 인자를 담은 Either
     * @return 적용 결과
     */
    static <L, A, S> Either<L, S> apply(Either<L, ? extends Function<? super A, ? extends S>> fn, Either<L, A> other) {
        return fn.fold(l -> Either.<L, S>left(l), f -> other.<S>map(f));
    }

    /**
     * 양쪽 경우를 하나의 값으로 접음.
     */
    default <U> U fold(Function<? super L, ? extends U> onLeft, Function<? super R, ? extends U> onRight) {
        if (this instanceof Right<L, R> right) {
            return onRight.apply(right.value());
        }
        return onLeft.apply(((Left<L, R>) this).value());
    }

    /**
     * Result로 변환. Right는 Ok, Left는 Err.
     */
    default Result<R, L> toResult() {
        return fold(Result::err, Result::ok);
    }
}
