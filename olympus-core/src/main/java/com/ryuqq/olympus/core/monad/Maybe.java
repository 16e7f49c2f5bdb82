package com.ryuqq.olympus.core.monad;

import java.util.Optional;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * 존재하거나 존재하지 않을 수 있는 값.
 *
 * <p>Maybe는 두 가지 경우를 가집니다:</p>
 * <ul>
 *   <li>{@link Some}: 값이 존재함</li>
 *   <li>{@link None}: 값이 없음 (값을 담지 않음)</li>
 * </ul>
 *
 * <p>sentinel이나 null 없이 "아직 할당되지 않은 식별자" 같은 부재 상태를 표현합니다.
 * {@link #get()}을 제외한 어떤 연산도 예외를 던지지 않습니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * Maybe&lt;Guid&gt; id = Maybe.none();
 * Guid assigned = id.getOrElseGet(Guid::generate);
 *
 * Maybe.some(1).map(x -&gt; x + 1);   // Some[value=2]
 * Maybe.&lt;Integer&gt;none().map(x -&gt; x + 1); // None[]
 * </pre>
 *
 * @param <T> 값 타입
 *
 * @author Olympus Team
 * @since 1.0.0
 */
public sealed interface Maybe<T> permits Maybe.Some, Maybe.None {

    /**
     * 값이 존재하는 경우.
     *
     * @param value 값 (null 불가)
     * @param <T> 값 타입
     */
    record Some<T>(T value) implements Maybe<T> {

        /**
         * Compact Constructor.
         *
         * @throws IllegalArgumentException value가 null인 경우
         */
        public Some {
            if (value == null) {
                throw new IllegalArgumentException("value cannot be null, use Maybe.none() for absence");
            }
        }
    }

    /**
     * 값이 없는 경우.
     *
     * @param <T> 값 타입
     */
    record None<T>() implements Maybe<T> {
    }

    /**
     * 값이 존재하는 Maybe 생성.
     *
     * @param value 값
     * @param <T> 값 타입
     * @return Some 인스턴스
     * @throws IllegalArgumentException value가 null인 경우
     */
    static <T> Maybe<T> some(T value) {
        return new Some<>(value);
    }

    /**
     * 값이 없는 Maybe.
     *
     * @param <T> 값 타입
     * @return None 인스턴스 (모든 None은 서로 equals)
     */
    static <T> Maybe<T> none() {
        return new None<>();
    }

    /**
     * null이면 None, 아니면 Some.
     *
     * @param value 값 (null 허용)
     * @param <T> 값 타입
     * @return Maybe 인스턴스
     */
    static <T> Maybe<T> ofNullable(T value) {
        return value == null ? none() : some(value);
    }

    /**
     * 조건이 참이면 Some(value), 아니면 None.
     *
     * @param present 값 존재 여부
     * @param value 값
     * @param <T> 값 타입
     * @return Maybe 인스턴스
     */
    static <T> Maybe<T> when(boolean present, T value) {
        return present ? ofNullable(value) : none();
    }

    /**
     * 중첩된 Maybe를 펼침.
     *
     * @param nested 중첩된 Maybe
     * @param <T> 값 타입
     * @return 안쪽 Maybe, 바깥이 None이면 None
     */
    static <T> Maybe<T> join(Maybe<Maybe<T>> nested) {
        return nested.flatMap(Function.identity());
    }

    /**
     * 값이 존재하는지 확인.
     *
     * @return 존재 여부
     */
    default boolean isSome() {
        return this instanceof Some;
    }

    /**
     * 값이 없는지 확인.
     *
     * @return 부재 여부
     */
    default boolean isNone() {
        return this instanceof None;
    }

    /**
     * 값 조회.
     *
     * @return 값
     * @throws MissingValueException None인 경우
     */
    default T get() {
        if (this instanceof Some<T> some) {
            return some.value();
        }
        throw new MissingValueException();
    }

    /**
     * 값이 있으면 값을, 없으면 기본값을 반환.
     *
     * @param defaultValue 기본값
     * @return 값 또는 기본값
     */
    default T getOrElse(T defaultValue) {
        return this instanceof Some<T> some ? some.value() : defaultValue;
    }

    /**
     * 값이 있으면 값을, 없으면 supplier 결과를 반환. supplier는 None일 때만 호출됩니다.
     *
     * @param supplier 기본값 공급자
     * @return 값 또는 공급된 값
     */
    default T getOrElseGet(Supplier<? extends T> supplier) {
        return this instanceof Some<T> some ? some.value() : supplier.get();
    }

    /**
     * 값이 있으면 변환. f가 null을 반환하면 None.
     *
     * @param f 변환 함수
     * @param <U> 결과 타입
     * @return 변환된 Maybe
     */
    default <U> Maybe<U> map(Function<? super T, ? extends U> f) {
        if (this instanceof Some<T> some) {
            return ofNullable(f.apply(some.value()));
        }
        return none();
    }

    /**
     * Maybe를 반환하는 함수로 변환 (monadic bind).
     *
     * @param f Maybe를 반환하는 함수
     * @param <U> 결과 타입
     * @return f의 결과, None이면 None
     */
    default <U> Maybe<U> flatMap(Function<? super T, ? extends Maybe<U>> f) {
        if (this instanceof Some<T> some) {
            return f.apply(some.value());
        }
        return none();
    }

    /**
     * {@link #flatMap(Function)}의 별칭.
     *
     * @param f Maybe를 반환하는 함수
     * @param <U> 결과 타입
     * @return f의 결과, None이면 None
     */
    default <U> Maybe<U> bind(Function<? super T, ? extends Maybe<U>> f) {
        return flatMap(f);
    }

    /**
     * 조건을 만족하지 않는 값은 None으로.
     *
     * @param predicate 조건
     * @return 조건을 만족하면 this, 아니면 None
     */
    default Maybe<T> filter(Predicate<? super T> predicate) {
        if (this instanceof Some<T> some && predicate.test(some.value())) {
            return this;
        }
        return none();
    }

    /**
     * {@link Optional}로 변환.
     *
     * @return Optional
     */
    default Optional<T> toOptional() {
        return this instanceof Some<T> some ? Optional.of(some.value()) : Optional.empty();
    }
}
