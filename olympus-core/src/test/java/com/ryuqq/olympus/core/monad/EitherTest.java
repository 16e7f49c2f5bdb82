package com.ryuqq.olympus.core.monad;

import org.junit.jupiter.api.Test;

import java.util.NoSuchElementException;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Either 테스트.
 *
 * @author Olympus Team
 * @since 1.0.0
 */
class EitherTest {

    @Test
    void map_Right_AppliesFunction() {
        Either<String, Integer> right = Either.right(2);

        assertEquals(Either.right(3), right.map(x -> x + 1));
        assertTrue(right.isRight());
    }

    @Test
    void map_Left_KeepsLeft() {
        Either<String, Integer> left = Either.left("error");

        assertEquals(Either.left("error"), left.map(x -> x + 1));
        assertTrue(left.isLeft());
    }

    @Test
    void bind_ChainsRightValues() {
        Function<Integer, Either<String, Integer>> positive =
            x -> x > 0 ? Either.right(x) : Either.left("not positive: " + x);

        assertEquals(Either.right(5), Either.<String, Integer>right(5).bind(positive));
        assertEquals(Either.left("not positive: -1"), Either.<String, Integer>right(-1).bind(positive));
    }

    @Test
    void apply_CombinesFunctionAndValue() {
        Either<String, Function<Integer, Integer>> doubler = Either.right(x -> x * 2);
        Either<String, Function<Integer, Integer>> broken = Either.left("no function");

        assertEquals(Either.right(8), Either.apply(doubler, Either.right(4)));
        assertEquals(Either.left("no value"), Either.apply(doubler, Either.<String, Integer>left("no value")));
        assertEquals(Either.left("no function"), Either.apply(broken, Either.right(4)));
    }

    @Test
    void fold_And_ToResult() {
        Either<String, Integer> right = Either.right(1);
        Either<String, Integer> left = Either.left("e");

        assertEquals("R1", right.fold(l -> "L" + l, r -> "R" + r));
        assertEquals("Le", left.fold(l -> "L" + l, r -> "R" + r));
        assertEquals(Result.ok(1), right.toResult());
        assertEquals(Result.err("e"), left.toResult());
    }

    @Test
    void getRight_Left_ThrowsException() {
        assertThrows(NoSuchElementException.class, () -> Either.left("e").getRight());
        assertEquals(1, Either.right(1).getRight());
    }
}
