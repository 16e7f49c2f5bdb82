package com.ryuqq.olympus.core.usecase;

import com.ryuqq.olympus.core.monad.Result;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * UseCase, UseCaseError 테스트.
 *
 * @author Olympus Team
 * @since 1.0.0
 */
class UseCaseErrorTest {

    @Test
    void of_HasNoCause() {
        // When
        UseCaseError error = UseCaseError.of("member not found");

        // Then
        assertEquals("member not found", error.message());
        assertTrue(error.getCause().isNone());
        assertEquals("UseCaseError(member not found)", error.toString());
    }

    @Test
    void from_UsesExceptionMessage() {
        // Given
        IllegalStateException cause = new IllegalStateException("stock exhausted");

        // When
        UseCaseError error = UseCaseError.from(cause);

        // Then
        assertEquals("stock exhausted", error.message());
        assertSame(cause, error.getCause().get());
    }

    @Test
    void from_ExceptionWithoutMessage_UsesTypeName() {
        assertEquals("IllegalStateException", UseCaseError.from(new IllegalStateException()).message());
    }

    @Test
    void invalidArguments_ThrowException() {
        assertThrows(IllegalArgumentException.class, () -> UseCaseError.of(" "));
        assertThrows(IllegalArgumentException.class, () -> UseCaseError.from(null));
    }

    @Test
    void useCase_ReturnsResultWithError() {
        // Given
        UseCase<Integer, Result<Integer, UseCaseError>> halve = n -> n % 2 == 0
            ? Result.ok(n / 2)
            : Result.err(UseCaseError.of(n + " is odd"));

        // When & Then
        assertEquals(Result.ok(5), halve.execute(10));
        assertEquals(Result.err(UseCaseError.of("3 is odd")), halve.execute(3));
    }
}
