package com.ryuqq.olympus.core.monad;

import java.util.NoSuchElementException;

/**
 * 값이 없는 {@link Maybe}에서 값을 꺼내려 할 때 발생.
 *
 * @author Olympus Team
 * @since 1.0.0
 */
public class MissingValueException extends NoSuchElementException {

    public MissingValueException() {
        super("Cannot get value from a Maybe with no value");
    }
}
