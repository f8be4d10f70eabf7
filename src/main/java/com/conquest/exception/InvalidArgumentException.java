package com.conquest.exception;

/**
 * Thrown when an operation is legal in the current stage but its arguments are not:
 * out-of-range counts, non-adjacent territories, territories owned by the wrong player
 * or an invalid number of stars.
 */
public class InvalidArgumentException extends IllegalArgumentException {

    public InvalidArgumentException(String message) {
        super(message);
    }
}
