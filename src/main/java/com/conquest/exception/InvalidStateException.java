package com.conquest.exception;

/**
 * Thrown when an operation is invoked while the game is not in the stage that governs it,
 * e.g. attacking during the draft stage.
 */
public class InvalidStateException extends IllegalStateException {

    public InvalidStateException(String message) {
        super(message);
    }
}
