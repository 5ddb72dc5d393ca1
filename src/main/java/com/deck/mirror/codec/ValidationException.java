package com.deck.mirror.codec;

/**
 * Raised when a deck file or one of its cards is structurally invalid.
 * Always raised before any remote call is attempted.
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
