package com.dish.curation.core;

/**
 * Thrown when an operation's input is rejected before any remote call is made.
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
