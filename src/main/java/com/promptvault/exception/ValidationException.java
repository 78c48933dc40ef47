package com.promptvault.exception;

/**
 * Rejected input: blank title or content, or a rating outside 1..5. Never retried, nothing is written.
 */
public class ValidationException extends RuntimeException {

    public ValidationException() {
        super();
    }

    public ValidationException(final String message, final Throwable cause) {
        super(message, cause);
    }

    public ValidationException(final String message) {
        super(message);
    }

    public ValidationException(final Throwable cause) {
        super(cause);
    }
}
