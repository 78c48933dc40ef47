package com.promptvault.exception;

/**
 * Underlying database or filesystem failure. Fatal for the current operation.
 */
public class StorageException extends RuntimeException {

    public StorageException() {
        super();
    }

    public StorageException(final String message, final Throwable cause) {
        super(message, cause);
    }

    public StorageException(final String message) {
        super(message);
    }

    public StorageException(final Throwable cause) {
        super(cause);
    }
}
