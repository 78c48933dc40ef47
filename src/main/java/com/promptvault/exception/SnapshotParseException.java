package com.promptvault.exception;

/**
 * Snapshot text could not be read. Raised before the import touches the store.
 */
public class SnapshotParseException extends RuntimeException {

    public SnapshotParseException() {
        super();
    }

    public SnapshotParseException(final String message, final Throwable cause) {
        super(message, cause);
    }

    public SnapshotParseException(final String message) {
        super(message);
    }

    public SnapshotParseException(final Throwable cause) {
        super(cause);
    }
}
