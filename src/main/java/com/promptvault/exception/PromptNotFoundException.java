package com.promptvault.exception;

/**
 * An operation targeted a prompt that does not exist where absence is not a valid no-op.
 */
public class PromptNotFoundException extends RuntimeException {

    public PromptNotFoundException() {
        super();
    }

    public PromptNotFoundException(final String message, final Throwable cause) {
        super(message, cause);
    }

    public PromptNotFoundException(final String message) {
        super(message);
    }

    public PromptNotFoundException(final Throwable cause) {
        super(cause);
    }

    public static PromptNotFoundException forId(final Long id) {
        return new PromptNotFoundException("Prompt not found: " + id);
    }
}
