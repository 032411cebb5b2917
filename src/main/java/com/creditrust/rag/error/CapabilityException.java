package com.creditrust.rag.error;

/**
 * An external capability (embedding or generation) could not be reached, or
 * kept failing after the configured retries.
 */
public class CapabilityException extends RagException {

    private final String userMessage;

    public CapabilityException(String message, String userMessage, Throwable cause) {
        super(message, cause);
        this.userMessage = userMessage;
    }

    public String getUserMessage() {
        return userMessage;
    }
}
