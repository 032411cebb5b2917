package com.creditrust.rag.error;

public class GenerationUnavailableException extends CapabilityException {

    public GenerationUnavailableException(String message) {
        this(message, null);
    }

    public GenerationUnavailableException(String message, Throwable cause) {
        super(message, "Answer generation is temporarily unavailable. Please try again later.", cause);
    }
}
