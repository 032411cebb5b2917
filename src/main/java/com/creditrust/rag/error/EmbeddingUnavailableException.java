package com.creditrust.rag.error;

public class EmbeddingUnavailableException extends CapabilityException {

    public EmbeddingUnavailableException(String message, Throwable cause) {
        super(message, "The search service is temporarily unavailable. Please try again later.", cause);
    }
}
