package com.creditrust.rag.error;

/**
 * Root of the domain exceptions raised by the answering pipeline.
 */
public class RagException extends RuntimeException {

    public RagException(String message) {
        super(message);
    }

    public RagException(String message, Throwable cause) {
        super(message, cause);
    }
}
