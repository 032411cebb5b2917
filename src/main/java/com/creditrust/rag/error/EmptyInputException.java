package com.creditrust.rag.error;

/**
 * Raised when a build receives nothing to index.
 */
public class EmptyInputException extends DataException {

    public EmptyInputException(String message) {
        super(message);
    }
}
