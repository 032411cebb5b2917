package com.creditrust.rag.error;

/**
 * A malformed input unit. The unit is rejected, the surrounding batch goes on.
 */
public class DataException extends RagException {

    public DataException(String message) {
        super(message);
    }

    public DataException(String message, Throwable cause) {
        super(message, cause);
    }
}
