package com.creditrust.rag.error;

public class IndexNotReadyException extends RagException {

    public IndexNotReadyException(String message) {
        super(message);
    }
}
