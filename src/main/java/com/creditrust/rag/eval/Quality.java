package com.creditrust.rag.eval;

public enum Quality {
    GROUNDED_CORRECT, GROUNDED_INCOMPLETE, UNGROUNDED, REFUSED, FAILED
}
