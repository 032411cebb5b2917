package com.creditrust.rag.chat;

/**
 * What to do when retrieval found nothing relevant.
 */
public enum EmptyContextPolicy {

    /** Answer with the fixed insufficient-information text without generating. */
    SHORT_CIRCUIT,

    /** Still ask the model, with an empty context. */
    CALL_WITH_EMPTY_CONTEXT
}
