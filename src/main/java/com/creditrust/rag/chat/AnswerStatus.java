package com.creditrust.rag.chat;

public enum AnswerStatus {

    /** The answer is supported by its citations. */
    GROUNDED,

    /** Text was generated but too little of it can be traced to the citations. */
    UNATTRIBUTED,

    INSUFFICIENT_INFORMATION,

    CANCELLED
}
