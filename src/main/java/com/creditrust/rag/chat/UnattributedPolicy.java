package com.creditrust.rag.chat;

/**
 * What to do with generated text that cannot be attributed to its citations.
 */
public enum UnattributedPolicy {
    KEEP, FLAG, REFUSE
}
