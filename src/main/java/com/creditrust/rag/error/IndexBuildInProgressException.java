package com.creditrust.rag.error;

public class IndexBuildInProgressException extends RagException {

    public IndexBuildInProgressException() {
        super("An index build is already running");
    }
}
