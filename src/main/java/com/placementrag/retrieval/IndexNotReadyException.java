package com.placementrag.retrieval;

public class IndexNotReadyException extends IllegalStateException {
    public IndexNotReadyException(String message) {
        super(message);
    }
}
