package com.placementrag.retrieval;

public class RecordNotFoundException extends RuntimeException {
    private final String recordId;

    public RecordNotFoundException(String recordId, String message) {
        super(message);
        this.recordId = recordId;
    }

    public String recordId() {
        return recordId;
    }
}
