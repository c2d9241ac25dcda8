package com.placementrag.index;

// recordId and metadata are null for slots of tombstoned records.
public record SearchHit(int slot, float score, String recordId, RecordMetadata metadata) {

    public boolean isLive() {
        return recordId != null && metadata != null;
    }
}
