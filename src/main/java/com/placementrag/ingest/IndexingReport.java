package com.placementrag.ingest;

import java.util.List;

public record IndexingReport(int indexedRecords, int skippedRecords, List<String> failedRecordIds, int vectorCount) {

    public IndexingReport {
        failedRecordIds = List.copyOf(failedRecordIds);
    }

    public int failedRecords() {
        return failedRecordIds.size();
    }
}
