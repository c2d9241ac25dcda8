package com.placementrag.ingest;

import java.util.List;
import java.util.Optional;

public interface SourceRecordStore {
    Optional<SourceRecord> fetchRecord(String id);

    List<SourceRecord> fetchAllApprovedRecords();
}
