package com.placementrag.retrieval;

import com.placementrag.index.RecordMetadata;
import com.placementrag.index.SearchHit;

public record Source(String recordId, float score, String snippet, String company, String role, Integer year) {

    static Source from(SearchHit hit, int snippetLength) {
        RecordMetadata metadata = hit.metadata();
        String document = metadata.documentSnippet();
        return new Source(
                hit.recordId(),
                hit.score(),
                document.substring(0, Math.min(document.length(), snippetLength)),
                metadata.company(),
                metadata.role(),
                metadata.year());
    }

    public RecordMetadata asMetadata() {
        return new RecordMetadata(company, role, year, snippet);
    }
}
