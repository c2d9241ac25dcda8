package com.placementrag.retrieval;

import java.util.List;

public record SimilarRecords(List<String> ids, List<Float> scores) {

    public SimilarRecords {
        ids = List.copyOf(ids);
        scores = List.copyOf(scores);
    }

    public static SimilarRecords empty() {
        return new SimilarRecords(List.of(), List.of());
    }
}
