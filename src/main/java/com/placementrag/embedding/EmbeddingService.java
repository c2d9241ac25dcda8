package com.placementrag.embedding;

import java.util.ArrayList;
import java.util.List;

public interface EmbeddingService {
    float[] embed(String text);

    int dimension();

    String version();

    default List<float[]> embedBatch(List<String> texts) {
        List<float[]> vectors = new ArrayList<>(texts.size());
        for (String text : texts) {
            vectors.add(embed(text));
        }
        return vectors;
    }
}
