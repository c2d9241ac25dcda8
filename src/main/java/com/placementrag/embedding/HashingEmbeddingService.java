package com.placementrag.embedding;

import java.util.Locale;

import com.placementrag.runtime.ConfigurationException;

public class HashingEmbeddingService implements EmbeddingService {
    private final int dimension;

    public HashingEmbeddingService(int dimension) {
        if (dimension <= 0) {
            throw new ConfigurationException("Embedding dimension must be positive: " + dimension);
        }
        this.dimension = dimension;
    }

    @Override
    public float[] embed(String text) {
        float[] vector = new float[dimension];
        if (text == null || text.isBlank()) {
            return vector;
        }
        for (String token : text.toLowerCase(Locale.ROOT).split("\\W+")) {
            if (!token.isBlank()) {
                VectorMath.addHashed(vector, token, 1f);
            }
        }
        return VectorMath.normalize(vector);
    }

    @Override
    public int dimension() {
        return dimension;
    }

    @Override
    public String version() {
        return "hashing-v1";
    }
}
