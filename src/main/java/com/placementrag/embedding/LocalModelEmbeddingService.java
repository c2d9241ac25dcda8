package com.placementrag.embedding;

import java.util.Locale;
import java.util.Set;

import com.placementrag.runtime.ConfigurationException;

public class LocalModelEmbeddingService implements EmbeddingService {
    public static final String VERSION = "local-interview-v1";

    private static final Set<String> DOMAIN_TERMS = Set.of(
            "dsa", "leetcode", "array", "arrays", "string", "strings", "tree", "trees", "graph", "graphs",
            "dp", "dynamic", "recursion", "sql", "dbms", "os", "oops", "system", "design", "behavioral",
            "hr", "coding", "aptitude", "oa", "assessment", "offer", "selected", "rejected");

    private final int dimension;

    public LocalModelEmbeddingService(int dimension) {
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
            if (token.isBlank()) {
                continue;
            }
            VectorMath.addHashed(vector, "tok:" + token, 1.0f);
            for (int i = 0; i + 3 <= token.length(); i++) {
                VectorMath.addHashed(vector, "tri:" + token.substring(i, i + 3), 0.35f);
            }
            if (DOMAIN_TERMS.contains(token)) {
                VectorMath.addHashed(vector, "domain:" + token, 1.6f);
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
        return VERSION;
    }
}
