package com.placementrag.retrieval;

import java.util.Objects;

public record QueryRequest(String text, String company, Integer year, int topK) {
    public static final int MIN_TEXT_LENGTH = 3;
    public static final int MAX_TEXT_LENGTH = 500;
    public static final int MIN_YEAR = 2015;
    public static final int MAX_YEAR = 2030;
    public static final int MAX_TOP_K = 20;

    public QueryRequest {
        Objects.requireNonNull(text, "text");
        text = text.strip();
        if (text.length() < MIN_TEXT_LENGTH || text.length() > MAX_TEXT_LENGTH) {
            throw new IllegalArgumentException("Query text must be between " + MIN_TEXT_LENGTH + " and "
                    + MAX_TEXT_LENGTH + " characters, got " + text.length());
        }
        if (year != null && (year < MIN_YEAR || year > MAX_YEAR)) {
            throw new IllegalArgumentException("Year must be between " + MIN_YEAR + " and " + MAX_YEAR + ": " + year);
        }
        if (topK < 1 || topK > MAX_TOP_K) {
            throw new IllegalArgumentException("topK must be between 1 and " + MAX_TOP_K + ": " + topK);
        }
        company = company == null || company.isBlank() ? null : company.strip();
    }

    public static QueryRequest of(String text, int topK) {
        return new QueryRequest(text, null, null, topK);
    }
}
