package com.placementrag.retrieval;

import java.util.List;

import com.placementrag.trends.TrendSummary;

public record QueryResult(List<Source> sources, double confidence, String message, String answer, TrendSummary trends) {
    public static final String NO_RESULTS_MESSAGE = "I couldn't find any relevant interview experiences matching your query. "
            + "Try broadening your search or asking about specific companies or topics.";

    public QueryResult {
        sources = List.copyOf(sources);
    }

    public static QueryResult empty() {
        return new QueryResult(List.of(), 0.0, NO_RESULTS_MESSAGE, NO_RESULTS_MESSAGE, null);
    }

    public static QueryResult of(List<Source> sources, double confidence) {
        return new QueryResult(sources, confidence, "", null, null);
    }

    public boolean noResults() {
        return sources.isEmpty();
    }

    public QueryResult withAnswer(String composedAnswer, TrendSummary trendSummary) {
        return new QueryResult(sources, confidence, message, composedAnswer, trendSummary);
    }
}
