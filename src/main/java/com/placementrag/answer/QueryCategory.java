package com.placementrag.answer;

import java.util.List;
import java.util.Locale;

public enum QueryCategory {
    DSA(List.of("dsa", "data structure", "algorithm")),
    PROCESS(List.of("process", "rounds", "pattern")),
    DIFFICULTY(List.of("difficulty", "hard", "easy")),
    TIPS(List.of("tips", "prepare", "advice")),
    GENERAL(List.of());

    private final List<String> keywords;

    QueryCategory(List<String> keywords) {
        this.keywords = keywords;
    }

    public static QueryCategory classify(String query) {
        String lower = query == null ? "" : query.toLowerCase(Locale.ROOT);
        for (QueryCategory category : values()) {
            if (category.keywords.stream().anyMatch(lower::contains)) {
                return category;
            }
        }
        return GENERAL;
    }
}
