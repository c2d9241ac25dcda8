package com.placementrag.trends;

import java.util.List;

public record TrendSummary(List<CompanyCount> topCompanies, Integer minYear, Integer maxYear, int totalRecords) {

    public TrendSummary {
        topCompanies = List.copyOf(topCompanies);
    }
}
