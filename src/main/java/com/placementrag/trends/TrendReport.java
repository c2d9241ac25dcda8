package com.placementrag.trends;

import java.util.List;

public record TrendReport(List<CompanyCount> data, List<String> insights) {

    public TrendReport {
        data = List.copyOf(data);
        insights = List.copyOf(insights);
    }
}
