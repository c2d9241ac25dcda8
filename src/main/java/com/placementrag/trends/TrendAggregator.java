package com.placementrag.trends;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import com.placementrag.index.RecordMetadata;

public class TrendAggregator {
    static final int REPORT_TOP_COMPANIES = 10;

    public TrendSummary summarize(List<RecordMetadata> records, int topN) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        Integer minYear = null;
        Integer maxYear = null;
        for (RecordMetadata record : records) {
            if (record.company() != null && !record.company().isBlank()) {
                counts.merge(record.company(), 1, Integer::sum);
            }
            Integer year = record.year();
            if (year != null) {
                minYear = minYear == null ? year : Math.min(minYear, year);
                maxYear = maxYear == null ? year : Math.max(maxYear, year);
            }
        }
        return new TrendSummary(top(counts, topN), minYear, maxYear, records.size());
    }

    public TrendReport analyze(Collection<RecordMetadata> indexed, String company, Integer year) {
        List<RecordMetadata> relevant = new ArrayList<>();
        for (RecordMetadata record : indexed) {
            if (matchesCompany(record, company) && (year == null || year.equals(record.year()))) {
                relevant.add(record);
            }
        }
        if (relevant.isEmpty()) {
            return new TrendReport(List.of(), List.of("No data available for the specified filters."));
        }

        Map<String, Integer> counts = new LinkedHashMap<>();
        for (RecordMetadata record : relevant) {
            String name = record.company() == null || record.company().isBlank() ? "Unknown" : record.company();
            counts.merge(name, 1, Integer::sum);
        }
        List<CompanyCount> data = top(counts, REPORT_TOP_COMPANIES);
        CompanyCount leader = data.get(0);
        return new TrendReport(data, List.of(
                "Total experiences analyzed: " + relevant.size(),
                "Top company: " + leader.company() + " with " + leader.count() + " experiences"));
    }

    public static boolean matchesCompany(RecordMetadata record, String company) {
        if (company == null || company.isBlank()) {
            return true;
        }
        return record.company() != null
                && record.company().toLowerCase(Locale.ROOT).contains(company.toLowerCase(Locale.ROOT));
    }

    private static List<CompanyCount> top(Map<String, Integer> counts, int topN) {
        // stable sort keeps first-seen order among equal counts
        return counts.entrySet().stream()
                .map(entry -> new CompanyCount(entry.getKey(), entry.getValue()))
                .sorted(Comparator.comparingInt(CompanyCount::count).reversed())
                .limit(Math.max(0, topN))
                .toList();
    }
}
