package com.placementrag.trends;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.placementrag.index.RecordMetadata;

class TrendAggregatorTest {

    private final TrendAggregator aggregator = new TrendAggregator();

    @Test
    void shouldOrderByCountThenFirstSeen() {
        List<RecordMetadata> records = List.of(
                meta("Globex", 2022),
                meta("Acme", 2024),
                meta("Initech", 2021),
                meta("Acme", 2023),
                meta("Initech", null),
                meta(null, 2025));

        TrendSummary summary = aggregator.summarize(records, 10);

        assertEquals(List.of(
                new CompanyCount("Acme", 2),
                new CompanyCount("Initech", 2),
                new CompanyCount("Globex", 1)), summary.topCompanies());
        assertEquals(2021, summary.minYear());
        assertEquals(2025, summary.maxYear());
        assertEquals(6, summary.totalRecords());
    }

    @Test
    void shouldLimitToTopN() {
        TrendSummary summary = aggregator.summarize(List.of(meta("A", 2020), meta("B", 2020), meta("B", 2020)), 1);

        assertEquals(List.of(new CompanyCount("B", 2)), summary.topCompanies());
    }

    @Test
    void shouldLeaveYearRangeEmptyWithoutYears() {
        TrendSummary summary = aggregator.summarize(List.of(meta("Acme", null)), 5);

        assertNull(summary.minYear());
        assertNull(summary.maxYear());
    }

    @Test
    void shouldAnalyzeWithFilters() {
        List<RecordMetadata> indexed = List.of(
                meta("Acme Corp", 2024),
                meta("Acme Labs", 2024),
                meta("Acme Corp", 2023),
                meta("Globex", 2024),
                meta(null, 2024));

        TrendReport byYear = aggregator.analyze(indexed, null, 2024);
        assertEquals(List.of(
                "Total experiences analyzed: 4",
                "Top company: Acme Corp with 1 experiences"), byYear.insights());
        assertEquals(4, byYear.data().size());
        assertEquals("Unknown", byYear.data().get(3).company());

        TrendReport acme = aggregator.analyze(indexed, "acme", null);
        assertEquals(new CompanyCount("Acme Corp", 2), acme.data().get(0));

        TrendReport none = aggregator.analyze(indexed, "Hooli", null);
        assertTrue(none.data().isEmpty());
        assertEquals(List.of("No data available for the specified filters."), none.insights());
    }

    @Test
    void shouldCapReportAtTenCompanies() {
        List<RecordMetadata> indexed = new ArrayList<>();
        for (int i = 0; i < 15; i++) {
            indexed.add(meta("Company " + i, 2024));
        }

        assertEquals(TrendAggregator.REPORT_TOP_COMPANIES, aggregator.analyze(indexed, null, null).data().size());
    }

    private static RecordMetadata meta(String company, Integer year) {
        return RecordMetadata.of(company, "SDE", year, "");
    }
}
