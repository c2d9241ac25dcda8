package com.placementrag.ingest;

import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record InterviewRound(
        @JsonProperty("round_number") Integer roundNumber,
        @JsonProperty("round_type") String roundType,
        @JsonProperty("description") String description) {

    public Optional<Integer> number() {
        return Optional.ofNullable(roundNumber);
    }

    public Optional<String> type() {
        return nonBlank(roundType);
    }

    public Optional<String> details() {
        return nonBlank(description);
    }

    static Optional<String> nonBlank(String value) {
        return value == null || value.isBlank() ? Optional.empty() : Optional.of(value);
    }
}
