package com.placementrag.index;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record RecordMetadata(
        @JsonProperty("company") String company,
        @JsonProperty("role") String role,
        @JsonProperty("year") Integer year,
        @JsonProperty("document") String documentSnippet) {

    public static final int SNIPPET_LENGTH = 500;

    public RecordMetadata {
        documentSnippet = documentSnippet == null ? "" : documentSnippet;
    }

    public static RecordMetadata of(String company, String role, Integer year, String document) {
        String snippet = document == null ? "" : document.substring(0, Math.min(document.length(), SNIPPET_LENGTH));
        return new RecordMetadata(company, role, year, snippet);
    }
}
