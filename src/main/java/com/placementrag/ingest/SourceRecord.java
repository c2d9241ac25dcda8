package com.placementrag.ingest;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SourceRecord(
        @JsonProperty("id") String id,
        @JsonProperty("company_name") String companyName,
        @JsonProperty("role") String role,
        @JsonProperty("interview_year") Integer interviewYear,
        @JsonProperty("offer_status") String offerStatus,
        @JsonProperty("difficulty_level") Integer difficultyLevel,
        @JsonProperty("tips") String tips,
        @JsonProperty("status") String status,
        @JsonProperty("rounds") List<InterviewRound> rounds,
        @JsonProperty("questions") List<InterviewQuestion> questions) {

    public SourceRecord {
        Objects.requireNonNull(id, "id");
        rounds = rounds == null ? List.of() : List.copyOf(rounds);
        questions = questions == null ? List.of() : List.copyOf(questions);
    }

    public Optional<String> company() {
        return InterviewRound.nonBlank(companyName);
    }

    public Optional<String> roleName() {
        return InterviewRound.nonBlank(role);
    }

    public Optional<Integer> year() {
        return Optional.ofNullable(interviewYear);
    }

    public Optional<String> result() {
        return InterviewRound.nonBlank(offerStatus);
    }

    public Optional<Integer> difficulty() {
        return Optional.ofNullable(difficultyLevel);
    }

    public Optional<String> tipsText() {
        return InterviewRound.nonBlank(tips);
    }

    // Records without a moderation status predate moderation.
    public boolean isApproved() {
        return status == null || "approved".equals(status.toLowerCase(Locale.ROOT));
    }
}
