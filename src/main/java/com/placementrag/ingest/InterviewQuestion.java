package com.placementrag.ingest;

import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record InterviewQuestion(
        @JsonProperty("question_text") String questionText,
        @JsonProperty("question_type") String questionType,
        @JsonProperty("topic") String topic,
        @JsonProperty("answer_approach") String answerApproach) {

    public Optional<String> type() {
        return InterviewRound.nonBlank(questionType);
    }

    public Optional<String> topicName() {
        return InterviewRound.nonBlank(topic);
    }

    public Optional<String> approach() {
        return InterviewRound.nonBlank(answerApproach);
    }
}
