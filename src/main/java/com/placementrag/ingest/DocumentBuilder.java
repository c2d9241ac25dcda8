package com.placementrag.ingest;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

// Section order is fixed; AnswerComposer extracts tips, rounds and questions by their labels.
public class DocumentBuilder {
    private static final Comparator<InterviewRound> ROUND_ORDER = Comparator.comparing(
            InterviewRound::roundNumber, Comparator.nullsLast(Comparator.naturalOrder()));

    public String build(SourceRecord record) {
        List<String> lines = new ArrayList<>();

        record.company().ifPresent(company -> lines.add("Company: " + company.strip()));
        record.roleName().ifPresent(role -> lines.add("Role: " + role.strip()));
        record.year().ifPresent(year -> lines.add("Year: " + year));
        record.result().ifPresent(result -> lines.add("Result: " + result.strip()));
        record.difficulty().ifPresent(level -> lines.add("Difficulty: " + level + "/5"));

        record.tipsText()
                .map(TextNormalizer::normalize)
                .filter(tips -> !tips.isEmpty())
                .ifPresent(tips -> lines.add("Tips: " + tips));

        record.rounds().stream()
                .sorted(ROUND_ORDER)
                .map(DocumentBuilder::roundLine)
                .flatMap(Optional::stream)
                .forEach(lines::add);

        for (InterviewQuestion question : record.questions()) {
            String text = TextNormalizer.normalize(question.questionText());
            if (text.isEmpty()) {
                continue;
            }
            String qualifiers = Stream.of(question.type(), question.topicName())
                    .flatMap(Optional::stream)
                    .map(String::strip)
                    .collect(Collectors.joining(", "));
            lines.add(qualifiers.isEmpty()
                    ? "Question: " + text
                    : "Question (" + qualifiers + "): " + text);
            question.approach()
                    .map(TextNormalizer::normalize)
                    .filter(approach -> !approach.isEmpty())
                    .ifPresent(approach -> lines.add("Approach: " + approach));
        }

        return String.join("\n", lines);
    }

    private static Optional<String> roundLine(InterviewRound round) {
        String description = round.details().map(TextNormalizer::normalize).orElse("");
        Optional<String> type = round.type().map(String::strip);
        if (round.number().isEmpty() && type.isEmpty() && description.isEmpty()) {
            return Optional.empty();
        }
        StringBuilder line = new StringBuilder("Round");
        round.number().ifPresent(number -> line.append(' ').append(number));
        String body = type.orElse("");
        if (!description.isEmpty()) {
            body = body.isEmpty() ? description : body + " - " + description;
        }
        if (!body.isEmpty()) {
            line.append(": ").append(body);
        }
        return Optional.of(line.toString());
    }
}
