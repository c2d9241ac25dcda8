package com.placementrag.answer;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.placementrag.retrieval.QueryResult;
import com.placementrag.retrieval.Source;

public class AnswerComposer {
    private static final Pattern QUESTION = Pattern.compile("Question[^:\\n]*:\\s*([^\\n]+)");
    private static final Pattern ROUND = Pattern.compile("Round\\s*\\d+[^:\\n]*:\\s*([^\\n]+)");
    private static final Pattern DIFFICULTY = Pattern.compile("Difficulty:\\s*([1-5])/5");
    private static final Pattern TIPS = Pattern.compile("Tips:\\s*([^\\n]+(?:\\n(?!Round|Question|Company)[^\\n]+)*)");
    private static final String[] LEVELS = { "Easy", "Easy-Medium", "Medium", "Medium-Hard", "Hard" };

    public String compose(String query, List<Source> sources) {
        if (sources.isEmpty()) {
            return QueryResult.NO_RESULTS_MESSAGE;
        }
        String body = switch (QueryCategory.classify(query)) {
            case DSA -> dsa(sources);
            case PROCESS -> process(sources);
            case DIFFICULTY -> difficulty(sources);
            case TIPS -> tips(sources);
            case GENERAL -> general(sources);
        };
        return body + attribution(sources);
    }

    private String general(List<Source> sources) {
        StringBuilder answer = new StringBuilder("Based on interview experiences from your campus:\n");
        for (Source source : sources.subList(0, Math.min(3, sources.size()))) {
            String snippet = source.snippet().length() > 200
                    ? source.snippet().substring(0, 200) + "..."
                    : source.snippet();
            answer.append("\n**").append(heading(source)).append(":**\n").append(snippet);
        }
        return answer.toString();
    }

    private String dsa(List<Source> sources) {
        StringBuilder answer = new StringBuilder("**DSA Questions from Campus Interviews:**\n\n");
        boolean found = false;
        for (Source source : sources.subList(0, Math.min(5, sources.size()))) {
            List<String> questions = matches(QUESTION, source.snippet(), 3);
            if (questions.isEmpty()) {
                continue;
            }
            found = true;
            answer.append("**").append(companyOf(source)).append(":**\n");
            questions.forEach(question -> answer.append("- ").append(question).append('\n'));
            answer.append('\n');
        }
        if (!found) {
            answer.append("Common topics include: Arrays, Strings, Trees, Graphs, Dynamic Programming, and System Design.\n");
        }
        return answer.toString();
    }

    private String process(List<Source> sources) {
        StringBuilder answer = new StringBuilder("**Interview Process Overview:**\n\n");
        for (Source source : sources.subList(0, Math.min(3, sources.size()))) {
            answer.append("**").append(companyOf(source));
            if (source.role() != null) {
                answer.append(" - ").append(source.role());
            }
            answer.append(":**\n");
            List<String> rounds = matches(ROUND, source.snippet(), Integer.MAX_VALUE);
            if (rounds.isEmpty()) {
                answer.append("- No round details recorded\n");
            } else {
                rounds.forEach(round -> answer.append("- ").append(round).append('\n'));
            }
            answer.append('\n');
        }
        return answer.toString();
    }

    private String difficulty(List<Source> sources) {
        StringBuilder answer = new StringBuilder("**Difficulty Assessment:**\n\n");
        List<String> lines = new ArrayList<>();
        int total = 0;
        for (Source source : sources) {
            Matcher matcher = DIFFICULTY.matcher(source.snippet());
            if (matcher.find()) {
                int level = Integer.parseInt(matcher.group(1));
                total += level;
                if (lines.size() < 5) {
                    lines.add("- " + companyOf(source) + ": " + level + "/5 (" + LEVELS[level - 1] + ")");
                }
            }
        }
        if (lines.isEmpty()) {
            return answer.append("Difficulty levels vary. Most technical interviews are rated Medium to Hard.\n").toString();
        }
        int rated = (int) sources.stream().filter(source -> DIFFICULTY.matcher(source.snippet()).find()).count();
        answer.append(String.format(Locale.ROOT, "Average difficulty: **%.1f/5**%n%n", (double) total / rated));
        lines.forEach(line -> answer.append(line).append('\n'));
        return answer.toString();
    }

    private String tips(List<Source> sources) {
        StringBuilder answer = new StringBuilder("**Preparation Tips from Successful Candidates:**\n\n");
        boolean found = false;
        for (Source source : sources.subList(0, Math.min(5, sources.size()))) {
            Matcher matcher = TIPS.matcher(source.snippet());
            if (matcher.find()) {
                found = true;
                String tip = matcher.group(1);
                answer.append("**").append(companyOf(source)).append(":** ")
                        .append(tip, 0, Math.min(tip.length(), 300)).append("\n\n");
            }
        }
        if (!found) {
            answer.append("""
                    Common recommendations:
                    - Practice DSA problems regularly
                    - Review core CS fundamentals
                    - Prepare behavioral questions with the STAR method
                    - Research company-specific interview patterns
                    """);
        }
        return answer.toString();
    }

    private static String attribution(List<Source> sources) {
        Set<String> companies = new LinkedHashSet<>();
        sources.stream().map(Source::company).filter(Objects::nonNull).forEach(companies::add);
        StringBuilder line = new StringBuilder("\n\nBased on ").append(sources.size()).append(" interview experience(s)");
        if (!companies.isEmpty()) {
            line.append(" from ").append(String.join(", ", companies.stream().limit(3).toList()));
        }
        sources.stream().map(Source::year).filter(Objects::nonNull).mapToInt(Integer::intValue).min().ifPresent(min -> {
            int max = sources.stream().map(Source::year).filter(Objects::nonNull).mapToInt(Integer::intValue).max().getAsInt();
            line.append(" (").append(min).append('-').append(max).append(')');
        });
        return line.toString();
    }

    private static List<String> matches(Pattern pattern, String text, int limit) {
        List<String> found = new ArrayList<>();
        Matcher matcher = pattern.matcher(text);
        while (matcher.find() && found.size() < limit) {
            found.add(matcher.group(1).strip());
        }
        return found;
    }

    private static String companyOf(Source source) {
        return source.company() == null ? "Unnamed company" : source.company();
    }

    private static String heading(Source source) {
        List<String> details = new ArrayList<>();
        if (source.role() != null) {
            details.add(source.role());
        }
        if (source.year() != null) {
            details.add(String.valueOf(source.year()));
        }
        return details.isEmpty() ? companyOf(source) : companyOf(source) + " (" + String.join(", ", details) + ")";
    }
}
