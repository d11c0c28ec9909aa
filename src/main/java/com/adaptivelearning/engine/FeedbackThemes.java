package com.adaptivelearning.engine;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Keyword-based themes found in free-text comments. A theme counts at most
 * once per comment; comments of 10 characters or fewer are ignored.
 */
final class FeedbackThemes {

    private static final int MIN_COMMENT_LENGTH = 11;

    static final Map<String, List<String>> HIGH_RATED = new LinkedHashMap<>();
    static final Map<String, List<String>> LOW_RATED = new LinkedHashMap<>();

    static {
        HIGH_RATED.put("specific",          List.of("specific", "detailed"));
        HIGH_RATED.put("actionable",        List.of("actionable", "useful"));
        HIGH_RATED.put("clear",             List.of("clear", "understand"));
        HIGH_RATED.put("data-driven",       List.of("number", "data"));
        HIGH_RATED.put("timeline-oriented", List.of("timeline", "when"));

        LOW_RATED.put("too vague",      List.of("vague", "unclear"));
        LOW_RATED.put("too generic",    List.of("generic", "general"));
        LOW_RATED.put("inaccurate",     List.of("wrong", "inaccurate"));
        LOW_RATED.put("confusing",      List.of("confusing", "confused"));
        LOW_RATED.put("not actionable", List.of("not helpful", "useless"));
    }

    private FeedbackThemes() {
    }

    /** Themes present in {@code comments}, most frequent first; ties keep table order. */
    static List<String> commonThemes(Collection<String> comments, Map<String, List<String>> table) {
        Map<String, Long> counts = new LinkedHashMap<>();
        for (String comment : comments) {
            if (comment == null || comment.length() < MIN_COMMENT_LENGTH) {
                continue;
            }
            String lower = comment.toLowerCase(Locale.ROOT);
            table.forEach((theme, keywords) -> {
                if (keywords.stream().anyMatch(lower::contains)) {
                    counts.merge(theme, 1L, Long::sum);
                }
            });
        }
        List<String> order = List.copyOf(table.keySet());
        return counts.entrySet().stream()
            .sorted(Map.Entry.<String, Long>comparingByValue().reversed()
                .thenComparing(e -> order.indexOf(e.getKey())))
            .map(Map.Entry::getKey)
            .toList();
    }
}
