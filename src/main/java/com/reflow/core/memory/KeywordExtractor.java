package com.reflow.core.memory;

import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Top-k keywords of an error text by frequency, ties broken alphabetically. Tokens of two
 * characters or fewer are ignored.
 */
final class KeywordExtractor {

    private static final Pattern TOKEN = Pattern.compile("[A-Za-z0-9_]+");

    private KeywordExtractor() {}

    static List<String> topKeywords(String text, int k) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        Map<String, Integer> frequency = new HashMap<>();
        Matcher matcher = TOKEN.matcher(text.toLowerCase(Locale.ROOT));
        while (matcher.find()) {
            String token = matcher.group();
            if (token.length() > 2) {
                frequency.merge(token, 1, Integer::sum);
            }
        }
        return frequency.entrySet().stream()
                .sorted(Map.Entry.<String, Integer>comparingByValue(Comparator.reverseOrder())
                        .thenComparing(Map.Entry.comparingByKey()))
                .limit(k)
                .map(Map.Entry::getKey)
                .toList();
    }
}
