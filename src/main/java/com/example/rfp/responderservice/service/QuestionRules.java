package com.example.rfp.responderservice.service;

import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * The stock detection rules. Detection favours recall: a false positive only costs one
 * low-value draft answer that the reviewer can delete.
 */
public final class QuestionRules {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    // "1. What is ...?" / "2) How ...?"
    static final Pattern NUMBERED = Pattern.compile("^\\d+[.)]\\s+.+\\?$", Pattern.MULTILINE);
    // capitalised, no sentence end before the terminal '?'
    static final Pattern CAPITALIZED = Pattern.compile("^[A-Z][^.!]*\\?$", Pattern.MULTILINE);
    static final Pattern IMPERATIVE = Pattern.compile(
            "(?:please|kindly)\\s+(?:describe|explain|provide|list|detail|outline)",
            Pattern.CASE_INSENSITIVE);

    private QuestionRules() {
    }

    public static List<QuestionRule> defaults(Collection<String> starters) {
        return List.of(
                endsWithQuestionMark(),
                matching(NUMBERED),
                matching(CAPITALIZED),
                matching(IMPERATIVE),
                starterWithinFirstWords(starters, 3));
    }

    public static QuestionRule endsWithQuestionMark() {
        return candidate -> candidate.stripTrailing().endsWith("?");
    }

    public static QuestionRule matching(Pattern pattern) {
        return candidate -> pattern.matcher(candidate).find();
    }

    /**
     * Matches when one of the first {@code words} tokens is a starter word. Looking past the
     * first token catches bullet prefixes that normalisation left in place.
     */
    public static QuestionRule starterWithinFirstWords(Collection<String> starters, int words) {
        Set<String> lower = starters.stream()
                .map(s -> s.toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
        return candidate -> {
            String[] tokens = WHITESPACE.split(candidate.strip());
            for (int i = 0; i < Math.min(words, tokens.length); i++) {
                if (lower.contains(tokens[i].toLowerCase(Locale.ROOT))) {
                    return true;
                }
            }
            return false;
        };
    }
}
