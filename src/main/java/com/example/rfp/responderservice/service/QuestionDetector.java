package com.example.rfp.responderservice.service;

import com.example.rfp.responderservice.config.DetectionProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Finds question-like sentences in text extracted from an RFP.
 *
 * <p>Extraction output is noisy: sentences wrap across physical lines and symbol-font bullets
 * come out as stray letters. The text is normalised first, then split into sentences, and each
 * sentence is checked against the configured {@link QuestionRule}s.
 */
@Component
public class QuestionDetector {

    private static final Pattern LINE_BREAK = Pattern.compile("\\r?\\n");
    private static final Pattern SENTENCE_BOUNDARY = Pattern.compile("(?<=[.!?\\n])\\s+");

    private final int minLength;
    private final String bulletGlyphs;
    private final List<QuestionRule> rules;

    @Autowired
    public QuestionDetector(DetectionProperties properties) {
        this(properties, QuestionRules.defaults(properties.getStarters()));
    }

    public QuestionDetector(DetectionProperties properties, List<QuestionRule> rules) {
        this.minLength = properties.getMinLength();
        this.bulletGlyphs = properties.getBulletGlyphs() == null ? "" : properties.getBulletGlyphs();
        this.rules = List.copyOf(rules);
    }

    /**
     * Distinct questions in order of first appearance.
     */
    public List<String> detect(String rawText) {
        if (rawText == null || rawText.isBlank()) {
            return List.of();
        }
        Set<String> questions = new LinkedHashSet<>();
        for (String sentence : SENTENCE_BOUNDARY.split(normalize(rawText))) {
            String candidate = sentence.trim();
            if (candidate.length() < minLength) {
                continue;
            }
            if (isQuestion(candidate)) {
                questions.add(candidate);
            }
        }
        return List.copyOf(questions);
    }

    public boolean isQuestion(String candidate) {
        for (QuestionRule rule : rules) {
            if (rule.matches(candidate)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Drops blank lines and lone bullet glyphs, then rejoins lines that were wrapped mid-sentence.
     * Finished sentences are separated by a newline.
     */
    String normalize(String text) {
        List<String> lines = new ArrayList<>();
        for (String line : LINE_BREAK.split(text)) {
            String trimmed = line.trim();
            if (trimmed.isEmpty() || isBulletArtifact(trimmed)) {
                continue;
            }
            lines.add(trimmed);
        }

        List<String> sentences = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        for (String line : lines) {
            if (current.length() == 0) {
                current.append(line);
            } else if (endsSentence(current.charAt(current.length() - 1))) {
                sentences.add(current.toString());
                current.setLength(0);
                current.append(line);
            } else {
                current.append(' ').append(line);
            }
        }
        if (current.length() > 0) {
            sentences.add(current.toString());
        }
        return String.join("\n", sentences);
    }

    private boolean isBulletArtifact(String trimmed) {
        return trimmed.length() == 1 && bulletGlyphs.indexOf(trimmed.charAt(0)) >= 0;
    }

    private static boolean endsSentence(char c) {
        return c == '.' || c == '!' || c == '?' || c == ':';
    }
}
