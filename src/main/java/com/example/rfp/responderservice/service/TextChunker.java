package com.example.rfp.responderservice.service;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Packs whole sentences into chunks of roughly {@code maxChars}. A sentence is never split,
 * so a single sentence longer than the limit becomes its own oversize chunk.
 */
@Component
public class TextChunker {

    private static final Pattern SENTENCE_BOUNDARY = Pattern.compile("(?<=[.!?])\\s+");

    private final int defaultMaxChars;

    public TextChunker(@Value("${app.chunking.max-chars:250}") int defaultMaxChars) {
        if (defaultMaxChars <= 0) {
            throw new IllegalArgumentException("app.chunking.max-chars must be positive");
        }
        this.defaultMaxChars = defaultMaxChars;
    }

    public List<String> chunk(String text) {
        return chunk(text, defaultMaxChars);
    }

    public List<String> chunk(String text, int maxChars) {
        return chunkWithOffsets(text, maxChars).stream().map(ChunkSpan::text).toList();
    }

    public List<ChunkSpan> chunkWithOffsets(String text) {
        return chunkWithOffsets(text, defaultMaxChars);
    }

    public List<ChunkSpan> chunkWithOffsets(String text, int maxChars) {
        if (maxChars <= 0) {
            throw new IllegalArgumentException("maxChars must be positive: " + maxChars);
        }
        List<ChunkSpan> chunks = new ArrayList<>();
        if (text == null || text.isBlank()) {
            return chunks;
        }

        StringBuilder buf = new StringBuilder();
        int chunkStart = -1;
        int chunkEnd = -1;
        for (ChunkSpan sentence : sentences(text)) {
            if (buf.length() > 0 && buf.length() + 1 + sentence.text().length() > maxChars) {
                chunks.add(new ChunkSpan(buf.toString(), chunkStart, chunkEnd));
                buf.setLength(0);
                chunkStart = -1;
            }
            if (buf.length() > 0) buf.append(' ');
            buf.append(sentence.text());
            if (chunkStart < 0) chunkStart = sentence.start();
            chunkEnd = sentence.end();
        }
        if (buf.length() > 0) {
            chunks.add(new ChunkSpan(buf.toString(), chunkStart, chunkEnd));
        }
        return chunks;
    }

    // trimmed, non-blank sentences with their offsets in the source text
    private static List<ChunkSpan> sentences(String text) {
        List<ChunkSpan> out = new ArrayList<>();
        Matcher m = SENTENCE_BOUNDARY.matcher(text);
        int from = 0;
        while (m.find()) {
            addTrimmed(text, from, m.start(), out);
            from = m.end();
        }
        addTrimmed(text, from, text.length(), out);
        return out;
    }

    private static void addTrimmed(String text, int start, int end, List<ChunkSpan> out) {
        while (start < end && Character.isWhitespace(text.charAt(start))) start++;
        while (end > start && Character.isWhitespace(text.charAt(end - 1))) end--;
        if (start < end) {
            out.add(new ChunkSpan(text.substring(start, end), start, end));
        }
    }

    /**
     * Chunk text plus the source range it was built from. The text joins sentences with a
     * single space, so it may differ from {@code source.substring(start, end)} in whitespace.
     */
    public record ChunkSpan(String text, int start, int end) {}
}
