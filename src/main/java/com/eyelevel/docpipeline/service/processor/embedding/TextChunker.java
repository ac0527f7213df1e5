package com.eyelevel.docpipeline.service.processor.embedding;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits text into pieces that fit an embedding model's token budget.
 * <p>
 * Tokens are approximated as four characters each. Chunks are built from whole sentences where possible,
 * from whole words when a sentence alone is too long, and a single word longer than the budget is cut hard.
 * Whitespace inside a chunk is kept as it was; only whitespace at chunk boundaries is dropped.
 */
public final class TextChunker {

    public static final int CHARS_PER_TOKEN = 4;

    private static final Pattern SENTENCE = Pattern.compile("[^.!?]*[.!?]+|[^.!?]+");
    private static final Pattern WORD = Pattern.compile("\\s*\\S+\\s*");
    private static final double MIN_TRUNCATION_RATIO = 0.8;

    private TextChunker() {
    }

    public static int estimateTokens(String text) {
        return (int) Math.ceil(text.length() / (double) CHARS_PER_TOKEN);
    }

    /**
     * @return chunks of at most {@code maxTokens * 4} characters, in text order. Each chunk is a verbatim slice of
     * the text with its leading and trailing whitespace removed.
     */
    public static List<String> splitIntoChunks(String text, int maxTokens) {
        int maxChars = maxTokens * CHARS_PER_TOKEN;
        List<String> chunks = new ArrayList<>();
        StringBuilder current = new StringBuilder();

        Matcher matcher = SENTENCE.matcher(text);
        while (matcher.find()) {
            String sentence = matcher.group();
            if (sentence.isBlank()) {
                if (current.length() > 0) {
                    current.append(sentence);
                }
                continue;
            }
            if (sentence.strip().length() > maxChars) {
                flush(current, chunks);
                splitByWords(sentence.strip(), maxChars, chunks);
                continue;
            }
            append(current, sentence, maxChars, chunks);
        }
        flush(current, chunks);
        return chunks;
    }

    /**
     * Cuts the text to the token budget, preferring the last word boundary past 80% of the limit.
     */
    public static String truncateToTokenLimit(String text, int maxTokens) {
        int maxChars = maxTokens * CHARS_PER_TOKEN;
        if (text.length() <= maxChars) {
            return text;
        }
        String truncated = text.substring(0, maxChars);
        int lastSpace = truncated.lastIndexOf(' ');
        if (lastSpace > maxChars * MIN_TRUNCATION_RATIO) {
            return truncated.substring(0, lastSpace);
        }
        return truncated;
    }

    private static void splitByWords(String sentence, int maxChars, List<String> chunks) {
        StringBuilder current = new StringBuilder();
        Matcher matcher = WORD.matcher(sentence);
        while (matcher.find()) {
            String word = matcher.group();
            String bare = word.strip();
            if (bare.length() > maxChars) {
                flush(current, chunks);
                for (int start = 0; start < bare.length(); start += maxChars) {
                    chunks.add(bare.substring(start, Math.min(bare.length(), start + maxChars)));
                }
                continue;
            }
            append(current, word, maxChars, chunks);
        }
        flush(current, chunks);
    }

    /**
     * Appends a piece with its own whitespace, first flushing the chunk when the piece would not fit.
     * A chunk never starts with whitespace, so its length bounds its trimmed length.
     */
    private static void append(StringBuilder current, String piece, int maxChars, List<String> chunks) {
        if (current.length() > 0 && current.length() + piece.stripTrailing().length() > maxChars) {
            flush(current, chunks);
        }
        current.append(current.length() == 0 ? piece.stripLeading() : piece);
    }

    private static void flush(StringBuilder current, List<String> chunks) {
        String chunk = current.toString().strip();
        if (!chunk.isEmpty()) {
            chunks.add(chunk);
        }
        current.setLength(0);
    }
}
