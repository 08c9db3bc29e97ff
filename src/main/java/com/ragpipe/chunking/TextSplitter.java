package com.ragpipe.chunking;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Splits text into overlapping windows that prefer to end on a sentence or word boundary.
 * Windows are measured in characters or, when a {@link Tokenizer} is available, in tokens.
 */
public class TextSplitter {
    private static final Logger log = LoggerFactory.getLogger(TextSplitter.class);
    private static final List<String> SENTENCE_DELIMITERS = List.of(". ", "? ", "! ", ".\n", "?\n", "!\n");
    private static final char REPLACEMENT = '\uFFFD';
    private static final int EDGE_TOKENS = 8;

    private final Tokenizer tokenizer;

    public TextSplitter() {
        this(null);
    }

    public TextSplitter(Tokenizer tokenizer) {
        this.tokenizer = tokenizer;
    }

    public boolean supportsTokens() {
        return tokenizer != null;
    }

    public List<String> split(String text, int chunkSize, int chunkOverlap, int minChunkSize, SplitMode mode) {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunkSize must be positive but was " + chunkSize);
        }
        if (text == null || text.isBlank()) {
            return List.of();
        }
        int overlap = Math.max(0, chunkOverlap);
        if (overlap >= chunkSize) {
            log.warn("chunking.overlap.corrected chunkSize={} overlap={}", chunkSize, overlap);
        }
        if (mode == SplitMode.TOKEN) {
            if (tokenizer == null) {
                throw new IllegalStateException("Token mode requires a tokenizer");
            }
            return splitTokens(text, chunkSize, overlap, minChunkSize);
        }
        return splitCharacters(text, chunkSize, overlap, minChunkSize);
    }

    private List<String> splitCharacters(String text, int chunkSize, int overlap, int minChunkSize) {
        List<String> chunks = new ArrayList<>();
        int length = text.length();
        if (length <= chunkSize) {
            addIfLongEnough(chunks, text, minChunkSize);
            return chunks;
        }

        int start = 0;
        while (start < length) {
            int end = Math.min(start + chunkSize, length);
            if (end < length) {
                end = start + boundary(text.substring(start, end));
            }
            addIfLongEnough(chunks, text.substring(start, end), minChunkSize);
            if (end >= length) {
                break;
            }
            start = nextStart(start, end, chunkSize, overlap);
        }
        return chunks;
    }

    private List<String> splitTokens(String text, int chunkSize, int overlap, int minChunkSize) {
        List<String> chunks = new ArrayList<>();
        int[] tokens = tokenizer.encode(text);
        if (tokens.length <= chunkSize) {
            addIfLongEnough(chunks, text, minChunkSize);
            return chunks;
        }

        // Byte-level encodings can spread one character over several tokens; windows must not
        // cut inside such a run. Text that already holds U+FFFD cannot be checked this way.
        boolean alignEdges = text.indexOf(REPLACEMENT) < 0;
        int start = 0;
        while (start < tokens.length) {
            int end = Math.min(start + chunkSize, tokens.length);
            if (alignEdges) {
                end = alignEnd(tokens, start, end);
            }
            String window = tokenizer.decode(Arrays.copyOfRange(tokens, start, end));
            if (end < tokens.length) {
                int cut = boundary(window);
                if (cut < window.length()) {
                    String truncated = window.substring(0, cut);
                    int truncatedTokens = tokenizer.encode(truncated).length;
                    if (truncatedTokens >= chunkSize / 2 && truncatedTokens > 0) {
                        window = truncated;
                        end = Math.min(start + truncatedTokens, end);
                        if (alignEdges) {
                            end = alignEnd(tokens, start, end);
                        }
                    }
                }
            }
            addIfLongEnough(chunks, window, minChunkSize);
            if (end >= tokens.length) {
                break;
            }
            start = nextStart(start, end, chunkSize, overlap);
            if (alignEdges) {
                start = alignStart(tokens, start, end);
            }
        }
        return chunks;
    }

    /**
     * Moves {@code end} back to the nearest token offset that completes a character, or forward
     * when no such offset exists after {@code start}.
     */
    private int alignEnd(int[] tokens, int start, int end) {
        for (int candidate = end; candidate > start; candidate--) {
            if (!endsInsideCharacter(tokens, start, candidate)) {
                return candidate;
            }
        }
        for (int candidate = end + 1; candidate < tokens.length; candidate++) {
            if (!endsInsideCharacter(tokens, start, candidate)) {
                return candidate;
            }
        }
        return tokens.length;
    }

    /**
     * Moves {@code start} forward past tokens that finish a character begun before it. Never
     * passes {@code limit}, which is a clean offset.
     */
    private int alignStart(int[] tokens, int start, int limit) {
        int candidate = start;
        while (candidate < limit && startsInsideCharacter(tokens, candidate)) {
            candidate++;
        }
        return candidate;
    }

    private boolean endsInsideCharacter(int[] tokens, int start, int end) {
        if (end >= tokens.length) {
            return false;
        }
        String tail = tokenizer.decode(Arrays.copyOfRange(tokens, Math.max(start, end - EDGE_TOKENS), end));
        return !tail.isEmpty() && tail.charAt(tail.length() - 1) == REPLACEMENT;
    }

    private boolean startsInsideCharacter(int[] tokens, int start) {
        if (start == 0) {
            return false;
        }
        String head = tokenizer.decode(Arrays.copyOfRange(tokens, start, Math.min(tokens.length, start + EDGE_TOKENS)));
        return !head.isEmpty() && head.charAt(0) == REPLACEMENT;
    }

    static int nextStart(int start, int end, int chunkSize, int overlap) {
        int next = end - overlap;
        if (next <= end - chunkSize || next <= start) {
            return end;
        }
        return next;
    }

    /**
     * Returns the offset inside {@code window} at which the window should be cut. Sentence
     * delimiters are looked up in the last quarter of the window, whitespace anywhere past the
     * midpoint; otherwise the full window length is returned.
     */
    static int boundary(String window) {
        int length = window.length();
        int midpoint = length / 2;
        int searchFrom = length - Math.max(1, length / 4);

        int best = -1;
        for (String delimiter : SENTENCE_DELIMITERS) {
            int index = window.lastIndexOf(delimiter, length - delimiter.length());
            if (index >= searchFrom && index > best) {
                best = index;
            }
        }
        if (best > midpoint) {
            return best + 1;
        }

        for (int i = length - 1; i > midpoint; i--) {
            if (Character.isWhitespace(window.charAt(i))) {
                return i;
            }
        }
        return length;
    }

    private static void addIfLongEnough(List<String> chunks, String candidate, int minChunkSize) {
        String trimmed = candidate.trim();
        if (!trimmed.isEmpty() && trimmed.length() >= minChunkSize) {
            chunks.add(trimmed);
        }
    }
}
