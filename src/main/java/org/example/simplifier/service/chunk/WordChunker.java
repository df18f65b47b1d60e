package org.example.simplifier.service.chunk;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Splits chapter text into overlapping word windows.
 * <p>
 * Each window holds at most {@code chunkSize} words; the next one starts {@code overlap} words before
 * the previous end. The last window ends exactly at the last word. Texts under
 * {@link #MIN_PROSE_WORDS} words are treated as non-prose and produce no windows.
 */
public class WordChunker {

    public static final int MIN_PROSE_WORDS = 5;

    // matches no-break space as well
    private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

    private final int chunkSize;
    private final int overlap;

    public WordChunker(int chunkSize, int overlap) {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunkSize must be positive");
        }
        if (overlap < 0 || overlap >= chunkSize) {
            throw new IllegalArgumentException("overlap must be >= 0 and < chunkSize");
        }
        this.chunkSize = chunkSize;
        this.overlap = overlap;
    }

    public List<Window> split(String text) {
        String[] words = words(text);
        if (words.length < MIN_PROSE_WORDS) {
            return List.of();
        }

        List<Window> windows = new ArrayList<>();
        int start = 0;
        while (start < words.length) {
            int end = Math.min(words.length, start + chunkSize);
            String windowText = String.join(" ", Arrays.copyOfRange(words, start, end));
            windows.add(new Window(windows.size(), start, end, windowText));
            if (end >= words.length) {
                break;
            }
            start = end - overlap;
        }
        return List.copyOf(windows);
    }

    /**
     * Words of the window that the previous window did not already contain.
     * Joining this over all windows of a text gives back its word sequence.
     */
    public String novelText(Window window) {
        if (window.index() == 0 || overlap == 0) {
            return window.text();
        }
        String[] words = words(window.text());
        int skip = Math.min(overlap, words.length);
        return String.join(" ", Arrays.copyOfRange(words, skip, words.length));
    }

    public static boolean isProse(String text) {
        return words(text).length >= MIN_PROSE_WORDS;
    }

    static String[] words(String text) {
        if (text == null) {
            return new String[0];
        }
        return WHITESPACE.splitAsStream(text)
                .filter(word -> !word.isEmpty())
                .toArray(String[]::new);
    }

    public int getChunkSize() {
        return chunkSize;
    }

    public int getOverlap() {
        return overlap;
    }
}
