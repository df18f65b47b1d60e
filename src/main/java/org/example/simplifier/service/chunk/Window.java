package org.example.simplifier.service.chunk;

/**
 * Contiguous word range {@code [startWord, endWord)} of a chapter, sent to the backend in one call.
 */
public record Window(int index, int startWord, int endWord, String text) {

    public int wordCount() {
        return endWord - startWord;
    }
}
