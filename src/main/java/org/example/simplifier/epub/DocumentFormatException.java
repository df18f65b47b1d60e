package org.example.simplifier.epub;

/**
 * Thrown when an EPUB container cannot be read at all.
 */
public class DocumentFormatException extends RuntimeException {

    public DocumentFormatException(String message) {
        super(message);
    }

    public DocumentFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
