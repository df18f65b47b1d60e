package org.example.simplifier.service.llm;

/**
 * Exception thrown when an LLM provider encounters an error.
 */
public class LlmProviderException extends RuntimeException {

    private final int statusCode;

    public LlmProviderException(String message) {
        this(message, null, -1);
    }

    public LlmProviderException(String message, Throwable cause) {
        this(message, cause, -1);
    }

    public LlmProviderException(String message, Throwable cause, int statusCode) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    /**
     * HTTP status returned by the backend, or -1 when the failure happened before a response.
     */
    public int getStatusCode() {
        return statusCode;
    }

    public boolean isRateLimited() {
        return statusCode == 429;
    }
}
