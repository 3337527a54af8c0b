package io.newsdigest.ingestion.api.exception;

/**
 * Summarization gave up on an article, either after exhausting retries or on a
 * permanent API error. Article-scoped and non-fatal.
 */
public class SummarizationException extends Exception {
    private final String fingerprint;
    private final int attempts;

    public SummarizationException(String fingerprint, int attempts, String message, Throwable cause) {
        super(message, cause);
        this.fingerprint = fingerprint;
        this.attempts = attempts;
    }

    public String getFingerprint() {
        return fingerprint;
    }

    public int getAttempts() {
        return attempts;
    }
}
