package io.newsdigest.ingestion.api.exception;

/**
 * A single failed call to the text-generation API. Not retried unless it is a
 * {@link TransientSummarizationException}.
 */
public class SummarizationApiException extends Exception {
    private final ErrorCategory category;

    public SummarizationApiException(String message, ErrorCategory category) {
        super(message);
        this.category = category;
    }

    public SummarizationApiException(String message, Throwable cause, ErrorCategory category) {
        super(message, cause);
        this.category = category;
    }

    public ErrorCategory getCategory() {
        return category;
    }
}
