package io.newsdigest.ingestion.api.exception;

public class FeedFetchException extends Exception {
    private final ErrorCategory category;

    public FeedFetchException(String message, ErrorCategory category) {
        super(message);
        this.category = category;
    }

    public FeedFetchException(String message, Throwable cause, ErrorCategory category) {
        super(message, cause);
        this.category = category;
    }

    /**
     * Creates the retryable subtype for transient categories.
     */
    public static FeedFetchException of(String message, Throwable cause, ErrorCategory category) {
        return category.isTransient()
                ? new TransientFeedFetchException(message, cause, category)
                : new FeedFetchException(message, cause, category);
    }

    public static FeedFetchException of(String message, ErrorCategory category) {
        return of(message, null, category);
    }

    public ErrorCategory getCategory() {
        return category;
    }

    public FailureKind getKind() {
        return category.toFailureKind();
    }
}
