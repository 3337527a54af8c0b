package io.newsdigest.ingestion.api.exception;

public class TransientFeedFetchException extends FeedFetchException {

    public TransientFeedFetchException(String message, Throwable cause, ErrorCategory category) {
        super(message, cause, category);
    }
}
