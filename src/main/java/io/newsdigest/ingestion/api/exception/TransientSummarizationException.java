package io.newsdigest.ingestion.api.exception;

public class TransientSummarizationException extends SummarizationApiException {

    public TransientSummarizationException(String message, ErrorCategory category) {
        super(message, category);
    }

    public TransientSummarizationException(String message, Throwable cause, ErrorCategory category) {
        super(message, cause, category);
    }
}
