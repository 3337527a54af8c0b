package io.newsdigest.ingestion.api.dto;

import io.newsdigest.ingestion.api.exception.ErrorCategory;
import io.newsdigest.ingestion.api.exception.FailureKind;
import io.newsdigest.ingestion.api.exception.FeedFetchException;

public record SourceFailure(
        String sourceName,
        String url,
        FailureKind kind,
        ErrorCategory category,
        String message
) {
    public static SourceFailure from(String sourceName, String url, FeedFetchException e) {
        return new SourceFailure(sourceName, url, e.getKind(), e.getCategory(), e.getMessage());
    }

    public static SourceFailure of(String sourceName, String url, ErrorCategory category, String message) {
        return new SourceFailure(sourceName, url, category.toFailureKind(), category, message);
    }
}
