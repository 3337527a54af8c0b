package io.newsdigest.ingestion.api.dto;

import io.newsdigest.ingestion.config.FeedSource;

import java.util.List;

/**
 * Outcome of fetching one source. A failed fetch carries no entries.
 */
public record FetchResult(
        FeedSource source,
        List<RawFeedEntry> entries,
        SourceFailure failure,
        long durationMs
) {
    public FetchResult {
        entries = entries == null ? List.of() : List.copyOf(entries);
    }

    public static FetchResult success(FeedSource source, List<RawFeedEntry> entries, long durationMs) {
        return new FetchResult(source, entries, null, durationMs);
    }

    public static FetchResult failure(FeedSource source, SourceFailure failure, long durationMs) {
        return new FetchResult(source, List.of(), failure, durationMs);
    }

    public boolean succeeded() {
        return failure == null;
    }
}
