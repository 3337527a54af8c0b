package io.newsdigest.ingestion.api.dto;

public enum SummarySource {
    CACHE,
    GENERATED,
    /** Truncated excerpt used after summarization failed; never cached. */
    FALLBACK
}
