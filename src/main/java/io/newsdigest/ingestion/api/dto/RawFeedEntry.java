package io.newsdigest.ingestion.api.dto;

import java.time.Instant;

/**
 * A feed entry as parsed, before cleaning and fingerprinting. Any field may be
 * null except where the parser guarantees otherwise.
 */
public record RawFeedEntry(
        String title,
        String link,
        String description,
        String author,
        Instant publishedAt
) {}
