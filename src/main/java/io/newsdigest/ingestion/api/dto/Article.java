package io.newsdigest.ingestion.api.dto;

import java.time.Instant;

/**
 * Canonical article. Two articles with the same fingerprint are the same
 * real-world article regardless of the feed that produced them.
 *
 * @param publishedAt null when the feed gave no date
 * @param excerpt     cleaned feed description, empty when absent
 * @param contentHash hash of the normalized title and excerpt, used to detect stale summaries
 */
public record Article(
        String fingerprint,
        FingerprintStrategy fingerprintStrategy,
        String category,
        String title,
        String link,
        Instant publishedAt,
        String excerpt,
        String sourceName,
        String contentHash
) {
    public boolean isDated() {
        return publishedAt != null;
    }

    public boolean hasExcerpt() {
        return excerpt != null && !excerpt.isBlank();
    }
}
