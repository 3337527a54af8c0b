package io.newsdigest.ingestion.api.dto;

import java.time.Instant;

/**
 * @param sourceContentHash content hash of the article the summary was generated from
 * @param lastReferencedAt  last run that served this entry; retention counts from here
 * @param title             truncated title, for humans reading the cache file
 */
public record CacheEntry(
        String fingerprint,
        String summaryText,
        Instant createdAt,
        Instant lastReferencedAt,
        String sourceContentHash,
        String title
) {
    public Instant referenceTime() {
        return lastReferencedAt != null ? lastReferencedAt : createdAt;
    }

    public CacheEntry touch(Instant now) {
        return new CacheEntry(fingerprint, summaryText, createdAt, now, sourceContentHash, title);
    }

    public boolean matches(String contentHash) {
        return sourceContentHash != null && sourceContentHash.equals(contentHash);
    }
}
