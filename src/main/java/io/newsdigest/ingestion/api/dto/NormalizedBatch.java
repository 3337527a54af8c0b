package io.newsdigest.ingestion.api.dto;

import java.util.List;

/**
 * Deduplicated articles in source-registry order, then feed order.
 */
public record NormalizedBatch(
        List<Article> articles,
        int candidates,
        int duplicates,
        int skipped,
        int titleDateFingerprints
) {
    public NormalizedBatch {
        articles = List.copyOf(articles);
    }
}
