package io.newsdigest.ingestion.api.dto;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Categorized digest handed to the rendering side. {@code categories} keeps
 * presentation order.
 */
public record Digest(
        Instant generatedAt,
        int articleCount,
        int sourceCount,
        Map<String, List<DigestItem>> categories
) {
    public Digest {
        Map<String, List<DigestItem>> ordered = new LinkedHashMap<>();
        categories.forEach((name, items) -> ordered.put(name, List.copyOf(items)));
        categories = Collections.unmodifiableMap(ordered);
    }

    public List<String> categoryNames() {
        return List.copyOf(categories.keySet());
    }
}
