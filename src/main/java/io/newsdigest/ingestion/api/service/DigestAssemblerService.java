package io.newsdigest.ingestion.api.service;

import io.newsdigest.ingestion.api.dto.Digest;
import io.newsdigest.ingestion.api.dto.DigestItem;
import io.newsdigest.ingestion.api.dto.SummarizedArticle;
import io.newsdigest.ingestion.config.ProcessingConfig;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Groups summarized articles by category and orders them for presentation.
 * Deterministic for a given input list; touches neither network nor cache.
 */
@Service
public class DigestAssemblerService {

    static final String UNCATEGORIZED = "Uncategorized";

    // dated first, newest first; undated keep input order through the stable sort
    private static final Comparator<DigestItem> BY_PUBLISHED_DESC = Comparator.comparing(
            DigestItem::publishedAt, Comparator.nullsLast(Comparator.reverseOrder()));

    private final List<String> categoryPriority;

    public DigestAssemblerService(ProcessingConfig processingConfig) {
        this.categoryPriority = processingConfig.categoryPriority();
    }

    /**
     * @param items       summarized articles in fetch order
     * @param generatedAt timestamp recorded in the digest
     */
    public Digest assemble(List<SummarizedArticle> items, Instant generatedAt) {
        Map<String, List<DigestItem>> byCategory = new LinkedHashMap<>();
        for (SummarizedArticle item : items) {
            DigestItem digestItem = DigestItem.from(item);
            byCategory.computeIfAbsent(categoryOf(digestItem), key -> new ArrayList<>()).add(digestItem);
        }

        byCategory.values().forEach(list -> list.sort(BY_PUBLISHED_DESC));

        Map<String, List<DigestItem>> ordered = new LinkedHashMap<>();
        for (String category : categoryPriority) {
            matchCategory(byCategory, category)
                    .ifPresent(name -> ordered.put(name, byCategory.remove(name)));
        }

        // categories missing from the priority list, alphabetically
        new TreeMap<>(byCategory).forEach(ordered::put);

        long sourceCount = items.stream()
                .map(item -> item.article().sourceName())
                .distinct()
                .count();

        return new Digest(generatedAt, items.size(), (int) sourceCount, ordered);
    }

    private Optional<String> matchCategory(Map<String, List<DigestItem>> byCategory, String wanted) {
        String key = wanted.trim().toLowerCase(Locale.ROOT);
        return byCategory.keySet().stream()
                .filter(name -> name.trim().toLowerCase(Locale.ROOT).equals(key))
                .findFirst();
    }

    private String categoryOf(DigestItem item) {
        return item.category() == null || item.category().isBlank() ? UNCATEGORIZED : item.category();
    }
}
