package io.newsdigest.ingestion.api.dto;

import java.util.List;

/**
 * Summaries in the same order as the articles handed in.
 *
 * @param timedOut the run deadline cut summarization short for at least one article
 */
public record SummaryBatch(
        List<SummarizedArticle> items,
        boolean timedOut
) {
    public SummaryBatch {
        items = List.copyOf(items);
    }

    public long count(SummarySource source) {
        return items.stream()
                .filter(item -> item.summarySource() == source)
                .count();
    }
}
