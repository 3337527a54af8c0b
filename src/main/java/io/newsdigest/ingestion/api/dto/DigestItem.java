package io.newsdigest.ingestion.api.dto;

import java.time.Instant;

public record DigestItem(
        String title,
        String link,
        String sourceName,
        String category,
        Instant publishedAt,
        String summary,
        SummarySource summarySource
) {
    public static DigestItem from(SummarizedArticle item) {
        Article article = item.article();
        return new DigestItem(
                article.title(),
                article.link(),
                article.sourceName(),
                article.category(),
                article.publishedAt(),
                item.summary(),
                item.summarySource()
        );
    }
}
