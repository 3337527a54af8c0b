package io.newsdigest.ingestion.api.dto;

public record SummarizedArticle(
        Article article,
        String summary,
        SummarySource summarySource
) {}
