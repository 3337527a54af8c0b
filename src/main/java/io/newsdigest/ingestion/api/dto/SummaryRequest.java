package io.newsdigest.ingestion.api.dto;

/**
 * @param content   excerpt or extracted body; empty means summarize from the title alone
 * @param sentences desired summary length
 */
public record SummaryRequest(
        String title,
        String content,
        int sentences,
        int maxTokens
) {
    public boolean isTitleOnly() {
        return content == null || content.isBlank();
    }
}
