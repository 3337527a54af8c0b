package io.newsdigest.ingestion.api.dto;

/**
 * @param digest null when the run produced no articles
 */
public record RunOutcome(
        RunStatus status,
        Digest digest,
        RunReport report
) {
    public boolean isSuccess() {
        return status == RunStatus.SUCCESS;
    }
}
