package io.newsdigest.ingestion.api.dto;

import java.util.List;

public record RunReport(
        String runId,
        int sourcesTotal,
        int sourcesFailed,
        List<SourceFailure> failures,
        int articlesFetched,
        int articlesUnique,
        long cacheHits,
        long generated,
        long fallbacks,
        long durationMs,
        boolean timedOut
) {
    public RunReport {
        failures = failures == null ? List.of() : List.copyOf(failures);
    }
}
