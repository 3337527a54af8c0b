package io.newsdigest.ingestion.api.dto.kafka;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;

public record DigestGeneratedEvent(
        @JsonProperty("runId") String runId,
        @JsonProperty("outputPath") String outputPath,
        @JsonProperty("categories") List<String> categories,
        @JsonProperty("articleCount") int articleCount,
        @JsonProperty("sourcesFailed") int sourcesFailed,
        @JsonProperty("newSummaries") long newSummaries,
        @JsonProperty("cacheHits") long cacheHits,
        @JsonProperty("fallbacks") long fallbacks,
        @JsonProperty("processingDurationMs") long processingDurationMs,
        @JsonProperty("generatedAt") @JsonFormat(pattern = "yyyy-MM-dd'T'HH:mm:ss")
        LocalDateTime generatedAt
) {
    public static DigestGeneratedEvent create(String runId, String outputPath, List<String> categories,
                                              int articleCount, int sourcesFailed, long newSummaries,
                                              long cacheHits, long fallbacks, long processingDurationMs,
                                              Instant generatedAt) {
        return new DigestGeneratedEvent(
                runId,
                outputPath,
                categories,
                articleCount,
                sourcesFailed,
                newSummaries,
                cacheHits,
                fallbacks,
                processingDurationMs,
                LocalDateTime.ofInstant(generatedAt, ZoneOffset.UTC)
        );
    }
}
