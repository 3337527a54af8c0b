package io.newsdigest.ingestion.config;

import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

public record SummarizerConfig(
        @DefaultValue("https://api.openai.com/v1/chat/completions") String apiUrl,
        String apiKey,
        @DefaultValue("gpt-4o-mini") String model,
        @DefaultValue("4") int maxConcurrency,
        @DefaultValue("3") int maxAttempts,
        @DefaultValue("4s") Duration initialBackoff,
        @DefaultValue("2.0") double backoffMultiplier,
        @DefaultValue("10s") Duration maxBackoff,
        @DefaultValue("30s") Duration requestTimeout,
        @DefaultValue("120") int maxTokens,
        @DefaultValue("0.1") double temperature,
        @DefaultValue("3000") int inputCharLimit,
        @DefaultValue("280") int fallbackChars,
        @DefaultValue("2") int summarySentences
) {
    public boolean hasApiKey() {
        return apiKey != null && !apiKey.isBlank();
    }
}
