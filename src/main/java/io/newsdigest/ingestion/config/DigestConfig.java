package io.newsdigest.ingestion.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.util.List;

@ConfigurationProperties(prefix = "digest")
public record DigestConfig(
        List<FeedSource> sources,
        @DefaultValue HttpConfig http,
        @DefaultValue ProcessingConfig processing,
        @DefaultValue CacheConfig cache,
        @DefaultValue SummarizerConfig summarizer,
        @DefaultValue OutputConfig output
) {
    public DigestConfig {
        sources = sources == null ? List.of() : List.copyOf(sources);
    }

    public List<FeedSource> getEnabledSources() {
        return sources.stream()
                .filter(FeedSource::enabled)
                .toList();
    }
}
