package io.newsdigest.ingestion.config;

import org.springframework.boot.context.properties.bind.DefaultValue;

import java.nio.file.Path;
import java.time.Duration;

/**
 * @param retention entries not created or referenced within this window are dropped on load
 */
public record CacheConfig(
        @DefaultValue("true") boolean enabled,
        @DefaultValue("article_cache.json") String file,
        @DefaultValue("7d") Duration retention
) {
    public Path getFilePath() {
        return Path.of(file);
    }
}
