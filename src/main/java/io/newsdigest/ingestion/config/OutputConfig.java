package io.newsdigest.ingestion.config;

import org.springframework.boot.context.properties.bind.DefaultValue;

import java.nio.file.Path;

public record OutputConfig(
        @DefaultValue("news_digest.json") String path
) {
    public Path getOutputPath() {
        return Path.of(path);
    }
}
