package io.newsdigest.ingestion.config;

import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;
import java.util.List;

public record ProcessingConfig(
        @DefaultValue("8") int maxFetchWorkers,
        @DefaultValue("10m") Duration runTimeout,
        List<String> categoryPriority,
        @DefaultValue("false") boolean extractFullContent
) {
    public ProcessingConfig {
        categoryPriority = categoryPriority == null ? List.of() : List.copyOf(categoryPriority);
    }

    public long getRunTimeoutMs() {
        return runTimeout.toMillis();
    }
}
