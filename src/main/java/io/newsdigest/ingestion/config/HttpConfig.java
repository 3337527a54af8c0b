package io.newsdigest.ingestion.config;

import org.springframework.boot.context.properties.bind.DefaultValue;

import java.util.List;

public record HttpConfig(
        @DefaultValue("10000") int connectTimeout,
        @DefaultValue("30000") int readTimeout,
        @DefaultValue("3") int maxRetries,
        @DefaultValue("2000") int retryDelay,
        List<String> userAgents
) {
    public HttpConfig {
        userAgents = userAgents == null || userAgents.isEmpty()
                ? List.of("NewsDigest/1.0")
                : List.copyOf(userAgents);
    }
}
