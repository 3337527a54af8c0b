package io.newsdigest.ingestion.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

@ConfigurationProperties(prefix = "kafka.events")
public record KafkaProperties(
        @DefaultValue("false") boolean enabled,
        @DefaultValue("digest-generated") String digestGenerated
) {}
