package io.newsdigest.ingestion.config;

import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.Duration;

/**
 * Exposes the sections of {@link DigestConfig} as beans so each service takes
 * only the settings it uses.
 */
@Configuration
public class PipelineConfiguration {

    @Bean
    public HttpConfig httpConfig(DigestConfig config) {
        return config.http();
    }

    @Bean
    public ProcessingConfig processingConfig(DigestConfig config) {
        return config.processing();
    }

    @Bean
    public CacheConfig cacheConfig(DigestConfig config) {
        return config.cache();
    }

    @Bean
    public SummarizerConfig summarizerConfig(DigestConfig config) {
        return config.summarizer();
    }

    @Bean
    public OutputConfig outputConfig(DigestConfig config) {
        return config.output();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RestTemplate summarizerRestTemplate(RestTemplateBuilder builder, HttpConfig httpConfig,
                                               SummarizerConfig summarizerConfig) {
        return builder
                .setConnectTimeout(Duration.ofMillis(httpConfig.connectTimeout()))
                .setReadTimeout(summarizerConfig.requestTimeout())
                .build();
    }
}
