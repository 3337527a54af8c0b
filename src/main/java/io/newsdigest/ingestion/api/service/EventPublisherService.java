package io.newsdigest.ingestion.api.service;

import io.newsdigest.ingestion.api.dto.RunOutcome;
import io.newsdigest.ingestion.api.dto.RunReport;
import io.newsdigest.ingestion.api.dto.kafka.DigestGeneratedEvent;
import io.newsdigest.ingestion.config.KafkaProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CompletableFuture;

@Service
public class EventPublisherService {

    private static final Logger logger = LoggerFactory.getLogger(EventPublisherService.class);

    private final ObjectProvider<KafkaTemplate<String, Object>> kafkaTemplate;
    private final KafkaProperties kafkaProperties;

    public EventPublisherService(ObjectProvider<KafkaTemplate<String, Object>> kafkaTemplate,
                                 KafkaProperties kafkaProperties) {
        this.kafkaTemplate = kafkaTemplate;
        this.kafkaProperties = kafkaProperties;
    }

    /**
     * Announce a written digest. Never fails the run: send errors are logged.
     */
    public void publishDigestGenerated(RunOutcome outcome, Path outputPath) {
        if (!kafkaProperties.enabled() || outcome.digest() == null) {
            return;
        }

        RunReport report = outcome.report();
        try {
            KafkaTemplate<String, Object> template = kafkaTemplate.getIfAvailable();
            if (template == null) {
                logger.warn("Digest events enabled but no KafkaTemplate is configured");
                return;
            }

            DigestGeneratedEvent event = DigestGeneratedEvent.create(
                    report.runId(),
                    outputPath.toAbsolutePath().toString(),
                    List.copyOf(outcome.digest().categoryNames()),
                    outcome.digest().articleCount(),
                    report.sourcesFailed(),
                    report.generated(),
                    report.cacheHits(),
                    report.fallbacks(),
                    report.durationMs(),
                    outcome.digest().generatedAt()
            );

            CompletableFuture<SendResult<String, Object>> future =
                    template.send(kafkaProperties.digestGenerated(), report.runId(), event);

            future.whenComplete((result, ex) -> {
                if (ex == null) {
                    logger.info("Sent digest generated event for run {} to partition: {}",
                            report.runId(), result.getRecordMetadata().partition());
                } else {
                    logger.error("Failed to send digest generated event for run {}", report.runId(), ex);
                }
            });

        } catch (Exception e) {
            logger.error("Error publishing digest generated event for run {}", report.runId(), e);
        }
    }
}
