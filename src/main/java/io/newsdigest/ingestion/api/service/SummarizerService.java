package io.newsdigest.ingestion.api.service;

import io.newsdigest.ingestion.api.client.SummarizationClient;
import io.newsdigest.ingestion.api.dto.Article;
import io.newsdigest.ingestion.api.dto.SummaryRequest;
import io.newsdigest.ingestion.api.exception.SummarizationApiException;
import io.newsdigest.ingestion.api.exception.SummarizationException;
import io.newsdigest.ingestion.api.exception.TransientSummarizationException;
import io.newsdigest.ingestion.api.util.TextCleaner;
import io.newsdigest.ingestion.config.SummarizerConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.retry.RetryCallback;
import org.springframework.retry.RetryContext;
import org.springframework.retry.RetryListener;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Service;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Produces a summary for one article through the {@link SummarizationClient},
 * retrying transient failures with exponential backoff.
 */
@Service
public class SummarizerService {

    private static final Logger logger = LoggerFactory.getLogger(SummarizerService.class);

    private final SummarizationClient client;
    private final ArticleContentExtractor contentExtractor;
    private final SummarizerConfig config;
    private final RetryTemplate retryTemplate;

    public SummarizerService(SummarizationClient client,
                             ArticleContentExtractor contentExtractor,
                             SummarizerConfig config) {
        this.client = client;
        this.contentExtractor = contentExtractor;
        this.config = config;
        this.retryTemplate = createRetryTemplate(config);
    }

    public boolean isAvailable() {
        return client.isAvailable();
    }

    /**
     * @throws SummarizationException after {@code maxAttempts} transient failures, or
     *                                immediately on a permanent one
     */
    public String summarize(Article article) throws SummarizationException {
        SummaryRequest request = new SummaryRequest(
                article.title(),
                contentExtractor.contentFor(article),
                config.summarySentences(),
                config.maxTokens()
        );

        AtomicInteger attempts = new AtomicInteger();
        try {
            String summary = retryTemplate.execute(context -> {
                attempts.incrementAndGet();
                return client.summarize(request);
            });

            logger.debug("Summarized '{}' via {} in {} attempt(s)",
                    article.title(), client.getProviderName(), attempts.get());
            return summary;

        } catch (SummarizationApiException e) {
            throw new SummarizationException(article.fingerprint(), attempts.get(),
                    "Summarization failed after " + attempts.get() + " attempt(s) (" + e.getCategory() + "): "
                            + e.getMessage(), e);
        }
    }

    /**
     * Placeholder text used when no generated summary is available: the excerpt
     * cut to {@code fallbackChars}, or the title when there is no excerpt.
     */
    public String fallbackSummary(Article article) {
        if (article.hasExcerpt()) {
            return TextCleaner.truncate(article.excerpt(), config.fallbackChars());
        }
        return article.title();
    }

    private static RetryTemplate createRetryTemplate(SummarizerConfig config) {
        long initial = Math.max(1, config.initialBackoff().toMillis());
        long max = Math.max(initial + 1, config.maxBackoff().toMillis());
        double multiplier = config.backoffMultiplier() > 1.0 ? config.backoffMultiplier() : 2.0;

        return RetryTemplate.builder()
                .maxAttempts(Math.max(1, config.maxAttempts()))
                .exponentialBackoff(initial, multiplier, max)
                .retryOn(TransientSummarizationException.class)
                .withListener(new RetryListener() {
                    @Override
                    public <T, E extends Throwable> void onError(RetryContext context,
                                                                 RetryCallback<T, E> callback,
                                                                 Throwable throwable) {
                        if (throwable instanceof TransientSummarizationException) {
                            logger.warn("Summarization attempt {} failed: {}",
                                    context.getRetryCount(), throwable.getMessage());
                        }
                    }
                })
                .build();
    }
}
