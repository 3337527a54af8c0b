package io.newsdigest.ingestion.api.service;

import io.newsdigest.ingestion.api.dto.Article;
import io.newsdigest.ingestion.api.dto.CacheEntry;
import io.newsdigest.ingestion.api.dto.SummarizedArticle;
import io.newsdigest.ingestion.api.dto.SummaryBatch;
import io.newsdigest.ingestion.api.dto.SummarySource;
import io.newsdigest.ingestion.api.exception.SummarizationException;
import io.newsdigest.ingestion.config.SummarizerConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Gives every article a summary: from the cache when the content is unchanged,
 * otherwise generated (and written through to the cache), otherwise a fallback.
 */
@Service
public class SummaryResolverService {

    private static final Logger logger = LoggerFactory.getLogger(SummaryResolverService.class);

    private final SummaryCacheService cache;
    private final SummarizerService summarizer;
    private final SummarizerConfig config;

    public SummaryResolverService(SummaryCacheService cache, SummarizerService summarizer, SummarizerConfig config) {
        this.cache = cache;
        this.summarizer = summarizer;
        this.config = config;
    }

    /**
     * @param articles deduplicated articles
     * @param budget   time left in the run; articles still pending when it runs out get a fallback
     * @return one summarized article per input, in input order
     */
    public SummaryBatch resolve(List<Article> articles, Duration budget) {
        long deadline = System.nanoTime() + Math.max(0, budget.toNanos());

        List<SummarizedArticle> resolved = new ArrayList<>(articles.size());
        List<Integer> pendingSlots = new ArrayList<>();
        List<CompletableFuture<SummarizedArticle>> pending = new ArrayList<>();
        // one generation per fingerprint for the whole run; repeats share its outcome
        Map<String, CompletableFuture<SummarizedArticle>> generations = new HashMap<>();

        boolean generationAvailable = summarizer.isAvailable();
        if (!generationAvailable) {
            logger.warn("No summarization API key configured; cache misses get fallback summaries");
        }

        ExecutorService executor = generationAvailable ? createExecutor(articles.size()) : null;

        try {
            for (Article article : articles) {
                CompletableFuture<SummarizedArticle> shared = generations.get(article.fingerprint());
                if (shared != null) {
                    resolved.add(null);
                    pendingSlots.add(resolved.size() - 1);
                    pending.add(shared);
                    continue;
                }

                Optional<CacheEntry> cached = cache.lookup(article.fingerprint(), article.contentHash());
                if (cached.isPresent()) {
                    resolved.add(new SummarizedArticle(article, cached.get().summaryText(), SummarySource.CACHE));
                    continue;
                }

                if (executor == null) {
                    resolved.add(fallback(article));
                    continue;
                }

                resolved.add(null);
                pendingSlots.add(resolved.size() - 1);
                CompletableFuture<SummarizedArticle> future =
                        CompletableFuture.supplyAsync(() -> generate(article), executor);
                generations.put(article.fingerprint(), future);
                pending.add(future);
            }

            boolean timedOut = false;
            for (int i = 0; i < pending.size(); i++) {
                int slot = pendingSlots.get(i);
                Article article = articles.get(slot);
                CompletableFuture<SummarizedArticle> future = pending.get(i);

                try {
                    long remaining = deadline - System.nanoTime();
                    if (remaining <= 0) {
                        throw new TimeoutException();
                    }
                    SummarizedArticle done = future.get(remaining, TimeUnit.NANOSECONDS);
                    resolved.set(slot, new SummarizedArticle(article, done.summary(), done.summarySource()));

                } catch (TimeoutException | CancellationException e) {
                    future.cancel(true);
                    timedOut = true;
                    logger.warn("Run deadline reached before '{}' was summarized, using fallback", article.title());
                    resolved.set(slot, fallback(article));

                } catch (ExecutionException e) {
                    logger.error("Unexpected error summarizing '{}': {}", article.title(),
                            e.getCause() != null ? e.getCause().getMessage() : e.getMessage(), e);
                    resolved.set(slot, fallback(article));

                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    timedOut = true;
                    resolved.set(slot, fallback(article));
                }
            }

            SummaryBatch batch = new SummaryBatch(resolved, timedOut);
            logger.info("Summaries resolved: {} cached, {} generated, {} fallback",
                    batch.count(SummarySource.CACHE), batch.count(SummarySource.GENERATED),
                    batch.count(SummarySource.FALLBACK));
            return batch;

        } finally {
            if (executor != null) {
                executor.shutdownNow();
            }
        }
    }

    SummarizedArticle generate(Article article) {
        try {
            String summary = summarizer.summarize(article);
            if (Thread.currentThread().isInterrupted()) {
                // abandoned at the run deadline; the caller already used a fallback
                return new SummarizedArticle(article, summary, SummarySource.GENERATED);
            }
            cache.store(article.fingerprint(), article.contentHash(), summary, article.title());
            return new SummarizedArticle(article, summary, SummarySource.GENERATED);

        } catch (SummarizationException e) {
            logger.warn("Falling back for '{}' after {} attempt(s): {}",
                    article.title(), e.getAttempts(), e.getMessage());
            return fallback(article);
        }
    }

    private SummarizedArticle fallback(Article article) {
        return new SummarizedArticle(article, summarizer.fallbackSummary(article), SummarySource.FALLBACK);
    }

    private ExecutorService createExecutor(int articleCount) {
        int poolSize = Math.max(1, Math.min(articleCount, config.maxConcurrency()));
        AtomicInteger threadCount = new AtomicInteger();

        return Executors.newFixedThreadPool(poolSize, r -> {
            Thread t = new Thread(r, "summarizer-" + threadCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }
}
