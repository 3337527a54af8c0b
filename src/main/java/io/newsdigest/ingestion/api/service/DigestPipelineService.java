package io.newsdigest.ingestion.api.service;

import io.newsdigest.ingestion.api.dto.Digest;
import io.newsdigest.ingestion.api.dto.FetchResult;
import io.newsdigest.ingestion.api.dto.NormalizedBatch;
import io.newsdigest.ingestion.api.dto.RunOutcome;
import io.newsdigest.ingestion.api.dto.RunReport;
import io.newsdigest.ingestion.api.dto.RunStatus;
import io.newsdigest.ingestion.api.dto.SourceFailure;
import io.newsdigest.ingestion.api.dto.SummaryBatch;
import io.newsdigest.ingestion.api.dto.SummarySource;
import io.newsdigest.ingestion.api.exception.CacheIOException;
import io.newsdigest.ingestion.api.exception.DigestOutputException;
import io.newsdigest.ingestion.api.exception.ErrorCategory;
import io.newsdigest.ingestion.config.FeedSource;
import io.newsdigest.ingestion.config.ProcessingConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * One digest run: fetch every source in parallel, deduplicate, resolve summaries,
 * assemble and write the digest, then persist the cache.
 */
@Service
public class DigestPipelineService {

    private static final Logger logger = LoggerFactory.getLogger(DigestPipelineService.class);

    private final FeedFetcherService feedFetcher;
    private final ArticleNormalizerService normalizer;
    private final SummaryCacheService cache;
    private final SummaryResolverService resolver;
    private final DigestAssemblerService assembler;
    private final DigestOutputWriter outputWriter;
    private final EventPublisherService eventPublisher;
    private final ProcessingConfig processingConfig;
    private final Clock clock;

    public DigestPipelineService(FeedFetcherService feedFetcher,
                                 ArticleNormalizerService normalizer,
                                 SummaryCacheService cache,
                                 SummaryResolverService resolver,
                                 DigestAssemblerService assembler,
                                 DigestOutputWriter outputWriter,
                                 EventPublisherService eventPublisher,
                                 ProcessingConfig processingConfig,
                                 Clock clock) {
        this.feedFetcher = feedFetcher;
        this.normalizer = normalizer;
        this.cache = cache;
        this.resolver = resolver;
        this.assembler = assembler;
        this.outputWriter = outputWriter;
        this.eventPublisher = eventPublisher;
        this.processingConfig = processingConfig;
        this.clock = clock;
    }

    public RunOutcome run(List<FeedSource> sources, Path outputPath) {
        String runId = UUID.randomUUID().toString().substring(0, 8);
        Instant startTime = clock.instant();
        long deadline = System.nanoTime() + processingConfig.runTimeout().toNanos();

        logger.info("Starting digest run {} for {} sources", runId, sources.size());

        try {
            cache.load();

            List<FetchResult> results = fetchAll(sources, remaining(deadline));
            List<SourceFailure> failures = results.stream()
                    .filter(result -> !result.succeeded())
                    .map(FetchResult::failure)
                    .toList();
            int fetched = results.stream().mapToInt(result -> result.entries().size()).sum();
            boolean fetchTimedOut = failures.stream().anyMatch(f -> f.category() == ErrorCategory.CANCELLED);

            NormalizedBatch batch = normalizer.normalizeAll(results);

            if (batch.articles().isEmpty()) {
                RunReport report = new RunReport(runId, sources.size(), failures.size(), failures,
                        fetched, 0, 0, 0, 0, elapsedMs(startTime), fetchTimedOut);
                logger.error("Run {} produced no articles ({} of {} sources failed), nothing written",
                        runId, failures.size(), sources.size());
                logReport(report);
                return new RunOutcome(RunStatus.NO_ARTICLES, null, report);
            }

            SummaryBatch summaries = resolver.resolve(batch.articles(), remaining(deadline));
            Digest digest = assembler.assemble(summaries.items(), clock.instant());

            RunStatus status = RunStatus.SUCCESS;
            try {
                outputWriter.write(digest, outputPath);
            } catch (DigestOutputException e) {
                logger.error("Could not write digest to {}: {}", e.getFile(), e.getMessage(), e);
                status = RunStatus.OUTPUT_FAILED;
            }

            // generated summaries are kept even when the digest could not be written
            try {
                cache.flush();
            } catch (CacheIOException e) {
                logger.error("Could not save summary cache to {}: {}", e.getFile(), e.getMessage(), e);
                if (status == RunStatus.SUCCESS) {
                    status = RunStatus.CACHE_FLUSH_FAILED;
                }
            }

            RunReport report = new RunReport(
                    runId,
                    sources.size(),
                    failures.size(),
                    failures,
                    fetched,
                    batch.articles().size(),
                    summaries.count(SummarySource.CACHE),
                    summaries.count(SummarySource.GENERATED),
                    summaries.count(SummarySource.FALLBACK),
                    elapsedMs(startTime),
                    fetchTimedOut || summaries.timedOut()
            );
            logReport(report);

            RunOutcome outcome = new RunOutcome(status, digest, report);
            if (outcome.isSuccess()) {
                eventPublisher.publishDigestGenerated(outcome, outputPath);
            }
            return outcome;

        } catch (RuntimeException e) {
            logger.error("Digest run {} failed: {}", runId, e.getMessage(), e);
            RunReport report = new RunReport(runId, sources.size(), 0, List.of(), 0, 0, 0, 0, 0,
                    elapsedMs(startTime), false);
            return new RunOutcome(RunStatus.FAILED, null, report);
        }
    }

    private long elapsedMs(Instant startTime) {
        return Duration.between(startTime, clock.instant()).toMillis();
    }

    /**
     * Fetch all sources in parallel and wait for every one of them, or for the
     * deadline. Results come back in the order of {@code sources}.
     */
    List<FetchResult> fetchAll(List<FeedSource> sources, Duration budget) {
        if (sources.isEmpty()) {
            return List.of();
        }

        int poolSize = Math.max(1, Math.min(sources.size(), processingConfig.maxFetchWorkers()));
        AtomicInteger threadCount = new AtomicInteger();
        ExecutorService executor = Executors.newFixedThreadPool(poolSize, r -> {
            Thread t = new Thread(r, "feed-fetch-" + threadCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });

        List<Callable<FetchResult>> tasks = sources.stream()
                .<Callable<FetchResult>>map(source -> () -> feedFetcher.fetch(source))
                .toList();

        List<FetchResult> results = new ArrayList<>(sources.size());
        try {
            List<Future<FetchResult>> futures = executor.invokeAll(tasks, budget.toNanos(), TimeUnit.NANOSECONDS);

            for (int i = 0; i < futures.size(); i++) {
                FeedSource source = sources.get(i);
                try {
                    results.add(futures.get(i).get());
                } catch (CancellationException e) {
                    logger.warn("Run deadline reached before {} finished fetching", source.name());
                    results.add(cancelled(source));
                } catch (ExecutionException e) {
                    logger.error("Unexpected error fetching {}: {}", source.name(), e.getCause().getMessage(), e);
                    results.add(FetchResult.failure(source, SourceFailure.of(source.name(), source.url(),
                            ErrorCategory.UNKNOWN, e.getCause().getMessage()), 0));
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Fetch phase interrupted, {} of {} sources collected", results.size(), sources.size());
            for (int i = results.size(); i < sources.size(); i++) {
                results.add(cancelled(sources.get(i)));
            }
        } finally {
            executor.shutdownNow();
        }

        logger.info("Fetch phase complete: {} of {} sources succeeded",
                results.stream().filter(FetchResult::succeeded).count(), sources.size());
        return results;
    }

    private FetchResult cancelled(FeedSource source) {
        return FetchResult.failure(source,
                SourceFailure.of(source.name(), source.url(), ErrorCategory.CANCELLED, "Run deadline reached"), 0);
    }

    private Duration remaining(long deadline) {
        return Duration.ofNanos(Math.max(0, deadline - System.nanoTime()));
    }

    private void logReport(RunReport report) {
        logger.info("Run {} finished in {}ms: {} sources ({} failed), {} fetched, {} unique, "
                        + "{} cached, {} generated, {} fallback{}",
                report.runId(), report.durationMs(), report.sourcesTotal(), report.sourcesFailed(),
                report.articlesFetched(), report.articlesUnique(), report.cacheHits(), report.generated(),
                report.fallbacks(), report.timedOut() ? " (timed out)" : "");

        for (SourceFailure failure : report.failures()) {
            logger.warn("  {} [{} / {}]: {}", failure.sourceName(), failure.kind(), failure.category(),
                    failure.message());
        }
    }
}
