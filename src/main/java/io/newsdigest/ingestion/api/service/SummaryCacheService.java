package io.newsdigest.ingestion.api.service;

import io.newsdigest.ingestion.api.dto.CacheEntry;
import io.newsdigest.ingestion.api.exception.CacheIOException;
import io.newsdigest.ingestion.api.util.TextCleaner;
import io.newsdigest.ingestion.config.CacheConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Fingerprint to summary mapping, loaded in full at the start of a run and
 * flushed in full at the end. Sole owner and writer of {@link CacheEntry} records.
 */
@Service
public class SummaryCacheService {

    private static final Logger logger = LoggerFactory.getLogger(SummaryCacheService.class);

    private static final int STORED_TITLE_LENGTH = 100;

    private final CacheFileRepository repository;
    private final CacheConfig cacheConfig;
    private final Clock clock;

    private final Map<String, CacheEntry> entries = new ConcurrentHashMap<>();
    private final Set<String> storedThisRun = ConcurrentHashMap.newKeySet();
    private volatile boolean enabled;

    public SummaryCacheService(CacheFileRepository repository, CacheConfig cacheConfig, Clock clock) {
        this.repository = repository;
        this.cacheConfig = cacheConfig;
        this.clock = clock;
        this.enabled = cacheConfig.enabled();
    }

    /**
     * Load the cache file, dropping entries past the retention window. A file
     * that cannot be read leaves the cache empty; the run continues cold.
     *
     * @return number of entries available for lookup
     */
    public int load() {
        entries.clear();
        storedThisRun.clear();

        if (!enabled) {
            logger.info("Summary cache disabled, every article will be summarized");
            return 0;
        }

        Map<String, CacheEntry> stored;
        try {
            stored = repository.read();
        } catch (CacheIOException e) {
            logger.warn("Could not load summary cache from {}: {}. Continuing with a cold cache",
                    e.getFile(), e.getMessage());
            return 0;
        }

        Instant cutoff = clock.instant().minus(cacheConfig.retention());
        int evicted = 0;

        for (Map.Entry<String, CacheEntry> item : stored.entrySet()) {
            CacheEntry entry = item.getValue();
            if (entry == null || entry.summaryText() == null || entry.referenceTime() == null
                    || !entry.referenceTime().isAfter(cutoff)) {
                evicted++;
                continue;
            }
            entries.put(item.getKey(), entry);
        }

        logger.info("Loaded {} cached summaries (evicted {} older than {})",
                entries.size(), evicted, cacheConfig.retention());
        return entries.size();
    }

    /**
     * @return the entry when present and generated from the same content; empty on
     * a miss or when the stored content hash differs
     */
    public Optional<CacheEntry> lookup(String fingerprint, String contentHash) {
        if (!enabled) return Optional.empty();

        CacheEntry entry = entries.get(fingerprint);
        if (entry == null) {
            return Optional.empty();
        }

        if (!entry.matches(contentHash)) {
            logger.debug("Stale summary for {}: content changed since {}", fingerprint, entry.createdAt());
            return Optional.empty();
        }

        Instant now = clock.instant();
        CacheEntry touched = entries.computeIfPresent(fingerprint,
                (key, current) -> current.matches(contentHash) ? current.touch(now) : current);

        return touched != null && touched.matches(contentHash) ? Optional.of(touched) : Optional.empty();
    }

    /**
     * Overwrite the entry for {@code fingerprint}. Repeated stores are harmless:
     * the last one wins.
     */
    public void store(String fingerprint, String contentHash, String summaryText, String title) {
        if (!enabled) return;

        Instant now = clock.instant();
        entries.compute(fingerprint, (key, previous) -> new CacheEntry(
                fingerprint,
                summaryText,
                now,
                now,
                contentHash,
                TextCleaner.truncate(title, STORED_TITLE_LENGTH)
        ));

        if (!storedThisRun.add(fingerprint)) {
            logger.warn("Summary for {} stored more than once in this run", fingerprint);
        }
    }

    /**
     * Rewrite the cache file atomically with the current entries.
     *
     * @throws CacheIOException when the file cannot be written; the previous file is left intact
     */
    public void flush() throws CacheIOException {
        if (!enabled) return;

        repository.write(Map.copyOf(entries), clock.instant());
    }

    public void disable() {
        this.enabled = false;
        entries.clear();
    }

    public boolean isEnabled() {
        return enabled;
    }

    public boolean contains(String fingerprint) {
        return entries.containsKey(fingerprint);
    }

    public int size() {
        return entries.size();
    }

    public int storedInRun() {
        return storedThisRun.size();
    }
}
