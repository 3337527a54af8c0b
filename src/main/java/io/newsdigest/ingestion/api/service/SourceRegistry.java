package io.newsdigest.ingestion.api.service;

import io.newsdigest.ingestion.config.DigestConfig;
import io.newsdigest.ingestion.config.FeedSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Enabled feed sources in configuration order. The url identifies a source;
 * a repeated url keeps its first definition.
 */
@Component
public class SourceRegistry {

    private static final Logger logger = LoggerFactory.getLogger(SourceRegistry.class);

    private final List<FeedSource> sources;

    @Autowired
    public SourceRegistry(DigestConfig digestConfig) {
        this(digestConfig.getEnabledSources());
    }

    SourceRegistry(List<FeedSource> configured) {
        Map<String, FeedSource> byUrl = new LinkedHashMap<>();
        for (FeedSource source : configured) {
            if (source.url() == null || source.url().isBlank()) {
                logger.warn("Ignoring source '{}' without url", source.name());
                continue;
            }
            FeedSource existing = byUrl.putIfAbsent(source.url().trim(), source);
            if (existing != null) {
                logger.warn("Source '{}' repeats the url of '{}', ignoring it", source.name(), existing.name());
            }
        }
        this.sources = List.copyOf(byUrl.values());
    }

    public List<FeedSource> getSources() {
        return sources;
    }

    public Optional<FeedSource> find(String name) {
        if (name == null) return Optional.empty();
        return sources.stream()
                .filter(source -> name.equalsIgnoreCase(source.name()))
                .findFirst();
    }

    /**
     * @param names source names, matched case-insensitively; empty selects everything
     */
    public List<FeedSource> select(Collection<String> names) {
        if (names == null || names.isEmpty()) {
            return sources;
        }

        List<FeedSource> selected = new ArrayList<>();
        for (String name : names) {
            String wanted = name.trim().toLowerCase(Locale.ROOT);
            sources.stream()
                    .filter(source -> source.name() != null && source.name().toLowerCase(Locale.ROOT).equals(wanted))
                    .findFirst()
                    .ifPresentOrElse(source -> {
                        if (!selected.contains(source)) selected.add(source);
                    }, () -> logger.warn("Unknown feed '{}' requested, available: {}", name, names()));
        }

        // registry order, not argument order
        selected.sort((a, b) -> Integer.compare(sources.indexOf(a), sources.indexOf(b)));
        return selected;
    }

    private List<String> names() {
        return sources.stream().map(FeedSource::name).toList();
    }
}
