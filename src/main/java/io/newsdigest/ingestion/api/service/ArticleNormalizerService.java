package io.newsdigest.ingestion.api.service;

import io.newsdigest.ingestion.api.dto.Article;
import io.newsdigest.ingestion.api.dto.FetchResult;
import io.newsdigest.ingestion.api.dto.FingerprintStrategy;
import io.newsdigest.ingestion.api.dto.NormalizedBatch;
import io.newsdigest.ingestion.api.dto.RawFeedEntry;
import io.newsdigest.ingestion.api.util.LinkCanonicalizer;
import io.newsdigest.ingestion.api.util.TextCleaner;
import io.newsdigest.ingestion.config.FeedSource;
import org.apache.commons.codec.digest.DigestUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Turns raw entries into {@link Article}s and removes duplicates across sources.
 * Pure computation; no I/O.
 */
@Service
public class ArticleNormalizerService {

    private static final Logger logger = LoggerFactory.getLogger(ArticleNormalizerService.class);

    private static final String LINK_PREFIX = "link:";
    private static final String TITLE_DATE_PREFIX = "meta:";
    private static final String UNKNOWN_DATE = "unknown";

    /**
     * @return the article, or empty when the entry has no usable title
     */
    public Optional<Article> normalize(RawFeedEntry entry, FeedSource source) {
        String title = TextCleaner.clean(entry.title());
        if (title.isEmpty()) {
            logger.debug("Skipping entry without title from {}: link='{}'", source.name(), entry.link());
            return Optional.empty();
        }

        String excerpt = TextCleaner.clean(entry.description());
        String link = entry.link() != null && !entry.link().isBlank() ? entry.link().trim() : null;

        Optional<String> canonicalLink = source.hints().unstableLinks()
                ? Optional.empty()
                : LinkCanonicalizer.canonicalize(link);

        String fingerprint;
        FingerprintStrategy strategy;
        if (canonicalLink.isPresent()) {
            fingerprint = DigestUtils.sha256Hex(LINK_PREFIX + canonicalLink.get());
            strategy = FingerprintStrategy.LINK;
        } else {
            fingerprint = titleDateFingerprint(source.name(), title, entry.publishedAt());
            strategy = FingerprintStrategy.TITLE_DATE;
            logger.debug("Title/date fingerprint for '{}' from {} (link: {})", title, source.name(), link);
        }

        return Optional.of(new Article(
                fingerprint,
                strategy,
                source.category(),
                title,
                link,
                entry.publishedAt(),
                excerpt,
                source.name(),
                contentHash(title, excerpt)
        ));
    }

    /**
     * Normalize every successful fetch and keep the first article per fingerprint.
     *
     * @param results fetch results in source-registry order
     */
    public NormalizedBatch normalizeAll(List<FetchResult> results) {
        Map<String, Article> unique = new LinkedHashMap<>();
        int candidates = 0;
        int skipped = 0;
        int duplicates = 0;
        int titleDate = 0;

        for (FetchResult result : results) {
            for (RawFeedEntry entry : result.entries()) {
                Optional<Article> normalized = normalize(entry, result.source());
                if (normalized.isEmpty()) {
                    skipped++;
                    continue;
                }

                Article article = normalized.get();
                candidates++;

                Article existing = unique.putIfAbsent(article.fingerprint(), article);
                if (existing != null) {
                    duplicates++;
                    logger.debug("Duplicate '{}' from {} already seen from {}",
                            article.title(), article.sourceName(), existing.sourceName());
                } else if (article.fingerprintStrategy() == FingerprintStrategy.TITLE_DATE) {
                    titleDate++;
                }
            }
        }

        if (titleDate > 0) {
            logger.info("{} article(s) fingerprinted by source/title/date instead of link", titleDate);
        }
        logger.info("Normalized {} articles: {} unique, {} duplicates, {} skipped",
                candidates, unique.size(), duplicates, skipped);

        return new NormalizedBatch(List.copyOf(unique.values()), candidates, duplicates, skipped, titleDate);
    }

    /**
     * Hash of the normalized title and excerpt; changes when a feed corrects either.
     */
    public static String contentHash(String title, String excerpt) {
        return DigestUtils.sha256Hex(TextCleaner.collapseWhitespace(title) + "\n" + TextCleaner.collapseWhitespace(excerpt));
    }

    static String titleDateFingerprint(String sourceName, String title, Instant publishedAt) {
        String date = publishedAt != null
                ? publishedAt.atOffset(ZoneOffset.UTC).toLocalDate().toString()
                : UNKNOWN_DATE;

        return DigestUtils.sha256Hex(TITLE_DATE_PREFIX
                + normalizeKey(sourceName) + "\n"
                + normalizeKey(title) + "\n"
                + date);
    }

    private static String normalizeKey(String value) {
        return TextCleaner.collapseWhitespace(value).toLowerCase(Locale.ROOT);
    }
}
