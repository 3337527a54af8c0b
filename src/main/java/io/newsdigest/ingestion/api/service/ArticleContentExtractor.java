package io.newsdigest.ingestion.api.service;

import io.newsdigest.ingestion.api.dto.Article;
import io.newsdigest.ingestion.api.util.TextCleaner;
import io.newsdigest.ingestion.config.HttpConfig;
import io.newsdigest.ingestion.config.ProcessingConfig;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.List;

/**
 * Pulls the main text block from an article page to give the summarizer more than
 * the feed excerpt. Only used for cache misses, and only when enabled.
 */
@Component
public class ArticleContentExtractor {

    private static final Logger logger = LoggerFactory.getLogger(ArticleContentExtractor.class);

    static final int MIN_CONTENT_LENGTH = 200;

    static final List<String> CONTENT_SELECTORS = List.of(
            "#text", ".story-body", "[id*=text]", ".article-content",
            ".post-content", ".entry-content", ".article-body",
            ".content", "article", ".main-content", "[role=main]"
    );

    private static final String NOISE = "script, style, nav, header, footer, aside";

    private final boolean enabled;
    private final HttpConfig httpConfig;
    private final UserAgentRotation userAgents;
    private final SourceRegistry sourceRegistry;

    public ArticleContentExtractor(ProcessingConfig processingConfig, HttpConfig httpConfig,
                                   UserAgentRotation userAgents, SourceRegistry sourceRegistry) {
        this.enabled = processingConfig.extractFullContent();
        this.httpConfig = httpConfig;
        this.userAgents = userAgents;
        this.sourceRegistry = sourceRegistry;
    }

    /**
     * @return extracted page text, or the article's excerpt when extraction is
     * disabled, fails or finds nothing substantial
     */
    public String contentFor(Article article) {
        if (!enabled || article.link() == null) {
            return article.excerpt();
        }

        try {
            Document doc = Jsoup.connect(article.link())
                    .userAgent(userAgentFor(article))
                    .timeout(httpConfig.readTimeout())
                    .get();

            String extracted = extract(doc);
            if (extracted != null) {
                logger.debug("Extracted {} chars from {}", extracted.length(), article.link());
                return extracted;
            }
        } catch (IOException | IllegalArgumentException e) {
            logger.warn("Could not extract content from {}: {}", article.link(), e.getMessage());
        }

        return article.excerpt();
    }

    private String userAgentFor(Article article) {
        return sourceRegistry.find(article.sourceName())
                .map(userAgents::forSource)
                .orElseGet(userAgents::next);
    }

    static String extract(Document doc) {
        for (String selector : CONTENT_SELECTORS) {
            Element block = doc.selectFirst(selector);
            if (block == null) {
                continue;
            }

            block.select(NOISE).remove();
            String text = TextCleaner.collapseWhitespace(block.text());
            if (text.length() > MIN_CONTENT_LENGTH) {
                return text;
            }
        }
        return null;
    }
}
