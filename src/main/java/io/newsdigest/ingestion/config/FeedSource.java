package io.newsdigest.ingestion.config;

import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * One configured feed endpoint. Identity is the url; {@code name} doubles as the
 * article's source name in the digest.
 *
 * @param maxArticles entries taken from the head of the feed, {@code 0} for all
 */
public record FeedSource(
        String name,
        String url,
        String category,
        @DefaultValue("0") int maxArticles,
        @DefaultValue("true") boolean enabled,
        ParserHints hints
) {
    public FeedSource {
        if (hints == null) {
            hints = ParserHints.NONE;
        }
    }

    public static FeedSource of(String name, String url, String category) {
        return new FeedSource(name, url, category, 0, true, ParserHints.NONE);
    }
}
