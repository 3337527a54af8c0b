package io.newsdigest.ingestion.config;

import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Per-source parsing overrides.
 *
 * @param unstableLinks the source rewrites article links between fetches, so
 *                      fingerprints fall back to source/title/date
 * @param userAgent     fixed user agent for this source instead of the rotation
 */
public record ParserHints(
        @DefaultValue("false") boolean unstableLinks,
        String userAgent
) {
    public static final ParserHints NONE = new ParserHints(false, null);
}
