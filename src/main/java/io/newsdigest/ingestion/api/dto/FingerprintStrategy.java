package io.newsdigest.ingestion.api.dto;

public enum FingerprintStrategy {
    /** Hash of the canonical link. */
    LINK,
    /** Hash of source name, title and publish date; used when the link is missing or unstable. */
    TITLE_DATE
}
