package io.newsdigest.ingestion.api.exception;

/**
 * Source-scoped failure kinds. Both are non-fatal: the source contributes no
 * articles and the run continues.
 */
public enum FailureKind {
    FETCH_ERROR,
    PARSE_ERROR
}
