package io.newsdigest.ingestion.api.dto;

public enum RunStatus {
    SUCCESS(0),
    NO_ARTICLES(1),
    CACHE_FLUSH_FAILED(2),
    FAILED(3),
    OUTPUT_FAILED(4);

    private final int exitCode;

    RunStatus(int exitCode) {
        this.exitCode = exitCode;
    }

    public int exitCode() {
        return exitCode;
    }
}
