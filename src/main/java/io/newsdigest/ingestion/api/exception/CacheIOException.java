package io.newsdigest.ingestion.api.exception;

import java.nio.file.Path;

public class CacheIOException extends Exception {
    private final Path file;

    public CacheIOException(String message, Path file, Throwable cause) {
        super(message, cause);
        this.file = file;
    }

    public Path getFile() {
        return file;
    }
}
