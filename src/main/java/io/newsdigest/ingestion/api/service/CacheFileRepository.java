package io.newsdigest.ingestion.api.service;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.newsdigest.ingestion.api.dto.CacheEntry;
import io.newsdigest.ingestion.api.exception.CacheIOException;
import io.newsdigest.ingestion.api.util.AtomicFiles;
import io.newsdigest.ingestion.config.CacheConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Map;
import java.util.TreeMap;

/**
 * Reads and rewrites the summary cache file as a whole. One JSON object keyed
 * by fingerprint; writes go through {@link AtomicFiles}.
 */
@Component
public class CacheFileRepository {

    private static final Logger logger = LoggerFactory.getLogger(CacheFileRepository.class);

    static final int FORMAT_VERSION = 1;

    public record CacheFile(
            int formatVersion,
            Instant savedAt,
            Map<String, CacheEntry> entries
    ) {}

    private final Path file;
    private final ObjectMapper mapper;

    @Autowired
    public CacheFileRepository(CacheConfig cacheConfig) {
        this(cacheConfig.getFilePath());
    }

    public CacheFileRepository(Path file) {
        this.file = file;
        this.mapper = createMapper();
    }

    protected ObjectMapper createMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    /**
     * @return entries keyed by fingerprint; empty when the file does not exist yet
     * @throws CacheIOException when the file exists but cannot be read or parsed
     */
    public Map<String, CacheEntry> read() throws CacheIOException {
        if (!Files.exists(file)) {
            logger.info("No summary cache at {}, starting cold", file.toAbsolutePath());
            return new TreeMap<>();
        }

        try {
            CacheFile content = mapper.readValue(file.toFile(), CacheFile.class);
            if (content == null || content.entries() == null) {
                return new TreeMap<>();
            }
            if (content.formatVersion() > FORMAT_VERSION) {
                logger.warn("Cache file {} has format version {}, expected {}",
                        file, content.formatVersion(), FORMAT_VERSION);
            }
            return new TreeMap<>(content.entries());
        } catch (IOException e) {
            throw new CacheIOException("Failed to read summary cache: " + e.getMessage(), file, e);
        }
    }

    public void write(Map<String, CacheEntry> entries, Instant savedAt) throws CacheIOException {
        CacheFile content = new CacheFile(FORMAT_VERSION, savedAt, new TreeMap<>(entries));

        try {
            AtomicFiles.write(file, out -> mapper.writeValue(out, content));
            logger.info("Saved {} cached summaries to {}", entries.size(), file.toAbsolutePath());
        } catch (IOException e) {
            throw new CacheIOException("Failed to write summary cache: " + e.getMessage(), file, e);
        }
    }

    public Path getFile() {
        return file;
    }
}
