package io.newsdigest.ingestion.api.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.newsdigest.ingestion.api.dto.Digest;
import io.newsdigest.ingestion.api.exception.DigestOutputException;
import io.newsdigest.ingestion.api.util.AtomicFiles;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Writes the digest document consumed by the rendering side.
 */
@Component
public class DigestOutputWriter {

    private static final Logger logger = LoggerFactory.getLogger(DigestOutputWriter.class);

    private final ObjectMapper objectMapper;

    public DigestOutputWriter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy()
                .enable(SerializationFeature.INDENT_OUTPUT)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    public void write(Digest digest, Path target) throws DigestOutputException {
        try {
            AtomicFiles.write(target, out -> objectMapper.writeValue(out, digest));
            logger.info("Digest with {} articles in {} categories written to {}",
                    digest.articleCount(), digest.categories().size(), target.toAbsolutePath());
        } catch (IOException e) {
            throw new DigestOutputException("Failed to write digest: " + e.getMessage(), target, e);
        }
    }
}
