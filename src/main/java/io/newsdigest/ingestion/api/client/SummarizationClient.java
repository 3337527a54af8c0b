package io.newsdigest.ingestion.api.client;

import io.newsdigest.ingestion.api.dto.SummaryRequest;
import io.newsdigest.ingestion.api.exception.SummarizationApiException;

/**
 * One call to a text-generation backend. Implementations make exactly one
 * request per invocation; retries belong to the caller.
 */
public interface SummarizationClient {

    /**
     * @return the generated summary, never blank
     * @throws SummarizationApiException on any failed call; transient failures are
     *                                   signalled with the retryable subtype
     */
    String summarize(SummaryRequest request) throws SummarizationApiException;

    String getProviderName();

    boolean isAvailable();
}
