package io.newsdigest.ingestion.api.client;

import io.newsdigest.ingestion.api.dto.SummaryRequest;
import io.newsdigest.ingestion.api.exception.ErrorCategory;
import io.newsdigest.ingestion.api.exception.SummarizationApiException;
import io.newsdigest.ingestion.api.exception.TransientSummarizationException;
import io.newsdigest.ingestion.config.SummarizerConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.net.SocketTimeoutException;
import java.util.List;
import java.util.Map;

/**
 * Chat-completions client for the OpenAI API (or any endpoint speaking the same
 * request/response shape).
 */
@Component
public class OpenAiSummarizationClient implements SummarizationClient {

    private static final Logger logger = LoggerFactory.getLogger(OpenAiSummarizationClient.class);

    private static final String SYSTEM_PROMPT = "You summarize science and technology articles concisely.";

    private final RestTemplate restTemplate;
    private final SummarizerConfig config;

    public OpenAiSummarizationClient(RestTemplate restTemplate, SummarizerConfig config) {
        this.restTemplate = restTemplate;
        this.config = config;
    }

    @Override
    public String summarize(SummaryRequest request) throws SummarizationApiException {
        if (!isAvailable()) {
            throw new SummarizationApiException("No API key configured", ErrorCategory.AUTH_REQUIRED);
        }

        Map<String, Object> body = Map.of(
                "model", config.model(),
                "messages", List.of(
                        Map.of("role", "system", "content", SYSTEM_PROMPT),
                        Map.of("role", "user", "content", buildPrompt(request))
                ),
                "temperature", config.temperature(),
                "max_tokens", request.maxTokens()
        );

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setBearerAuth(config.apiKey());

        Map<?, ?> response;
        try {
            response = restTemplate.postForObject(config.apiUrl(), new HttpEntity<>(body, headers), Map.class);

        } catch (HttpClientErrorException.TooManyRequests e) {
            throw new TransientSummarizationException("Rate limited (429)", e, ErrorCategory.RATE_LIMITED);

        } catch (HttpServerErrorException e) {
            throw new TransientSummarizationException("Server error (" + e.getStatusCode().value() + ")",
                    e, ErrorCategory.SERVER_ERROR);

        } catch (HttpClientErrorException e) {
            throw new SummarizationApiException("Request rejected (" + e.getStatusCode().value() + "): "
                    + e.getStatusText(), e, categoryFor(e.getStatusCode().value()));

        } catch (ResourceAccessException e) {
            ErrorCategory category = e.getCause() instanceof SocketTimeoutException
                    ? ErrorCategory.TIMEOUT
                    : ErrorCategory.NETWORK_ERROR;
            throw new TransientSummarizationException("I/O error calling " + config.apiUrl() + ": " + e.getMessage(),
                    e, category);

        } catch (RestClientException e) {
            throw new SummarizationApiException("Unreadable response: " + e.getMessage(), e, ErrorCategory.PARSE_ERROR);
        }

        String content = extractContent(response);
        if (content == null || content.isBlank()) {
            throw new TransientSummarizationException("Empty completion", ErrorCategory.PARSE_ERROR);
        }

        logger.debug("Completion received ({} chars)", content.length());
        return content.trim();
    }

    String buildPrompt(SummaryRequest request) {
        String sentences = request.sentences() <= 1 ? "one factual sentence" : "one or two factual sentences";
        StringBuilder prompt = new StringBuilder()
                .append("Summarize this science/tech article in ").append(sentences)
                .append(" covering the new finding or breakthrough. Be neutral and concise, avoid hype or speculation.\n")
                .append("Title: ").append(request.title());

        if (!request.isTitleOnly()) {
            String content = request.content();
            if (content.length() > config.inputCharLimit()) {
                content = content.substring(0, config.inputCharLimit());
            }
            prompt.append("\nContent: ").append(content);
        }
        return prompt.toString();
    }

    @SuppressWarnings("unchecked")
    private String extractContent(Map<?, ?> response) throws SummarizationApiException {
        if (response == null) {
            return null;
        }

        try {
            List<Map<String, Object>> choices = (List<Map<String, Object>>) response.get("choices");
            if (choices == null || choices.isEmpty()) {
                throw new SummarizationApiException("Response has no choices", ErrorCategory.PARSE_ERROR);
            }
            Map<String, Object> message = (Map<String, Object>) choices.get(0).get("message");
            Object content = message != null ? message.get("content") : null;
            return content != null ? content.toString() : null;
        } catch (ClassCastException e) {
            throw new SummarizationApiException("Unexpected response structure", e, ErrorCategory.PARSE_ERROR);
        }
    }

    private ErrorCategory categoryFor(int status) {
        return switch (status) {
            case 401 -> ErrorCategory.AUTH_REQUIRED;
            case 403 -> ErrorCategory.ACCESS_FORBIDDEN;
            case 404 -> ErrorCategory.NOT_FOUND;
            default -> ErrorCategory.HTTP_ERROR;
        };
    }

    @Override
    public String getProviderName() {
        return "openai:" + config.model();
    }

    @Override
    public boolean isAvailable() {
        return config.hasApiKey();
    }
}
