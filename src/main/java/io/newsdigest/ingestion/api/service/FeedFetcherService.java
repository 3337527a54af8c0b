package io.newsdigest.ingestion.api.service;

import com.rometools.rome.feed.synd.SyndContent;
import com.rometools.rome.feed.synd.SyndEntry;
import com.rometools.rome.feed.synd.SyndFeed;
import com.rometools.rome.io.FeedException;
import com.rometools.rome.io.SyndFeedInput;
import com.rometools.rome.io.XmlReader;
import io.newsdigest.ingestion.api.dto.FetchResult;
import io.newsdigest.ingestion.api.dto.RawFeedEntry;
import io.newsdigest.ingestion.api.dto.SourceFailure;
import io.newsdigest.ingestion.api.exception.ErrorCategory;
import io.newsdigest.ingestion.api.exception.FeedFetchException;
import io.newsdigest.ingestion.api.exception.TransientFeedFetchException;
import io.newsdigest.ingestion.config.FeedSource;
import io.newsdigest.ingestion.config.HttpConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Service;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.ConnectException;
import java.net.HttpURLConnection;
import java.net.MalformedURLException;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.net.URL;
import java.net.UnknownHostException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Date;
import java.util.List;
import java.util.Objects;
import java.util.zip.GZIPInputStream;

/**
 * Retrieves and parses one feed. Failures never escape {@link #fetch(FeedSource)}:
 * they come back as a {@link FetchResult} with a {@link SourceFailure} and no entries.
 */
@Service
public class FeedFetcherService {

    private static final Logger logger = LoggerFactory.getLogger(FeedFetcherService.class);

    private static final long MAX_RETRY_DELAY_MS = 10_000;

    private final HttpConfig httpConfig;
    private final UserAgentRotation userAgents;
    private final RetryTemplate retryTemplate;

    public FeedFetcherService(HttpConfig httpConfig, UserAgentRotation userAgents) {
        this.httpConfig = httpConfig;
        this.userAgents = userAgents;
        this.retryTemplate = createRetryTemplate(httpConfig);
    }

    /**
     * Fetch a feed with retries on transient failures.
     *
     * @param source configured feed
     * @return entries in feed order, or a failure with no entries
     */
    public FetchResult fetch(FeedSource source) {
        long startTime = System.currentTimeMillis();

        try {
            List<RawFeedEntry> entries = retryTemplate.execute(context -> {
                if (context.getRetryCount() > 0) {
                    logger.info("Retrying {} (attempt {})", source.name(), context.getRetryCount() + 1);
                }
                return fetchEntries(source);
            });

            List<RawFeedEntry> limited = limit(entries, source.maxArticles());
            long duration = System.currentTimeMillis() - startTime;

            logger.info("Fetched {} [{}]: {} entries ({} kept) in {}ms",
                    source.name(), source.category(), entries.size(), limited.size(), duration);

            return FetchResult.success(source, limited, duration);

        } catch (FeedFetchException e) {
            logFailure(source, e);
            return FetchResult.failure(source, SourceFailure.from(source.name(), source.url(), e),
                    System.currentTimeMillis() - startTime);

        } catch (RuntimeException e) {
            logger.error("Unexpected error fetching {} from {}: {}", source.name(), source.url(), e.getMessage(), e);
            return FetchResult.failure(source,
                    SourceFailure.of(source.name(), source.url(), ErrorCategory.UNKNOWN, e.getMessage()),
                    System.currentTimeMillis() - startTime);
        }
    }

    private List<RawFeedEntry> fetchEntries(FeedSource source) throws FeedFetchException {
        String url = source.url();
        HttpURLConnection connection = null;

        try {
            if (url == null || url.trim().isEmpty()) {
                throw FeedFetchException.of("URL is null or empty", ErrorCategory.INVALID_URL);
            }

            URL feedUrl = new URL(url);
            connection = (HttpURLConnection) feedUrl.openConnection();

            configureConnection(connection, source);

            connection.connect();

            validateHttpResponse(connection, url);

            return parseFeed(readBody(connection), url);

        } catch (FeedFetchException e) {
            throw e;

        } catch (MalformedURLException | IllegalArgumentException e) {
            throw FeedFetchException.of("Invalid URL format: " + url, e, ErrorCategory.INVALID_URL);

        } catch (SocketTimeoutException e) {
            throw FeedFetchException.of("Connection timeout for: " + url, e, ErrorCategory.TIMEOUT);

        } catch (ConnectException e) {
            throw FeedFetchException.of("Connection refused: " + url, e, ErrorCategory.CONNECTION_REFUSED);

        } catch (UnknownHostException e) {
            throw FeedFetchException.of("Unknown host: " + url, e, ErrorCategory.DNS_ERROR);

        } catch (SocketException e) {
            throw FeedFetchException.of("Network error: " + url, e, ErrorCategory.NETWORK_ERROR);

        } catch (IOException e) {
            throw FeedFetchException.of("I/O error reading: " + url, e, ErrorCategory.IO_ERROR);

        } finally {
            if (connection != null) {
                connection.disconnect();
            }
        }
    }

    private void configureConnection(HttpURLConnection connection, FeedSource source) {
        connection.setConnectTimeout(httpConfig.connectTimeout());
        connection.setReadTimeout(httpConfig.readTimeout());

        // Set headers to avoid blocking
        connection.setRequestProperty("User-Agent", userAgents.forSource(source));
        connection.setRequestProperty("Accept", "application/rss+xml, application/atom+xml, application/xml, text/xml, */*");
        connection.setRequestProperty("Accept-Language", "en-US,en;q=0.9");
        connection.setRequestProperty("Accept-Encoding", "gzip");
        connection.setRequestProperty("Cache-Control", "no-cache");
        connection.setRequestProperty("Connection", "close");

        connection.setInstanceFollowRedirects(true);
        connection.setUseCaches(false);
        connection.setDoInput(true);
        connection.setDoOutput(false);
    }

    private void validateHttpResponse(HttpURLConnection connection, String url) throws IOException, FeedFetchException {
        int responseCode = connection.getResponseCode();
        String responseMessage = connection.getResponseMessage();

        switch (responseCode) {
            case HttpURLConnection.HTTP_OK:
                String contentType = connection.getContentType();
                if (contentType != null && !isValidFeedContentType(contentType)) {
                    logger.warn("Unexpected content type for {}: {}", url, contentType);
                }
                break;

            case HttpURLConnection.HTTP_NOT_FOUND:
                throw FeedFetchException.of("Feed not found (404): " + url, ErrorCategory.NOT_FOUND);

            case HttpURLConnection.HTTP_FORBIDDEN:
                throw FeedFetchException.of("Access forbidden (403): " + url, ErrorCategory.ACCESS_FORBIDDEN);

            case HttpURLConnection.HTTP_UNAUTHORIZED:
                throw FeedFetchException.of("Authentication required (401): " + url, ErrorCategory.AUTH_REQUIRED);

            case 429:
                throw FeedFetchException.of("Rate limited (429): " + url, ErrorCategory.RATE_LIMITED);

            case HttpURLConnection.HTTP_INTERNAL_ERROR:
                throw FeedFetchException.of("Server error (500): " + url, ErrorCategory.SERVER_ERROR);

            case HttpURLConnection.HTTP_BAD_GATEWAY:
            case HttpURLConnection.HTTP_UNAVAILABLE:
            case HttpURLConnection.HTTP_GATEWAY_TIMEOUT:
                throw FeedFetchException.of("Server temporarily unavailable (" + responseCode + "): " + url,
                        ErrorCategory.SERVER_UNAVAILABLE);

            default:
                if (responseCode >= 400) {
                    throw FeedFetchException.of(
                            String.format("HTTP error %d (%s): %s", responseCode, responseMessage, url),
                            ErrorCategory.HTTP_ERROR
                    );
                }
        }
    }

    private byte[] readBody(HttpURLConnection connection) throws IOException {
        InputStream inputStream = connection.getInputStream();

        if ("gzip".equalsIgnoreCase(connection.getContentEncoding())) {
            inputStream = new GZIPInputStream(inputStream);
        }

        try (InputStream in = inputStream) {
            return in.readAllBytes();
        }
    }

    List<RawFeedEntry> parseFeed(byte[] body, String url) throws FeedFetchException {
        if (body.length == 0) {
            throw FeedFetchException.of("Empty feed body: " + url, ErrorCategory.PARSE_ERROR);
        }

        try (XmlReader reader = new XmlReader(new ByteArrayInputStream(body))) {
            SyndFeed feed = new SyndFeedInput().build(reader);

            if (feed == null) {
                throw FeedFetchException.of("Feed is null: " + url, ErrorCategory.PARSE_ERROR);
            }

            if (feed.getEntries() == null || feed.getEntries().isEmpty()) {
                logger.warn("Feed has no entries: {}", url);
                return Collections.emptyList();
            }

            return feed.getEntries().stream()
                    .map(this::toRawEntry)
                    .filter(Objects::nonNull)
                    .toList();

        } catch (FeedException | IllegalArgumentException e) {
            throw FeedFetchException.of("Feed parsing error: " + e.getMessage(), e, ErrorCategory.PARSE_ERROR);
        } catch (IOException e) {
            throw FeedFetchException.of("I/O error reading feed: " + e.getMessage(), e, ErrorCategory.IO_ERROR);
        }
    }

    private RawFeedEntry toRawEntry(SyndEntry entry) {
        if (entry == null) {
            return null;
        }

        String link = entry.getLink();
        if ((link == null || link.isBlank()) && entry.getUri() != null && entry.getUri().startsWith("http")) {
            link = entry.getUri();
        }

        Date published = entry.getPublishedDate() != null ? entry.getPublishedDate() : entry.getUpdatedDate();

        return new RawFeedEntry(
                entry.getTitle(),
                link != null ? link.trim() : null,
                descriptionOf(entry),
                entry.getAuthor(),
                published != null ? published.toInstant() : null
        );
    }

    private String descriptionOf(SyndEntry entry) {
        if (entry.getDescription() != null && entry.getDescription().getValue() != null) {
            return entry.getDescription().getValue();
        }

        List<SyndContent> contents = entry.getContents();
        if (contents != null) {
            for (SyndContent content : contents) {
                if (content.getValue() != null && !content.getValue().isBlank()) {
                    return content.getValue();
                }
            }
        }
        return null;
    }

    private List<RawFeedEntry> limit(List<RawFeedEntry> entries, int maxArticles) {
        if (maxArticles <= 0 || entries.size() <= maxArticles) {
            return entries;
        }
        return new ArrayList<>(entries.subList(0, maxArticles));
    }

    private void logFailure(FeedSource source, FeedFetchException e) {
        switch (e.getCategory()) {
            case TIMEOUT, CONNECTION_REFUSED, NETWORK_ERROR, SERVER_UNAVAILABLE, SERVER_ERROR ->
                    logger.warn("Temporary error for {} ({}): {}", source.name(), e.getKind(), e.getMessage());
            case NOT_FOUND, ACCESS_FORBIDDEN, AUTH_REQUIRED, INVALID_URL, DNS_ERROR ->
                    logger.error("Permanent error for {} ({}): {}", source.name(), e.getKind(), e.getMessage());
            case RATE_LIMITED ->
                    logger.warn("Rate limited for {}: {}", source.name(), e.getMessage());
            case PARSE_ERROR ->
                    logger.warn("Parse error for {}: {}", source.name(), e.getMessage());
            default ->
                    logger.error("Fetch failed for {} (category: {}): {}", source.name(), e.getCategory(), e.getMessage());
        }
    }

    private boolean isValidFeedContentType(String contentType) {
        String lowerContentType = contentType.toLowerCase();
        return lowerContentType.contains("xml") ||
                lowerContentType.contains("rss") ||
                lowerContentType.contains("atom") ||
                lowerContentType.contains("text");
    }

    private static RetryTemplate createRetryTemplate(HttpConfig httpConfig) {
        long initialDelay = Math.max(1, httpConfig.retryDelay());

        return RetryTemplate.builder()
                .maxAttempts(Math.max(1, httpConfig.maxRetries()))
                .exponentialBackoff(initialDelay, 2.0, Math.max(MAX_RETRY_DELAY_MS, initialDelay + 1))
                .retryOn(TransientFeedFetchException.class)
                .build();
    }
}
