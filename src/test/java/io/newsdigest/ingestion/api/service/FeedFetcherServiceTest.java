package io.newsdigest.ingestion.api.service;

import com.github.tomakehurst.wiremock.junit5.WireMockExtension;
import io.newsdigest.ingestion.api.dto.FetchResult;
import io.newsdigest.ingestion.api.dto.RawFeedEntry;
import io.newsdigest.ingestion.api.exception.ErrorCategory;
import io.newsdigest.ingestion.api.exception.FailureKind;
import io.newsdigest.ingestion.api.exception.FeedFetchException;
import io.newsdigest.ingestion.config.FeedSource;
import io.newsdigest.ingestion.config.HttpConfig;
import io.newsdigest.ingestion.config.ParserHints;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.RegisterExtension;

import java.io.IOException;
import java.io.InputStream;
import java.time.Instant;
import java.util.List;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.equalTo;
import static com.github.tomakehurst.wiremock.client.WireMock.get;
import static com.github.tomakehurst.wiremock.client.WireMock.getRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlEqualTo;
import static com.github.tomakehurst.wiremock.core.WireMockConfiguration.wireMockConfig;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FeedFetcherServiceTest {

    @RegisterExtension
    static WireMockExtension wireMock = WireMockExtension.newInstance()
            .options(wireMockConfig().dynamicPort())
            .build();

    private FeedFetcherService fetcher;

    @BeforeEach
    void setUp() {
        HttpConfig http = new HttpConfig(1000, 500, 2, 1, List.of("DigestTest/1.0"));
        fetcher = new FeedFetcherService(http, new UserAgentRotation(http));
    }

    @Test
    @DisplayName("Should parse RSS items in feed order with dates and links")
    void shouldParseRssFeed() throws IOException {
        stubFeed("/science.xml", fixture("science.xml"));

        FetchResult result = fetcher.fetch(source("science", "/science.xml"));

        assertThat(result.succeeded()).isTrue();
        assertThat(result.entries()).hasSize(3);

        RawFeedEntry first = result.entries().get(0);
        assertThat(first.title()).isEqualTo("Telescope spots & maps distant galaxy");
        assertThat(first.link()).isEqualTo("https://science.example.com/news/galaxy?utm_source=rss");
        assertThat(first.publishedAt()).isEqualTo(Instant.parse("2024-01-02T10:00:00Z"));
        assertThat(first.description()).contains("Astronomers mapped a galaxy");

        assertThat(result.entries().get(2).publishedAt()).isNull();
    }

    @Test
    @DisplayName("Should read Atom links, updated dates and content bodies")
    void shouldParseAtomFeed() throws IOException {
        stubFeed("/gaming.xml", fixture("gaming-atom.xml"));

        FetchResult result = fetcher.fetch(source("gaming", "/gaming.xml"));

        assertThat(result.succeeded()).isTrue();
        assertThat(result.entries())
                .extracting(RawFeedEntry::link)
                .containsExactly("https://games.example.com/reviews/sequel", "https://games.example.com/news/price-cut");
        assertThat(result.entries().get(0).publishedAt()).isEqualTo(Instant.parse("2024-01-01T12:00:00Z"));
        assertThat(result.entries().get(1).description()).contains("Prices drop");
    }

    @Test
    @DisplayName("Should keep only the first maxArticles entries")
    void shouldApplyMaxArticles() throws IOException {
        stubFeed("/science.xml", fixture("science.xml"));
        FeedSource limited = new FeedSource("science", wireMock.baseUrl() + "/science.xml", "Science",
                2, true, ParserHints.NONE);

        FetchResult result = fetcher.fetch(limited);

        assertThat(result.entries())
                .extracting(RawFeedEntry::title)
                .containsExactly("Telescope spots & maps distant galaxy", "New battery chemistry doubles capacity");
    }

    @Test
    @DisplayName("Should retry server errors and report a fetch failure when they persist")
    void shouldRetryServerErrors() {
        wireMock.stubFor(get("/broken").willReturn(aResponse().withStatus(500)));

        FetchResult result = fetcher.fetch(source("broken", "/broken"));

        assertThat(result.succeeded()).isFalse();
        assertThat(result.entries()).isEmpty();
        assertThat(result.failure().kind()).isEqualTo(FailureKind.FETCH_ERROR);
        assertThat(result.failure().category()).isEqualTo(ErrorCategory.SERVER_ERROR);
        wireMock.verify(2, getRequestedFor(urlEqualTo("/broken")));
    }

    @Test
    @DisplayName("Should not retry a missing feed")
    void shouldNotRetryNotFound() {
        wireMock.stubFor(get("/missing").willReturn(aResponse().withStatus(404)));

        FetchResult result = fetcher.fetch(source("missing", "/missing"));

        assertThat(result.failure().category()).isEqualTo(ErrorCategory.NOT_FOUND);
        wireMock.verify(1, getRequestedFor(urlEqualTo("/missing")));
    }

    @Test
    @DisplayName("Should report a timeout as a fetch failure instead of throwing")
    void shouldReportTimeout() throws IOException {
        wireMock.stubFor(get("/slow").willReturn(aResponse()
                .withStatus(200)
                .withBody(fixture("science.xml"))
                .withFixedDelay(1500)));

        FetchResult result = fetcher.fetch(source("slow", "/slow"));

        assertThat(result.succeeded()).isFalse();
        assertThat(result.failure().kind()).isEqualTo(FailureKind.FETCH_ERROR);
        assertThat(result.failure().category()).isEqualTo(ErrorCategory.TIMEOUT);
    }

    @Test
    @DisplayName("Should report a malformed body as a parse failure")
    void shouldReportMalformedFeed() throws IOException {
        stubFeed("/malformed.xml", fixture("malformed.xml"));

        FetchResult result = fetcher.fetch(source("malformed", "/malformed.xml"));

        assertThat(result.succeeded()).isFalse();
        assertThat(result.failure().kind()).isEqualTo(FailureKind.PARSE_ERROR);
        wireMock.verify(1, getRequestedFor(urlEqualTo("/malformed.xml")));
    }

    @Test
    @DisplayName("Should reject an empty body as a parse error")
    void shouldRejectEmptyBody() {
        assertThatThrownBy(() -> fetcher.parseFeed(new byte[0], "http://example.com/feed"))
                .isInstanceOf(FeedFetchException.class)
                .extracting(e -> ((FeedFetchException) e).getCategory())
                .isEqualTo(ErrorCategory.PARSE_ERROR);
    }

    @Test
    @DisplayName("Should send the per-source user agent when configured")
    void shouldUseSourceUserAgent() throws IOException {
        stubFeed("/science.xml", fixture("science.xml"));
        FeedSource custom = new FeedSource("science", wireMock.baseUrl() + "/science.xml", "Science",
                0, true, new ParserHints(false, "CustomAgent/2.0"));

        fetcher.fetch(custom);

        wireMock.verify(getRequestedFor(urlEqualTo("/science.xml"))
                .withHeader("User-Agent", equalTo("CustomAgent/2.0")));
    }

    @Test
    @DisplayName("Should report an invalid url without a request")
    void shouldRejectInvalidUrl() {
        FetchResult result = fetcher.fetch(FeedSource.of("bad", "not a url", "Science"));

        assertThat(result.failure().category()).isEqualTo(ErrorCategory.INVALID_URL);
    }

    private FeedSource source(String name, String path) {
        return FeedSource.of(name, wireMock.baseUrl() + path, "Science");
    }

    private void stubFeed(String path, byte[] body) {
        wireMock.stubFor(get(path).willReturn(aResponse()
                .withStatus(200)
                .withHeader("Content-Type", "application/rss+xml; charset=utf-8")
                .withBody(body)));
    }

    static byte[] fixture(String name) throws IOException {
        try (InputStream in = FeedFetcherServiceTest.class.getResourceAsStream("/feeds/" + name)) {
            if (in == null) {
                throw new IOException("Missing fixture " + name);
            }
            return in.readAllBytes();
        }
    }
}
