package io.newsdigest.ingestion.api.service;

import com.github.tomakehurst.wiremock.junit5.WireMockExtension;
import io.newsdigest.ingestion.api.dto.Article;
import io.newsdigest.ingestion.api.dto.FingerprintStrategy;
import io.newsdigest.ingestion.config.FeedSource;
import io.newsdigest.ingestion.config.HttpConfig;
import io.newsdigest.ingestion.config.ParserHints;
import io.newsdigest.ingestion.config.ProcessingConfig;
import org.jsoup.Jsoup;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.RegisterExtension;

import java.time.Duration;
import java.util.List;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.equalTo;
import static com.github.tomakehurst.wiremock.client.WireMock.get;
import static com.github.tomakehurst.wiremock.client.WireMock.getRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlEqualTo;
import static com.github.tomakehurst.wiremock.core.WireMockConfiguration.wireMockConfig;
import static org.assertj.core.api.Assertions.assertThat;

class ArticleContentExtractorTest {

    private static final String BODY = "The research team observed the galaxy for three hundred hours. ".repeat(5);

    @RegisterExtension
    static WireMockExtension wireMock = WireMockExtension.newInstance()
            .options(wireMockConfig().dynamicPort())
            .build();

    @Test
    @DisplayName("Should take the first substantial content block without navigation noise")
    void shouldExtractMainContent() {
        String html = "<html><body><div class='content'><nav>Home | News</nav><p>" + BODY
                + "</p><script>track()</script></div></body></html>";

        String text = ArticleContentExtractor.extract(Jsoup.parse(html));

        assertThat(text).startsWith("The research team").doesNotContain("Home | News").doesNotContain("track()");
    }

    @Test
    @DisplayName("Should skip blocks shorter than the minimum length")
    void shouldIgnoreShortBlocks() {
        String html = "<html><body><div id='text'>Too short</div><article>" + BODY + "</article></body></html>";

        assertThat(ArticleContentExtractor.extract(Jsoup.parse(html))).startsWith("The research team");
        assertThat(ArticleContentExtractor.extract(Jsoup.parse("<div class='content'>short</div>"))).isNull();
    }

    @Test
    @DisplayName("Should fetch the article page when enabled")
    void shouldFetchPageWhenEnabled() {
        wireMock.stubFor(get("/story").willReturn(aResponse()
                .withHeader("Content-Type", "text/html")
                .withBody("<html><body><article>" + BODY + "</article></body></html>")));

        String content = extractor(true).contentFor(article(wireMock.baseUrl() + "/story"));

        assertThat(content).startsWith("The research team");
    }

    @Test
    @DisplayName("Should fall back to the excerpt when disabled or the page fails")
    void shouldFallBackToExcerpt() {
        wireMock.stubFor(get("/gone").willReturn(aResponse().withStatus(404)));

        assertThat(extractor(false).contentFor(article(wireMock.baseUrl() + "/story"))).isEqualTo("feed excerpt");
        assertThat(extractor(true).contentFor(article(wireMock.baseUrl() + "/gone"))).isEqualTo("feed excerpt");
    }

    @Test
    @DisplayName("Should request the page with the source's fixed user agent")
    void shouldUseSourceUserAgent() {
        stubStory();

        extractor(true).contentFor(article(wireMock.baseUrl() + "/story", "pinned"));

        wireMock.verify(getRequestedFor(urlEqualTo("/story"))
                .withHeader("User-Agent", equalTo("PinnedAgent/3.0")));
    }

    @Test
    @DisplayName("Should rotate configured user agents for sources without a fixed one")
    void shouldRotateUserAgents() {
        stubStory();
        ArticleContentExtractor extractor = extractor(true);

        extractor.contentFor(article(wireMock.baseUrl() + "/story", "source"));
        extractor.contentFor(article(wireMock.baseUrl() + "/story", "unknown"));

        wireMock.verify(1, getRequestedFor(urlEqualTo("/story")).withHeader("User-Agent", equalTo("DigestTest/1.0")));
        wireMock.verify(1, getRequestedFor(urlEqualTo("/story")).withHeader("User-Agent", equalTo("DigestTest/2.0")));
    }

    private void stubStory() {
        wireMock.stubFor(get("/story").willReturn(aResponse()
                .withHeader("Content-Type", "text/html")
                .withBody("<html><body><article>" + BODY + "</article></body></html>")));
    }

    private ArticleContentExtractor extractor(boolean enabled) {
        HttpConfig http = new HttpConfig(1000, 1000, 1, 1, List.of("DigestTest/1.0", "DigestTest/2.0"));
        SourceRegistry registry = new SourceRegistry(List.of(
                FeedSource.of("source", "https://example.com/feed.xml", "Science"),
                new FeedSource("pinned", "https://pinned.example.com/feed.xml", "Science", 0, true,
                        new ParserHints(false, "PinnedAgent/3.0"))));
        return new ArticleContentExtractor(
                new ProcessingConfig(2, Duration.ofMinutes(1), List.of(), enabled),
                http, new UserAgentRotation(http), registry);
    }

    private static Article article(String link) {
        return article(link, "source");
    }

    private static Article article(String link, String sourceName) {
        return new Article("fp", FingerprintStrategy.LINK, "Science", "Title", link, null,
                "feed excerpt", sourceName, "hash");
    }
}
