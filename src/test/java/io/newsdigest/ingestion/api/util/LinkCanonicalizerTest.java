package io.newsdigest.ingestion.api.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

class LinkCanonicalizerTest {

    @Test
    @DisplayName("Should drop tracking parameters, fragment and trailing slash")
    void shouldNormalizeSyndicatedLink() {
        assertThat(LinkCanonicalizer.canonicalize("https://Example.COM/News/Story/?utm_source=rss&utm_medium=feed#comments"))
                .contains("https://example.com/news/story");
    }

    @Test
    @DisplayName("Should keep meaningful parameters in sorted order")
    void shouldSortRemainingParameters() {
        assertThat(LinkCanonicalizer.canonicalize("http://example.com/article?page=2&id=17&fbclid=xyz"))
                .contains("http://example.com/article?id=17&page=2");
    }

    @Test
    @DisplayName("Should drop default ports but keep others")
    void shouldHandlePorts() {
        assertThat(LinkCanonicalizer.canonicalize("https://example.com:443/a")).contains("https://example.com/a");
        assertThat(LinkCanonicalizer.canonicalize("http://example.com:8080/a")).contains("http://example.com:8080/a");
    }

    @Test
    @DisplayName("Should map the root path to a single slash")
    void shouldNormalizeRoot() {
        assertThat(LinkCanonicalizer.canonicalize("https://example.com")).contains("https://example.com/");
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "   ", "not a link", "ftp://example.com/file", "/relative/path", "mailto:news@example.com"})
    @DisplayName("Should reject links that cannot identify an article")
    void shouldRejectUnusableLinks(String link) {
        assertThat(LinkCanonicalizer.canonicalize(link)).isEmpty();
    }

    @Test
    void shouldRecognizeTrackingParameters() {
        assertThat(LinkCanonicalizer.isTrackingParameter("UTM_Campaign")).isTrue();
        assertThat(LinkCanonicalizer.isTrackingParameter("gclid")).isTrue();
        assertThat(LinkCanonicalizer.isTrackingParameter("id")).isFalse();
    }
}
