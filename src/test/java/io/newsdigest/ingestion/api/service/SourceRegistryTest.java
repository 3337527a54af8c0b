package io.newsdigest.ingestion.api.service;

import io.newsdigest.ingestion.config.FeedSource;
import io.newsdigest.ingestion.config.ParserHints;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SourceRegistryTest {

    private final SourceRegistry registry = new SourceRegistry(List.of(
            FeedSource.of("science_daily", "https://science.example.com/rss", "Science"),
            FeedSource.of("pcgamer", "https://games.example.com/rss", "Gaming"),
            FeedSource.of("science_mirror", "https://science.example.com/rss", "Science"),
            new FeedSource("no_url", " ", "Science", 0, true, ParserHints.NONE),
            FeedSource.of("hacker_news", "https://hn.example.com/rss", "Tech News")
    ));

    @Test
    @DisplayName("Should keep the first definition of a repeated url")
    void shouldDeduplicateByUrl() {
        assertThat(registry.getSources())
                .extracting(FeedSource::name)
                .containsExactly("science_daily", "pcgamer", "hacker_news");
    }

    @Test
    @DisplayName("Should select named feeds in registry order and ignore unknown names")
    void shouldSelectByName() {
        assertThat(registry.select(List.of("HACKER_NEWS", "unknown", "science_daily", "hacker_news")))
                .extracting(FeedSource::name)
                .containsExactly("science_daily", "hacker_news");
    }

    @Test
    void shouldSelectEverythingWithoutNames() {
        assertThat(registry.select(List.of())).hasSize(3);
    }

    @Test
    @DisplayName("Should find a registered source by name ignoring case")
    void shouldFindByName() {
        assertThat(registry.find("PCGamer")).map(FeedSource::url).contains("https://games.example.com/rss");
        assertThat(registry.find("science_mirror")).isEmpty();
        assertThat(registry.find(null)).isEmpty();
    }
}
