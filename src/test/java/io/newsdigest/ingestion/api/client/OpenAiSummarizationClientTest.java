package io.newsdigest.ingestion.api.client;

import com.github.tomakehurst.wiremock.client.ResponseDefinitionBuilder;
import com.github.tomakehurst.wiremock.junit5.WireMockExtension;
import io.newsdigest.ingestion.api.dto.SummaryRequest;
import io.newsdigest.ingestion.api.exception.ErrorCategory;
import io.newsdigest.ingestion.api.exception.SummarizationApiException;
import io.newsdigest.ingestion.api.exception.TransientSummarizationException;
import io.newsdigest.ingestion.config.SummarizerConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.RegisterExtension;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.containing;
import static com.github.tomakehurst.wiremock.client.WireMock.equalTo;
import static com.github.tomakehurst.wiremock.client.WireMock.matchingJsonPath;
import static com.github.tomakehurst.wiremock.client.WireMock.post;
import static com.github.tomakehurst.wiremock.client.WireMock.postRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlEqualTo;
import static com.github.tomakehurst.wiremock.core.WireMockConfiguration.wireMockConfig;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OpenAiSummarizationClientTest {

    private static final String PATH = "/v1/chat/completions";

    @RegisterExtension
    static WireMockExtension wireMock = WireMockExtension.newInstance()
            .options(wireMockConfig().dynamicPort())
            .build();

    private OpenAiSummarizationClient client;

    private final SummaryRequest request = new SummaryRequest("Galaxy found", "Astronomers mapped a galaxy.", 2, 120);

    @BeforeEach
    void setUp() {
        client = new OpenAiSummarizationClient(new RestTemplate(), config("test-key", 3000));
    }

    @Test
    @DisplayName("Should post a chat completion request and return the trimmed content")
    void shouldReturnCompletion() throws Exception {
        wireMock.stubFor(post(PATH).willReturn(json("""
                {"choices":[{"index":0,"message":{"role":"assistant","content":"  A distant galaxy was mapped.  "}}]}
                """)));

        assertThat(client.summarize(request)).isEqualTo("A distant galaxy was mapped.");

        wireMock.verify(postRequestedFor(urlEqualTo(PATH))
                .withHeader("Authorization", equalTo("Bearer test-key"))
                .withRequestBody(matchingJsonPath("$.model", equalTo("gpt-4o-mini")))
                .withRequestBody(matchingJsonPath("$.max_tokens", equalTo("120")))
                .withRequestBody(matchingJsonPath("$.messages[1].content", containing("Galaxy found"))));
    }

    @Test
    @DisplayName("Should flag rate limiting as transient")
    void shouldTreatRateLimitAsTransient() {
        wireMock.stubFor(post(PATH).willReturn(aResponse().withStatus(429)));

        assertThatThrownBy(() -> client.summarize(request))
                .isInstanceOf(TransientSummarizationException.class)
                .extracting(e -> ((SummarizationApiException) e).getCategory())
                .isEqualTo(ErrorCategory.RATE_LIMITED);
    }

    @Test
    @DisplayName("Should flag server errors as transient")
    void shouldTreatServerErrorAsTransient() {
        wireMock.stubFor(post(PATH).willReturn(aResponse().withStatus(503)));

        assertThatThrownBy(() -> client.summarize(request)).isInstanceOf(TransientSummarizationException.class);
    }

    @Test
    @DisplayName("Should treat a rejected request as permanent")
    void shouldTreatClientErrorAsPermanent() {
        wireMock.stubFor(post(PATH).willReturn(aResponse().withStatus(400)));

        assertThatThrownBy(() -> client.summarize(request))
                .isInstanceOf(SummarizationApiException.class)
                .isNotInstanceOf(TransientSummarizationException.class);
    }

    @Test
    @DisplayName("Should retry-flag an empty completion and reject a response without choices")
    void shouldValidateResponseShape() {
        wireMock.stubFor(post(PATH).willReturn(json("""
                {"choices":[{"message":{"role":"assistant","content":"   "}}]}
                """)));
        assertThatThrownBy(() -> client.summarize(request)).isInstanceOf(TransientSummarizationException.class);

        wireMock.stubFor(post(PATH).willReturn(json("{\"choices\":[]}")));
        assertThatThrownBy(() -> client.summarize(request))
                .isInstanceOf(SummarizationApiException.class)
                .isNotInstanceOf(TransientSummarizationException.class);
    }

    @Test
    @DisplayName("Should refuse to call the API without a key")
    void shouldRequireApiKey() {
        OpenAiSummarizationClient noKey = new OpenAiSummarizationClient(new RestTemplate(), config("", 3000));

        assertThat(noKey.isAvailable()).isFalse();
        assertThatThrownBy(() -> noKey.summarize(request)).isInstanceOf(SummarizationApiException.class);
        assertThat(wireMock.getAllServeEvents()).isEmpty();
    }

    @Test
    @DisplayName("Should cut long content and summarize from the title when there is none")
    void shouldBuildPrompt() {
        OpenAiSummarizationClient shortInput = new OpenAiSummarizationClient(new RestTemplate(), config("k", 10));

        String truncated = shortInput.buildPrompt(new SummaryRequest("T", "0123456789ABCDEF", 2, 120));
        String titleOnly = shortInput.buildPrompt(new SummaryRequest("Only title", "", 1, 120));

        assertThat(truncated).contains("Content: 0123456789").doesNotContain("ABCDEF");
        assertThat(titleOnly).contains("Title: Only title").doesNotContain("Content:").contains("one factual sentence");
    }

    private SummarizerConfig config(String apiKey, int inputCharLimit) {
        return new SummarizerConfig(wireMock.baseUrl() + PATH, apiKey, "gpt-4o-mini", 2, 3,
                Duration.ofMillis(1), 2.0, Duration.ofMillis(5), Duration.ofSeconds(2),
                120, 0.1, inputCharLimit, 280, 2);
    }

    private static ResponseDefinitionBuilder json(String body) {
        return aResponse()
                .withStatus(200)
                .withHeader("Content-Type", "application/json")
                .withBody(body);
    }
}
