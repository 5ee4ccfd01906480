package io.dronewatch.ingestion.api.service.ai;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.tomakehurst.wiremock.junit5.WireMockExtension;
import io.dronewatch.ingestion.PipelineFixtures;
import io.dronewatch.ingestion.api.dto.ClassificationRequest;
import io.dronewatch.ingestion.api.dto.ClassifierResponse;
import io.dronewatch.ingestion.api.exception.ClassifierException;
import io.dronewatch.ingestion.api.exception.ErrorCategory;
import io.dronewatch.ingestion.config.AiConfig;
import io.dronewatch.ingestion.config.HttpConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.RegisterExtension;

import java.time.Duration;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.containing;
import static com.github.tomakehurst.wiremock.client.WireMock.equalTo;
import static com.github.tomakehurst.wiremock.client.WireMock.post;
import static com.github.tomakehurst.wiremock.client.WireMock.postRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlEqualTo;
import static com.github.tomakehurst.wiremock.core.WireMockConfiguration.wireMockConfig;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OpenAiIncidentClassifierTest {

    @RegisterExtension
    static WireMockExtension wireMock = WireMockExtension.newInstance()
            .options(wireMockConfig().dynamicPort())
            .build();

    private static final ClassificationRequest REQUEST = new ClassificationRequest(
            "Drone sighted over Aalborg Airport", "Police confirm the sighting.", "57.0928,9.8492 DK");

    private OpenAiIncidentClassifier classifier;

    @BeforeEach
    void setUp() {
        classifier = classifierWithKey("test-key");
    }

    @Test
    @DisplayName("Should parse the JSON verdict from the chat completion")
    void shouldParseVerdict() throws Exception {
        wireMock.stubFor(post(urlEqualTo("/v1/chat/completions"))
                .willReturn(aResponse()
                        .withStatus(200)
                        .withHeader("Content-Type", "application/json")
                        .withBody(completion("{\\\"is_incident\\\": true, \\\"category\\\": \\\"incident\\\", "
                                + "\\\"confidence\\\": 0.93, \\\"reasoning\\\": \\\"Police confirmed.\\\"}"))));

        ClassifierResponse response = classifier.classify(REQUEST);

        assertThat(response.isIncident()).isTrue();
        assertThat(response.category()).isEqualTo("incident");
        assertThat(response.confidence()).isEqualTo(0.93);
        assertThat(response.reasoning()).isEqualTo("Police confirmed.");
        wireMock.verify(postRequestedFor(urlEqualTo("/v1/chat/completions"))
                .withHeader("Authorization", equalTo("Bearer test-key"))
                .withRequestBody(containing("Aalborg")));
    }

    @Test
    @DisplayName("Should report a parse error for a malformed body")
    void shouldFailOnMalformedBody() {
        wireMock.stubFor(post(urlEqualTo("/v1/chat/completions"))
                .willReturn(aResponse().withStatus(200).withBody(completion("not json at all"))));

        assertThatThrownBy(() -> classifier.classify(REQUEST))
                .isInstanceOf(ClassifierException.class)
                .satisfies(e -> assertThat(((ClassifierException) e).getCategory()).isEqualTo(ErrorCategory.PARSE_ERROR));
    }

    @Test
    @DisplayName("Should report a parse error when the completion has no content")
    void shouldFailOnMissingContent() {
        wireMock.stubFor(post(urlEqualTo("/v1/chat/completions"))
                .willReturn(aResponse().withStatus(200).withBody("{\"choices\": []}")));

        assertThatThrownBy(() -> classifier.classify(REQUEST))
                .isInstanceOf(ClassifierException.class)
                .satisfies(e -> assertThat(((ClassifierException) e).getCategory()).isEqualTo(ErrorCategory.PARSE_ERROR));
    }

    @Test
    @DisplayName("Should categorize server errors")
    void shouldCategorizeServerErrors() {
        wireMock.stubFor(post(urlEqualTo("/v1/chat/completions")).willReturn(aResponse().withStatus(503)));

        assertThatThrownBy(() -> classifier.classify(REQUEST))
                .isInstanceOf(ClassifierException.class)
                .satisfies(e -> assertThat(((ClassifierException) e).getCategory()).isEqualTo(ErrorCategory.SERVER_UNAVAILABLE));
    }

    @Test
    @DisplayName("Should categorize rate limiting")
    void shouldCategorizeRateLimit() {
        wireMock.stubFor(post(urlEqualTo("/v1/chat/completions")).willReturn(aResponse().withStatus(429)));

        assertThatThrownBy(() -> classifier.classify(REQUEST))
                .isInstanceOf(ClassifierException.class)
                .satisfies(e -> assertThat(((ClassifierException) e).getCategory()).isEqualTo(ErrorCategory.RATE_LIMITED));
    }

    @Test
    @DisplayName("Should categorize read timeouts")
    void shouldCategorizeTimeout() {
        wireMock.stubFor(post(urlEqualTo("/v1/chat/completions"))
                .willReturn(aResponse().withStatus(200).withFixedDelay(2_000).withBody(completion("{}"))));

        assertThatThrownBy(() -> classifier.classify(REQUEST))
                .isInstanceOf(ClassifierException.class)
                .satisfies(e -> assertThat(((ClassifierException) e).getCategory()).isEqualTo(ErrorCategory.TIMEOUT));
    }

    @Test
    @DisplayName("Should refuse to call without an API key")
    void shouldRequireApiKey() {
        OpenAiIncidentClassifier keyless = classifierWithKey("");

        assertThat(keyless.isAvailable()).isFalse();
        assertThatThrownBy(() -> keyless.classify(REQUEST))
                .isInstanceOf(ClassifierException.class)
                .satisfies(e -> assertThat(((ClassifierException) e).getCategory()).isEqualTo(ErrorCategory.AUTH_REQUIRED));
        assertThat(wireMock.getAllServeEvents()).isEmpty();
    }

    private static OpenAiIncidentClassifier classifierWithKey(String apiKey) {
        AiConfig ai = new AiConfig(true, apiKey, "gpt-4o-mini", wireMock.baseUrl() + "/v1", 0.6,
                Duration.ofHours(24), Duration.ofSeconds(10), "memory", new HttpConfig(500, 500, "test"));
        return new OpenAiIncidentClassifier(PipelineFixtures.config(ai), new ObjectMapper());
    }

    private static String completion(String escapedContent) {
        return "{\"choices\": [{\"message\": {\"role\": \"assistant\", \"content\": \"" + escapedContent + "\"}}]}";
    }
}
