package dev.llumos.infrastructure.provider;

import com.github.tomakehurst.wiremock.junit5.WireMockRuntimeInfo;
import com.github.tomakehurst.wiremock.junit5.WireMockTest;
import dev.llumos.config.ProviderProperties;
import dev.llumos.domain.valueobject.ProviderAnswer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@WireMockTest
class OpenAiClientTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private OpenAiClient client;

    @BeforeEach
    void setUp(WireMockRuntimeInfo wmInfo) {
        ProviderProperties properties = new ProviderProperties(
                new ProviderProperties.Endpoint(true, "sk-test", wmInfo.getHttpBaseUrl(), null),
                null, null, null, null, null);
        client = new OpenAiClient(WebClient.builder(), properties);
    }

    @Test
    @DisplayName("sends the prompt as a single user message and reads the first choice")
    void returnsFirstChoice() {
        stubFor(post(urlPathEqualTo("/v1/chat/completions"))
                .withHeader("Authorization", equalTo("Bearer sk-test"))
                .withRequestBody(matchingJsonPath("$.model", equalTo("gpt-4o-mini")))
                .withRequestBody(matchingJsonPath("$.messages[0].role", equalTo("user")))
                .withRequestBody(matchingJsonPath("$.messages[0].content", equalTo("best crm for startups")))
                .willReturn(okJson("""
                        {"model":"gpt-4o-mini-2024-07-18",
                         "choices":[{"message":{"role":"assistant","content":"Try Acme CRM."}}],
                         "usage":{"prompt_tokens":12,"completion_tokens":5}}
                        """)));

        ProviderAnswer answer = client.ask("best crm for startups", TIMEOUT);

        assertThat(answer.text()).isEqualTo("Try Acme CRM.");
        assertThat(answer.model()).isEqualTo("gpt-4o-mini-2024-07-18");
        assertThat(answer.tokensIn()).isEqualTo(12);
        assertThat(answer.tokensOut()).isEqualTo(5);
    }

    @Test
    @DisplayName("server errors are retryable")
    void serverErrorIsRetryable() {
        stubFor(post(urlPathEqualTo("/v1/chat/completions"))
                .willReturn(aResponse().withStatus(503).withBody("upstream overloaded")));

        assertThatThrownBy(() -> client.ask("q", TIMEOUT))
                .isInstanceOfSatisfying(ProviderCallException.class, e -> {
                    assertThat(e.getStatusCode()).isEqualTo(503);
                    assertThat(e.isRetryable()).isTrue();
                    assertThat(e.getMessage()).contains("upstream overloaded");
                });
    }

    @Test
    @DisplayName("rate limiting is retryable")
    void rateLimitIsRetryable() {
        stubFor(post(urlPathEqualTo("/v1/chat/completions"))
                .willReturn(aResponse().withStatus(429).withBody("{\"error\":\"rate_limited\"}")));

        assertThatThrownBy(() -> client.ask("q", TIMEOUT))
                .isInstanceOfSatisfying(ProviderCallException.class, e -> assertThat(e.isRetryable()).isTrue());
    }

    @Test
    @DisplayName("an unknown model fails fast")
    void invalidModelFailsFast() {
        stubFor(post(urlPathEqualTo("/v1/chat/completions"))
                .willReturn(aResponse().withStatus(404)
                        .withBody("{\"error\":{\"code\":\"model_not_found\"}}")));

        assertThatThrownBy(() -> client.ask("q", TIMEOUT))
                .isInstanceOfSatisfying(ProviderCallException.class, e -> {
                    assertThat(e.isRetryable()).isFalse();
                    assertThat(e.getMessage()).contains("invalid model");
                });
    }

    @Test
    @DisplayName("a response without choices is reported as malformed")
    void missingChoices() {
        stubFor(post(urlPathEqualTo("/v1/chat/completions")).willReturn(okJson("{\"choices\":[]}")));

        assertThatThrownBy(() -> client.ask("q", TIMEOUT))
                .isInstanceOf(ProviderCallException.class)
                .hasMessageContaining("unreadable response");
    }

    @Test
    @DisplayName("a slow answer times out")
    void timesOut() {
        stubFor(post(urlPathEqualTo("/v1/chat/completions"))
                .willReturn(okJson("{\"choices\":[{\"message\":{\"content\":\"late\"}}]}").withFixedDelay(1_000)));

        assertThatThrownBy(() -> client.ask("q", Duration.ofMillis(100)))
                .isInstanceOfSatisfying(ProviderCallException.class, e -> {
                    assertThat(e.getMessage()).contains("timed out");
                    assertThat(e.isRetryable()).isTrue();
                });
    }

    @Test
    @DisplayName("without an API key the client is not configured")
    void notConfiguredWithoutKey() {
        OpenAiClient bare = new OpenAiClient(WebClient.builder(),
                new ProviderProperties(new ProviderProperties.Endpoint(true, " ", null, null),
                        null, null, null, null, null));

        assertThat(bare.isConfigured()).isFalse();
    }
}
