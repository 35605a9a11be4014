package dev.llumos.infrastructure.provider;

import com.github.tomakehurst.wiremock.junit5.WireMockRuntimeInfo;
import com.github.tomakehurst.wiremock.junit5.WireMockTest;
import dev.llumos.config.ProviderProperties;
import dev.llumos.domain.enums.LlmProvider;
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
class PerplexityClientTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private PerplexityClient client;

    @BeforeEach
    void setUp(WireMockRuntimeInfo wmInfo) {
        ProviderProperties properties = new ProviderProperties(null,
                new ProviderProperties.Endpoint(true, "pplx-key", wmInfo.getHttpBaseUrl(), null),
                null, null, null, null);
        client = new PerplexityClient(WebClient.builder(), properties);
    }

    @Test
    @DisplayName("posts to /chat/completions with the sonar model and a bearer key")
    void asksSonar() {
        stubFor(post(urlPathEqualTo("/chat/completions"))
                .withHeader("Authorization", equalTo("Bearer pplx-key"))
                .withRequestBody(matchingJsonPath("$.model", equalTo("sonar")))
                .withRequestBody(matchingJsonPath("$.messages[0].content", equalTo("best crm for startups")))
                .willReturn(okJson("""
                        {"model":"sonar",
                         "choices":[{"message":{"role":"assistant","content":"Acme CRM and HubSpot lead."}}],
                         "usage":{"prompt_tokens":9,"completion_tokens":7}}
                        """)));

        ProviderAnswer answer = client.ask("best crm for startups", TIMEOUT);

        assertThat(client.provider()).isEqualTo(LlmProvider.PERPLEXITY);
        assertThat(answer.text()).isEqualTo("Acme CRM and HubSpot lead.");
        assertThat(answer.model()).isEqualTo("sonar");
        assertThat(answer.tokensIn()).isEqualTo(9);
        assertThat(answer.tokensOut()).isEqualTo(7);
    }

    @Test
    @DisplayName("a rejected key is not retryable")
    void unauthorizedFailsFast() {
        stubFor(post(urlPathEqualTo("/chat/completions"))
                .willReturn(aResponse().withStatus(401).withBody("{\"error\":\"invalid key\"}")));

        assertThatThrownBy(() -> client.ask("q", TIMEOUT))
                .isInstanceOfSatisfying(ProviderCallException.class, e -> {
                    assertThat(e.getStatusCode()).isEqualTo(401);
                    assertThat(e.isRetryable()).isFalse();
                });
    }

    @Test
    @DisplayName("a gateway error is retryable")
    void badGatewayIsRetryable() {
        stubFor(post(urlPathEqualTo("/chat/completions")).willReturn(aResponse().withStatus(502)));

        assertThatThrownBy(() -> client.ask("q", TIMEOUT))
                .isInstanceOfSatisfying(ProviderCallException.class, e -> assertThat(e.isRetryable()).isTrue());
    }
}
