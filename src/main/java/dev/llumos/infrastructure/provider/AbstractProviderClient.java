package dev.llumos.infrastructure.provider;

import com.fasterxml.jackson.databind.JsonNode;
import dev.llumos.config.ProviderProperties;
import io.netty.channel.ChannelOption;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;

/**
 * Shared WebClient plumbing: connection setup, JSON POST with a per-call timeout, and mapping of
 * HTTP and transport failures onto {@link ProviderCallException}. Calls block; they run on the
 * bounded provider pool, never on a reactive event loop.
 */
abstract class AbstractProviderClient implements LlmProviderClient {

    private static final int CONNECT_TIMEOUT_MILLIS = 10_000;

    protected final ProviderProperties.Endpoint endpoint;
    protected final WebClient webClient;

    protected AbstractProviderClient(WebClient.Builder builder, ProviderProperties.Endpoint endpoint,
                                     String defaultBaseUrl) {
        this.endpoint = endpoint;
        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, CONNECT_TIMEOUT_MILLIS);
        this.webClient = builder.baseUrl(endpoint.baseUrlOr(defaultBaseUrl))
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .build();
    }

    @Override
    public boolean isConfigured() {
        return endpoint.isConfigured();
    }

    protected JsonNode postJson(Function<WebClient, WebClient.RequestBodySpec> request, Object body, Duration timeout) {
        try {
            JsonNode response = request.apply(webClient)
                    .bodyValue(body)
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, r -> r.bodyToMono(String.class)
                            .defaultIfEmpty("")
                            .flatMap(text -> Mono.error(
                                    ProviderCallException.fromStatus(provider(), r.statusCode().value(), text))))
                    .bodyToMono(JsonNode.class)
                    .timeout(timeout)
                    .block();
            if (response == null) throw ProviderCallException.malformed(provider(), "empty body");
            return response;
        } catch (ProviderCallException e) {
            throw e;
        } catch (WebClientRequestException e) {
            throw ProviderCallException.transport(provider(), e);
        } catch (RuntimeException e) {
            Throwable cause = Exceptions.unwrap(e);
            if (cause instanceof TimeoutException) throw ProviderCallException.timeout(provider(), cause);
            throw ProviderCallException.transport(provider(), cause);
        }
    }

    protected static int intOrZero(JsonNode node) {
        return node == null || node.isMissingNode() || !node.canConvertToInt() ? 0 : node.asInt();
    }
}
