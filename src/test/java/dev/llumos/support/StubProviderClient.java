package dev.llumos.support;

import dev.llumos.domain.enums.LlmProvider;
import dev.llumos.domain.valueobject.ProviderAnswer;
import dev.llumos.infrastructure.provider.LlmProviderClient;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

/**
 * Scriptable provider client. Records every prompt it was asked and optionally advances a
 * {@link MutableClock} per call to simulate latency.
 */
public class StubProviderClient implements LlmProviderClient {

    private final LlmProvider provider;
    private final boolean configured;
    private volatile Function<String, ProviderAnswer> behaviour;
    private volatile MutableClock clock;
    private volatile Duration latency = Duration.ZERO;
    private final List<String> prompts = new CopyOnWriteArrayList<>();

    public StubProviderClient(LlmProvider provider) {
        this(provider, true);
    }

    public StubProviderClient(LlmProvider provider, boolean configured) {
        this.provider = provider;
        this.configured = configured;
        this.behaviour = prompt -> new ProviderAnswer("Answer about " + prompt, provider.wireName() + "-model", 10, 20);
    }

    public StubProviderClient answering(Function<String, ProviderAnswer> behaviour) {
        this.behaviour = behaviour;
        return this;
    }

    public StubProviderClient answeringWith(String text) {
        return answering(prompt -> new ProviderAnswer(text, provider.wireName() + "-model", 10, 20));
    }

    public StubProviderClient failingWith(RuntimeException error) {
        return answering(prompt -> { throw error; });
    }

    public StubProviderClient withLatency(MutableClock clock, Duration latency) {
        this.clock = clock;
        this.latency = latency;
        return this;
    }

    @Override
    public LlmProvider provider() {
        return provider;
    }

    @Override
    public boolean isConfigured() {
        return configured;
    }

    @Override
    public ProviderAnswer ask(String prompt, Duration timeout) {
        prompts.add(prompt);
        if (clock != null) clock.advance(latency);
        return behaviour.apply(prompt);
    }

    public int calls() {
        return prompts.size();
    }

    public List<String> prompts() {
        return List.copyOf(prompts);
    }
}
