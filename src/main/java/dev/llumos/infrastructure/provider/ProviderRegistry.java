package dev.llumos.infrastructure.provider;

import dev.llumos.domain.enums.LlmProvider;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** Looks up provider clients by provider. */
@Component
public class ProviderRegistry {

    private final Map<LlmProvider, LlmProviderClient> clients = new EnumMap<>(LlmProvider.class);

    public ProviderRegistry(List<LlmProviderClient> clients) {
        for (LlmProviderClient client : clients) {
            if (this.clients.putIfAbsent(client.provider(), client) != null)
                throw new IllegalStateException("Duplicate client for " + client.provider());
        }
    }

    public Optional<LlmProviderClient> client(LlmProvider provider) {
        return Optional.ofNullable(clients.get(provider));
    }

    /** Configured providers in declaration order. */
    public List<LlmProvider> configuredProviders() {
        return Arrays.stream(LlmProvider.values())
                .filter(p -> clients.containsKey(p) && clients.get(p).isConfigured())
                .toList();
    }
}
