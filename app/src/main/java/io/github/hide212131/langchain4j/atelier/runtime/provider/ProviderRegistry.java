package io.github.hide212131.langchain4j.atelier.runtime.provider;

import io.github.hide212131.langchain4j.atelier.runtime.model.ProviderType;
import java.util.Collection;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Configured gateways by backend, together with the tracker they report to.
 */
public final class ProviderRegistry {

    private final Map<ProviderType, ProviderGateway> gateways;
    private final ProviderHealthTracker healthTracker;

    public ProviderRegistry(Collection<? extends ProviderGateway> gateways, ProviderHealthTracker healthTracker) {
        this.healthTracker = Objects.requireNonNull(healthTracker, "healthTracker");
        Map<ProviderType, ProviderGateway> byType = new EnumMap<>(ProviderType.class);
        for (ProviderGateway gateway : gateways) {
            byType.put(gateway.type(), gateway);
        }
        this.gateways = byType;
    }

    public Optional<ProviderGateway> find(ProviderType type) {
        return Optional.ofNullable(gateways.get(type));
    }

    public Set<ProviderType> types() {
        return Set.copyOf(gateways.keySet());
    }

    public Collection<ProviderGateway> gateways() {
        return gateways.values();
    }

    public ProviderHealthTracker healthTracker() {
        return healthTracker;
    }
}
