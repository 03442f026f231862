package io.github.hide212131.langchain4j.atelier.runtime.provider;

import io.github.hide212131.langchain4j.atelier.runtime.model.ProviderType;
import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Backends that have credentials, plus the request timeout they share.
 */
public record ProviderConfiguration(Map<ProviderType, ProviderSettings> providers, Duration timeout) {

    public ProviderConfiguration {
        Objects.requireNonNull(providers, "providers");
        Objects.requireNonNull(timeout, "timeout");
        Map<ProviderType, ProviderSettings> copy = new EnumMap<>(ProviderType.class);
        copy.putAll(providers);
        providers = Collections.unmodifiableMap(copy);
    }

    public Optional<ProviderSettings> settings(ProviderType type) {
        return Optional.ofNullable(providers.get(type));
    }

    public boolean isEmpty() {
        return providers.isEmpty();
    }
}
