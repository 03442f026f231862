package io.github.hide212131.langchain4j.atelier.runtime.provider;

import io.github.hide212131.langchain4j.atelier.infra.logging.WorkflowLogger;
import io.github.hide212131.langchain4j.atelier.runtime.model.ProviderType;
import java.util.Objects;

/** Credentials and endpoint of one backend. */
public record ProviderSettings(ProviderType provider, String apiKey, String baseUrl) {

    public ProviderSettings {
        Objects.requireNonNull(provider, "provider");
        Objects.requireNonNull(apiKey, "apiKey");
        Objects.requireNonNull(baseUrl, "baseUrl");
    }

    public String maskedApiKey() {
        return WorkflowLogger.mask(apiKey);
    }

    @Override
    public String toString() {
        return "ProviderSettings[provider=" + provider + ", apiKey=" + maskedApiKey() + ", baseUrl=" + baseUrl + "]";
    }
}
