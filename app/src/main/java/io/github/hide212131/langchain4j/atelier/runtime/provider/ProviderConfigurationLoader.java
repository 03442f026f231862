package io.github.hide212131.langchain4j.atelier.runtime.provider;

import io.github.cdimascio.dotenv.Dotenv;
import io.github.hide212131.langchain4j.atelier.infra.logging.WorkflowLogger;
import io.github.hide212131.langchain4j.atelier.runtime.model.ProviderType;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Resolves backend credentials from the environment, falling back to {@code .env} only for unset keys.
 * Every backend is reached through its OpenAI-compatible endpoint.
 */
public final class ProviderConfigurationLoader {

    static final String ENV_TIMEOUT_SECONDS = "ATELIER_PROVIDER_TIMEOUT_SECONDS";
    static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(120);

    private static final WorkflowLogger LOG = new WorkflowLogger(ProviderConfigurationLoader.class);
    private static final Map<ProviderType, String> DEFAULT_BASE_URLS = Map.of(
            ProviderType.ANTHROPIC, "https://api.anthropic.com/v1/",
            ProviderType.OPENAI, "https://api.openai.com/v1",
            ProviderType.GOOGLE, "https://generativelanguage.googleapis.com/v1beta/openai/",
            ProviderType.PERPLEXITY, "https://api.perplexity.ai");

    private final Map<String, String> environment;
    private final Dotenv dotenv;

    public ProviderConfigurationLoader() {
        this(System.getenv(), Dotenv.configure().ignoreIfMalformed().ignoreIfMissing().load());
    }

    ProviderConfigurationLoader(Map<String, String> environment, Dotenv dotenv) {
        this.environment = Map.copyOf(Objects.requireNonNull(environment, "environment"));
        this.dotenv = Objects.requireNonNull(dotenv, "dotenv");
    }

    public ProviderConfiguration load() {
        Map<ProviderType, ProviderSettings> providers = new EnumMap<>(ProviderType.class);
        for (ProviderType type : ProviderType.values()) {
            String prefix = type.name();
            String apiKey = trimToNull(resolveWithPriority(prefix + "_API_KEY"));
            if (apiKey == null) {
                LOG.debug("{} is not configured ({}_API_KEY unset)", type, prefix);
                continue;
            }
            String baseUrl = trimToNull(resolveWithPriority(prefix + "_BASE_URL"));
            ProviderSettings settings =
                    new ProviderSettings(type, apiKey, baseUrl != null ? baseUrl : DEFAULT_BASE_URLS.get(type));
            LOG.info("Configured provider {} at {} with key {}", type, settings.baseUrl(), settings.maskedApiKey());
            providers.put(type, settings);
        }
        return new ProviderConfiguration(providers, resolveTimeout());
    }

    private Duration resolveTimeout() {
        String raw = trimToNull(resolveWithPriority(ENV_TIMEOUT_SECONDS));
        if (raw == null) {
            return DEFAULT_TIMEOUT;
        }
        long seconds;
        try {
            seconds = Long.parseLong(raw);
        } catch (NumberFormatException ex) {
            throw new IllegalStateException(ENV_TIMEOUT_SECONDS + " must be a positive integer (seconds)", ex);
        }
        if (seconds <= 0) {
            throw new IllegalStateException(ENV_TIMEOUT_SECONDS + " must be greater than zero");
        }
        return Duration.ofSeconds(seconds);
    }

    private String resolveWithPriority(String key) {
        if (environment.containsKey(key)) {
            return environment.get(key);
        }
        return dotenv.get(key);
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
