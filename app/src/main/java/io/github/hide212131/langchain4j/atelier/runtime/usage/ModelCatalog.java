package io.github.hide212131.langchain4j.atelier.runtime.usage;

import io.github.hide212131.langchain4j.atelier.runtime.model.ProviderType;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Known models, the backend serving each, and their credit multiplier. Unknown models cost 1.0.
 */
public final class ModelCatalog {

    public static final double DEFAULT_MULTIPLIER = 1.0;
    public static final String DEFAULT_MODEL = "claude-sonnet-4-5-20250929";

    public record ModelEntry(String model, ProviderType provider, double multiplier) {}

    private static final Map<String, ModelEntry> ENTRIES = new LinkedHashMap<>();

    static {
        register("claude-opus-4-5-20251101", ProviderType.ANTHROPIC, 5.0);
        register("claude-sonnet-4-5-20250929", ProviderType.ANTHROPIC, 1.0);
        register("claude-sonnet-4-thinking-20250514", ProviderType.ANTHROPIC, 1.5);
        register("claude-3-5-haiku-20241022", ProviderType.ANTHROPIC, 0.25);

        register("gemini-2.5-pro", ProviderType.GOOGLE, 1.2);
        register("gemini-2.5-flash", ProviderType.GOOGLE, 0.4);
        register("gemini-2.0-flash", ProviderType.GOOGLE, 0.3);

        register("gpt-4o", ProviderType.OPENAI, 1.0);
        register("gpt-4o-mini", ProviderType.OPENAI, 0.25);
        register("o1", ProviderType.OPENAI, 5.5);
        register("o1-mini", ProviderType.OPENAI, 2.0);
        register("o3-mini", ProviderType.OPENAI, 2.0);

        // Perplexity prices include web search
        register("sonar", ProviderType.PERPLEXITY, 0.5);
        register("sonar-pro", ProviderType.PERPLEXITY, 1.5);
        register("sonar-reasoning", ProviderType.PERPLEXITY, 2.5);
    }

    private ModelCatalog() {
    }

    private static void register(String model, ProviderType provider, double multiplier) {
        ENTRIES.put(model, new ModelEntry(model, provider, multiplier));
    }

    public static double multiplier(String model) {
        if (model == null) {
            return DEFAULT_MULTIPLIER;
        }
        ModelEntry entry = ENTRIES.get(model);
        return entry == null ? DEFAULT_MULTIPLIER : entry.multiplier();
    }

    public static Optional<ProviderType> provider(String model) {
        return Optional.ofNullable(model).map(ENTRIES::get).map(ModelEntry::provider);
    }

    public static List<ModelEntry> models() {
        return List.copyOf(ENTRIES.values());
    }

    public static List<ModelEntry> models(ProviderType provider) {
        return ENTRIES.values().stream().filter(entry -> entry.provider() == provider).toList();
    }

    /** Lowest-multiplier model of a backend, used for health pings. */
    public static Optional<String> cheapestModel(ProviderType provider) {
        return models(provider).stream()
                .min(Comparator.comparingDouble(ModelEntry::multiplier))
                .map(ModelEntry::model);
    }
}
