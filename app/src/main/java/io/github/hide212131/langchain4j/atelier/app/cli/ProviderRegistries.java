package io.github.hide212131.langchain4j.atelier.app.cli;

import io.github.hide212131.langchain4j.atelier.infra.logging.WorkflowLogger;
import io.github.hide212131.langchain4j.atelier.runtime.provider.ProviderConfiguration;
import io.github.hide212131.langchain4j.atelier.runtime.provider.ProviderConfigurationLoader;
import io.github.hide212131.langchain4j.atelier.runtime.provider.ProviderGatewayFactory;
import io.github.hide212131.langchain4j.atelier.runtime.provider.ProviderHealthTracker;
import io.github.hide212131.langchain4j.atelier.runtime.provider.ProviderRegistry;

/** Registry selection shared by the commands. */
final class ProviderRegistries {

    private static final WorkflowLogger LOGGER = new WorkflowLogger(ProviderRegistries.class);

    private ProviderRegistries() {
    }

    /**
     * @throws IllegalStateException when no backend is configured outside dry-run mode
     */
    static ProviderRegistry create(boolean dryRun, ProviderHealthTracker healthTracker) {
        ProviderGatewayFactory factory = new ProviderGatewayFactory(healthTracker);
        if (dryRun) {
            LOGGER.info("Dry run: using offline models for every provider");
            return factory.dryRun();
        }
        ProviderConfiguration configuration = new ProviderConfigurationLoader().load();
        if (configuration.isEmpty()) {
            throw new IllegalStateException(
                    "No provider API key configured. Set ANTHROPIC_API_KEY, OPENAI_API_KEY, GOOGLE_API_KEY or "
                            + "PERPLEXITY_API_KEY (environment or .env), or use --dry-run.");
        }
        return factory.create(configuration);
    }
}
