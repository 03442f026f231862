package io.github.hide212131.langchain4j.atelier.runtime.provider;

import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.StreamingChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import dev.langchain4j.model.openai.OpenAiStreamingChatModel;
import io.github.hide212131.langchain4j.atelier.runtime.model.ProviderType;
import io.github.hide212131.langchain4j.atelier.runtime.usage.ModelCatalog;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Builds one {@link LangChain4jProviderGateway} per configured backend.
 */
public final class ProviderGatewayFactory {

    private final ProviderHealthTracker healthTracker;
    private final RetryPolicy retryPolicy;
    private final RetryListener retryListener;
    private final ChatModelFactory modelFactory;

    public ProviderGatewayFactory(ProviderHealthTracker healthTracker) {
        this(healthTracker, RetryPolicy.defaults(), RetryListener.none(), new OpenAiCompatibleModelFactory());
    }

    ProviderGatewayFactory(ProviderHealthTracker healthTracker, RetryPolicy retryPolicy) {
        this(healthTracker, retryPolicy, RetryListener.none(), new OpenAiCompatibleModelFactory());
    }

    ProviderGatewayFactory(
            ProviderHealthTracker healthTracker,
            RetryPolicy retryPolicy,
            RetryListener retryListener,
            ChatModelFactory modelFactory) {
        this.healthTracker = Objects.requireNonNull(healthTracker, "healthTracker");
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
        this.retryListener = Objects.requireNonNull(retryListener, "retryListener");
        this.modelFactory = Objects.requireNonNull(modelFactory, "modelFactory");
    }

    public ProviderRegistry create(ProviderConfiguration configuration) {
        List<ProviderGateway> gateways = new ArrayList<>();
        for (ProviderSettings settings : configuration.providers().values()) {
            gateways.add(new LangChain4jProviderGateway(
                    settings.provider(),
                    modelFactory.chatModel(settings, configuration.timeout()),
                    modelFactory.streamingModel(settings, configuration.timeout()),
                    retryPolicy,
                    healthTracker,
                    retryListener));
        }
        return new ProviderRegistry(gateways, healthTracker);
    }

    /**
     * Registry answering every backend with deterministic offline models.
     */
    public ProviderRegistry dryRun() {
        List<ProviderGateway> gateways = new ArrayList<>();
        for (ProviderType type : ProviderType.values()) {
            gateways.add(new LangChain4jProviderGateway(
                    type, new DryRunChatModel(), new DryRunStreamingChatModel(), retryPolicy, healthTracker, retryListener));
        }
        return new ProviderRegistry(gateways, healthTracker);
    }

    interface ChatModelFactory {
        ChatModel chatModel(ProviderSettings settings, Duration timeout);

        StreamingChatModel streamingModel(ProviderSettings settings, Duration timeout);
    }

    /**
     * Client-side retries are switched off; {@link RetryPolicy} is the only retry layer. The streaming client
     * never retries on its own.
     */
    private static final class OpenAiCompatibleModelFactory implements ChatModelFactory {

        @Override
        public ChatModel chatModel(ProviderSettings settings, Duration timeout) {
            return OpenAiChatModel.builder()
                    .baseUrl(settings.baseUrl())
                    .apiKey(settings.apiKey())
                    .modelName(defaultModel(settings.provider()))
                    .timeout(timeout)
                    .maxRetries(0)
                    .build();
        }

        @Override
        public StreamingChatModel streamingModel(ProviderSettings settings, Duration timeout) {
            return OpenAiStreamingChatModel.builder()
                    .baseUrl(settings.baseUrl())
                    .apiKey(settings.apiKey())
                    .modelName(defaultModel(settings.provider()))
                    .timeout(timeout)
                    .build();
        }

        private static String defaultModel(ProviderType provider) {
            return ModelCatalog.cheapestModel(provider).orElse(ModelCatalog.DEFAULT_MODEL);
        }
    }
}
