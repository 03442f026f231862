package io.github.hide212131.langchain4j.atelier.runtime.provider;

import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.StreamingChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.request.ChatRequestParameters;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.chat.response.StreamingChatResponseHandler;
import dev.langchain4j.model.output.TokenUsage;
import io.github.hide212131.langchain4j.atelier.infra.logging.WorkflowLogger;
import io.github.hide212131.langchain4j.atelier.runtime.model.ProviderType;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BooleanSupplier;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * {@link ProviderGateway} backed by a LangChain4j chat model pair.
 *
 * <p>Every attempt, successful or not, is recorded in the shared {@link ProviderHealthTracker}.</p>
 */
public final class LangChain4jProviderGateway implements ProviderGateway {

    private static final WorkflowLogger LOG = new WorkflowLogger(LangChain4jProviderGateway.class);

    private final ProviderType type;
    private final ChatModel chatModel;
    private final StreamingChatModel streamingModel;
    private final RetryPolicy retryPolicy;
    private final ProviderHealthTracker healthTracker;
    private final RetryListener retryListener;

    public LangChain4jProviderGateway(
            ProviderType type,
            ChatModel chatModel,
            StreamingChatModel streamingModel,
            RetryPolicy retryPolicy,
            ProviderHealthTracker healthTracker,
            RetryListener retryListener) {
        this.type = Objects.requireNonNull(type, "type");
        this.chatModel = Objects.requireNonNull(chatModel, "chatModel");
        this.streamingModel = Objects.requireNonNull(streamingModel, "streamingModel");
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
        this.healthTracker = Objects.requireNonNull(healthTracker, "healthTracker");
        this.retryListener = retryListener != null ? retryListener : RetryListener.none();
    }

    @Override
    public ProviderType type() {
        return type;
    }

    @Override
    public GenerationResult generate(GenerationRequest request) {
        return withRetry(request, () -> false, () -> {
            ChatResponse response = chatModel.chat(toChatRequest(request));
            String content = textOf(response);
            String model = response.modelName() != null ? response.modelName() : request.model();
            return new GenerationResult(content, model, usageOf(response, request, content));
        });
    }

    @Override
    public StreamingResult generateStreamWithUsage(GenerationRequest request, Consumer<String> onChunk) {
        Objects.requireNonNull(onChunk, "onChunk");
        AtomicBoolean emitted = new AtomicBoolean();
        return withRetry(request, emitted::get, () -> streamOnce(request, chunk -> {
            emitted.set(true);
            onChunk.accept(chunk);
        }));
    }

    private StreamingResult streamOnce(GenerationRequest request, Consumer<String> onChunk) {
        CompletableFuture<ChatResponse> completion = new CompletableFuture<>();
        StringBuilder streamed = new StringBuilder();
        streamingModel.chat(toChatRequest(request), new StreamingChatResponseHandler() {
            @Override
            public void onPartialResponse(String partialResponse) {
                if (partialResponse == null || partialResponse.isEmpty()) {
                    return;
                }
                streamed.append(partialResponse);
                onChunk.accept(partialResponse);
            }

            @Override
            public void onCompleteResponse(ChatResponse completeResponse) {
                completion.complete(completeResponse);
            }

            @Override
            public void onError(Throwable error) {
                completion.completeExceptionally(error);
            }
        });

        ChatResponse response;
        try {
            response = completion.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IllegalStateException(cause.getMessage(), cause);
        }
        String content = streamed.length() > 0 ? streamed.toString() : textOf(response);
        return new StreamingResult(content, usageOf(response, request, content));
    }

    private <T> T withRetry(GenerationRequest request, BooleanSupplier outputDelivered, Supplier<T> call) {
        int maxAttempts = retryPolicy.maxAttempts();
        for (int attempt = 1; ; attempt++) {
            try {
                T result = call.get();
                healthTracker.recordSuccess(type);
                return result;
            } catch (RuntimeException e) {
                ProviderFault fault = FaultClassifier.classify(e);
                String message = describe(e);
                healthTracker.recordFailure(type, message);
                if (outputDelivered.getAsBoolean()) {
                    LOG.warn("{} stream for model {} broke after partial output: {}", type, request.model(), message);
                    throw new ProviderException(type, fault, attempt, true,
                            type + " stream failed after partial output: " + message, e);
                }
                if (!fault.isRetryable()) {
                    LOG.warn("{} call for model {} failed ({}): {}", type, request.model(), fault, message);
                    throw new ProviderException(type, fault, attempt, false,
                            type + " request failed: " + message, e);
                }
                if (attempt >= maxAttempts) {
                    LOG.warn("{} call for model {} gave up after {} attempts ({}): {}",
                            type, request.model(), attempt, fault, message);
                    throw new ProviderException(type, fault, attempt, false,
                            type + " request failed after " + attempt + " attempts: " + message, e);
                }
                Duration delay = retryPolicy.delayAfter(attempt);
                LOG.info("{} call for model {} hit {}; retry {}/{} in {} ms",
                        type, request.model(), fault, attempt, maxAttempts - 1, delay.toMillis());
                retryListener.onRetry(attempt, maxAttempts, fault.retryReason());
                pause(delay, attempt, fault, e);
            }
        }
    }

    private void pause(Duration delay, int attempt, ProviderFault fault, RuntimeException cause) {
        try {
            retryPolicy.sleeper().sleep(delay);
        } catch (InterruptedException interrupted) {
            Thread.currentThread().interrupt();
            throw new ProviderException(type, fault, attempt, false,
                    type + " retry interrupted: " + describe(cause), cause);
        }
    }

    private static ChatRequest toChatRequest(GenerationRequest request) {
        List<ChatMessage> messages = new ArrayList<>();
        if (!request.systemPrompt().isBlank()) {
            messages.add(SystemMessage.from(request.systemPrompt()));
        }
        messages.add(UserMessage.from(request.userPrompt()));
        ChatRequestParameters parameters = ChatRequestParameters.builder()
                .modelName(request.model())
                .temperature(request.temperature())
                .maxOutputTokens(request.maxTokens())
                .build();
        return ChatRequest.builder().messages(messages).parameters(parameters).build();
    }

    private static String textOf(ChatResponse response) {
        if (response == null) {
            return "";
        }
        AiMessage message = response.aiMessage();
        return message != null && message.text() != null ? message.text() : "";
    }

    private static UsageReport usageOf(ChatResponse response, GenerationRequest request, String content) {
        TokenUsage usage = response != null ? response.tokenUsage() : null;
        if (usage == null || usage.inputTokenCount() == null || usage.outputTokenCount() == null) {
            return UsageReport.estimate(request, content);
        }
        return UsageReport.reported(usage.inputTokenCount(), usage.outputTokenCount());
    }

    private static String describe(Throwable error) {
        String message = error.getMessage();
        return message == null || message.isBlank() ? error.getClass().getSimpleName() : message;
    }
}
