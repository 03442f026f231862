package io.github.hide212131.langchain4j.atelier.runtime.provider;

import io.github.hide212131.langchain4j.atelier.runtime.model.ProviderType;
import java.util.function.Consumer;

/**
 * Uniform access to one generative backend.
 *
 * <p>Implementations retry transient faults before a response starts and raise {@link ProviderException}
 * when a call cannot complete. Chunks handed to {@code onChunk} are never retracted; a stream that fails
 * after its first chunk is not retried.</p>
 */
public interface ProviderGateway {

    ProviderType type();

    GenerationResult generate(GenerationRequest request);

    /**
     * Streams the response and returns its full text.
     */
    default String generateStream(GenerationRequest request, Consumer<String> onChunk) {
        return generateStreamWithUsage(request, onChunk).content();
    }

    /**
     * Streams the response and returns its full text with the backend's own usage report, or a
     * four-characters-per-token estimate when the backend reports none.
     */
    StreamingResult generateStreamWithUsage(GenerationRequest request, Consumer<String> onChunk);
}
