package io.github.hide212131.langchain4j.atelier.runtime.provider;

import java.util.Objects;

/**
 * One prompt pair sent to a backend. {@code maxTokens} is nullable; the backend default applies then.
 */
public record GenerationRequest(String systemPrompt, String userPrompt, String model, double temperature, Integer maxTokens) {

    public GenerationRequest {
        Objects.requireNonNull(userPrompt, "userPrompt");
        Objects.requireNonNull(model, "model");
        systemPrompt = systemPrompt == null ? "" : systemPrompt;
        if (maxTokens != null && maxTokens < 1) {
            throw new IllegalArgumentException("maxTokens must be positive");
        }
    }

    public GenerationRequest(String systemPrompt, String userPrompt, String model, double temperature) {
        this(systemPrompt, userPrompt, model, temperature, null);
    }
}
