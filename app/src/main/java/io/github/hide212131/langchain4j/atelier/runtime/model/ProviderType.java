package io.github.hide212131.langchain4j.atelier.runtime.model;

/**
 * Generative backends an agent can be bound to.
 */
public enum ProviderType {
    ANTHROPIC("anthropic"),
    OPENAI("openai"),
    GOOGLE("google"),
    PERPLEXITY("perplexity");

    private final String id;

    ProviderType(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    public static ProviderType from(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("provider must not be blank");
        }
        String normalized = value.trim().toLowerCase();
        return switch (normalized) {
            case "anthropic", "claude" -> ANTHROPIC;
            case "openai" -> OPENAI;
            case "google", "gemini" -> GOOGLE;
            case "perplexity" -> PERPLEXITY;
            default -> throw new IllegalArgumentException("Unknown provider: " + value);
        };
    }

    @Override
    public String toString() {
        return id;
    }
}
