package io.github.hide212131.langchain4j.atelier.runtime.prompt;

import java.util.Objects;

public record AgentPrompt(String systemPrompt, String userPrompt) {

    public AgentPrompt {
        Objects.requireNonNull(systemPrompt, "systemPrompt");
        Objects.requireNonNull(userPrompt, "userPrompt");
    }
}
