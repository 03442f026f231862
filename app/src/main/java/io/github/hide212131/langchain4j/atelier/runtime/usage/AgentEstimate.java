package io.github.hide212131.langchain4j.atelier.runtime.usage;

import io.github.hide212131.langchain4j.atelier.runtime.model.Phase;

/**
 * Expected consumption of one agent over a whole session. {@code credits} is not rounded.
 */
public record AgentEstimate(
        String agentId,
        String model,
        Phase phase,
        double multiplier,
        int inputTokensPerRun,
        int outputTokensPerRun,
        int runs,
        double credits) {}
