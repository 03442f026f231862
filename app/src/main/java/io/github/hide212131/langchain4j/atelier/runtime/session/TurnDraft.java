package io.github.hide212131.langchain4j.atelier.runtime.session;

import io.github.hide212131.langchain4j.atelier.runtime.model.AgentConfig;
import io.github.hide212131.langchain4j.atelier.runtime.model.Evaluation;

/**
 * Result of one provider call before it is numbered and appended to the history.
 */
record TurnDraft(
        AgentConfig agent,
        String rawResponse,
        String output,
        Evaluation evaluation,
        String parseError,
        int inputTokens,
        int outputTokens,
        int creditsUsed,
        boolean usageEstimated) {}
