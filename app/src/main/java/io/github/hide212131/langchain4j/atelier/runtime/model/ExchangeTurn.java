package io.github.hide212131.langchain4j.atelier.runtime.model;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Record of one completed agent invocation. {@code workingDocument} is the document after the turn.
 */
public record ExchangeTurn(
        int turnNumber,
        int roundNumber,
        Phase phase,
        String agentId,
        String agentName,
        String outputText,
        String rawResponse,
        Evaluation evaluation,
        String parseError,
        String workingDocument,
        int inputTokens,
        int outputTokens,
        int creditsUsed,
        boolean finalPass,
        Instant timestamp) {

    public ExchangeTurn {
        Objects.requireNonNull(phase, "phase");
        Objects.requireNonNull(agentId, "agentId");
        Objects.requireNonNull(timestamp, "timestamp");
        if (turnNumber < 1) {
            throw new IllegalArgumentException("turnNumber must be positive: " + turnNumber);
        }
        outputText = outputText == null ? "" : outputText;
        rawResponse = rawResponse == null ? "" : rawResponse;
        workingDocument = workingDocument == null ? "" : workingDocument;
    }

    public Optional<Evaluation> optionalEvaluation() {
        return Optional.ofNullable(evaluation);
    }
}
