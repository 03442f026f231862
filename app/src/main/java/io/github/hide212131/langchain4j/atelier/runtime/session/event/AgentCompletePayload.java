package io.github.hide212131.langchain4j.atelier.runtime.session.event;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.github.hide212131.langchain4j.atelier.runtime.model.Evaluation;
import java.util.List;

/**
 * Completion of one agent turn. {@code evaluation} is null when the response carried no parseable
 * self-evaluation.
 */
public record AgentCompletePayload(
        String agentId,
        String agentName,
        int turnNumber,
        int roundNumber,
        int phase,
        @JsonProperty("is_final_pass") Boolean finalPass,
        EvaluationSummary evaluation,
        int outputLength,
        TurnUsage usage)
        implements SessionEventPayload {

    @Override
    public SessionEventType type() {
        return SessionEventType.AGENT_COMPLETE;
    }

    public record EvaluationSummary(double overallScore, List<ScoreEntry> criteriaScores) {

        public static EvaluationSummary of(Evaluation evaluation) {
            if (evaluation == null) {
                return null;
            }
            List<ScoreEntry> scores = evaluation.criteriaScores().stream()
                    .map(score -> new ScoreEntry(score.criterion(), score.score()))
                    .toList();
            return new EvaluationSummary(evaluation.overallScore(), scores);
        }
    }

    public record ScoreEntry(String criterion, double score) {}

    public record TurnUsage(int inputTokens, int outputTokens, int creditsUsed, int sessionTotalCredits) {}
}
