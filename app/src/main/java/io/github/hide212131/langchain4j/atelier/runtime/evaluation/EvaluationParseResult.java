package io.github.hide212131.langchain4j.atelier.runtime.evaluation;

import io.github.hide212131.langchain4j.atelier.runtime.model.Evaluation;
import java.util.Optional;

/**
 * Outcome of {@link EvaluationParser#parse}. Exactly one of the two fields is set.
 */
public record EvaluationParseResult(Evaluation evaluation, String error) {

    public EvaluationParseResult {
        if ((evaluation == null) == (error == null)) {
            throw new IllegalArgumentException("exactly one of evaluation and error must be set");
        }
    }

    public static EvaluationParseResult success(Evaluation evaluation) {
        return new EvaluationParseResult(evaluation, null);
    }

    public static EvaluationParseResult failure(String error) {
        return new EvaluationParseResult(null, error);
    }

    public boolean isSuccess() {
        return evaluation != null;
    }

    public Optional<Evaluation> optionalEvaluation() {
        return Optional.ofNullable(evaluation);
    }
}
