package io.github.hide212131.langchain4j.atelier.runtime.model;

import java.util.Objects;

public record CriterionScore(String criterion, double score, String justification) {

    public CriterionScore {
        Objects.requireNonNull(criterion, "criterion");
        if (score < 1.0 || score > 10.0) {
            throw new IllegalArgumentException("score must be between 1 and 10: " + score);
        }
        justification = justification == null ? "" : justification;
    }
}
