package io.github.hide212131.langchain4j.atelier.runtime.model;

import java.util.Optional;

/**
 * When a session stops on its own. {@code scoreThreshold} is nullable.
 */
public record TerminationCondition(int maxRounds, Double scoreThreshold) {

    public TerminationCondition {
        if (maxRounds < 1) {
            throw new IllegalArgumentException("max_rounds must be at least 1: " + maxRounds);
        }
        if (scoreThreshold != null && (scoreThreshold < 1.0 || scoreThreshold > 10.0)) {
            throw new IllegalArgumentException("score_threshold must be between 1 and 10: " + scoreThreshold);
        }
    }

    public static TerminationCondition maxRounds(int maxRounds) {
        return new TerminationCondition(maxRounds, null);
    }

    public Optional<Double> threshold() {
        return Optional.ofNullable(scoreThreshold);
    }
}
