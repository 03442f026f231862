package io.github.hide212131.langchain4j.atelier.runtime.model;

import java.util.Objects;

/**
 * A named dimension an agent scores its own work on. Weight is relative, 0 to 1.
 */
public record EvaluationCriterion(String name, String description, double weight) {

    public EvaluationCriterion {
        Objects.requireNonNull(name, "name");
        if (name.isBlank()) {
            throw new IllegalArgumentException("criterion name must not be blank");
        }
        description = description == null ? "" : description;
        if (weight < 0.0 || weight > 1.0) {
            throw new IllegalArgumentException("criterion weight must be between 0 and 1: " + weight);
        }
    }

    public EvaluationCriterion(String name, String description) {
        this(name, description, 1.0);
    }
}
