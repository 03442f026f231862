package io.github.hide212131.langchain4j.atelier.runtime.model;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Scores an agent gave its own output.
 */
public record Evaluation(List<CriterionScore> criteriaScores, double overallScore, String summary) {

    public Evaluation {
        criteriaScores = List.copyOf(Objects.requireNonNull(criteriaScores, "criteriaScores"));
        if (overallScore < 1.0 || overallScore > 10.0) {
            throw new IllegalArgumentException("overallScore must be between 1 and 10: " + overallScore);
        }
        summary = summary == null ? "" : summary;
    }

    /**
     * Criterion-weighted mean of the scores. Criteria missing from {@code weights} count with weight 1.0;
     * when every weight is zero the overall score is returned.
     */
    public double weightedScore(Map<String, Double> weights) {
        if (criteriaScores.isEmpty()) {
            return overallScore;
        }
        double totalWeight = 0.0;
        double weighted = 0.0;
        for (CriterionScore score : criteriaScores) {
            double weight = weights == null ? 1.0 : weights.getOrDefault(score.criterion(), 1.0);
            weighted += score.score() * weight;
            totalWeight += weight;
        }
        if (totalWeight == 0.0) {
            return overallScore;
        }
        return weighted / totalWeight;
    }
}
