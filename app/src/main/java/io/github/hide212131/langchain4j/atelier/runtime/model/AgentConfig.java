package io.github.hide212131.langchain4j.atelier.runtime.model;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One participant of a session, fixed for the whole session.
 */
public record AgentConfig(
        String agentId,
        String displayName,
        ProviderType provider,
        String model,
        String roleDescription,
        List<EvaluationCriterion> evaluationCriteria,
        boolean active,
        Phase phase) {

    public AgentConfig {
        Objects.requireNonNull(agentId, "agentId");
        Objects.requireNonNull(provider, "provider");
        Objects.requireNonNull(model, "model");
        Objects.requireNonNull(phase, "phase");
        if (agentId.isBlank()) {
            throw new IllegalArgumentException("agentId must not be blank");
        }
        displayName = displayName == null || displayName.isBlank() ? agentId : displayName;
        roleDescription = roleDescription == null ? "" : roleDescription;
        evaluationCriteria = evaluationCriteria == null ? List.of() : List.copyOf(evaluationCriteria);
    }

    public List<String> criterionNames() {
        return evaluationCriteria.stream().map(EvaluationCriterion::name).toList();
    }

    public Map<String, Double> criterionWeights() {
        Map<String, Double> weights = new LinkedHashMap<>();
        for (EvaluationCriterion criterion : evaluationCriteria) {
            weights.put(criterion.name(), criterion.weight());
        }
        return weights;
    }
}
