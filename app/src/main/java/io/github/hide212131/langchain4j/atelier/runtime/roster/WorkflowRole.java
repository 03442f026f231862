package io.github.hide212131.langchain4j.atelier.runtime.roster;

import io.github.hide212131.langchain4j.atelier.runtime.model.AgentConfig;
import io.github.hide212131.langchain4j.atelier.runtime.model.EvaluationCriterion;
import io.github.hide212131.langchain4j.atelier.runtime.model.Phase;
import io.github.hide212131.langchain4j.atelier.runtime.model.ProviderType;
import java.util.List;
import java.util.Objects;

/**
 * A pre-crafted participant: default persona, phase and rubric.
 */
public record WorkflowRole(
        String id,
        String name,
        String description,
        Phase phase,
        boolean required,
        String defaultPrompt,
        List<EvaluationCriterion> evaluationCriteria) {

    public WorkflowRole {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(phase, "phase");
        evaluationCriteria = List.copyOf(evaluationCriteria);
    }

    /**
     * Agent with this role's defaults, bound to the given backend and model.
     */
    public AgentConfig toAgent(ProviderType provider, String model) {
        return new AgentConfig(id, name, provider, model, defaultPrompt, evaluationCriteria, true, phase);
    }
}
