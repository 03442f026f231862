package io.github.hide212131.langchain4j.atelier.runtime.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class SessionModelTest {

    private static final Evaluation EVALUATION = new Evaluation(
            List.of(new CriterionScore("Accuracy", 9.0, ""), new CriterionScore("Tone", 6.0, "")), 7.5, "ok");

    @Test
    @DisplayName("Weighted score favours heavier criteria and treats unknown ones as weight 1")
    void weightedScore() {
        assertThat(EVALUATION.weightedScore(Map.of("Accuracy", 1.0, "Tone", 0.5))).isCloseTo(8.0, within(1e-9));
        assertThat(EVALUATION.weightedScore(Map.of())).isCloseTo(7.5, within(1e-9));
        assertThat(EVALUATION.weightedScore(null)).isCloseTo(7.5, within(1e-9));
        assertThat(EVALUATION.weightedScore(Map.of("Accuracy", 0.0, "Tone", 0.0))).isEqualTo(7.5);
        assertThat(new Evaluation(List.of(), 6.0, null).weightedScore(Map.of("Tone", 1.0))).isEqualTo(6.0);
    }

    @Test
    void scoresMustStayOnTheTenPointScale() {
        assertThatThrownBy(() -> new CriterionScore("Tone", 0.5, "")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new Evaluation(List.of(), 10.5, "")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new EvaluationCriterion("Tone", "", 1.5)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void terminationValidatesRoundsAndThreshold() {
        assertThat(TerminationCondition.maxRounds(3).threshold()).isEmpty();
        assertThat(new TerminationCondition(2, 8.0).threshold()).contains(8.0);
        assertThatThrownBy(() -> TerminationCondition.maxRounds(0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new TerminationCondition(1, 11.0)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("A session holds one to five agents with unique ids")
    void sessionAgentLimits() {
        AgentConfig writer = agent("writer", Phase.WRITER);

        assertThatThrownBy(() -> builder().build()).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> builder().agent(writer).agent(writer).build())
                .hasMessage("duplicate agent id: writer");
        assertThatThrownBy(() -> builder()
                        .agents(List.of(writer, agent("a", Phase.EDITOR), agent("b", Phase.EDITOR),
                                agent("c", Phase.EDITOR), agent("d", Phase.EDITOR), agent("e", Phase.SYNTHESIZER)))
                        .build())
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void sessionDefaultsAndActiveAgents() {
        AgentConfig inactive = new AgentConfig("quiet", null, ProviderType.OPENAI, "gpt-4o", null, null, false, Phase.EDITOR);
        SessionConfig config = builder()
                .agent(agent("writer", Phase.WRITER))
                .agent(inactive)
                .agent(agent("style", Phase.EDITOR))
                .userId(" ")
                .build();

        assertThat(config.draftTreatment()).isEqualTo(DraftTreatment.MODERATE_REVISION);
        assertThat(config.flowType()).isEqualTo(FlowType.PARALLEL_CRITIQUE);
        assertThat(config.displayTitle()).isEqualTo("model");
        assertThat(config.optionalUserId()).isEmpty();
        assertThat(config.activeAgents(Phase.EDITOR)).extracting(AgentConfig::agentId).containsExactly("style");
        assertThat(config.firstActive(Phase.SYNTHESIZER)).isEmpty();
        assertThat(inactive.displayName()).isEqualTo("quiet");
        assertThat(inactive.evaluationCriteria()).isEqualTo(Collections.emptyList());
    }

    @Test
    void enumsParseTheirWireIds() {
        assertThat(Phase.fromNumber(2)).isEqualTo(Phase.EDITOR);
        assertThat(Phase.WRITER.mutatesDocument()).isTrue();
        assertThat(Phase.SYNTHESIZER.mutatesDocument()).isFalse();
        assertThat(ProviderType.from(" Gemini ")).isEqualTo(ProviderType.GOOGLE);
        assertThat(FlowType.from("parallel")).isEqualTo(FlowType.PARALLEL_CRITIQUE);
        assertThat(FlowType.from(null)).isEqualTo(FlowType.PARALLEL_CRITIQUE);
        assertThat(DraftTreatment.from("free-rewrite")).isEqualTo(DraftTreatment.FREE_REWRITE);
        assertThatThrownBy(() -> ProviderType.from("mistral")).hasMessage("Unknown provider: mistral");
        assertThatThrownBy(() -> Phase.fromNumber(0)).isInstanceOf(IllegalArgumentException.class);
    }

    private static SessionConfig.Builder builder() {
        return SessionConfig.builder().sessionId("model").initialPrompt("Write.");
    }

    private static AgentConfig agent(String id, Phase phase) {
        return new AgentConfig(id, id, ProviderType.ANTHROPIC, "claude-sonnet-4-5-20250929", "", List.of(), true, phase);
    }
}
