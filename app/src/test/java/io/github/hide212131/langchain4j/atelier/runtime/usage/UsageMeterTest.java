package io.github.hide212131.langchain4j.atelier.runtime.usage;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import io.github.hide212131.langchain4j.atelier.runtime.model.AgentConfig;
import io.github.hide212131.langchain4j.atelier.runtime.model.Phase;
import io.github.hide212131.langchain4j.atelier.runtime.model.ProviderType;
import io.github.hide212131.langchain4j.atelier.runtime.model.SessionConfig;
import io.github.hide212131.langchain4j.atelier.runtime.model.TerminationCondition;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class UsageMeterTest {

    private static final AgentConfig WRITER = agent("writer", "claude-sonnet-4-5-20250929", Phase.WRITER);
    private static final AgentConfig EDITOR = agent("style_editor", "gpt-4o-mini", Phase.EDITOR);
    private static final AgentConfig SYNTHESIZER = agent("synthesizer", "claude-opus-4-5-20251101", Phase.SYNTHESIZER);

    @Test
    @DisplayName("Turn credits round up per turn and scale with the model multiplier")
    void creditsForTurn() {
        assertThat(UsageMeter.creditsForTurn("claude-sonnet-4-5-20250929", 1000, 500)).isEqualTo(1);
        assertThat(UsageMeter.creditsForTurn("claude-sonnet-4-5-20250929", 10_001, 0)).isEqualTo(2);
        assertThat(UsageMeter.creditsForTurn("gpt-4o-mini", 10_000, 10_000)).isEqualTo(1);
        assertThat(UsageMeter.creditsForTurn("claude-opus-4-5-20251101", 10_000, 0)).isEqualTo(5);
        assertThat(UsageMeter.creditsForTurn("unknown-model", 20_000, 0)).isEqualTo(2);
        assertThat(UsageMeter.creditsForTurn("gpt-4o", 0, 0)).isZero();
    }

    @Test
    void estimateTokensUsesFourCharactersPerToken() {
        assertThat(UsageMeter.estimateTokens("abcdefgh")).isEqualTo(2);
        assertThat(UsageMeter.estimateTokens("")).isEqualTo(1);
        assertThat(UsageMeter.estimateTokens(null)).isEqualTo(1);
    }

    @Test
    @DisplayName("Estimates count the final Writer pass and the editors' feedback read by the Synthesizer")
    void estimateSession() {
        CreditEstimate estimate = UsageMeter.estimateSession(List.of(WRITER, EDITOR, SYNTHESIZER), 2, 100);

        assertThat(estimate.agents()).extracting(AgentEstimate::runs).containsExactly(3, 2, 2);
        assertThat(estimate.agents()).extracting(AgentEstimate::inputTokensPerRun).containsExactly(650, 450, 1250);
        assertThat(estimate.agents().get(0).credits()).isCloseTo(0.495, within(1e-9));
        assertThat(estimate.agents().get(1).credits()).isCloseTo(0.0725, within(1e-9));
        assertThat(estimate.agents().get(2).credits()).isCloseTo(2.25, within(1e-9));
        assertThat(estimate.totalCredits()).isEqualTo(3);
        assertThat(estimate.hasSufficientCredits(3)).isTrue();
        assertThat(estimate.hasSufficientCredits(2)).isFalse();
    }

    @Test
    void estimateFromConfigReadsDocumentAndReferences() {
        SessionConfig config = SessionConfig.builder()
                .sessionId("estimate")
                .initialPrompt("Write.")
                .workingDocument("one two three")
                .referenceDocument("notes.md", "four  five\nsix")
                .agents(List.of(WRITER, agent("inactive", "gpt-4o", Phase.EDITOR, false)))
                .termination(TerminationCondition.maxRounds(1))
                .build();

        CreditEstimate estimate = UsageMeter.estimateSession(config);

        assertThat(UsageMeter.documentWords(config)).isEqualTo(6);
        assertThat(estimate.agents()).extracting(AgentEstimate::agentId).containsExactly("writer");
        assertThat(estimate.agents().get(0).inputTokensPerRun()).isEqualTo(509);
    }

    @Test
    void estimateRejectsZeroRounds() {
        assertThatThrownBy(() -> UsageMeter.estimateSession(List.of(WRITER), 0, 10))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void countWordsIgnoresBlankInput() {
        assertThat(UsageMeter.countWords("  ")).isZero();
        assertThat(UsageMeter.countWords(null)).isZero();
        assertThat(UsageMeter.countWords(" a\tb \n c ")).isEqualTo(3);
    }

    @Test
    void catalogKnowsProvidersAndCheapestModels() {
        assertThat(ModelCatalog.provider("gpt-4o")).contains(ProviderType.OPENAI);
        assertThat(ModelCatalog.provider("my-local-model")).isEmpty();
        assertThat(ModelCatalog.multiplier("my-local-model")).isEqualTo(ModelCatalog.DEFAULT_MULTIPLIER);
        assertThat(ModelCatalog.cheapestModel(ProviderType.ANTHROPIC)).contains("claude-3-5-haiku-20241022");
        assertThat(ModelCatalog.cheapestModel(ProviderType.PERPLEXITY)).contains("sonar");
        assertThat(ModelCatalog.models(ProviderType.GOOGLE)).hasSize(3);
    }

    private static AgentConfig agent(String id, String model, Phase phase) {
        return agent(id, model, phase, true);
    }

    private static AgentConfig agent(String id, String model, Phase phase, boolean active) {
        ProviderType provider = ModelCatalog.provider(model).orElse(ProviderType.ANTHROPIC);
        return new AgentConfig(id, id, provider, model, "", List.of(), active, phase);
    }
}
