package io.github.hide212131.langchain4j.atelier.runtime.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

import io.github.hide212131.langchain4j.atelier.runtime.model.AgentConfig;
import io.github.hide212131.langchain4j.atelier.runtime.model.DraftTreatment;
import io.github.hide212131.langchain4j.atelier.runtime.model.EvaluationCriterion;
import io.github.hide212131.langchain4j.atelier.runtime.model.FlowType;
import io.github.hide212131.langchain4j.atelier.runtime.model.Phase;
import io.github.hide212131.langchain4j.atelier.runtime.model.ProviderType;
import io.github.hide212131.langchain4j.atelier.runtime.model.SessionConfig;
import io.github.hide212131.langchain4j.atelier.runtime.roster.WorkflowRoles;
import io.github.hide212131.langchain4j.atelier.runtime.usage.ModelCatalog;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SessionConfigLoaderTest {

    private final SessionConfigLoader loader = new SessionConfigLoader();

    @Test
    @DisplayName("Roles fill in persona, phase and criteria with the default provider")
    void minimalYamlUsesRoleDefaults() throws Exception {
        SessionConfig config = loader.load(fixture("writer-editor.yaml"));

        assertThat(config.sessionId()).isEqualTo("writer-editor");
        assertThat(config.displayTitle()).isEqualTo("Remote work essay");
        assertThat(config.termination().maxRounds()).isEqualTo(1);
        assertThat(config.termination().threshold()).isEmpty();
        assertThat(config.flowType()).isEqualTo(FlowType.PARALLEL_CRITIQUE);
        assertThat(config.draftTreatment()).isEqualTo(DraftTreatment.MODERATE_REVISION);
        assertThat(config.agents())
                .extracting(AgentConfig::agentId, AgentConfig::phase, AgentConfig::provider, AgentConfig::model)
                .containsExactly(
                        tuple("writer", Phase.WRITER, ProviderType.ANTHROPIC, ModelCatalog.DEFAULT_MODEL),
                        tuple("style_editor", Phase.EDITOR, ProviderType.ANTHROPIC, ModelCatalog.DEFAULT_MODEL));
        assertThat(config.agents().get(1).roleDescription()).isEqualTo(WorkflowRoles.STYLE_EDITOR.defaultPrompt());
        assertThat(config.agents().get(1).criterionNames()).containsExactly("Tone", "Flow", "Economy", "Readability");
    }

    @Test
    void fullRosterReadsFilesOverridesAndCustomAgents() throws Exception {
        SessionConfig config = loader.load(fixture("full-roster.yml"));

        assertThat(config.userId()).isEqualTo("user-7");
        assertThat(config.workingDocument()).startsWith("We are launching Chronos 1.0 today.");
        assertThat(config.referenceDocuments()).containsOnlyKeys("changelog.md");
        assertThat(config.projectInstructions()).isEqualTo("Keep it under 400 words.");
        assertThat(config.draftTreatment()).isEqualTo(DraftTreatment.LIGHT_POLISH);
        assertThat(config.flowType()).isEqualTo(FlowType.SEQUENTIAL);
        assertThat(config.termination().scoreThreshold()).isEqualTo(8.5);

        assertThat(config.agents())
                .extracting(AgentConfig::agentId, AgentConfig::provider, AgentConfig::model, AgentConfig::active)
                .containsExactly(
                        tuple("writer", ProviderType.OPENAI, "gpt-4o", true),
                        tuple("content_expert", ProviderType.OPENAI, "gpt-4o-mini", true),
                        tuple("fact_checker", ProviderType.ANTHROPIC, ModelCatalog.DEFAULT_MODEL, false),
                        tuple("house_style", ProviderType.ANTHROPIC, ModelCatalog.DEFAULT_MODEL, true),
                        tuple("synthesizer", ProviderType.ANTHROPIC, ModelCatalog.DEFAULT_MODEL, true));

        AgentConfig houseStyle = config.agents().get(3);
        assertThat(houseStyle.displayName()).isEqualTo("House Style Editor");
        assertThat(houseStyle.phase()).isEqualTo(Phase.EDITOR);
        assertThat(houseStyle.evaluationCriteria())
                .extracting(EvaluationCriterion::name, EvaluationCriterion::weight)
                .containsExactly(tuple("Consistency", 0.5), tuple("Tone", 1.0));
        assertThat(config.activeAgents(Phase.EDITOR)).extracting(AgentConfig::agentId)
                .containsExactly("content_expert", "house_style");
    }

    @Test
    void jsonIsAccepted() throws Exception {
        SessionConfig config = loader.load(fixture("session.json"));

        assertThat(config.sessionId()).isEqualTo("json-session");
        assertThat(config.termination().maxRounds()).isEqualTo(3);
        assertThat(config.agents()).hasSize(4);
    }

    @Test
    void sessionIdFallsBackToTheFileName(@TempDir Path tempDir) throws Exception {
        Path file = tempDir.resolve("essay-draft.yaml");
        Files.writeString(file, "initial_prompt: Write.\nagents:\n  - role: writer\n");

        assertThat(loader.load(file).sessionId()).isEqualTo("essay-draft");
    }

    @Test
    void referenceFilesAreKeyedByFileName(@TempDir Path tempDir) throws Exception {
        Files.createDirectories(tempDir.resolve("refs"));
        Files.writeString(tempDir.resolve("refs/brief.md"), "Audience: engineers.");
        Path file = tempDir.resolve("session.yaml");
        Files.writeString(file, "initial_prompt: Write.\nreference_files:\n  - refs/brief.md\nagents:\n  - role: writer\n");

        assertThat(loader.load(file).referenceDocuments()).containsEntry("brief.md", "Audience: engineers.");
    }

    @Test
    void unknownKeysAreRejected() {
        assertThatThrownBy(() -> loader.parse("initial_prompt: x\nrounds: 3\nagents:\n  - role: writer\n", null, "s"))
                .isInstanceOf(SessionConfigurationException.class)
                .hasMessage("Unsupported key 'rounds' in session");
        assertThatThrownBy(() -> loader.parse("initial_prompt: x\nagents:\n  - role: writer\n    temperature: 1\n", null, "s"))
                .isInstanceOf(SessionConfigurationException.class)
                .hasMessage("Unsupported key 'temperature' in agents[0]");
    }

    @Test
    void initialPromptIsRequired() {
        assertThatThrownBy(() -> loader.parse("agents:\n  - role: writer\n", null, "s"))
                .isInstanceOf(SessionConfigurationException.class)
                .hasMessage("Missing required key 'initial_prompt' in session");
    }

    @Test
    @DisplayName("Invalid values are reported as configuration errors")
    void invalidValues() {
        assertThatThrownBy(() -> loader.parse("initial_prompt: x\nagents:\n  - role: poet\n", null, "s"))
                .isInstanceOf(SessionConfigurationException.class)
                .hasMessageContaining("Unknown role 'poet'");
        assertThatThrownBy(() -> loader.parse(
                "initial_prompt: x\ntermination:\n  max_rounds: 0\nagents:\n  - role: writer\n", null, "s"))
                .isInstanceOf(SessionConfigurationException.class)
                .hasMessageStartingWith("Invalid termination");
        assertThatThrownBy(() -> loader.parse("initial_prompt: x\nagents:\n  - agent_id: a\n    phase: 4\n", null, "s"))
                .isInstanceOf(SessionConfigurationException.class)
                .hasMessageContaining("phase must be 1, 2 or 3");
        assertThatThrownBy(() -> loader.parse("initial_prompt: x\nagents:\n  - role: writer\n  - role: writer\n", null, "s"))
                .isInstanceOf(SessionConfigurationException.class)
                .hasMessageContaining("duplicate agent id: writer");
        assertThatThrownBy(() -> loader.parse("initial_prompt: x\n", null, "s"))
                .isInstanceOf(SessionConfigurationException.class)
                .hasMessage("Session definition has no agents");
        assertThatThrownBy(() -> loader.parse("  ", null, "s"))
                .isInstanceOf(SessionConfigurationException.class);
    }

    @Test
    void providerWithoutModelUsesItsCheapestModel() {
        SessionConfig config = loader.parse(
                "initial_prompt: x\nagents:\n  - role: writer\n    provider: google\n", null, "s");

        assertThat(config.agents().get(0).model())
                .isEqualTo(ModelCatalog.cheapestModel(ProviderType.GOOGLE).orElseThrow());
    }

    private static Path fixture(String name) throws URISyntaxException {
        return Path.of(Objects.requireNonNull(SessionConfigLoaderTest.class.getResource("/sessions/" + name)).toURI());
    }
}
