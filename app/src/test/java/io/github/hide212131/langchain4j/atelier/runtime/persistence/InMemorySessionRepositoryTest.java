package io.github.hide212131.langchain4j.atelier.runtime.persistence;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.github.hide212131.langchain4j.atelier.runtime.model.AgentConfig;
import io.github.hide212131.langchain4j.atelier.runtime.model.ExchangeTurn;
import io.github.hide212131.langchain4j.atelier.runtime.model.Phase;
import io.github.hide212131.langchain4j.atelier.runtime.model.ProviderType;
import io.github.hide212131.langchain4j.atelier.runtime.model.SessionConfig;
import io.github.hide212131.langchain4j.atelier.runtime.model.SessionStatus;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;

class InMemorySessionRepositoryTest {

    private static final SessionConfig CONFIG = SessionConfig.builder()
            .sessionId("repo")
            .initialPrompt("Write.")
            .workingDocument("seed")
            .agent(new AgentConfig("writer", "Writer", ProviderType.ANTHROPIC, "claude-sonnet-4-5-20250929",
                    "", List.of(), true, Phase.WRITER))
            .build();

    private final InMemorySessionRepository repository = new InMemorySessionRepository();

    @Test
    void snapshotReflectsEveryUpdate() {
        repository.createSession(CONFIG);
        ExchangeTurn turn = new ExchangeTurn(1, 1, Phase.WRITER, "writer", "Writer", "Draft", "Draft", null, null,
                "Draft", 100, 50, 1, false, Instant.now());

        repository.updateStatus("repo", SessionStatus.RUNNING, null);
        repository.updateRound("repo", 1);
        repository.appendTurn("repo", turn, Phase.WRITER, 100, 50, 1);
        repository.updateWorkingDocument("repo", "Draft");

        InMemorySessionRepository.SessionSnapshot snapshot = repository.find("repo").orElseThrow();
        assertThat(snapshot.status()).isEqualTo(SessionStatus.RUNNING);
        assertThat(snapshot.round()).isEqualTo(1);
        assertThat(snapshot.workingDocument()).isEqualTo("Draft");
        assertThat(snapshot.turns()).containsExactly(
                new InMemorySessionRepository.StoredTurn(turn, Phase.WRITER, 100, 50, 1));
    }

    @Test
    void newSessionStartsIdleWithTheSeedDocument() {
        repository.createSession(CONFIG);

        InMemorySessionRepository.SessionSnapshot snapshot = repository.find("repo").orElseThrow();
        assertThat(snapshot.status()).isEqualTo(SessionStatus.IDLE);
        assertThat(snapshot.workingDocument()).isEqualTo("seed");
        assertThat(snapshot.turns()).isEmpty();
    }

    @Test
    void duplicateAndUnknownSessionsFail() {
        repository.createSession(CONFIG);

        assertThatThrownBy(() -> repository.createSession(CONFIG))
                .isInstanceOf(PersistenceException.class)
                .hasMessage("Session already exists: repo");
        assertThatThrownBy(() -> repository.updateRound("missing", 1))
                .isInstanceOf(PersistenceException.class)
                .hasMessage("Unknown session: missing");
        assertThat(repository.find("missing")).isEmpty();
    }
}
