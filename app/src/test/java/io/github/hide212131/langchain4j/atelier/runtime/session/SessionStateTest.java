package io.github.hide212131.langchain4j.atelier.runtime.session;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.github.hide212131.langchain4j.atelier.runtime.model.AgentConfig;
import io.github.hide212131.langchain4j.atelier.runtime.model.ExchangeTurn;
import io.github.hide212131.langchain4j.atelier.runtime.model.Phase;
import io.github.hide212131.langchain4j.atelier.runtime.model.ProviderType;
import io.github.hide212131.langchain4j.atelier.runtime.model.SessionConfig;
import io.github.hide212131.langchain4j.atelier.runtime.model.SessionStatus;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class SessionStateTest {

    private static final SessionConfig CONFIG = SessionConfig.builder()
            .sessionId("state")
            .initialPrompt("Write a haiku.")
            .workingDocument("seed")
            .agent(new AgentConfig("writer", "Writer", ProviderType.ANTHROPIC, "claude-sonnet-4-5-20250929",
                    "", List.of(), true, Phase.WRITER))
            .build();

    @Test
    void startsIdleWithTheConfiguredDocument() {
        SessionState state = new SessionState(CONFIG);

        assertThat(state.status()).isEqualTo(SessionStatus.IDLE);
        assertThat(state.workingDocument()).isEqualTo("seed");
        assertThat(state.creditBudget()).isEmpty();
        assertThat(state.terminationReason()).isEmpty();
        assertThat(state.isRunning()).isFalse();
    }

    @Test
    void appendTurnAdvancesDocumentAndCredits() {
        SessionState state = new SessionState(CONFIG, 10);
        state.markStatus(SessionStatus.RUNNING);
        int round = state.startNextRound();

        state.appendTurn(turn(1, round, "first"));
        state.appendTurn(turn(2, round, "second"));

        assertThat(state.creditBudget()).contains(10);
        assertThat(state.turnCount()).isEqualTo(2);
        assertThat(state.workingDocument()).isEqualTo("second");
        assertThat(state.creditsUsed()).isEqualTo(2);
        assertThat(state.history()).extracting(ExchangeTurn::turnNumber).containsExactly(1, 2);
        assertThat(state.isRunning()).isTrue();
    }

    @Test
    void appendTurnRejectsGapsInNumbering() {
        SessionState state = new SessionState(CONFIG);

        assertThatThrownBy(() -> state.appendTurn(turn(2, 1, "skipped")))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("turn 2 does not follow turn 0");
    }

    @Test
    void awaitResumeReturnsImmediatelyWhenNotPaused() throws InterruptedException {
        SessionState state = new SessionState(CONFIG);

        assertThat(state.awaitResume(Duration.ofMillis(5))).isTrue();
    }

    @Test
    void resumeReleasesAWaitingScheduler() throws Exception {
        SessionState state = new SessionState(CONFIG);
        state.pause();
        CompletableFuture<Boolean> waiter = CompletableFuture.supplyAsync(() -> await(state));

        Thread.sleep(50);
        assertThat(waiter).isNotDone();
        state.resume();

        assertThat(waiter.get(2, TimeUnit.SECONDS)).isTrue();
        assertThat(state.isPaused()).isFalse();
    }

    @Test
    void cancelWhilePausedReportsCancellation() throws Exception {
        SessionState state = new SessionState(CONFIG);
        state.pause();
        CompletableFuture<Boolean> waiter = CompletableFuture.supplyAsync(() -> await(state));

        state.cancel();

        assertThat(waiter.get(2, TimeUnit.SECONDS)).isFalse();
        assertThat(state.isCancelled()).isTrue();
    }

    @Test
    void finishRecordsStatusAndReason() {
        SessionState state = new SessionState(CONFIG);

        state.finish(SessionStatus.COMPLETED, "Maximum rounds reached (1)");

        assertThat(state.status()).isEqualTo(SessionStatus.COMPLETED);
        assertThat(state.terminationReason()).contains("Maximum rounds reached (1)");
    }

    private static boolean await(SessionState state) {
        try {
            return state.awaitResume(Duration.ofMillis(5));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        }
    }

    private static ExchangeTurn turn(int number, int round, String document) {
        return new ExchangeTurn(number, round, Phase.WRITER, "writer", "Writer", document, document, null, null,
                document, 10, 10, 1, false, Instant.now());
    }
}
