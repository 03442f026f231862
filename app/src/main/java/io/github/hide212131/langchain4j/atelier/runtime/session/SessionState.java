package io.github.hide212131.langchain4j.atelier.runtime.session;

import io.github.hide212131.langchain4j.atelier.runtime.model.ExchangeTurn;
import io.github.hide212131.langchain4j.atelier.runtime.model.SessionConfig;
import io.github.hide212131.langchain4j.atelier.runtime.model.SessionStatus;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Live state of one session.
 *
 * <p>The {@link RoundScheduler} is the only writer of progress fields. {@link #pause()}, {@link #resume()}
 * and {@link #cancel()} may be called from any thread; the scheduler honours them at its next
 * checkpoint.</p>
 */
public final class SessionState {

    private final SessionConfig config;
    private final Integer creditBudget;
    private final List<ExchangeTurn> history = new CopyOnWriteArrayList<>();
    private final Object monitor = new Object();

    private volatile SessionStatus status = SessionStatus.IDLE;
    private volatile int currentRound;
    private volatile String workingDocument;
    private volatile String terminationReason;
    private volatile int creditsUsed;
    private volatile boolean paused;
    private volatile boolean cancelled;

    /**
     * @param creditBudget credits the session may spend, or null to read the user's balance from the
     *     ledger at start (no limit when neither is available)
     */
    public SessionState(SessionConfig config, Integer creditBudget) {
        this.config = Objects.requireNonNull(config, "config");
        this.creditBudget = creditBudget;
        this.workingDocument = config.workingDocument();
    }

    public SessionState(SessionConfig config) {
        this(config, null);
    }

    public SessionConfig config() {
        return config;
    }

    public Optional<Integer> creditBudget() {
        return Optional.ofNullable(creditBudget);
    }

    public SessionStatus status() {
        return status;
    }

    public int currentRound() {
        return currentRound;
    }

    public String workingDocument() {
        return workingDocument;
    }

    public Optional<String> terminationReason() {
        return Optional.ofNullable(terminationReason);
    }

    public int creditsUsed() {
        return creditsUsed;
    }

    public List<ExchangeTurn> history() {
        return List.copyOf(history);
    }

    public int turnCount() {
        return history.size();
    }

    public boolean isRunning() {
        SessionStatus current = status;
        return current == SessionStatus.RUNNING || current == SessionStatus.PAUSED;
    }

    public boolean isPaused() {
        return paused;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    public void pause() {
        synchronized (monitor) {
            paused = true;
        }
    }

    public void resume() {
        synchronized (monitor) {
            paused = false;
            monitor.notifyAll();
        }
    }

    public void cancel() {
        synchronized (monitor) {
            cancelled = true;
            monitor.notifyAll();
        }
    }

    /**
     * Blocks while paused, waking at least every {@code pollInterval}.
     *
     * @return true when resumed, false when cancelled
     */
    boolean awaitResume(Duration pollInterval) throws InterruptedException {
        long waitMillis = Math.max(1L, pollInterval.toMillis());
        synchronized (monitor) {
            while (paused && !cancelled) {
                monitor.wait(waitMillis);
            }
            return !cancelled;
        }
    }

    void markStatus(SessionStatus newStatus) {
        this.status = Objects.requireNonNull(newStatus, "newStatus");
    }

    int startNextRound() {
        currentRound = currentRound + 1;
        return currentRound;
    }

    void appendTurn(ExchangeTurn turn) {
        if (turn.turnNumber() != history.size() + 1) {
            throw new IllegalStateException(
                    "turn " + turn.turnNumber() + " does not follow turn " + history.size());
        }
        history.add(turn);
        workingDocument = turn.workingDocument();
        creditsUsed = creditsUsed + turn.creditsUsed();
    }

    void finish(SessionStatus finalStatus, String reason) {
        this.terminationReason = reason;
        this.status = finalStatus;
    }
}
