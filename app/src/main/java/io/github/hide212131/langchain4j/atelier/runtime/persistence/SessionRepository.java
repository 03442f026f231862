package io.github.hide212131.langchain4j.atelier.runtime.persistence;

import io.github.hide212131.langchain4j.atelier.runtime.model.ExchangeTurn;
import io.github.hide212131.langchain4j.atelier.runtime.model.Phase;
import io.github.hide212131.langchain4j.atelier.runtime.model.SessionConfig;
import io.github.hide212131.langchain4j.atelier.runtime.model.SessionStatus;

/**
 * Storage the scheduler writes progress to. Calls are independent; implementations make
 * {@link #updateStatus} durable on its own so an interrupted session can always be marked stopped.
 *
 * <p>Implementations signal failures with {@link PersistenceException}.</p>
 */
public interface SessionRepository {

    void createSession(SessionConfig config);

    /** {@code reason} is nullable. */
    void updateStatus(String sessionId, SessionStatus status, String reason);

    void appendTurn(String sessionId, ExchangeTurn turn, Phase phase, int tokensIn, int tokensOut, int credits);

    void updateWorkingDocument(String sessionId, String text);

    void updateRound(String sessionId, int round);
}
