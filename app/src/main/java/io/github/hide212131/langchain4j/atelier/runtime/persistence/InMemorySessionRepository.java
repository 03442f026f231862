package io.github.hide212131.langchain4j.atelier.runtime.persistence;

import io.github.hide212131.langchain4j.atelier.runtime.model.ExchangeTurn;
import io.github.hide212131.langchain4j.atelier.runtime.model.Phase;
import io.github.hide212131.langchain4j.atelier.runtime.model.SessionConfig;
import io.github.hide212131.langchain4j.atelier.runtime.model.SessionStatus;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local {@link SessionRepository} for the command line and tests.
 */
public final class InMemorySessionRepository implements SessionRepository {

    private final Map<String, StoredSession> sessions = new ConcurrentHashMap<>();

    @Override
    public void createSession(SessionConfig config) {
        StoredSession previous = sessions.putIfAbsent(config.sessionId(), new StoredSession(config));
        if (previous != null) {
            throw new PersistenceException("Session already exists: " + config.sessionId());
        }
    }

    @Override
    public void updateStatus(String sessionId, SessionStatus status, String reason) {
        StoredSession session = require(sessionId);
        synchronized (session) {
            session.status = status;
            session.reason = reason;
        }
    }

    @Override
    public void appendTurn(String sessionId, ExchangeTurn turn, Phase phase, int tokensIn, int tokensOut, int credits) {
        StoredSession session = require(sessionId);
        synchronized (session) {
            session.turns.add(new StoredTurn(turn, phase, tokensIn, tokensOut, credits));
        }
    }

    @Override
    public void updateWorkingDocument(String sessionId, String text) {
        StoredSession session = require(sessionId);
        synchronized (session) {
            session.workingDocument = text;
        }
    }

    @Override
    public void updateRound(String sessionId, int round) {
        StoredSession session = require(sessionId);
        synchronized (session) {
            session.round = round;
        }
    }

    public Optional<SessionSnapshot> find(String sessionId) {
        StoredSession session = sessions.get(sessionId);
        if (session == null) {
            return Optional.empty();
        }
        synchronized (session) {
            return Optional.of(new SessionSnapshot(
                    session.config,
                    session.status,
                    session.reason,
                    session.round,
                    session.workingDocument,
                    List.copyOf(session.turns)));
        }
    }

    private StoredSession require(String sessionId) {
        StoredSession session = sessions.get(sessionId);
        if (session == null) {
            throw new PersistenceException("Unknown session: " + sessionId);
        }
        return session;
    }

    public record StoredTurn(ExchangeTurn turn, Phase phase, int tokensIn, int tokensOut, int credits) {}

    public record SessionSnapshot(
            SessionConfig config,
            SessionStatus status,
            String reason,
            int round,
            String workingDocument,
            List<StoredTurn> turns) {}

    private static final class StoredSession {
        private final SessionConfig config;
        private final List<StoredTurn> turns = new ArrayList<>();
        private SessionStatus status = SessionStatus.IDLE;
        private String reason;
        private int round;
        private String workingDocument;

        private StoredSession(SessionConfig config) {
            this.config = config;
            this.workingDocument = config.workingDocument();
        }
    }
}
