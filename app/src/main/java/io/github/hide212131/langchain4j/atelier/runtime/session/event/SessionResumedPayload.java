package io.github.hide212131.langchain4j.atelier.runtime.session.event;

public record SessionResumedPayload(int turnNumber, int roundNumber) implements SessionEventPayload {

    @Override
    public SessionEventType type() {
        return SessionEventType.SESSION_RESUMED;
    }
}
