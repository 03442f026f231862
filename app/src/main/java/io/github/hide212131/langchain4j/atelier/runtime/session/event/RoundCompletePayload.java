package io.github.hide212131.langchain4j.atelier.runtime.session.event;

public record RoundCompletePayload(int round, int turnsInRound) implements SessionEventPayload {

    @Override
    public SessionEventType type() {
        return SessionEventType.ROUND_COMPLETE;
    }
}
