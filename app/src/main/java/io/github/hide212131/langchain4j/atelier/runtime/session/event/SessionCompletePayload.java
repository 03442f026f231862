package io.github.hide212131.langchain4j.atelier.runtime.session.event;

/**
 * Terminal event. {@code message} and {@code creditsUsed} are only set when the session stopped on
 * credits or failed.
 */
public record SessionCompletePayload(
        String reason, String message, int roundsCompleted, int turnsCompleted, Integer creditsUsed)
        implements SessionEventPayload {

    @Override
    public SessionEventType type() {
        return SessionEventType.SESSION_COMPLETE;
    }
}
