package io.github.hide212131.langchain4j.atelier.runtime.session.event;

/** Non-fatal failure. {@code agentId} and {@code fault} are null for session-level errors. */
public record ErrorPayload(String agentId, String message, String fault) implements SessionEventPayload {

    public ErrorPayload {
        if (message == null || message.isBlank()) {
            message = "Unknown error";
        }
    }

    @Override
    public SessionEventType type() {
        return SessionEventType.ERROR;
    }
}
