package io.github.hide212131.langchain4j.atelier.runtime.session.event;

import java.time.Instant;
import java.util.Objects;

/** One entry of the session event stream. */
public record SessionEvent(String sessionId, Instant timestamp, SessionEventPayload payload) {

    public SessionEvent {
        Objects.requireNonNull(sessionId, "sessionId");
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(payload, "payload");
    }

    public SessionEventType type() {
        return payload.type();
    }

    /** Returns the payload when it has the given type. */
    public <P extends SessionEventPayload> P payloadAs(Class<P> payloadType) {
        return payloadType.cast(payload);
    }
}
