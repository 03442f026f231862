package io.github.hide212131.langchain4j.atelier.runtime.session.event;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/** Keeps published events in memory. */
public final class SessionEventCollector implements SessionEventPublisher {

    private final List<SessionEvent> buffer = new CopyOnWriteArrayList<>();

    @Override
    public void publish(SessionEvent event) {
        buffer.add(Objects.requireNonNull(event, "event"));
    }

    public List<SessionEvent> events() {
        return List.copyOf(buffer);
    }

    public List<SessionEventType> types() {
        return buffer.stream().map(SessionEvent::type).toList();
    }

    public <P extends SessionEventPayload> List<P> payloads(Class<P> payloadType) {
        return buffer.stream()
                .map(SessionEvent::payload)
                .filter(payloadType::isInstance)
                .map(payloadType::cast)
                .toList();
    }

    public void clear() {
        buffer.clear();
    }
}
