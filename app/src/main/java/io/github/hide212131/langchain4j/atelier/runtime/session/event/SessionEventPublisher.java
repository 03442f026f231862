package io.github.hide212131.langchain4j.atelier.runtime.session.event;

import java.util.List;

/** Destination of session events. Called from the scheduler thread only. */
@FunctionalInterface
public interface SessionEventPublisher extends AutoCloseable {

    void publish(SessionEvent event);

    @Override
    default void close() {
        // default no-op
    }

    static SessionEventPublisher noop() {
        return event -> {
            // no-op
        };
    }

    /** Forwards every event to each publisher in order. */
    static SessionEventPublisher fanOut(List<? extends SessionEventPublisher> publishers) {
        List<SessionEventPublisher> targets = List.copyOf(publishers);
        return new SessionEventPublisher() {
            @Override
            public void publish(SessionEvent event) {
                for (SessionEventPublisher target : targets) {
                    target.publish(event);
                }
            }

            @Override
            public void close() {
                for (SessionEventPublisher target : targets) {
                    target.close();
                }
            }
        };
    }
}
