package io.github.hide212131.langchain4j.atelier.runtime.session;

import io.github.hide212131.langchain4j.atelier.runtime.model.SessionStatus;

/** Unwinds a running session on cancellation or credit exhaustion. Never leaves the scheduler. */
final class SessionAbortedException extends RuntimeException {

    static final String STOPPED_BY_USER = "Stopped by user";
    static final String CREDIT_DEPLETED = "credit_depleted";
    static final String INSUFFICIENT_CREDITS = "Insufficient credits";
    static final String INSUFFICIENT_CREDITS_MESSAGE = "Session stopped: insufficient credits remaining";

    private final SessionStatus status;
    private final String stateReason;
    private final String eventReason;
    private final String eventMessage;

    private SessionAbortedException(SessionStatus status, String stateReason, String eventReason, String eventMessage) {
        super(stateReason, null, false, false);
        this.status = status;
        this.stateReason = stateReason;
        this.eventReason = eventReason;
        this.eventMessage = eventMessage;
    }

    static SessionAbortedException cancelled() {
        return new SessionAbortedException(SessionStatus.CANCELLED, STOPPED_BY_USER, STOPPED_BY_USER, null);
    }

    static SessionAbortedException creditDepleted() {
        return new SessionAbortedException(
                SessionStatus.COMPLETED, INSUFFICIENT_CREDITS, CREDIT_DEPLETED, INSUFFICIENT_CREDITS_MESSAGE);
    }

    SessionStatus status() {
        return status;
    }

    String stateReason() {
        return stateReason;
    }

    String eventReason() {
        return eventReason;
    }

    String eventMessage() {
        return eventMessage;
    }
}
