package io.github.hide212131.langchain4j.atelier.runtime.session.event;

public record CreditWarningPayload(int remainingCredits, int sessionCreditsUsed, String message)
        implements SessionEventPayload {

    @Override
    public SessionEventType type() {
        return SessionEventType.CREDIT_WARNING;
    }
}
