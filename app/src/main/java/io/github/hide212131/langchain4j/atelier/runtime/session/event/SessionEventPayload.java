package io.github.hide212131.langchain4j.atelier.runtime.session.event;

/** Marker implemented by every event payload. */
public sealed interface SessionEventPayload
        permits SessionStartPayload,
                RoundStartPayload,
                AgentStartPayload,
                AgentTokenPayload,
                AgentCompletePayload,
                RoundCompletePayload,
                CreditWarningPayload,
                SessionPausedPayload,
                SessionResumedPayload,
                SessionCompletePayload,
                ErrorPayload {

    SessionEventType type();
}
