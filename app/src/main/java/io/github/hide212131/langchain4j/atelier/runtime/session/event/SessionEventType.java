package io.github.hide212131.langchain4j.atelier.runtime.session.event;

/** Event kinds of the session stream, with their wire names. */
public enum SessionEventType {
    SESSION_START("session_start"),
    ROUND_START("round_start"),
    AGENT_START("agent_start"),
    AGENT_TOKEN("agent_token"),
    AGENT_COMPLETE("agent_complete"),
    ROUND_COMPLETE("round_complete"),
    CREDIT_WARNING("credit_warning"),
    SESSION_PAUSED("session_paused"),
    SESSION_RESUMED("session_resumed"),
    SESSION_COMPLETE("session_complete"),
    ERROR("error");

    private final String wireName;

    SessionEventType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
