package io.github.hide212131.langchain4j.atelier.runtime.session.event;

import com.fasterxml.jackson.annotation.JsonProperty;

public record AgentStartPayload(
        String agentId,
        String agentName,
        int turnNumber,
        int roundNumber,
        int phase,
        @JsonProperty("is_final_pass") Boolean finalPass)
        implements SessionEventPayload {

    @Override
    public SessionEventType type() {
        return SessionEventType.AGENT_START;
    }
}
