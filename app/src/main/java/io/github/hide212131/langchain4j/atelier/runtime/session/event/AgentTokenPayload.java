package io.github.hide212131.langchain4j.atelier.runtime.session.event;

public record AgentTokenPayload(String agentId, String token) implements SessionEventPayload {

    @Override
    public SessionEventType type() {
        return SessionEventType.AGENT_TOKEN;
    }
}
