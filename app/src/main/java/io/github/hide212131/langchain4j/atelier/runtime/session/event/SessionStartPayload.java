package io.github.hide212131.langchain4j.atelier.runtime.session.event;

import java.util.List;

public record SessionStartPayload(
        int agentCount, List<AgentSummary> agents, int maxRounds, Double scoreThreshold, String flowType)
        implements SessionEventPayload {

    public SessionStartPayload {
        agents = agents == null ? List.of() : List.copyOf(agents);
    }

    @Override
    public SessionEventType type() {
        return SessionEventType.SESSION_START;
    }

    public record AgentSummary(String id, String name, int phase) {}
}
