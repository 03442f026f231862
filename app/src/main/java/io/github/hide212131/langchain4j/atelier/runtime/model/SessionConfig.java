package io.github.hide212131.langchain4j.atelier.runtime.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Everything a session starts from. Read-only once the session runs.
 */
public record SessionConfig(
        String sessionId,
        String title,
        String projectId,
        String userId,
        String initialPrompt,
        String workingDocument,
        Map<String, String> referenceDocuments,
        String referenceInstructions,
        String projectInstructions,
        DraftTreatment draftTreatment,
        List<AgentConfig> agents,
        TerminationCondition termination,
        FlowType flowType) {

    public static final int MAX_AGENTS = 5;

    public SessionConfig {
        Objects.requireNonNull(sessionId, "sessionId");
        Objects.requireNonNull(initialPrompt, "initialPrompt");
        Objects.requireNonNull(agents, "agents");
        Objects.requireNonNull(termination, "termination");
        if (sessionId.isBlank()) {
            throw new IllegalArgumentException("sessionId must not be blank");
        }
        if (agents.isEmpty() || agents.size() > MAX_AGENTS) {
            throw new IllegalArgumentException("a session needs between 1 and " + MAX_AGENTS + " agents, got " + agents.size());
        }
        Set<String> ids = new HashSet<>();
        for (AgentConfig agent : agents) {
            if (!ids.add(agent.agentId())) {
                throw new IllegalArgumentException("duplicate agent id: " + agent.agentId());
            }
        }
        agents = List.copyOf(agents);
        workingDocument = workingDocument == null ? "" : workingDocument;
        referenceDocuments = referenceDocuments == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(referenceDocuments));
        draftTreatment = draftTreatment == null ? DraftTreatment.MODERATE_REVISION : draftTreatment;
        flowType = flowType == null ? FlowType.PARALLEL_CRITIQUE : flowType;
    }

    public List<AgentConfig> activeAgents(Phase phase) {
        return agents.stream().filter(AgentConfig::active).filter(agent -> agent.phase() == phase).toList();
    }

    public List<AgentConfig> activeAgents() {
        return agents.stream().filter(AgentConfig::active).toList();
    }

    public Optional<AgentConfig> firstActive(Phase phase) {
        return activeAgents(phase).stream().findFirst();
    }

    public Optional<String> optionalUserId() {
        return Optional.ofNullable(userId).filter(id -> !id.isBlank());
    }

    public String displayTitle() {
        return title == null || title.isBlank() ? sessionId : title;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String sessionId;
        private String title;
        private String projectId;
        private String userId;
        private String initialPrompt;
        private String workingDocument = "";
        private final Map<String, String> referenceDocuments = new LinkedHashMap<>();
        private String referenceInstructions;
        private String projectInstructions;
        private DraftTreatment draftTreatment;
        private final List<AgentConfig> agents = new ArrayList<>();
        private TerminationCondition termination = TerminationCondition.maxRounds(1);
        private FlowType flowType;

        private Builder() {
        }

        public Builder sessionId(String sessionId) {
            this.sessionId = sessionId;
            return this;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder projectId(String projectId) {
            this.projectId = projectId;
            return this;
        }

        public Builder userId(String userId) {
            this.userId = userId;
            return this;
        }

        public Builder initialPrompt(String initialPrompt) {
            this.initialPrompt = initialPrompt;
            return this;
        }

        public Builder workingDocument(String workingDocument) {
            this.workingDocument = workingDocument;
            return this;
        }

        public Builder referenceDocument(String filename, String content) {
            this.referenceDocuments.put(filename, content);
            return this;
        }

        public Builder referenceDocuments(Map<String, String> documents) {
            this.referenceDocuments.putAll(documents);
            return this;
        }

        public Builder referenceInstructions(String referenceInstructions) {
            this.referenceInstructions = referenceInstructions;
            return this;
        }

        public Builder projectInstructions(String projectInstructions) {
            this.projectInstructions = projectInstructions;
            return this;
        }

        public Builder draftTreatment(DraftTreatment draftTreatment) {
            this.draftTreatment = draftTreatment;
            return this;
        }

        public Builder agent(AgentConfig agent) {
            this.agents.add(agent);
            return this;
        }

        public Builder agents(List<AgentConfig> agents) {
            this.agents.addAll(agents);
            return this;
        }

        public Builder termination(TerminationCondition termination) {
            this.termination = termination;
            return this;
        }

        public Builder flowType(FlowType flowType) {
            this.flowType = flowType;
            return this;
        }

        public SessionConfig build() {
            return new SessionConfig(
                    sessionId,
                    title,
                    projectId,
                    userId,
                    initialPrompt,
                    workingDocument,
                    referenceDocuments,
                    referenceInstructions,
                    projectInstructions,
                    draftTreatment,
                    agents,
                    termination,
                    flowType);
        }
    }
}
