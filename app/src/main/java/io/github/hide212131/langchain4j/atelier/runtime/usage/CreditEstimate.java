package io.github.hide212131.langchain4j.atelier.runtime.usage;

import java.util.List;
import java.util.Objects;

public record CreditEstimate(int totalCredits, List<AgentEstimate> agents) {

    public CreditEstimate {
        agents = List.copyOf(Objects.requireNonNull(agents, "agents"));
    }

    public boolean hasSufficientCredits(int balance) {
        return balance >= totalCredits;
    }
}
