package io.github.hide212131.langchain4j.atelier.runtime.usage;

import io.github.hide212131.langchain4j.atelier.runtime.model.AgentConfig;
import io.github.hide212131.langchain4j.atelier.runtime.model.Phase;
import io.github.hide212131.langchain4j.atelier.runtime.model.SessionConfig;
import java.util.ArrayList;
import java.util.List;

/**
 * Converts token counts into credits and estimates a session before it starts.
 *
 * <p>One credit buys 10,000 tokens of a model with multiplier 1.0. Turn costs are rounded up per turn.
 * Estimates lean high: they decide whether a session may start at all.</p>
 */
public final class UsageMeter {

    public static final int TOKENS_PER_CREDIT = 10_000;
    public static final int CHARS_PER_TOKEN = 4;

    static final int WRITER_OVERHEAD_TOKENS = 500;
    static final int EDITOR_OVERHEAD_TOKENS = 300;
    static final int SYNTHESIZER_OVERHEAD_TOKENS = 300;
    static final int FEEDBACK_TOKENS_PER_EDITOR = 800;
    static final int OUTPUT_TOKENS_PER_RUN = 1000;
    static final double TOKENS_PER_WORD = 1.5;

    private UsageMeter() {
    }

    public static int estimateTokens(String text) {
        if (text == null) {
            return 1;
        }
        return Math.max(1, text.length() / CHARS_PER_TOKEN);
    }

    public static int creditsForTurn(String model, int inputTokens, int outputTokens) {
        double base = (double) (inputTokens + outputTokens) / TOKENS_PER_CREDIT;
        return (int) Math.ceil(base * ModelCatalog.multiplier(model));
    }

    public static CreditEstimate estimateSession(SessionConfig config) {
        return estimateSession(config.activeAgents(), config.termination().maxRounds(), documentWords(config));
    }

    public static CreditEstimate estimateSession(List<AgentConfig> agents, int maxRounds, int documentWords) {
        if (maxRounds < 1) {
            throw new IllegalArgumentException("maxRounds must be at least 1");
        }
        int documentTokens = (int) Math.ceil(Math.max(0, documentWords) * TOKENS_PER_WORD);
        long editors = agents.stream().filter(agent -> agent.phase() == Phase.EDITOR).count();

        List<AgentEstimate> estimates = new ArrayList<>();
        double total = 0.0;
        for (AgentConfig agent : agents) {
            int input = switch (agent.phase()) {
                case WRITER -> WRITER_OVERHEAD_TOKENS + documentTokens;
                case EDITOR -> EDITOR_OVERHEAD_TOKENS + documentTokens;
                case SYNTHESIZER -> SYNTHESIZER_OVERHEAD_TOKENS + documentTokens
                        + (int) editors * FEEDBACK_TOKENS_PER_EDITOR;
            };
            double multiplier = ModelCatalog.multiplier(agent.model());
            int runs = agent.phase() == Phase.WRITER ? maxRounds + 1 : maxRounds;
            double credits = (double) (input + OUTPUT_TOKENS_PER_RUN) / TOKENS_PER_CREDIT * multiplier * runs;
            estimates.add(new AgentEstimate(
                    agent.agentId(), agent.model(), agent.phase(), multiplier, input, OUTPUT_TOKENS_PER_RUN, runs, credits));
            total += credits;
        }
        return new CreditEstimate((int) Math.ceil(total), estimates);
    }

    /** Words the agents will read every run: the working document plus reference material. */
    static int documentWords(SessionConfig config) {
        int words = countWords(config.workingDocument());
        for (String reference : config.referenceDocuments().values()) {
            words += countWords(reference);
        }
        return words;
    }

    static int countWords(String text) {
        if (text == null || text.isBlank()) {
            return 0;
        }
        return text.trim().split("\\s+").length;
    }
}
