package io.github.hide212131.langchain4j.atelier.runtime.prompt;

import java.util.Map;

/**
 * Fixed focus instructions per editor role, keyed by agent id.
 */
final class EditorFocus {

    static final String NO_REWRITE = "Do NOT rewrite the document. Provide feedback only.";

    private static final Map<String, String> FOCUS = Map.of(
            "content_expert",
            "Focus on: accuracy, completeness, intellectual depth. Flag oversimplifications, gaps, and claims that "
                    + "overreach evidence. Suggest specific additions.",
            "style_editor",
            "Focus on: sentence rhythm, word choice, transitions, clarity, economy. Cut throat-clearing, redundancy, "
                    + "jargon. Preserve the author's voice.",
            "fact_checker",
            "Focus on: verifiable claims, statistics, attributions. For each issue, specify what's claimed, why it's "
                    + "problematic, and what would resolve it.");

    private static final String GENERIC = "Provide editorial feedback.";

    private EditorFocus() {
    }

    static String forAgent(String agentId) {
        return FOCUS.getOrDefault(agentId, GENERIC);
    }
}
