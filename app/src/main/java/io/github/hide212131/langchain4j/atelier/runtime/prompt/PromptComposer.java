package io.github.hide212131.langchain4j.atelier.runtime.prompt;

import io.github.hide212131.langchain4j.atelier.runtime.model.AgentConfig;
import io.github.hide212131.langchain4j.atelier.runtime.model.DraftTreatment;
import io.github.hide212131.langchain4j.atelier.runtime.model.EvaluationCriterion;
import io.github.hide212131.langchain4j.atelier.runtime.model.SessionConfig;
import java.util.Map;

/**
 * Builds the system and user prompts for each role.
 *
 * <p>Every user prompt ends with the evaluation-format block naming the agent's own criteria, which is what
 * {@code EvaluationParser} looks for in the response.</p>
 */
public final class PromptComposer {

    static final String PARTICIPANT_STATEMENT = "You are participating in a multi-agent writing refinement process.";
    static final String NO_FEEDBACK = "(No editorial feedback from previous round)";

    public String systemPrompt(AgentConfig agent) {
        StringBuilder system = new StringBuilder(agent.roleDescription());
        system.append("\n\n").append(PARTICIPANT_STATEMENT);
        system.append("\n\nYour evaluation criteria are:");
        for (EvaluationCriterion criterion : agent.evaluationCriteria()) {
            system.append("\n- ").append(criterion.name()).append(": ").append(criterion.description());
        }
        return system.toString();
    }

    /**
     * First Writer turn of a session: produces the initial draft, or reworks the user's own draft.
     */
    public AgentPrompt writerFirstTurn(SessionConfig config, AgentConfig agent) {
        StringBuilder prompt = new StringBuilder();
        String projectInstructions = config.projectInstructions();
        if (projectInstructions != null && !projectInstructions.isBlank()) {
            prompt.append("=== PROJECT INSTRUCTIONS ===\n").append(projectInstructions.trim()).append("\n\n");
        }
        appendReferences(prompt, config);
        if (!config.workingDocument().isBlank()) {
            prompt.append("=== YOUR DRAFT ===\n")
                    .append("(The user supplied this draft. ")
                    .append(treatmentDirective(config.draftTreatment()))
                    .append(")\n\n")
                    .append(config.workingDocument().trim())
                    .append("\n\n");
        }
        prompt.append("=== YOUR TASK ===\n").append(config.initialPrompt().trim());
        appendEvaluationFormat(prompt, agent);
        return new AgentPrompt(systemPrompt(agent), prompt.toString());
    }

    /**
     * Later Writer turns. {@code directive} is the Synthesizer's directive the revision must follow, or the
     * round's aggregated editor feedback when no Synthesizer ran; blank means no feedback.
     */
    public AgentPrompt writerRevision(
            SessionConfig config, AgentConfig agent, String currentDocument, String directive, boolean finalPass) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("=== ORIGINAL TASK (AUTHORITATIVE) ===\n")
                .append(config.initialPrompt().trim())
                .append("\n\n");
        appendReferences(prompt, config);
        appendWorkingDocument(prompt, currentDocument);
        prompt.append("=== REVISION DIRECTIVE ===\n")
                .append(directive == null || directive.isBlank() ? NO_FEEDBACK : directive.trim())
                .append("\n\n");
        prompt.append("=== YOUR TASK ===\n");
        if (finalPass) {
            prompt.append("This is the final revision. Apply the directive above and deliver the finished document.\n\n");
        } else {
            prompt.append("Revise the WORKING DOCUMENT according to the directive above.\n\n");
        }
        prompt.append("Instructions:\n")
                .append("- The ORIGINAL TASK is authoritative: where editorial feedback conflicts with it, honor the task\n")
                .append("- Incorporate feedback that strengthens the work\n")
                .append("- Push back (in your self-evaluation) on suggestions that would weaken it\n")
                .append("- Preserve what's working\n")
                .append("- Produce a complete revised draft");
        appendEvaluationFormat(prompt, agent);
        return new AgentPrompt(systemPrompt(agent), prompt.toString());
    }

    public AgentPrompt editor(SessionConfig config, AgentConfig agent, String currentDocument) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("=== ORIGINAL TASK (FOR CONTEXT ONLY) ===\n")
                .append(config.initialPrompt().trim())
                .append("\n\n");
        appendWorkingDocument(prompt, currentDocument);
        prompt.append("=== YOUR TASK ===\n")
                .append("Review the WORKING DOCUMENT above and provide your editorial feedback.\n\n")
                .append(EditorFocus.forAgent(agent.agentId()))
                .append("\n\n")
                .append(EditorFocus.NO_REWRITE);
        appendEvaluationFormat(prompt, agent);
        return new AgentPrompt(systemPrompt(agent), prompt.toString());
    }

    /**
     * {@code editorFeedback} must hold this round's editor feedback only.
     */
    public AgentPrompt synthesizer(SessionConfig config, AgentConfig agent, String currentDocument, String editorFeedback) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("=== ORIGINAL TASK ===\n").append(config.initialPrompt().trim()).append("\n\n");
        appendWorkingDocument(prompt, currentDocument);
        prompt.append("=== EDITORIAL FEEDBACK (THIS ROUND) ===\n")
                .append(editorFeedback == null || editorFeedback.isBlank() ? NO_FEEDBACK : editorFeedback.trim())
                .append("\n\n");
        prompt.append("=== YOUR TASK ===\n")
                .append("Review all editorial feedback from this round and produce a PRIORITIZED REVISION DIRECTIVE.\n\n")
                .append("Your output should be:\n")
                .append("1. A clear hierarchy of what MUST change, what SHOULD change, and what can be ignored\n")
                .append("2. When editors conflict, make the call and explain your reasoning; ")
                .append("resolve conflicts in favor of the ORIGINAL TASK\n")
                .append("3. Specific, actionable direction for the Writer\n\n")
                .append("Do NOT rewrite the document. Produce a revision directive only.");
        appendEvaluationFormat(prompt, agent);
        return new AgentPrompt(systemPrompt(agent), prompt.toString());
    }

    /**
     * Joins editor outputs into one section per editor, labelled with the editor's name.
     */
    public static String aggregateFeedback(Map<String, String> feedbackByAgentName) {
        if (feedbackByAgentName.isEmpty()) {
            return NO_FEEDBACK;
        }
        StringBuilder joined = new StringBuilder();
        for (Map.Entry<String, String> entry : feedbackByAgentName.entrySet()) {
            if (joined.length() > 0) {
                joined.append("\n---\n");
            }
            joined.append("### ").append(entry.getKey()).append('\n').append(entry.getValue()).append('\n');
        }
        return joined.toString();
    }

    static String treatmentDirective(DraftTreatment treatment) {
        return switch (treatment) {
            case LIGHT_POLISH -> "Light polish: fix errors and smooth awkward phrasing. Keep the structure, "
                    + "argument and voice as they are.";
            case MODERATE_REVISION -> "Moderate revision: improve structure, clarity and flow where needed, "
                    + "keeping the author's core content and voice.";
            case FREE_REWRITE -> "Free rewrite: treat the draft as raw material and restructure or rewrite it "
                    + "as the task requires.";
        };
    }

    private static void appendReferences(StringBuilder prompt, SessionConfig config) {
        if (config.referenceDocuments().isEmpty()) {
            return;
        }
        prompt.append("=== REFERENCE MATERIALS ===\n")
                .append("(These are supporting documents for context only. Do NOT edit these.)\n");
        String instructions = config.referenceInstructions();
        if (instructions != null && !instructions.isBlank()) {
            prompt.append("\nHow to use these materials: ").append(instructions.trim()).append('\n');
        }
        config.referenceDocuments().forEach((filename, content) ->
                prompt.append("\n--- ").append(filename).append(" ---\n").append(content).append('\n'));
        prompt.append('\n');
    }

    private static void appendWorkingDocument(StringBuilder prompt, String currentDocument) {
        if (currentDocument == null || currentDocument.isBlank()) {
            return;
        }
        prompt.append("=== WORKING DOCUMENT ===\n")
                .append("(This is the central document being written and edited.)\n\n")
                .append(currentDocument.trim())
                .append("\n\n");
    }

    private static void appendEvaluationFormat(StringBuilder prompt, AgentConfig agent) {
        prompt.append("\n\n=== EVALUATION FORMAT ===\n")
                .append("After completing your task, provide a structured evaluation in the following JSON format:\n\n")
                .append("```json\n")
                .append("{\n")
                .append("  \"output\": \"Your revised text or critique goes here\",\n")
                .append("  \"evaluation\": {\n")
                .append("    \"criteria_scores\": [\n");
        int remaining = agent.evaluationCriteria().size();
        for (EvaluationCriterion criterion : agent.evaluationCriteria()) {
            remaining--;
            prompt.append("      {\"criterion\": \"").append(criterion.name())
                    .append("\", \"score\": 7, \"justification\": \"Brief explanation\"}")
                    .append(remaining > 0 ? ",\n" : "\n");
        }
        prompt.append("    ],\n")
                .append("    \"overall_score\": 7.5,\n")
                .append("    \"summary\": \"Brief overall assessment\"\n")
                .append("  }\n")
                .append("}\n")
                .append("```\n\n")
                .append("Score each criterion from 1-10. The overall score should be the average of criterion scores.\n");
    }
}
