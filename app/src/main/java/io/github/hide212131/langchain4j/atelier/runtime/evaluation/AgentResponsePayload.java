package io.github.hide212131.langchain4j.atelier.runtime.evaluation;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Recognised top-level keys of a JSON-shaped agent response. Missing or non-text keys are absent, not errors.
 */
public record AgentResponsePayload(
        String output,
        String thinking,
        String reasoning,
        String analysis,
        String comments,
        String feedback,
        String suggestions,
        String changes,
        JsonNode evaluation) {

    /** Narrative keys in the order they precede {@code output}. */
    public static final List<String> NARRATIVE_FIELDS =
            List.of("thinking", "reasoning", "analysis", "comments", "feedback", "suggestions", "changes");

    static AgentResponsePayload from(JsonNode root) {
        return new AgentResponsePayload(
                text(root, "output"),
                text(root, "thinking"),
                text(root, "reasoning"),
                text(root, "analysis"),
                text(root, "comments"),
                text(root, "feedback"),
                text(root, "suggestions"),
                text(root, "changes"),
                root.get("evaluation"));
    }

    static AgentResponsePayload fromFields(Map<String, String> fields) {
        return new AgentResponsePayload(
                fields.get("output"),
                fields.get("thinking"),
                fields.get("reasoning"),
                fields.get("analysis"),
                fields.get("comments"),
                fields.get("feedback"),
                fields.get("suggestions"),
                fields.get("changes"),
                null);
    }

    public List<String> narrative() {
        List<String> parts = new ArrayList<>();
        for (String value : new String[] {thinking, reasoning, analysis, comments, feedback, suggestions, changes}) {
            if (value != null && !value.isBlank()) {
                parts.add(value.trim());
            }
        }
        return parts;
    }

    public Optional<String> optionalOutput() {
        return Optional.ofNullable(output).map(String::trim).filter(s -> !s.isEmpty());
    }

    public boolean isEmpty() {
        return optionalOutput().isEmpty() && narrative().isEmpty();
    }

    /** Deliverable text: narrative fields first, then the output, separated by blank lines. */
    public String joined() {
        List<String> parts = new ArrayList<>(narrative());
        optionalOutput().ifPresent(parts::add);
        return String.join("\n\n", parts);
    }

    private static String text(JsonNode root, String key) {
        JsonNode node = root.get(key);
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isTextual() || node.isNumber() || node.isBoolean()) {
            return node.asText();
        }
        if (node.isArray()) {
            List<String> items = new ArrayList<>();
            Iterator<JsonNode> elements = node.elements();
            while (elements.hasNext()) {
                JsonNode element = elements.next();
                items.add("- " + (element.isValueNode() ? element.asText() : element.toString()));
            }
            return String.join("\n", items);
        }
        return node.toString();
    }
}
