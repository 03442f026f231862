package io.github.hide212131.langchain4j.atelier.runtime.provider;

import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.output.TokenUsage;
import io.github.hide212131.langchain4j.atelier.runtime.usage.UsageMeter;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Deterministic offline answers in the evaluation format, for {@code --dry-run} sessions.
 */
final class DryRunResponder {

    private static final Pattern CRITERION = Pattern.compile("\"criterion\":\\s*\"([^\"]+)\"");
    private static final Pattern CHUNK_BOUNDARY = Pattern.compile("(?<=\\s)");

    private DryRunResponder() {
    }

    static ChatResponse respond(ChatRequest request) {
        String prompt = userText(request);
        String text = compose(prompt);
        return ChatResponse.builder()
                .aiMessage(AiMessage.from(text))
                .tokenUsage(new TokenUsage(UsageMeter.estimateTokens(prompt), UsageMeter.estimateTokens(text)))
                .modelName(request.parameters() != null ? request.parameters().modelName() : "dry-run")
                .build();
    }

    static List<String> chunks(String text) {
        List<String> chunks = new ArrayList<>();
        for (String piece : CHUNK_BOUNDARY.split(text)) {
            if (!piece.isEmpty()) {
                chunks.add(piece);
            }
        }
        return chunks;
    }

    private static String compose(String prompt) {
        String body;
        if (prompt.contains("PRIORITIZED REVISION DIRECTIVE")) {
            body = "MUST: tighten the opening paragraph.\nSHOULD: vary sentence length.\nIGNORE: minor stylistic preferences.";
        } else if (prompt.contains("Do NOT rewrite the document")) {
            body = "The draft is coherent. Consider clarifying the central claim and trimming repetition.";
        } else {
            body = "Dry-run draft. " + firstLine(prompt);
        }
        StringBuilder json = new StringBuilder();
        json.append(body).append("\n\n```json\n{\n  \"evaluation\": {\n    \"criteria_scores\": [");
        Set<String> criteria = criteriaIn(prompt);
        int i = 0;
        for (String criterion : criteria) {
            json.append(i++ == 0 ? "\n" : ",\n")
                    .append("      {\"criterion\": \"").append(criterion)
                    .append("\", \"score\": 8, \"justification\": \"Offline placeholder\"}");
        }
        json.append("\n    ],\n    \"overall_score\": 8.0,\n    \"summary\": \"Dry-run evaluation\"\n  }\n}\n```");
        return json.toString();
    }

    private static Set<String> criteriaIn(String prompt) {
        Set<String> names = new LinkedHashSet<>();
        Matcher matcher = CRITERION.matcher(prompt);
        while (matcher.find()) {
            names.add(matcher.group(1));
        }
        return names;
    }

    private static String firstLine(String prompt) {
        int marker = prompt.indexOf("=== YOUR TASK ===");
        String tail = marker >= 0 ? prompt.substring(marker + "=== YOUR TASK ===".length()) : prompt;
        for (String line : tail.split("\n")) {
            if (!line.isBlank()) {
                return line.trim();
            }
        }
        return "";
    }

    private static String userText(ChatRequest request) {
        StringBuilder text = new StringBuilder();
        for (ChatMessage message : request.messages()) {
            if (message instanceof UserMessage user && user.hasSingleText()) {
                text.append(user.singleText());
            }
        }
        return text.toString();
    }
}
