package io.github.hide212131.langchain4j.atelier.runtime.evaluation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Separates the deliverable text of a response from its JSON evaluation wrapper.
 *
 * <p>Prose written before a JSON block is the deliverable. A response that is JSON throughout yields its
 * narrative fields followed by {@code output}. Truncated JSON, common when a stream was cut off, is read
 * field by field with patterns that accept an unterminated final string.</p>
 */
public final class ContentExtractor {

    private static final Pattern JSON_START = Pattern.compile("```(?:json)?\\s*\\{|(?m)^\\s*\\{");
    private static final Pattern LEADING_FENCE = Pattern.compile("^```(?:json)?\\s*\\n?");
    private static final Pattern TRAILING_FENCE = Pattern.compile("\\n?```\\s*$");

    private final ObjectMapper objectMapper;

    public ContentExtractor() {
        this(new ObjectMapper());
    }

    public ContentExtractor(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    }

    public String extract(String rawResponse) {
        if (rawResponse == null || rawResponse.isBlank()) {
            return "";
        }
        String text = rawResponse.trim();
        Matcher jsonStart = JSON_START.matcher(text);
        if (!jsonStart.find()) {
            return text;
        }
        String prose = text.substring(0, jsonStart.start()).trim();
        if (!prose.isEmpty()) {
            return prose;
        }

        String body = TRAILING_FENCE.matcher(LEADING_FENCE.matcher(text).replaceFirst("")).replaceFirst("").trim();
        AgentResponsePayload payload = readPayload(body);
        if (payload != null && !payload.isEmpty()) {
            return payload.joined();
        }
        AgentResponsePayload scanned = AgentResponsePayload.fromFields(scanFields(body));
        if (!scanned.isEmpty()) {
            return scanned.joined();
        }
        return text;
    }

    private AgentResponsePayload readPayload(String body) {
        String candidate = EvaluationParser.firstBalancedObject(body);
        if (candidate == null) {
            return null;
        }
        try {
            JsonNode root = objectMapper.readTree(candidate);
            return root != null && root.isObject() ? AgentResponsePayload.from(root) : null;
        } catch (JsonProcessingException e) {
            return null;
        }
    }

    static Map<String, String> scanFields(String body) {
        Map<String, String> fields = new LinkedHashMap<>();
        for (String key : AgentResponsePayload.NARRATIVE_FIELDS) {
            scanField(body, key).ifPresent(value -> fields.put(key, value));
        }
        scanField(body, "output").ifPresent(value -> fields.put("output", value));
        return fields;
    }

    private static Optional<String> scanField(String body, String key) {
        Pattern pattern = Pattern.compile("\"" + key + "\"\\s*:\\s*\"((?:[^\"\\\\]|\\\\.)*)(?:\"|\\\\?$)", Pattern.DOTALL);
        Matcher matcher = pattern.matcher(body);
        if (!matcher.find()) {
            return Optional.empty();
        }
        String value = unescape(matcher.group(1)).trim();
        return value.isEmpty() ? Optional.empty() : Optional.of(value);
    }

    static String unescape(String value) {
        StringBuilder out = new StringBuilder(value.length());
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c != '\\') {
                out.append(c);
                continue;
            }
            if (i + 1 >= value.length()) {
                // dangling escape at a truncation point
                break;
            }
            char next = value.charAt(++i);
            switch (next) {
                case 'n' -> out.append('\n');
                case 't' -> out.append('\t');
                case 'r' -> out.append('\r');
                case '"' -> out.append('"');
                case '\\' -> out.append('\\');
                case '/' -> out.append('/');
                case 'u' -> {
                    if (i + 4 < value.length()) {
                        try {
                            out.append((char) Integer.parseInt(value.substring(i + 1, i + 5), 16));
                            i += 4;
                        } catch (NumberFormatException e) {
                            out.append("\\u");
                        }
                    } else {
                        out.append("\\u");
                    }
                }
                default -> out.append(next);
            }
        }
        return out.toString();
    }
}
