package io.github.hide212131.langchain4j.atelier.runtime.evaluation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.hide212131.langchain4j.atelier.runtime.model.CriterionScore;
import io.github.hide212131.langchain4j.atelier.runtime.model.Evaluation;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts an agent's self-evaluation from its free-text response.
 *
 * <p>Three strategies are tried in order and the first success wins:</p>
 * <ol>
 *   <li>a fenced {@code ```json} block, or else the first balanced {@code {...}} object;</li>
 *   <li>inline {@code "Criterion: 7/10"} patterns for each expected criterion;</li>
 *   <li>any integers from 1 to 10, assigned positionally to the expected criteria.</li>
 * </ol>
 *
 * <p>Never throws. A response without a usable evaluation yields a failed result carrying the reason.</p>
 */
public final class EvaluationParser {

    static final String AUTO_EXTRACTED = "(Auto-extracted)";
    static final String FALLBACK_SUMMARY = "(Scores extracted via fallback parsing)";

    private static final Pattern FENCED_JSON = Pattern.compile("```json\\s*(\\{.*?\\})\\s*```", Pattern.DOTALL);
    private static final Pattern OVERALL = Pattern.compile(
            "overall\\s*(?:score)?:?\\s*(\\d+(?:\\.\\d+)?)\\s*(?:/\\s*10)?", Pattern.CASE_INSENSITIVE);
    private static final Pattern SUMMARY = Pattern.compile(
            "(?:summary|overall assessment):?\\s*(.+?)(?:\\n\\n|\\n#|$)", Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    private static final Pattern LOOSE_SCORE = Pattern.compile("\\b([1-9]|10)(?:\\.\\d+)?\\b");
    private static final int JUSTIFICATION_LOOKAHEAD = 200;

    private final ObjectMapper objectMapper;

    public EvaluationParser() {
        this(new ObjectMapper());
    }

    public EvaluationParser(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    }

    public EvaluationParseResult parse(String rawResponse, List<String> expectedCriteria) {
        String text = rawResponse == null ? "" : rawResponse;
        List<String> criteria = expectedCriteria == null ? List.of() : expectedCriteria;

        Attempt attempt = tryStructured(text);
        if (attempt.evaluation() != null) {
            return EvaluationParseResult.success(attempt.evaluation());
        }
        attempt = tryNaturalLanguage(text, criteria);
        if (attempt.evaluation() != null) {
            return EvaluationParseResult.success(attempt.evaluation());
        }
        attempt = tryLooseNumbers(text, criteria);
        if (attempt.evaluation() != null) {
            return EvaluationParseResult.success(attempt.evaluation());
        }
        return EvaluationParseResult.failure("Failed to parse evaluation: " + attempt.error());
    }

    private Attempt tryStructured(String text) {
        Matcher fenced = FENCED_JSON.matcher(text);
        if (fenced.find()) {
            try {
                return fromTree(objectMapper.readTree(fenced.group(1)));
            } catch (JsonProcessingException e) {
                return Attempt.failed("JSON decode error: " + e.getOriginalMessage());
            }
        }
        String balanced = firstBalancedObject(text);
        if (balanced != null) {
            try {
                return fromTree(objectMapper.readTree(balanced));
            } catch (JsonProcessingException e) {
                return Attempt.failed("No valid JSON found");
            }
        }
        return Attempt.failed("No valid JSON found");
    }

    private Attempt fromTree(JsonNode root) {
        if (root == null || !root.isObject()) {
            return Attempt.failed("JSON structure error: not an object");
        }
        JsonNode data = root.has("evaluation") && root.get("evaluation").isObject() ? root.get("evaluation") : root;
        try {
            List<CriterionScore> scores = new ArrayList<>();
            JsonNode list = data.path("criteria_scores");
            if (list.isArray()) {
                for (JsonNode entry : list) {
                    JsonNode criterion = entry.get("criterion");
                    JsonNode score = entry.get("score");
                    if (criterion == null || score == null) {
                        return Attempt.failed("JSON structure error: criterion entry needs 'criterion' and 'score'");
                    }
                    scores.add(new CriterionScore(
                            criterion.asText(), toDouble(score), entry.path("justification").asText("")));
                }
            }
            double overall = data.has("overall_score") ? toDouble(data.get("overall_score")) : 0.0;
            if (overall == 0.0 && !scores.isEmpty()) {
                overall = mean(scores);
            }
            return Attempt.of(new Evaluation(scores, overall, data.path("summary").asText("")));
        } catch (IllegalArgumentException e) {
            return Attempt.failed("JSON structure error: " + e.getMessage());
        }
    }

    private Attempt tryNaturalLanguage(String text, List<String> expectedCriteria) {
        List<CriterionScore> scores = new ArrayList<>();
        for (String criterion : expectedCriteria) {
            Pattern pattern = Pattern.compile(
                    Pattern.quote(criterion) + "\\s*:?\\s*(\\d+(?:\\.\\d+)?)\\s*(?:/\\s*10)?",
                    Pattern.CASE_INSENSITIVE);
            Matcher matcher = pattern.matcher(text);
            if (!matcher.find()) {
                continue;
            }
            double score = Double.parseDouble(matcher.group(1));
            if (score < 1.0 || score > 10.0) {
                continue;
            }
            scores.add(new CriterionScore(criterion, score, justificationAfter(text, matcher.end())));
        }
        if (scores.isEmpty()) {
            return Attempt.failed("No natural language scores found");
        }

        double overall = mean(scores);
        Matcher overallMatcher = OVERALL.matcher(text);
        if (overallMatcher.find()) {
            double explicit = Double.parseDouble(overallMatcher.group(1));
            if (explicit >= 1.0 && explicit <= 10.0) {
                overall = explicit;
            }
        }
        Matcher summaryMatcher = SUMMARY.matcher(text);
        String summary = summaryMatcher.find() ? summaryMatcher.group(1).trim() : "";
        return Attempt.of(new Evaluation(scores, overall, summary));
    }

    private Attempt tryLooseNumbers(String text, List<String> expectedCriteria) {
        if (expectedCriteria.isEmpty()) {
            return Attempt.failed("No extractable scores found");
        }
        List<Double> numbers = new ArrayList<>();
        Matcher matcher = LOOSE_SCORE.matcher(text);
        while (matcher.find() && numbers.size() < expectedCriteria.size()) {
            numbers.add(Double.parseDouble(matcher.group(1)));
        }
        if (numbers.isEmpty()) {
            return Attempt.failed("No extractable scores found");
        }
        List<CriterionScore> scores = new ArrayList<>();
        for (int i = 0; i < numbers.size(); i++) {
            scores.add(new CriterionScore(expectedCriteria.get(i), numbers.get(i), AUTO_EXTRACTED));
        }
        return Attempt.of(new Evaluation(scores, mean(scores), FALLBACK_SUMMARY));
    }

    static String firstBalancedObject(String text) {
        int start = text.indexOf('{');
        if (start < 0) {
            return null;
        }
        int depth = 0;
        for (int i = start; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth == 0) {
                    return text.substring(start, i + 1);
                }
            }
        }
        return null;
    }

    private static String justificationAfter(String text, int position) {
        String window = text.substring(position, Math.min(text.length(), position + JUSTIFICATION_LOOKAHEAD));
        if (window.isBlank()) {
            return "";
        }
        String firstLine = window.split("\n", -1)[0];
        return stripChars(firstLine, ": -");
    }

    private static String stripChars(String value, String chars) {
        int begin = 0;
        int end = value.length();
        while (begin < end && chars.indexOf(value.charAt(begin)) >= 0) {
            begin++;
        }
        while (end > begin && chars.indexOf(value.charAt(end - 1)) >= 0) {
            end--;
        }
        return value.substring(begin, end);
    }

    private static double toDouble(JsonNode node) {
        if (node.isNumber()) {
            return node.asDouble();
        }
        try {
            return Double.parseDouble(node.asText().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("not a number: " + node.asText(), e);
        }
    }

    private static double mean(List<CriterionScore> scores) {
        return scores.stream().mapToDouble(CriterionScore::score).average().orElse(0.0);
    }

    private record Attempt(Evaluation evaluation, String error) {
        static Attempt of(Evaluation evaluation) {
            return new Attempt(evaluation, null);
        }

        static Attempt failed(String error) {
            return new Attempt(null, error);
        }
    }
}
