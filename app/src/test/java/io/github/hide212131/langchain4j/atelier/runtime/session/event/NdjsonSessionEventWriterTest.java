package io.github.hide212131.langchain4j.atelier.runtime.session.event;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.ByteArrayOutputStream;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class NdjsonSessionEventWriterTest {

    private static final Instant AT = Instant.parse("2026-03-01T10:15:30Z");

    private final ObjectMapper reader = new ObjectMapper();

    @Test
    @DisplayName("Envelope fields come first, payload fields follow in snake_case")
    void envelopeThenPayload() throws Exception {
        NdjsonSessionEventWriter writer = new NdjsonSessionEventWriter(new StringWriter(), false);

        String line = writer.toJson(new SessionEvent("s-1", AT, new CreditWarningPayload(4, 12, "Low credits")));

        assertThat(line).startsWith(
                "{\"type\":\"credit_warning\",\"session_id\":\"s-1\",\"timestamp\":\"2026-03-01T10:15:30Z\",");
        JsonNode node = reader.readTree(line);
        assertThat(node.get("remaining_credits").asInt()).isEqualTo(4);
        assertThat(node.get("session_credits_used").asInt()).isEqualTo(12);
        assertThat(node.get("message").asText()).isEqualTo("Low credits");
    }

    @Test
    void nullFieldsAreOmitted() throws Exception {
        NdjsonSessionEventWriter writer = new NdjsonSessionEventWriter(new StringWriter(), false);

        JsonNode regular = reader.readTree(writer.toJson(new SessionEvent("s-1", AT, new RoundStartPayload(2, 3, null))));
        JsonNode complete = reader.readTree(writer.toJson(
                new SessionEvent("s-1", AT, new SessionCompletePayload("max_rounds", null, 3, 9, null))));

        assertThat(regular.has("is_final_pass")).isFalse();
        assertThat(regular.get("max_rounds").asInt()).isEqualTo(3);
        assertThat(complete.has("message")).isFalse();
        assertThat(complete.has("credits_used")).isFalse();
        assertThat(complete.get("turns_completed").asInt()).isEqualTo(9);
    }

    @Test
    @DisplayName("The final pass flag keeps its is_ prefix")
    void finalPassFlag() throws Exception {
        NdjsonSessionEventWriter writer = new NdjsonSessionEventWriter(new StringWriter(), false);

        JsonNode node = reader.readTree(writer.toJson(new SessionEvent("s-1", AT, new RoundStartPayload(4, 3, true))));

        assertThat(node.get("is_final_pass").asBoolean()).isTrue();
        assertThat(node.has("final_pass")).isFalse();
    }

    @Test
    void nestedPayloadsAreSnakeCased() throws Exception {
        NdjsonSessionEventWriter writer = new NdjsonSessionEventWriter(new StringWriter(), false);
        AgentCompletePayload payload = new AgentCompletePayload(
                "style_editor",
                "Style Editor",
                3,
                1,
                2,
                null,
                new AgentCompletePayload.EvaluationSummary(
                        7.5, List.of(new AgentCompletePayload.ScoreEntry("Rhythm", 7.5))),
                120,
                new AgentCompletePayload.TurnUsage(900, 300, 1, 4));

        JsonNode node = reader.readTree(writer.toJson(new SessionEvent("s-1", AT, payload)));

        assertThat(node.get("agent_id").asText()).isEqualTo("style_editor");
        assertThat(node.get("evaluation").get("overall_score").asDouble()).isEqualTo(7.5);
        assertThat(node.get("evaluation").get("criteria_scores").get(0).get("criterion").asText()).isEqualTo("Rhythm");
        assertThat(node.get("usage").get("session_total_credits").asInt()).isEqualTo(4);
        assertThat(node.get("output_length").asInt()).isEqualTo(120);
    }

    @Test
    @DisplayName("Each published event is one flushed line")
    void publishWritesOneLinePerEvent() {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        NdjsonSessionEventWriter writer = new NdjsonSessionEventWriter(out);

        writer.publish(new SessionEvent("s-1", AT, new AgentTokenPayload("writer", "Hel")));
        writer.publish(new SessionEvent("s-1", AT, new AgentTokenPayload("writer", "lo\n")));

        String[] lines = out.toString(StandardCharsets.UTF_8).split("\n");
        assertThat(lines).hasSize(2);
        assertThat(lines[1]).contains("\"token\":\"lo\\n\"");
    }

    @Test
    void blankErrorMessageBecomesUnknownError() {
        assertThat(new ErrorPayload(null, " ", null).message()).isEqualTo("Unknown error");
        assertThat(new ErrorPayload("writer", null, "fatal").message()).isEqualTo("Unknown error");
    }

    @Test
    void fanOutForwardsToEveryPublisherInOrder() {
        SessionEventCollector first = new SessionEventCollector();
        SessionEventCollector second = new SessionEventCollector();
        SessionEventPublisher publisher = SessionEventPublisher.fanOut(List.of(first, second));

        publisher.publish(new SessionEvent("s-1", AT, new RoundCompletePayload(1, 2)));

        assertThat(first.types()).containsExactly(SessionEventType.ROUND_COMPLETE);
        assertThat(second.payloads(RoundCompletePayload.class)).containsExactly(new RoundCompletePayload(1, 2));
    }
}
