package io.github.hide212131.langchain4j.atelier.runtime.provider;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.sun.net.httpserver.HttpServer;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.StreamingChatModel;
import io.github.hide212131.langchain4j.atelier.runtime.evaluation.EvaluationParseResult;
import io.github.hide212131.langchain4j.atelier.runtime.evaluation.EvaluationParser;
import io.github.hide212131.langchain4j.atelier.runtime.model.ProviderType;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class ProviderGatewayFactoryTest {

    private final ProviderHealthTracker tracker = new ProviderHealthTracker();

    @Test
    void createsOneGatewayPerConfiguredBackend() {
        List<String> built = new ArrayList<>();
        ProviderGatewayFactory.ChatModelFactory models = new ProviderGatewayFactory.ChatModelFactory() {
            @Override
            public ChatModel chatModel(ProviderSettings settings, Duration timeout) {
                built.add("chat " + settings.provider() + " " + timeout.toSeconds());
                return new DryRunChatModel();
            }

            @Override
            public StreamingChatModel streamingModel(ProviderSettings settings, Duration timeout) {
                built.add("stream " + settings.provider() + " " + timeout.toSeconds());
                return new DryRunStreamingChatModel();
            }
        };
        ProviderConfiguration configuration = new ProviderConfiguration(
                Map.of(ProviderType.OPENAI, new ProviderSettings(ProviderType.OPENAI, "key", "https://api.openai.com/v1")),
                Duration.ofSeconds(45));

        ProviderRegistry registry =
                new ProviderGatewayFactory(tracker, RetryPolicy.defaults(), RetryListener.none(), models)
                        .create(configuration);

        assertThat(registry.types()).containsExactly(ProviderType.OPENAI);
        assertThat(registry.find(ProviderType.ANTHROPIC)).isEmpty();
        assertThat(registry.healthTracker()).isSameAs(tracker);
        assertThat(built).containsExactly("chat openai 45", "stream openai 45");
    }

    @Test
    void dryRunAnswersEveryBackendInTheEvaluationFormat() {
        ProviderRegistry registry = new ProviderGatewayFactory(tracker).dryRun();
        String prompt = "=== YOUR TASK ===\nWrite a haiku.\n\n```json\n"
                + "{\"criterion\": \"Imagery\", \"score\": 7}\n{\"criterion\": \"Form\", \"score\": 7}\n```";
        List<String> chunks = new ArrayList<>();

        StreamingResult result = registry.find(ProviderType.GOOGLE).orElseThrow()
                .generateStreamWithUsage(new GenerationRequest("", prompt, "gemini-2.5-flash", 0.7), chunks::add);

        assertThat(registry.types()).containsExactlyInAnyOrder(ProviderType.values());
        assertThat(result.content()).startsWith("Dry-run draft. Write a haiku.");
        assertThat(String.join("", chunks)).isEqualTo(result.content());
        assertThat(result.usage().estimated()).isFalse();
        EvaluationParseResult parsed = new EvaluationParser().parse(result.content(), List.of("Imagery", "Form"));
        assertThat(parsed.isSuccess()).isTrue();
        assertThat(parsed.evaluation().overallScore()).isEqualTo(8.0);
        assertThat(parsed.evaluation().criteriaScores()).hasSize(2);
    }

    @Test
    void unavailableBackendIsCalledOncePerRetryAttempt() throws IOException {
        // Given: An OpenAI-compatible endpoint that always answers 503
        AtomicInteger hits = new AtomicInteger();
        HttpServer server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/", exchange -> {
            hits.incrementAndGet();
            byte[] body = "{\"error\":{\"message\":\"service unavailable\",\"type\":\"server_error\"}}"
                    .getBytes(StandardCharsets.UTF_8);
            exchange.getResponseHeaders().add("Content-Type", "application/json");
            exchange.sendResponseHeaders(503, body.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(body);
            }
        });
        server.start();
        List<Duration> sleeps = new CopyOnWriteArrayList<>();
        try {
            String baseUrl = "http://127.0.0.1:" + server.getAddress().getPort() + "/v1";
            ProviderConfiguration configuration = new ProviderConfiguration(
                    Map.of(ProviderType.OPENAI, new ProviderSettings(ProviderType.OPENAI, "key", baseUrl)),
                    Duration.ofSeconds(5));
            ProviderGateway gateway = new ProviderGatewayFactory(tracker, RetryPolicy.defaults().withSleeper(sleeps::add))
                    .create(configuration)
                    .find(ProviderType.OPENAI)
                    .orElseThrow();

            // When: One generation is requested
            assertThatThrownBy(() -> gateway.generate(new GenerationRequest("", "ping", "gpt-4o-mini", 0.0, 10)))
                    .isInstanceOf(ProviderException.class);
        } finally {
            server.stop(0);
        }

        // Then: Only the gateway's own retry schedule reaches the backend
        assertThat(hits.get()).isEqualTo(RetryPolicy.DEFAULT_MAX_ATTEMPTS);
        assertThat(sleeps).containsExactly(Duration.ofSeconds(2), Duration.ofSeconds(4));
    }
}
