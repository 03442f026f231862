package io.github.hide212131.langchain4j.atelier.runtime.provider;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.github.hide212131.langchain4j.atelier.runtime.model.ProviderType;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import org.junit.jupiter.api.Test;

class ProviderHealthProbeTest {

    @Test
    void pingsEachBackendWithItsCheapestModel() {
        List<GenerationRequest> pings = new ArrayList<>();
        ProviderHealthTracker tracker = new ProviderHealthTracker();
        ProviderRegistry registry = new ProviderRegistry(
                List.of(new PingGateway(ProviderType.ANTHROPIC, pings, false), new PingGateway(ProviderType.OPENAI, pings, true)),
                tracker);

        try (ProviderHealthProbe probe = new ProviderHealthProbe(registry)) {
            assertThat(probe.probeAll()).isEqualTo(1);
        }

        assertThat(pings)
                .extracting(GenerationRequest::model)
                .containsExactlyInAnyOrder("claude-3-5-haiku-20241022", "gpt-4o-mini");
        assertThat(pings).allSatisfy(ping -> {
            assertThat(ping.userPrompt()).isEqualTo(ProviderHealthProbe.PING_PROMPT);
            assertThat(ping.maxTokens()).isEqualTo(ProviderHealthProbe.PING_MAX_TOKENS);
        });
    }

    @Test
    void startPingsRepeatedlyUntilClosed() throws InterruptedException {
        List<GenerationRequest> pings = new CopyOnWriteArrayList<>();
        ProviderHealthTracker tracker = new ProviderHealthTracker();
        ProviderRegistry registry =
                new ProviderRegistry(List.of(new PingGateway(ProviderType.OPENAI, pings, false)), tracker);
        ProviderHealthProbe probe = new ProviderHealthProbe(registry, Duration.ofMillis(20));

        probe.start();
        probe.start();
        long deadline = System.nanoTime() + Duration.ofSeconds(5).toNanos();
        while (pings.size() < 3 && System.nanoTime() < deadline) {
            Thread.sleep(10);
        }
        probe.close();
        Thread.sleep(50);
        int afterClose = pings.size();
        Thread.sleep(100);

        assertThat(afterClose).isGreaterThanOrEqualTo(3);
        assertThat(pings).hasSize(afterClose);
        assertThat(pings).extracting(GenerationRequest::model).containsOnly("gpt-4o-mini");
    }

    @Test
    void rejectsANonPositiveInterval() {
        ProviderRegistry registry = new ProviderRegistry(List.of(), new ProviderHealthTracker());

        assertThatThrownBy(() -> new ProviderHealthProbe(registry, Duration.ZERO))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private record PingGateway(ProviderType type, List<GenerationRequest> pings, boolean failing)
            implements ProviderGateway {

        @Override
        public GenerationResult generate(GenerationRequest request) {
            pings.add(request);
            if (failing) {
                throw new ProviderException(type, ProviderFault.FATAL, 1, false, "unauthorized", null);
            }
            return new GenerationResult("OK", request.model(), UsageReport.reported(5, 1));
        }

        @Override
        public StreamingResult generateStreamWithUsage(GenerationRequest request, Consumer<String> onChunk) {
            throw new UnsupportedOperationException();
        }
    }
}
