package io.github.hide212131.langchain4j.atelier.infra.observability;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.sdk.common.CompletableResultCode;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.data.EventData;
import io.opentelemetry.sdk.trace.data.SpanData;
import io.opentelemetry.sdk.trace.export.SimpleSpanProcessor;
import io.opentelemetry.sdk.trace.export.SpanExporter;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class SessionTracerTest {

    private final CollectingExporter exporter = new CollectingExporter();
    private final SdkTracerProvider provider = SdkTracerProvider.builder()
            .addSpanProcessor(SimpleSpanProcessor.create(exporter))
            .build();
    private final SessionTracer sessionTracer = new SessionTracer(provider.get("test"), true);

    @AfterEach
    void shutdown() {
        provider.shutdown();
    }

    @Test
    void traceSession_shouldNestRoundsAndRecordTurns() {
        // Given: A session with one round and two turns
        String result = sessionTracer.traceSession("tides", 3, "parallel_critique", 2, () -> {
            sessionTracer.traceRound("tides", 1, () -> {
                sessionTracer.turnRecorded(1, "writer", 1, 7.5);
                sessionTracer.turnRecorded(2, "style_editor", 1, null);
            });
            return "done";
        });

        // Then: The round span is a child of the session span and carries the turn events
        assertThat(result).isEqualTo("done");
        SpanData round = exporter.span(SessionTracer.ROUND_SPAN);
        SpanData session = exporter.span(SessionTracer.SESSION_SPAN);
        assertThat(round.getParentSpanId()).isEqualTo(session.getSpanId());
        assertThat(session.getAttributes().get(SessionTracer.SESSION_ID)).isEqualTo("tides");
        assertThat(session.getAttributes().get(SessionTracer.MAX_ROUNDS)).isEqualTo(3L);
        assertThat(round.getAttributes().get(SessionTracer.ROUND)).isEqualTo(1L);
        assertThat(round.getEvents()).extracting(EventData::getName)
                .containsExactly(SessionTracer.TURN_EVENT, SessionTracer.TURN_EVENT);
        assertThat(round.getEvents().get(0).getAttributes().get(SessionTracer.SCORE)).isEqualTo(7.5);
        assertThat(round.getEvents().get(1).getAttributes().get(SessionTracer.SCORE)).isNull();
        assertThat(session.getStatus().getStatusCode()).isEqualTo(StatusCode.OK);
    }

    @Test
    void agentFailed_shouldAddAFailureEventToTheCurrentRound() {
        // When: An agent fails without a provider fault category
        sessionTracer.traceRound("tides", 2, () -> sessionTracer.agentFailed("fact_checker", null));

        // Then: The failure is recorded with an unknown fault
        EventData event = exporter.span(SessionTracer.ROUND_SPAN).getEvents().get(0);
        assertThat(event.getName()).isEqualTo(SessionTracer.AGENT_FAILURE_EVENT);
        assertThat(event.getAttributes().get(SessionTracer.FAULT)).isEqualTo("unknown");
    }

    @Test
    void traceSession_shouldMarkTheSpanAndRethrow() {
        assertThatThrownBy(() -> sessionTracer.traceSession("tides", 1, "sequential", 1, () -> {
            throw new IllegalStateException("boom");
        })).isInstanceOf(IllegalStateException.class).hasMessage("boom");

        assertThat(exporter.span(SessionTracer.SESSION_SPAN).getStatus().getStatusCode()).isEqualTo(StatusCode.ERROR);
    }

    @Test
    void disabledTracer_shouldRunWorkWithoutSpans() {
        // Given: A disabled tracer over the same provider
        SessionTracer disabled = new SessionTracer(provider.get("test"), false);
        List<Integer> rounds = new CopyOnWriteArrayList<>();

        // When: The session and a round run
        Integer result = disabled.traceSession("tides", 1, "sequential", 1, () -> {
            disabled.traceRound("tides", 1, () -> rounds.add(1));
            disabled.turnRecorded(1, "writer", 1, 8.0);
            return 42;
        });

        // Then: Work happens and nothing is exported
        assertThat(result).isEqualTo(42);
        assertThat(rounds).containsExactly(1);
        assertThat(exporter.spans).isEmpty();
        assertThat(SessionTracer.noop().isEnabled()).isFalse();
    }

    @Test
    void eventsOutsideASpan_shouldBeDropped() {
        sessionTracer.turnRecorded(1, "writer", 1, 7.0);
        sessionTracer.agentFailed("writer", "fatal");

        assertThat(exporter.spans).isEmpty();
    }

    private static final class CollectingExporter implements SpanExporter {

        private final List<SpanData> spans = new CopyOnWriteArrayList<>();

        @Override
        public CompletableResultCode export(Collection<SpanData> batch) {
            spans.addAll(batch);
            return CompletableResultCode.ofSuccess();
        }

        @Override
        public CompletableResultCode flush() {
            return CompletableResultCode.ofSuccess();
        }

        @Override
        public CompletableResultCode shutdown() {
            return CompletableResultCode.ofSuccess();
        }

        SpanData span(String name) {
            return spans.stream()
                    .filter(span -> span.getName().equals(name))
                    .findFirst()
                    .orElseThrow(() -> new AssertionError("no span named " + name));
        }
    }
}
