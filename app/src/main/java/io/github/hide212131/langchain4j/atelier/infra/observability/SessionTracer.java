package io.github.hide212131.langchain4j.atelier.infra.observability;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.common.AttributesBuilder;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import java.util.function.Supplier;

/**
 * Session-shaped tracing: one span per session, a child span per round, and span events for turns and
 * agent failures. All methods are cheap no-ops when tracing is disabled.
 */
public final class SessionTracer {

    static final String SESSION_SPAN = "atelier.session";
    static final String ROUND_SPAN = "atelier.round";
    static final String TURN_EVENT = "atelier.turn";
    static final String AGENT_FAILURE_EVENT = "atelier.agent_failure";

    static final AttributeKey<String> SESSION_ID = AttributeKey.stringKey("atelier.session.id");
    static final AttributeKey<Long> MAX_ROUNDS = AttributeKey.longKey("atelier.session.max_rounds");
    static final AttributeKey<String> FLOW_TYPE = AttributeKey.stringKey("atelier.session.flow_type");
    static final AttributeKey<Long> AGENT_COUNT = AttributeKey.longKey("atelier.session.agents");
    static final AttributeKey<Long> ROUND = AttributeKey.longKey("atelier.round");
    static final AttributeKey<Long> TURN = AttributeKey.longKey("atelier.turn");
    static final AttributeKey<String> AGENT_ID = AttributeKey.stringKey("atelier.agent.id");
    static final AttributeKey<Long> CREDITS = AttributeKey.longKey("atelier.turn.credits");
    static final AttributeKey<Double> SCORE = AttributeKey.doubleKey("atelier.turn.score");
    static final AttributeKey<String> FAULT = AttributeKey.stringKey("atelier.agent.fault");

    private final Tracer tracer;
    private final boolean enabled;

    public SessionTracer(Tracer tracer, boolean enabled) {
        this.tracer = tracer;
        this.enabled = enabled;
    }

    public static SessionTracer noop() {
        return ObservabilityConfig.disabled().sessionTracer();
    }

    public <T> T traceSession(String sessionId, int maxRounds, String flowType, int agentCount, Supplier<T> run) {
        if (!enabled) {
            return run.get();
        }
        Attributes attributes = Attributes.builder()
                .put(SESSION_ID, sessionId)
                .put(MAX_ROUNDS, (long) maxRounds)
                .put(FLOW_TYPE, flowType)
                .put(AGENT_COUNT, (long) agentCount)
                .build();
        return inSpan(SESSION_SPAN, attributes, run);
    }

    public void traceRound(String sessionId, int round, Runnable run) {
        if (!enabled) {
            run.run();
            return;
        }
        Attributes attributes = Attributes.of(SESSION_ID, sessionId, ROUND, (long) round);
        inSpan(ROUND_SPAN, attributes, () -> {
            run.run();
            return null;
        });
    }

    /**
     * @param overallScore null when the turn has no evaluation
     */
    public void turnRecorded(int turnNumber, String agentId, int credits, Double overallScore) {
        if (!enabled) {
            return;
        }
        AttributesBuilder builder = Attributes.builder()
                .put(TURN, (long) turnNumber)
                .put(AGENT_ID, agentId)
                .put(CREDITS, (long) credits);
        if (overallScore != null) {
            builder.put(SCORE, overallScore);
        }
        addEvent(TURN_EVENT, builder.build());
    }

    /**
     * @param fault lower-case fault category, or null when the failure was not a provider fault
     */
    public void agentFailed(String agentId, String fault) {
        if (!enabled) {
            return;
        }
        addEvent(AGENT_FAILURE_EVENT, Attributes.of(AGENT_ID, agentId, FAULT, fault == null ? "unknown" : fault));
    }

    public boolean isEnabled() {
        return enabled;
    }

    private <T> T inSpan(String name, Attributes attributes, Supplier<T> run) {
        Span span = tracer.spanBuilder(name)
                .setSpanKind(SpanKind.INTERNAL)
                .setAllAttributes(attributes)
                .startSpan();
        try (Scope ignored = span.makeCurrent()) {
            T result = run.get();
            span.setStatus(StatusCode.OK);
            return result;
        } catch (RuntimeException e) {
            span.setStatus(StatusCode.ERROR, String.valueOf(e.getMessage()));
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    private static void addEvent(String name, Attributes attributes) {
        Span current = Span.current();
        if (current.isRecording()) {
            current.addEvent(name, attributes);
        }
    }
}
