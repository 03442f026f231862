package io.github.hide212131.langchain4j.atelier.runtime.provider;

import io.github.hide212131.langchain4j.atelier.runtime.model.ProviderType;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Sliding-window success rates per backend, shared by every gateway of a process.
 *
 * <p>Each backend keeps its most recent calls in a bounded buffer; only calls inside the window count.
 * Read-only telemetry: nothing in the engine schedules by it.</p>
 */
public final class ProviderHealthTracker {

    public static final Duration DEFAULT_WINDOW = Duration.ofMinutes(5);
    public static final int DEFAULT_CAPACITY = 100;
    public static final int DEFAULT_MIN_CALLS = 1;

    static final double HEALTHY_THRESHOLD = 0.7;
    static final double DEGRADED_THRESHOLD = 0.3;

    private final Clock clock;
    private final Duration window;
    private final int capacity;
    private final int minCalls;
    private final Map<ProviderType, Deque<CallRecord>> calls = new EnumMap<>(ProviderType.class);
    private final Map<ProviderType, CallRecord> lastErrors = new EnumMap<>(ProviderType.class);

    public ProviderHealthTracker() {
        this(Clock.systemUTC(), DEFAULT_WINDOW, DEFAULT_CAPACITY, DEFAULT_MIN_CALLS);
    }

    public ProviderHealthTracker(Clock clock, Duration window, int capacity, int minCalls) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.window = Objects.requireNonNull(window, "window");
        if (capacity < 1 || minCalls < 1) {
            throw new IllegalArgumentException("capacity and minCalls must be positive");
        }
        this.capacity = capacity;
        this.minCalls = minCalls;
        for (ProviderType type : ProviderType.values()) {
            calls.put(type, new ArrayDeque<>());
        }
    }

    public synchronized void recordSuccess(ProviderType provider) {
        append(provider, new CallRecord(clock.instant(), true, null));
    }

    public synchronized void recordFailure(ProviderType provider, String errorMessage) {
        CallRecord record = new CallRecord(clock.instant(), false, errorMessage);
        append(provider, record);
        lastErrors.put(provider, record);
    }

    public synchronized ProviderHealth health(ProviderType provider) {
        Instant cutoff = clock.instant().minus(window);
        int recent = 0;
        int successes = 0;
        for (CallRecord record : calls.get(provider)) {
            if (record.timestamp().isAfter(cutoff)) {
                recent++;
                if (record.success()) {
                    successes++;
                }
            }
        }
        if (recent < minCalls) {
            return new ProviderHealth(provider, HealthStatus.UNKNOWN, 1.0, recent, null, null);
        }
        double rate = (double) successes / recent;
        HealthStatus status;
        if (rate >= HEALTHY_THRESHOLD) {
            status = HealthStatus.HEALTHY;
        } else if (rate >= DEGRADED_THRESHOLD) {
            status = HealthStatus.DEGRADED;
        } else {
            status = HealthStatus.UNHEALTHY;
        }
        CallRecord lastError = lastErrors.get(provider);
        return new ProviderHealth(
                provider,
                status,
                rate,
                recent,
                lastError == null ? null : lastError.errorMessage(),
                lastError == null ? null : lastError.timestamp());
    }

    public HealthStatus status(ProviderType provider) {
        return health(provider).status();
    }

    /**
     * Health of every known backend, in declaration order.
     */
    public Map<ProviderType, ProviderHealth> snapshot() {
        Map<ProviderType, ProviderHealth> snapshot = new EnumMap<>(ProviderType.class);
        for (ProviderType type : ProviderType.values()) {
            snapshot.put(type, health(type));
        }
        return Collections.unmodifiableMap(snapshot);
    }

    private void append(ProviderType provider, CallRecord record) {
        Deque<CallRecord> buffer = calls.get(provider);
        if (buffer.size() == capacity) {
            buffer.removeFirst();
        }
        buffer.addLast(record);
    }

    private record CallRecord(Instant timestamp, boolean success, String errorMessage) {}
}
