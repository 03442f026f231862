package io.github.hide212131.langchain4j.atelier.infra.config;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Scheduler tunables resolved from the environment.
 */
public record RuntimeConfig(
        Duration pausePollInterval,
        Duration queuePollInterval,
        double temperature,
        int minCreditsPerAgent,
        int lowCreditWarning,
        Duration healthProbeInterval) {

    public static final String PAUSE_POLL_MILLIS = "ATELIER_PAUSE_POLL_MILLIS";
    public static final String QUEUE_POLL_MILLIS = "ATELIER_QUEUE_POLL_MILLIS";
    public static final String TEMPERATURE = "ATELIER_TEMPERATURE";
    public static final String MIN_CREDITS_PER_AGENT = "ATELIER_MIN_CREDITS_PER_AGENT";
    public static final String LOW_CREDIT_WARNING = "ATELIER_LOW_CREDIT_WARNING";
    public static final String HEALTH_PROBE_SECONDS = "ATELIER_HEALTH_PROBE_SECONDS";

    public RuntimeConfig {
        Objects.requireNonNull(pausePollInterval, "pausePollInterval");
        Objects.requireNonNull(queuePollInterval, "queuePollInterval");
        if (pausePollInterval.isNegative() || pausePollInterval.isZero()) {
            throw new IllegalArgumentException("pausePollInterval must be positive");
        }
        if (queuePollInterval.isNegative() || queuePollInterval.isZero()) {
            throw new IllegalArgumentException("queuePollInterval must be positive");
        }
        if (temperature < 0.0 || temperature > 2.0) {
            throw new IllegalArgumentException("temperature must be between 0 and 2");
        }
        if (minCreditsPerAgent < 0) {
            throw new IllegalArgumentException("minCreditsPerAgent must not be negative");
        }
        if (lowCreditWarning < 0) {
            throw new IllegalArgumentException("lowCreditWarning must not be negative");
        }
        Objects.requireNonNull(healthProbeInterval, "healthProbeInterval");
        if (healthProbeInterval.isNegative()) {
            throw new IllegalArgumentException("healthProbeInterval must not be negative");
        }
    }

    public RuntimeConfig() {
        this(System::getenv);
    }

    public RuntimeConfig(EnvironmentVariables environment) {
        this(
                Duration.ofMillis(readLong(environment, PAUSE_POLL_MILLIS, 500L)),
                Duration.ofMillis(readLong(environment, QUEUE_POLL_MILLIS, 50L)),
                readDouble(environment, TEMPERATURE, 0.7),
                (int) readLong(environment, MIN_CREDITS_PER_AGENT, 2L),
                (int) readLong(environment, LOW_CREDIT_WARNING, 5L),
                Duration.ofSeconds(readLong(environment, HEALTH_PROBE_SECONDS, 60L)));
    }

    public static RuntimeConfig defaults() {
        return new RuntimeConfig(key -> null);
    }

    public RuntimeConfig withPollIntervals(Duration pause, Duration queue) {
        return new RuntimeConfig(pause, queue, temperature, minCreditsPerAgent, lowCreditWarning, healthProbeInterval);
    }

    /** A zero interval switches the periodic provider health probe off. */
    public boolean healthProbeEnabled() {
        return !healthProbeInterval.isZero();
    }

    private static long readLong(EnvironmentVariables environment, String key, long defaultValue) {
        Optional<String> raw = read(environment, key);
        if (raw.isEmpty()) {
            return defaultValue;
        }
        try {
            return Long.parseLong(raw.get());
        } catch (NumberFormatException ex) {
            throw new IllegalStateException(key + " must be an integer: " + raw.get(), ex);
        }
    }

    private static double readDouble(EnvironmentVariables environment, String key, double defaultValue) {
        Optional<String> raw = read(environment, key);
        if (raw.isEmpty()) {
            return defaultValue;
        }
        try {
            return Double.parseDouble(raw.get());
        } catch (NumberFormatException ex) {
            throw new IllegalStateException(key + " must be a number: " + raw.get(), ex);
        }
    }

    private static Optional<String> read(EnvironmentVariables environment, String key) {
        return Optional.ofNullable(environment.get(key)).map(String::trim).filter(s -> !s.isBlank());
    }

    @FunctionalInterface
    public interface EnvironmentVariables {
        String get(String key);
    }
}
