package io.github.hide212131.langchain4j.atelier.runtime.provider;

import io.github.hide212131.langchain4j.atelier.runtime.model.ProviderType;
import java.time.Instant;

/**
 * Point-in-time health of one backend. {@code successRate} is 0..1; {@code lastError} fields are nullable.
 */
public record ProviderHealth(
        ProviderType provider,
        HealthStatus status,
        double successRate,
        int recentCalls,
        String lastError,
        Instant lastErrorAt) {

    /** Success rate as a percentage rounded to one decimal. */
    public double successRatePercent() {
        return Math.round(successRate * 1000.0) / 10.0;
    }
}
