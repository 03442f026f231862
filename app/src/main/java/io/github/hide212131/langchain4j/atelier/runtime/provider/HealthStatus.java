package io.github.hide212131.langchain4j.atelier.runtime.provider;

public enum HealthStatus {
    HEALTHY("healthy"),
    DEGRADED("degraded"),
    UNHEALTHY("unhealthy"),
    UNKNOWN("unknown");

    private final String id;

    HealthStatus(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }
}
