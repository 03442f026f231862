package io.github.hide212131.langchain4j.atelier.runtime.model;

public enum SessionStatus {
    IDLE("idle"),
    RUNNING("running"),
    PAUSED("paused"),
    COMPLETED("completed"),
    FAILED("failed"),
    CANCELLED("cancelled");

    private final String id;

    SessionStatus(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }
}
