package io.github.hide212131.langchain4j.atelier.runtime.model;

/**
 * How editors of a round are dispatched.
 */
public enum FlowType {
    /** One editor at a time, in configuration order. */
    SEQUENTIAL("sequential"),
    /** Every editor of the round at once. */
    PARALLEL_CRITIQUE("parallel_critique");

    private final String id;

    FlowType(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    public static FlowType from(String value) {
        if (value == null || value.isBlank()) {
            return PARALLEL_CRITIQUE;
        }
        return switch (value.trim().toLowerCase()) {
            case "sequential" -> SEQUENTIAL;
            case "parallel_critique", "parallel" -> PARALLEL_CRITIQUE;
            default -> throw new IllegalArgumentException("Unknown flow type: " + value);
        };
    }
}
