package io.github.hide212131.langchain4j.atelier.runtime.model;

/**
 * Role category of an agent. Decides prompt shape and whether the agent may change the document.
 */
public enum Phase {
    WRITER(1, "Writer"),
    EDITOR(2, "Editor"),
    SYNTHESIZER(3, "Synthesizer");

    private final int number;
    private final String label;

    Phase(int number, String label) {
        this.number = number;
        this.label = label;
    }

    public int number() {
        return number;
    }

    public String label() {
        return label;
    }

    public boolean mutatesDocument() {
        return this == WRITER;
    }

    public static Phase fromNumber(int number) {
        return switch (number) {
            case 1 -> WRITER;
            case 2 -> EDITOR;
            case 3 -> SYNTHESIZER;
            default -> throw new IllegalArgumentException("phase must be 1, 2 or 3: " + number);
        };
    }
}
