package io.github.hide212131.langchain4j.atelier.runtime.model;

/**
 * How freely the writer may change a draft supplied by the user.
 */
public enum DraftTreatment {
    LIGHT_POLISH("light_polish"),
    MODERATE_REVISION("moderate_revision"),
    FREE_REWRITE("free_rewrite");

    private final String id;

    DraftTreatment(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    public static DraftTreatment from(String value) {
        if (value == null || value.isBlank()) {
            return MODERATE_REVISION;
        }
        return switch (value.trim().toLowerCase().replace('-', '_')) {
            case "light_polish" -> LIGHT_POLISH;
            case "moderate_revision" -> MODERATE_REVISION;
            case "free_rewrite" -> FREE_REWRITE;
            default -> throw new IllegalArgumentException("Unknown draft treatment: " + value);
        };
    }
}
