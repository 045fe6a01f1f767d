package org.faultline.runtime;

/**
 * The severity of a diagnostic. Each severity contributes a one-letter marker to the display code.
 */
public enum Severity {
    /** A failure. Display codes start with {@code E}. */
    ERROR("E"),
    /** A warning. Display codes start with {@code W}. */
    WARN("W");

    private final String shortMarker;

    Severity(String shortMarker) {
        this.shortMarker = shortMarker;
    }

    /**
     * @return The marker placed in front of the numeric code.
     */
    public String shortMarker() {
        return shortMarker;
    }

    /**
     * Parses a kind literal as written in a taxonomy.
     * @param literal The literal, e.g. {@code "Error"} or {@code "warn"}.
     * @return The severity, or null if the literal names none.
     */
    public static Severity fromLiteral(String literal) {
        return switch (literal) {
            case "Error", "error" -> ERROR;
            case "Warn", "warn" -> WARN;
            default -> null;
        };
    }
}
