package com.vidnyan.swivel.domain.model;

/**
 * Validation tiers in order of increasing cost and precision.
 */
public enum ValidationLevel {
    SYNTAX(1),
    STATIC(2),
    STRUCTURE(3),
    SANDBOX(4);

    private final int number;

    ValidationLevel(int number) {
        this.number = number;
    }

    public int number() {
        return number;
    }

    /**
     * Short label used in logs and metadata, e.g. {@code L3}.
     */
    public String label() {
        return "L" + number;
    }

    public static ValidationLevel ofNumber(int number) {
        for (ValidationLevel level : values()) {
            if (level.number == number) {
                return level;
            }
        }
        throw new IllegalArgumentException("No validation level " + number);
    }
}
