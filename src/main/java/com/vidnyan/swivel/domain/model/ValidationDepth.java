package com.vidnyan.swivel.domain.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * How many tiers a validation run executes.
 */
public enum ValidationDepth {
    /** L1 and L2. */
    FAST(EnumSet.of(ValidationLevel.SYNTAX, ValidationLevel.STATIC)),
    /** L1 to L3, everything except the sandbox. */
    STRUCTURAL(EnumSet.of(ValidationLevel.SYNTAX, ValidationLevel.STATIC, ValidationLevel.STRUCTURE)),
    /** All four tiers. */
    FULL(EnumSet.allOf(ValidationLevel.class));

    private final Set<ValidationLevel> levels;

    ValidationDepth(Set<ValidationLevel> levels) {
        this.levels = levels;
    }

    public boolean includes(ValidationLevel level) {
        return levels.contains(level);
    }

    public String jsonValue() {
        return name().toLowerCase();
    }
}
