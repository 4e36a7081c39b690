package com.vidnyan.swivel.domain.model;

/**
 * Outcome of a validation run or of a single tier.
 * {@link #SKIPPED} only ever describes a tier; aggregated results are PASS, FAIL or ERROR.
 */
public enum ValidationStatus {
    PASS,
    FAIL,
    ERROR,
    SKIPPED;

    public String jsonValue() {
        return name().toLowerCase();
    }
}
