package com.vidnyan.swivel.domain.model;

import java.util.List;
import java.util.Objects;

/**
 * What one tier produced: its own status, its findings and any notes for the result metadata.
 */
public record TierReport(
    ValidationLevel level,
    ValidationStatus status,
    List<ValidationError> findings,
    List<String> notes
) {

    public TierReport {
        Objects.requireNonNull(level, "level");
        Objects.requireNonNull(status, "status");
        findings = findings == null ? List.of() : List.copyOf(findings);
        notes = notes == null ? List.of() : List.copyOf(notes);
    }

    public static TierReport of(ValidationLevel level, List<ValidationError> findings) {
        return of(level, findings, List.of());
    }

    public static TierReport of(ValidationLevel level, List<ValidationError> findings, List<String> notes) {
        boolean anyError = findings.stream().anyMatch(ValidationError::isError);
        return new TierReport(level, anyError ? ValidationStatus.FAIL : ValidationStatus.PASS, findings, notes);
    }

    public static TierReport skipped(ValidationLevel level, String reason) {
        return new TierReport(level, ValidationStatus.SKIPPED, List.of(), List.of(reason));
    }

    public boolean failed() {
        return status == ValidationStatus.FAIL;
    }
}
