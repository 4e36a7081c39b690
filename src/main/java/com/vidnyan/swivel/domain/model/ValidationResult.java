package com.vidnyan.swivel.domain.model;

import java.util.List;
import java.util.Objects;

/**
 * Canonical output of a validation run. Every tier and the orchestrator produce this shape.
 * <p>
 * {@code errors} keeps detection order. The status is derived from the findings unless the run hit
 * an infrastructure fault: FAIL iff at least one finding has severity error.
 */
public record ValidationResult(
    ValidationStatus status,
    List<ValidationError> errors,
    ValidationSummary summary,
    ValidationMetadata metadata
) {

    public ValidationResult {
        Objects.requireNonNull(status, "status");
        errors = errors == null ? List.of() : List.copyOf(errors);
        summary = ValidationSummary.of(errors);
        if (status == ValidationStatus.SKIPPED) {
            throw new IllegalArgumentException("Aggregated results are never skipped");
        }
        boolean anyError = errors.stream().anyMatch(ValidationError::isError);
        if (status == ValidationStatus.FAIL && !anyError) {
            throw new IllegalArgumentException("FAIL requires at least one error-severity finding");
        }
        if (status == ValidationStatus.PASS && anyError) {
            throw new IllegalArgumentException("PASS cannot carry error-severity findings");
        }
    }

    /**
     * Result whose status follows from the findings.
     */
    public static ValidationResult of(List<ValidationError> findings, ValidationMetadata metadata) {
        boolean anyError = findings.stream().anyMatch(ValidationError::isError);
        return new ValidationResult(anyError ? ValidationStatus.FAIL : ValidationStatus.PASS,
                findings, null, metadata);
    }

    /**
     * Result for a run aborted by an infrastructure fault.
     */
    public static ValidationResult error(List<ValidationError> findings, ValidationMetadata metadata) {
        return new ValidationResult(ValidationStatus.ERROR, findings, null, metadata);
    }

    public boolean isPass() {
        return status == ValidationStatus.PASS;
    }

    public boolean isInfrastructureError() {
        return status == ValidationStatus.ERROR;
    }

    public boolean hasCode(String code) {
        return errors.stream().anyMatch(e -> e.code().equals(code));
    }

    public List<ValidationError> errorsWithCode(String code) {
        return errors.stream().filter(e -> e.code().equals(code)).toList();
    }

    public List<ValidationError> errorsAt(ValidationLevel level) {
        return errors.stream().filter(e -> e.level() == level).toList();
    }
}
