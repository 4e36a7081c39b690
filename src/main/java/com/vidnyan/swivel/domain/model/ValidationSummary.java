package com.vidnyan.swivel.domain.model;

import java.util.List;

/**
 * Finding counts per severity.
 */
public record ValidationSummary(int total, int errors, int warnings) {

    public static final ValidationSummary EMPTY = new ValidationSummary(0, 0, 0);

    public static ValidationSummary of(List<ValidationError> findings) {
        int errors = (int) findings.stream().filter(ValidationError::isError).count();
        return new ValidationSummary(findings.size(), errors, findings.size() - errors);
    }
}
