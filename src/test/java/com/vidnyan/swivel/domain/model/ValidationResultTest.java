package com.vidnyan.swivel.domain.model;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ValidationResultTest {

    private static ValidationError finding(String code, Severity severity, Integer line) {
        return ValidationError.builder()
                .code(code)
                .severity(severity)
                .message("finding " + code)
                .line(line)
                .build();
    }

    @Test
    void of_ShouldFailWhenAnyFindingIsAnError() {
        ValidationResult result = ValidationResult.of(List.of(
                finding("W205", Severity.WARNING, 1),
                finding("E201", Severity.ERROR, 2)), null);

        assertEquals(ValidationStatus.FAIL, result.status());
        assertEquals(new ValidationSummary(2, 1, 1), result.summary());
        assertTrue(result.hasCode("E201"));
        assertEquals(1, result.errorsAt(ValidationLevel.STATIC).stream().filter(ValidationError::isError).count());
    }

    @Test
    void of_ShouldPassWithWarningsOnly() {
        ValidationResult result = ValidationResult.of(List.of(finding("S403", Severity.WARNING, null)), null);

        assertTrue(result.isPass());
        assertEquals(1, result.summary().warnings());
        assertEquals(0, result.summary().errors());
    }

    @Test
    void constructor_ShouldRejectInconsistentStatus() {
        List<ValidationError> warningsOnly = List.of(finding("W203", Severity.WARNING, 3));
        List<ValidationError> withError = List.of(finding("E101", Severity.ERROR, 1));

        assertThrows(IllegalArgumentException.class,
                () -> new ValidationResult(ValidationStatus.FAIL, warningsOnly, null, null));
        assertThrows(IllegalArgumentException.class,
                () -> new ValidationResult(ValidationStatus.PASS, withError, null, null));
        assertThrows(IllegalArgumentException.class,
                () -> new ValidationResult(ValidationStatus.SKIPPED, List.of(), null, null));
    }

    @Test
    void error_ShouldAllowAnyFindings() {
        ValidationResult result = ValidationResult.error(List.of(finding("S499", Severity.ERROR, null)), null);

        assertTrue(result.isInfrastructureError());
        assertFalse(result.isPass());
    }

    @Test
    void builder_ShouldDeriveLevelFromCode() {
        ValidationError error = finding("D302", Severity.ERROR, 7);

        assertEquals(ValidationLevel.STRUCTURE, error.level());
        assertEquals("D302@7", error.dedupKey());
    }

    @Test
    void constructor_ShouldRejectMalformedCodesAndPositions() {
        assertThrows(IllegalArgumentException.class, () -> finding("X101", Severity.ERROR, 1));
        assertThrows(IllegalArgumentException.class, () -> finding("E101", Severity.ERROR, 0));
        assertThrows(IllegalArgumentException.class, () -> new ValidationError("E201", ValidationLevel.SYNTAX,
                Severity.ERROR, "wrong tier", 1, 1, null, null, Map.of()));
    }

    @Test
    void contextValue_ShouldExposeRuleInputs() {
        ValidationError error = ValidationError.builder()
                .code("W205")
                .severity(Severity.WARNING)
                .message("unused")
                .context(Map.of("import", "javax.swing.JCheckBox"))
                .build();

        assertEquals("javax.swing.JCheckBox", error.contextValue("import").orElseThrow());
        assertTrue(error.contextValue("binding").isEmpty());
    }
}
