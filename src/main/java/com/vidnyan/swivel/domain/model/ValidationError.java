package com.vidnyan.swivel.domain.model;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A single validation finding.
 * Immutable value object; {@code context} carries the machine-readable inputs correction rules need
 * (import names, variable bindings, suggested identifiers).
 */
public record ValidationError(
    String code,
    ValidationLevel level,
    Severity severity,
    String message,
    Integer line,
    Integer column,
    String fixSuggestion,
    String llmAction,
    Map<String, String> context
) {

    public ValidationError {
        Objects.requireNonNull(code, "code");
        Objects.requireNonNull(level, "level");
        Objects.requireNonNull(severity, "severity");
        Objects.requireNonNull(message, "message");
        if (!ErrorCodes.isWellFormed(code)) {
            throw new IllegalArgumentException("Malformed error code: " + code);
        }
        if (ErrorCodes.levelOf(code) != level.number()) {
            throw new IllegalArgumentException("Code " + code + " does not belong to " + level.label());
        }
        if (line != null && line < 1) {
            throw new IllegalArgumentException("Line numbers are 1-based: " + line);
        }
        if (column != null && column < 1) {
            throw new IllegalArgumentException("Column numbers are 1-based: " + column);
        }
        context = context == null ? Map.of() : Map.copyOf(context);
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }

    public Optional<String> contextValue(String key) {
        return Optional.ofNullable(context.get(key));
    }

    /**
     * Key used to collapse repeated findings: same code on the same line.
     */
    public String dedupKey() {
        return code + "@" + (line == null ? "-" : line);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String code;
        private ValidationLevel level;
        private Severity severity = Severity.ERROR;
        private String message;
        private Integer line;
        private Integer column;
        private String fixSuggestion;
        private String llmAction;
        private Map<String, String> context = Map.of();

        public Builder code(String code) { this.code = code; return this; }
        public Builder level(ValidationLevel level) { this.level = level; return this; }
        public Builder severity(Severity severity) { this.severity = severity; return this; }
        public Builder message(String message) { this.message = message; return this; }
        public Builder line(Integer line) { this.line = line; return this; }
        public Builder column(Integer column) { this.column = column; return this; }
        public Builder fixSuggestion(String text) { this.fixSuggestion = text; return this; }
        public Builder llmAction(String action) { this.llmAction = action; return this; }
        public Builder context(Map<String, String> context) { this.context = context; return this; }

        public ValidationError build() {
            ValidationLevel effectiveLevel = level != null ? level
                    : ValidationLevel.ofNumber(ErrorCodes.levelOf(code));
            return new ValidationError(code, effectiveLevel, severity, message, line, column,
                    fixSuggestion, llmAction, context);
        }
    }
}
