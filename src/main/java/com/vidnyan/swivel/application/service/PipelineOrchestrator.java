package com.vidnyan.swivel.application.service;

import com.vidnyan.swivel.application.port.in.ValidateSourceUseCase;
import com.vidnyan.swivel.application.port.out.FrameworkRuntime;
import com.vidnyan.swivel.application.validation.SandboxExecutor;
import com.vidnyan.swivel.application.validation.StaticAnalyzer;
import com.vidnyan.swivel.application.validation.StructuralValidator;
import com.vidnyan.swivel.application.validation.SyntaxValidator;
import com.vidnyan.swivel.application.validation.SyntaxValidator.SyntaxReport;
import com.vidnyan.swivel.domain.model.ErrorCodes;
import com.vidnyan.swivel.domain.model.TierReport;
import com.vidnyan.swivel.domain.model.ValidationDepth;
import com.vidnyan.swivel.domain.model.ValidationError;
import com.vidnyan.swivel.domain.model.ValidationLevel;
import com.vidnyan.swivel.domain.model.ValidationMetadata;
import com.vidnyan.swivel.domain.model.ValidationResult;
import com.vidnyan.swivel.domain.model.ValidationStatus;
import com.vidnyan.swivel.domain.source.ParsedSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Runs the tiers in order for the requested depth and folds them into one {@link ValidationResult}.
 * <p>
 * A syntax failure ends the run with the L1 finding alone. Later tiers always run when included,
 * whatever the earlier tiers found. Infrastructure faults never escape: they end the run with
 * {@code status = error} and the tier's {@code ?99} finding.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PipelineOrchestrator implements ValidateSourceUseCase {

    private final SyntaxValidator syntaxValidator;
    private final StaticAnalyzer staticAnalyzer;
    private final StructuralValidator structuralValidator;
    private final SandboxExecutor sandboxExecutor;
    private final FrameworkRuntime frameworkRuntime;

    @Override
    public ValidationResult validate(String source, ValidationDepth depth, Duration timeout) {
        Run run = new Run(depth == null ? ValidationDepth.FULL : depth);
        Instant start = Instant.now();
        log.info("Validating {} chars at depth {}", source == null ? 0 : source.length(), run.depth.jsonValue());

        ValidationResult result = execute(run, source, run.checkedTimeout(timeout));

        log.info("Validation {} with {} error(s) and {} warning(s) in {}ms",
                result.status().jsonValue(), result.summary().errors(), result.summary().warnings(),
                Duration.between(start, Instant.now()).toMillis());
        return result;
    }

    @Override
    public ValidationResult validate(byte[] source, ValidationDepth depth, Duration timeout) {
        SyntaxValidator.Decoded decoded = syntaxValidator.decode(source == null ? new byte[0] : source);
        if (decoded.ok()) {
            return validate(decoded.text(), depth, timeout);
        }
        Run run = new Run(depth == null ? ValidationDepth.FULL : depth);
        run.record(SyntaxReport.failed(decoded.error()).report());
        return run.finish();
    }

    private ValidationResult execute(Run run, String source, Duration timeout) {
        SyntaxReport syntax;
        try {
            syntax = syntaxValidator.validate(source);
        } catch (RuntimeException | StackOverflowError e) {
            return run.fault(ValidationLevel.SYNTAX, e);
        }
        run.record(syntax.report());
        if (syntax.report().failed() || syntax.parsed().isEmpty()) {
            log.debug("L1 failed, later tiers not run");
            return run.finish();
        }
        ParsedSource parsed = syntax.parsed().get();

        if (run.depth.includes(ValidationLevel.STATIC)
                && !run.tier(ValidationLevel.STATIC, () -> staticAnalyzer.analyze(parsed))) {
            return run.finish();
        }
        if (run.depth.includes(ValidationLevel.STRUCTURE)
                && !run.tier(ValidationLevel.STRUCTURE, () -> structuralValidator.validate(parsed))) {
            return run.finish();
        }
        if (run.depth.includes(ValidationLevel.SANDBOX)) {
            run.tier(ValidationLevel.SANDBOX, () -> sandboxExecutor.execute(parsed, timeout));
        }
        return run.finish();
    }

    /**
     * Accumulator for a single validation run.
     */
    private final class Run {

        private final ValidationDepth depth;
        private final List<ValidationError> findings = new ArrayList<>();
        private final Map<ValidationLevel, ValidationStatus> tiers = new EnumMap<>(ValidationLevel.class);
        private final List<String> warnings = new ArrayList<>();
        private String fault;

        Run(ValidationDepth depth) {
            this.depth = depth;
        }

        Duration checkedTimeout(Duration timeout) {
            if (timeout != null && (timeout.isZero() || timeout.isNegative())) {
                warnings.add("ignored non-positive timeout " + timeout + ", using the default");
                return null;
            }
            return timeout;
        }

        void record(TierReport report) {
            tiers.put(report.level(), report.status());
            findings.addAll(report.findings());
            warnings.addAll(report.notes());
            log.debug("{} {} with {} finding(s)", report.level().label(), report.status().jsonValue(),
                    report.findings().size());
        }

        /**
         * Run one tier; false when it hit an infrastructure fault.
         */
        boolean tier(ValidationLevel level, Supplier<TierReport> tier) {
            try {
                record(tier.get());
                return true;
            } catch (RuntimeException | StackOverflowError e) {
                markFault(level, e);
                return false;
            }
        }

        ValidationResult fault(ValidationLevel level, Throwable e) {
            markFault(level, e);
            return finish();
        }

        private void markFault(ValidationLevel level, Throwable e) {
            log.error("{} infrastructure fault: {}", level.label(), e.getMessage(), e);
            tiers.put(level, ValidationStatus.ERROR);
            fault = level.label() + ": " + (e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
            findings.add(ValidationError.builder()
                    .code(ErrorCodes.infrastructure(level))
                    .message(level.label() + " could not run: " + fault)
                    .fixSuggestion("This is a fault of the validation environment, not of the program")
                    .llmAction("Do not change the program for this error; retry the validation")
                    .build());
        }

        ValidationResult finish() {
            ToolVersions versions = ToolVersions.detect(frameworkRuntime);
            ValidationMetadata metadata = new ValidationMetadata(versions.tool(), versions.java(),
                    versions.framework(), versions.platform(), depth, tiers, warnings, fault);
            List<ValidationError> unique = deduplicate(findings);
            return fault != null
                    ? ValidationResult.error(unique, metadata)
                    : ValidationResult.of(unique, metadata);
        }
    }

    /**
     * Drop exact repeats of the same code on the same line, keeping the first.
     */
    static List<ValidationError> deduplicate(List<ValidationError> findings) {
        Map<String, ValidationError> unique = new LinkedHashMap<>();
        for (ValidationError finding : findings) {
            unique.putIfAbsent(finding.dedupKey(), finding);
        }
        return List.copyOf(unique.values());
    }
}
