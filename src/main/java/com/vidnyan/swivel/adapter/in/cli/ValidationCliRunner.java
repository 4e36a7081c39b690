package com.vidnyan.swivel.adapter.in.cli;

import com.vidnyan.swivel.adapter.out.json.ValidationResultJson;
import com.vidnyan.swivel.application.port.in.DescribeFrameworkUseCase;
import com.vidnyan.swivel.application.port.in.FixSourceUseCase;
import com.vidnyan.swivel.application.port.in.FixSourceUseCase.FixReport;
import com.vidnyan.swivel.application.port.in.HealSourceUseCase;
import com.vidnyan.swivel.application.port.in.ValidateSourceUseCase;
import com.vidnyan.swivel.application.validation.SyntaxValidator;
import com.vidnyan.swivel.config.SwivelProperties;
import com.vidnyan.swivel.domain.healing.HealingSession;
import com.vidnyan.swivel.domain.model.ValidationError;
import com.vidnyan.swivel.domain.model.ValidationResult;
import com.vidnyan.swivel.domain.model.ValidationStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * CLI runner for one-shot validation.
 * Runs when swivel.validate.path (or swivel.validate.describe) is set; exits with 0 (pass), 1 (fail) or 2 (infrastructure error).
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ValidationCliRunner implements CommandLineRunner {

    static final int EXIT_PASS = 0;
    static final int EXIT_FAIL = 1;
    static final int EXIT_ERROR = 2;

    private final ValidateSourceUseCase validateSourceUseCase;
    private final HealSourceUseCase healSourceUseCase;
    private final FixSourceUseCase fixSourceUseCase;
    private final DescribeFrameworkUseCase describeFrameworkUseCase;
    private final SyntaxValidator syntaxValidator;
    private final ValidationResultJson json;
    private final SwivelProperties properties;
    private final ConfigurableApplicationContext context;

    @Override
    public void run(String... args) throws Exception {
        SwivelProperties.Validate options = properties.getValidate();
        if (options.isDescribe()) {
            int exitCode = EXIT_ERROR;
            try {
                exitCode = describe(options);
            } finally {
                int code = exitCode;
                SpringApplication.exit(context, () -> code);
            }
            return;
        }
        if (options.getPath() == null || options.getPath().isBlank()) {
            log.info("No source path specified. Set swivel.validate.path property.");
            return;
        }

        int exitCode = EXIT_ERROR;
        try {
            Path path = Path.of(options.getPath());
            log.info("Validating {} (depth {}{})", path, options.getDepth().jsonValue(),
                    options.isHeal() ? ", healing" : options.isFix() ? ", fixing" : "");
            exitCode = execute(path, options);
        } finally {
            int code = exitCode;
            SpringApplication.exit(context, () -> code);
        }
    }

    int execute(Path path, SwivelProperties.Validate options) throws IOException {
        byte[] bytes = Files.readAllBytes(path);
        if (!options.isHeal() && !options.isFix()) {
            ValidationResult result = validateSourceUseCase.validate(bytes, options.getDepth(), null);
            printResult(result);
            emit(json.write(result), options);
            return exitCodeOf(result);
        }

        SyntaxValidator.Decoded decoded = syntaxValidator.decode(bytes);
        if (!decoded.ok()) {
            log.error("{} is not valid UTF-8; reporting the encoding failure instead", path);
            ValidationResult result = validateSourceUseCase.validate(bytes, options.getDepth(), null);
            printResult(result);
            emit(json.write(result), options);
            return exitCodeOf(result);
        }
        String source = decoded.text();

        if (options.isHeal()) {
            HealingSession session = healSourceUseCase.heal(source);
            log.info("Healing {} after {} iteration(s); rules applied: {}",
                    session.outcome().name().toLowerCase(), session.iterationCount(), session.appliedRuleIds());
            printResult(session.finalResult());
            emit(json.write(session), options);
            writeSource(session.finalSource(), options);
            return exitCodeOf(session.finalResult());
        }

        FixReport report = fixSourceUseCase.fix(source);
        log.info("Fix applied {}; remaining codes: {}", report.ruleCounts(), report.remaining());
        emit(json.write(report), options);
        writeSource(report.source(), options);
        return report.remaining().isEmpty() ? EXIT_PASS : EXIT_FAIL;
    }

    int describe(SwivelProperties.Validate options) throws IOException {
        DescribeFrameworkUseCase.FrameworkInfo info = describeFrameworkUseCase.describe();
        if (!info.unresolved().isEmpty()) {
            log.warn("Catalogue entries the runtime cannot load: {}", info.unresolved());
        }
        emit(json.write(info), options);
        return info.available() ? EXIT_PASS : EXIT_ERROR;
    }

    static int exitCodeOf(ValidationResult result) {
        if (result.status() == ValidationStatus.ERROR) {
            return EXIT_ERROR;
        }
        return result.isPass() ? EXIT_PASS : EXIT_FAIL;
    }

    private void printResult(ValidationResult result) {
        log.info("Status: {} ({} error(s), {} warning(s))", result.status().jsonValue(),
                result.summary().errors(), result.summary().warnings());
        for (ValidationError error : result.errors()) {
            String location = error.line() == null ? "-" : error.line() + ":" + (error.column() == null ? "?" : error.column());
            if (error.isError()) {
                log.warn("  {} [{}] {}", error.code(), location, error.message());
            } else {
                log.info("  {} [{}] {}", error.code(), location, error.message());
            }
        }
        if (result.metadata() != null && result.metadata().fault() != null) {
            log.error("Infrastructure fault: {}", result.metadata().fault());
        }
    }

    private void emit(String document, SwivelProperties.Validate options) throws IOException {
        if (options.getOutput() == null || options.getOutput().isBlank()) {
            log.info("{}", document);
            return;
        }
        Path output = Path.of(options.getOutput());
        Files.writeString(output, document, StandardCharsets.UTF_8);
        log.info("Result written to {}", output);
    }

    private void writeSource(String source, SwivelProperties.Validate options) throws IOException {
        if (options.getHealedPath() == null || options.getHealedPath().isBlank()) {
            return;
        }
        Path target = Path.of(options.getHealedPath());
        Files.writeString(target, source, StandardCharsets.UTF_8);
        log.info("Corrected source written to {}", target);
    }
}
