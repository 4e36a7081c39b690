package com.vidnyan.swivel.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.vidnyan.swivel.adapter.out.framework.SwingFrameworkRuntime;
import com.vidnyan.swivel.adapter.out.rule.CorrectionRules;
import com.vidnyan.swivel.adapter.out.sandbox.ProcessLaunchers;
import com.vidnyan.swivel.application.port.out.FrameworkRuntime;
import com.vidnyan.swivel.application.port.out.ProcessLauncher;
import com.vidnyan.swivel.application.validation.SandboxExecutor;
import com.vidnyan.swivel.application.validation.StaticAnalyzer;
import com.vidnyan.swivel.application.validation.StructuralValidator;
import com.vidnyan.swivel.application.validation.SyntaxValidator;
import com.vidnyan.swivel.domain.rule.CorrectionRule;
import com.vidnyan.swivel.domain.rule.RulesEngine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

/**
 * Spring configuration for the validation pipeline.
 * Wires the tier validators and the outbound adapters they depend on.
 */
@Slf4j
@Configuration
public class SwivelConfiguration {

    /**
     * ObjectMapper for result documents.
     */
    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(SerializationFeature.INDENT_OUTPUT, true);
    }

    @Bean
    public FrameworkRuntime frameworkRuntime() {
        SwingFrameworkRuntime runtime = new SwingFrameworkRuntime();
        if (runtime.isAvailable()) {
            log.info("Swing runtime {} available", runtime.version().orElse("(unknown version)"));
        } else {
            log.warn("Swing runtime not available; structural validation will be skipped");
        }
        return runtime;
    }

    @Bean
    public ProcessLauncher processLauncher() {
        ProcessLauncher launcher = ProcessLaunchers.forCurrentPlatform();
        log.info("Sandbox processes start through the {}", launcher.describe());
        return launcher;
    }

    @Bean
    public SyntaxValidator syntaxValidator() {
        return new SyntaxValidator();
    }

    @Bean
    public StaticAnalyzer staticAnalyzer(SwivelProperties properties) {
        return new StaticAnalyzer(properties.getAnalysis().getBlockingCallSeverity());
    }

    @Bean
    public StructuralValidator structuralValidator(FrameworkRuntime frameworkRuntime) {
        return new StructuralValidator(frameworkRuntime);
    }

    @Bean
    public SandboxExecutor sandboxExecutor(ProcessLauncher processLauncher, SwivelProperties properties) {
        SwivelProperties.Sandbox sandbox = properties.getSandbox();
        Path java = sandbox.getJavaCommand() == null || sandbox.getJavaCommand().isBlank()
                ? SandboxExecutor.Settings.currentJava()
                : Path.of(sandbox.getJavaCommand());
        return new SandboxExecutor(processLauncher, new SandboxExecutor.Settings(
                sandbox.getTimeout(), sandbox.getMaxHeap(), sandbox.getCaptureLimit(), java));
    }

    @Bean
    public RulesEngine rulesEngine() {
        RulesEngine engine = CorrectionRules.defaultEngine();
        log.info("Registered {} correction rules:", engine.rules().size());
        for (CorrectionRule rule : engine.rules()) {
            log.info("  - {} {}", rule.id(), rule.codes());
        }
        return engine;
    }
}
