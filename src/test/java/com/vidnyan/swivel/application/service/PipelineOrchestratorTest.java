package com.vidnyan.swivel.application.service;

import com.vidnyan.swivel.SamplePrograms;
import com.vidnyan.swivel.TestDoubles;
import com.vidnyan.swivel.adapter.out.framework.SwingFrameworkRuntime;
import com.vidnyan.swivel.adapter.out.sandbox.ProcessLaunchers;
import com.vidnyan.swivel.application.port.out.FrameworkRuntime;
import com.vidnyan.swivel.application.port.out.ProcessLauncher;
import com.vidnyan.swivel.application.validation.SandboxExecutor;
import com.vidnyan.swivel.application.validation.StaticAnalyzer;
import com.vidnyan.swivel.application.validation.StructuralValidator;
import com.vidnyan.swivel.application.validation.SyntaxValidator;
import com.vidnyan.swivel.domain.model.Severity;
import com.vidnyan.swivel.domain.model.TierReport;
import com.vidnyan.swivel.domain.model.ValidationDepth;
import com.vidnyan.swivel.domain.model.ValidationError;
import com.vidnyan.swivel.domain.model.ValidationLevel;
import com.vidnyan.swivel.domain.model.ValidationResult;
import com.vidnyan.swivel.domain.model.ValidationStatus;
import com.vidnyan.swivel.domain.source.ParsedSource;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PipelineOrchestratorTest {

    private static PipelineOrchestrator orchestrator(FrameworkRuntime runtime, ProcessLauncher launcher) {
        return new PipelineOrchestrator(new SyntaxValidator(), new StaticAnalyzer(),
                new StructuralValidator(runtime), new SandboxExecutor(launcher), runtime);
    }

    private final PipelineOrchestrator pipeline =
            orchestrator(new SwingFrameworkRuntime(), ProcessLaunchers.forCurrentPlatform());

    @Test
    void validate_ShouldFailWithSingleForbiddenImportFinding() {
        ValidationResult result = pipeline.validate(SamplePrograms.GREETER_WITH_FILES_IMPORT, ValidationDepth.FULL);

        assertEquals(ValidationStatus.FAIL, result.status());
        assertEquals(1, result.errors().size(), () -> "unexpected " + result.errors());
        assertEquals("E201", result.errors().get(0).code());
        assertEquals(5, result.errors().get(0).line());
        assertEquals(1, result.summary().errors());
        assertEquals(ValidationStatus.FAIL, result.metadata().tierStatus(ValidationLevel.STATIC));
        assertEquals(ValidationStatus.PASS, result.metadata().tierStatus(ValidationLevel.SANDBOX));
    }

    @Test
    void validate_ShouldPassCleanProgramAndDescribeEnvironment() {
        ValidationResult result = pipeline.validate(SamplePrograms.GREETER, ValidationDepth.FULL);

        assertEquals(ValidationStatus.PASS, result.status(), () -> "unexpected " + result.errors());
        assertTrue(result.errors().isEmpty());
        assertEquals(0, result.summary().total());
        assertNotNull(result.metadata().toolVersion());
        assertEquals(System.getProperty("java.version"), result.metadata().javaVersion());
        assertNotNull(result.metadata().frameworkVersion());
        assertEquals(ValidationDepth.FULL, result.metadata().depth());
        assertEquals(4, result.metadata().tiers().size());
        assertNull(result.metadata().fault());
    }

    @Test
    void validate_ShouldStopAfterSyntaxFailure() {
        ValidationResult result = pipeline.validate("public class Broken { void f( }", ValidationDepth.FULL);

        assertEquals(ValidationStatus.FAIL, result.status());
        assertEquals(List.of("E101"), result.errors().stream().map(ValidationError::code).toList());
        assertEquals(1, result.metadata().tiers().size());
    }

    @Test
    void validate_ShouldRunOnlyTheTiersOfTheRequestedDepth() {
        ValidationResult fast = pipeline.validate(SamplePrograms.UNNAMED_COMPONENTS, ValidationDepth.FAST);
        ValidationResult structural = pipeline.validate(SamplePrograms.UNNAMED_COMPONENTS, ValidationDepth.STRUCTURAL);

        assertTrue(fast.isPass());
        assertEquals(2, fast.metadata().tiers().size());
        assertEquals(ValidationStatus.FAIL, structural.status());
        assertEquals(2, structural.errorsWithCode("D302").size());
        assertNull(structural.metadata().tierStatus(ValidationLevel.SANDBOX));
    }

    @Test
    void validate_ShouldKeepRunningLaterTiersAfterStaticFindings() {
        ValidationResult result = pipeline.validate(SamplePrograms.UNUSED_AND_MISSING_IMPORT, ValidationDepth.FULL);

        assertEquals(ValidationStatus.FAIL, result.status());
        assertTrue(result.hasCode("W205"));
        assertTrue(result.hasCode("W203"));
        assertTrue(result.hasCode("S402"));
        assertEquals(3, result.errors().size(), () -> "unexpected " + result.errors());
    }

    @Test
    void validate_ShouldRecordSkippedStructuralTier() {
        PipelineOrchestrator headless = orchestrator(TestDoubles.unavailableRuntime(), ProcessLaunchers.forCurrentPlatform());

        ValidationResult result = headless.validate(SamplePrograms.UNNAMED_COMPONENTS, ValidationDepth.STRUCTURAL);

        assertTrue(result.isPass());
        assertEquals(ValidationStatus.SKIPPED, result.metadata().tierStatus(ValidationLevel.STRUCTURE));
        assertTrue(result.metadata().warnings().stream().anyMatch(w -> w.startsWith("L3 skipped")));
        assertNull(result.metadata().frameworkVersion());
    }

    @Test
    void validate_ShouldReportInfrastructureFaultAsError() {
        PipelineOrchestrator broken = orchestrator(new SwingFrameworkRuntime(), TestDoubles.failingLauncher("no fork"));

        ValidationResult result = broken.validate(SamplePrograms.GREETER, ValidationDepth.FULL);

        assertEquals(ValidationStatus.ERROR, result.status());
        assertTrue(result.hasCode("S499"));
        assertEquals(ValidationStatus.ERROR, result.metadata().tierStatus(ValidationLevel.SANDBOX));
        assertTrue(result.metadata().fault().startsWith("L4:"));
        assertTrue(result.metadata().fault().contains("no fork"));
    }

    @Test
    void validate_ShouldReportUndecodableBytes() {
        ValidationResult result = pipeline.validate(new byte[] {(byte) 0xFF, (byte) 0xFE, 'x'}, ValidationDepth.FULL, null);

        assertEquals(ValidationStatus.FAIL, result.status());
        assertEquals(List.of("E102"), result.errors().stream().map(ValidationError::code).toList());
    }

    @Test
    void validate_ShouldIgnoreNonPositiveTimeout() {
        ValidationResult result = pipeline.validate(SamplePrograms.GREETER, ValidationDepth.FAST, Duration.ZERO);

        assertTrue(result.isPass());
        assertTrue(result.metadata().warnings().stream().anyMatch(w -> w.contains("non-positive timeout")));
    }

    @Test
    void validate_ShouldRejectDeeplyNestedExpressionWithoutThrowing() {
        int depth = 20_000;
        String source = "public class Deep { int x = " + "(".repeat(depth) + "1" + ")".repeat(depth) + "; }";

        ValidationResult result = assertDoesNotThrow(() -> pipeline.validate(source, ValidationDepth.FAST));

        assertEquals(ValidationStatus.FAIL, result.status());
        assertTrue(result.hasCode("E101"));
        assertTrue(result.errors().get(0).message().contains("nesting"));
    }

    @Test
    void validate_ShouldSurviveVeryLongConcatenation() {
        String source = "public class Long { String s = " + "\"a\" + ".repeat(50_000) + "\"a\"; }";

        ValidationResult result = assertDoesNotThrow(() -> pipeline.validate(source, ValidationDepth.FAST));

        assertNotEquals(ValidationStatus.PASS, result.status());
        assertTrue(result.hasCode("E101") || result.hasCode("E299"), () -> "unexpected " + result.errors());
    }

    @Test
    void validate_ShouldReportStackExhaustionInTierAsFault() {
        StaticAnalyzer exhausted = new StaticAnalyzer() {
            @Override
            public TierReport analyze(ParsedSource source) {
                throw new StackOverflowError();
            }
        };
        FrameworkRuntime runtime = new SwingFrameworkRuntime();
        PipelineOrchestrator broken = new PipelineOrchestrator(new SyntaxValidator(), exhausted,
                new StructuralValidator(runtime), new SandboxExecutor(ProcessLaunchers.forCurrentPlatform()), runtime);

        ValidationResult result = broken.validate(SamplePrograms.GREETER, ValidationDepth.FAST);

        assertEquals(ValidationStatus.ERROR, result.status());
        assertTrue(result.hasCode("E299"));
        assertEquals(ValidationStatus.ERROR, result.metadata().tierStatus(ValidationLevel.STATIC));
        assertTrue(result.metadata().fault().contains("StackOverflowError"));
    }

    @Test
    void deduplicate_ShouldKeepFirstFindingPerCodeAndLine() {
        ValidationError first = ValidationError.builder().code("E201").message("first").line(3).build();
        ValidationError repeat = ValidationError.builder().code("E201").message("repeat").line(3).build();
        ValidationError other = ValidationError.builder().code("W205").severity(Severity.WARNING).message("w").line(3).build();

        List<ValidationError> unique = PipelineOrchestrator.deduplicate(List.of(first, repeat, other));

        assertEquals(List.of(first, other), unique);
    }
}
