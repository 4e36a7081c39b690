package com.vidnyan.swivel.application.service;

import com.vidnyan.swivel.SamplePrograms;
import com.vidnyan.swivel.adapter.out.framework.SwingFrameworkRuntime;
import com.vidnyan.swivel.adapter.out.rule.ComponentIdentifierRule;
import com.vidnyan.swivel.adapter.out.rule.CorrectionRules;
import com.vidnyan.swivel.adapter.out.rule.MissingImportInsertionRule;
import com.vidnyan.swivel.adapter.out.rule.UnusedImportRemovalRule;
import com.vidnyan.swivel.adapter.out.sandbox.ProcessLaunchers;
import com.vidnyan.swivel.application.port.in.FixSourceUseCase.FixReport;
import com.vidnyan.swivel.application.validation.SandboxExecutor;
import com.vidnyan.swivel.application.validation.StaticAnalyzer;
import com.vidnyan.swivel.application.validation.StructuralValidator;
import com.vidnyan.swivel.application.validation.SyntaxValidator;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AutoFixServiceTest {

    private final AutoFixService service;

    AutoFixServiceTest() {
        SwingFrameworkRuntime runtime = new SwingFrameworkRuntime();
        PipelineOrchestrator pipeline = new PipelineOrchestrator(new SyntaxValidator(), new StaticAnalyzer(),
                new StructuralValidator(runtime), new SandboxExecutor(ProcessLaunchers.forCurrentPlatform()), runtime);
        service = new AutoFixService(pipeline, CorrectionRules.defaultEngine());
    }

    @Test
    void fix_ShouldApplyRoundsUntilNothingChanges() {
        FixReport report = service.fix(SamplePrograms.UNUSED_AND_MISSING_IMPORT);

        assertTrue(report.changed());
        assertEquals(Map.of(UnusedImportRemovalRule.ID, 1, MissingImportInsertionRule.ID, 1), report.ruleCounts());
        assertEquals(List.of(), report.remaining());
        assertTrue(report.source().contains("import javax.swing.JButton;"));
        assertFalse(report.source().contains("JCheckBox"));
    }

    @Test
    void fix_ShouldInsertIdentifiersForFieldAndLocal() {
        FixReport report = service.fix(SamplePrograms.UNNAMED_COMPONENTS);

        assertEquals(Map.of(ComponentIdentifierRule.ID, 1), report.ruleCounts());
        assertTrue(report.remaining().isEmpty());
        assertTrue(report.source().contains("{ panel.setName(\"panel\"); }"));
        assertTrue(report.source().contains("ok.setName(\"ok\");"));
    }

    @Test
    void fix_ShouldReportWhatItCannotFix() {
        FixReport report = service.fix("public class Broken { void f( }");

        assertFalse(report.changed());
        assertEquals(List.of("E101"), report.remaining());
        assertEquals("public class Broken { void f( }", report.source());
    }
}
