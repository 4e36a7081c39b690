package com.vidnyan.swivel.application.service;

import com.vidnyan.swivel.SamplePrograms;
import com.vidnyan.swivel.TestDoubles;
import com.vidnyan.swivel.adapter.out.framework.SwingFrameworkRuntime;
import com.vidnyan.swivel.adapter.out.rule.ComponentIdentifierRule;
import com.vidnyan.swivel.adapter.out.rule.CorrectionRules;
import com.vidnyan.swivel.adapter.out.rule.MissingImportInsertionRule;
import com.vidnyan.swivel.adapter.out.rule.UnusedImportRemovalRule;
import com.vidnyan.swivel.adapter.out.sandbox.ProcessLaunchers;
import com.vidnyan.swivel.application.port.in.ValidateSourceUseCase;
import com.vidnyan.swivel.application.port.out.FrameworkRuntime;
import com.vidnyan.swivel.application.port.out.ProcessLauncher;
import com.vidnyan.swivel.application.validation.SandboxExecutor;
import com.vidnyan.swivel.application.validation.StaticAnalyzer;
import com.vidnyan.swivel.application.validation.StructuralValidator;
import com.vidnyan.swivel.application.validation.SyntaxValidator;
import com.vidnyan.swivel.domain.healing.HealingIteration;
import com.vidnyan.swivel.domain.healing.HealingOutcome;
import com.vidnyan.swivel.domain.healing.HealingSession;
import com.vidnyan.swivel.domain.model.Severity;
import com.vidnyan.swivel.domain.model.ValidationDepth;
import com.vidnyan.swivel.domain.model.ValidationError;
import com.vidnyan.swivel.domain.model.ValidationMetadata;
import com.vidnyan.swivel.domain.model.ValidationResult;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SelfHealingEngineTest {

    private static PipelineOrchestrator pipeline(FrameworkRuntime runtime, ProcessLauncher launcher) {
        return new PipelineOrchestrator(new SyntaxValidator(), new StaticAnalyzer(),
                new StructuralValidator(runtime), new SandboxExecutor(launcher), runtime);
    }

    private final SelfHealingEngine engine = new SelfHealingEngine(
            pipeline(new SwingFrameworkRuntime(), ProcessLaunchers.forCurrentPlatform()),
            CorrectionRules.defaultEngine(), 5);

    @Test
    void heal_ShouldRemoveUnusedImportThenInsertMissingOne() {
        HealingSession session = engine.heal(SamplePrograms.UNUSED_AND_MISSING_IMPORT);

        assertEquals(HealingOutcome.CONVERGED, session.outcome());
        assertTrue(session.converged());
        assertEquals(2, session.iterationCount());
        assertTrue(session.initialResult().hasCode("W205"));
        assertTrue(session.initialResult().hasCode("W203"));
        assertTrue(session.initialResult().hasCode("S402"));

        HealingIteration first = session.iterations().get(0);
        assertEquals(List.of(UnusedImportRemovalRule.ID), first.appliedRuleIds());
        assertEquals(List.of(MissingImportInsertionRule.ID), first.deferredRuleIds());
        assertTrue(first.diff().contains("-import javax.swing.JCheckBox;"));
        assertTrue(first.diff().startsWith("--- iteration-0\n+++ iteration-1\n"));

        HealingIteration second = session.iterations().get(1);
        assertEquals(List.of(MissingImportInsertionRule.ID), second.appliedRuleIds());
        assertTrue(second.diff().contains("+import javax.swing.JButton;"));

        assertTrue(session.finalResult().isPass(), () -> "unexpected " + session.finalResult().errors());
        assertTrue(session.finalSource().contains("import javax.swing.JButton;\n"));
        assertFalse(session.finalSource().contains("JCheckBox"));
        assertEquals(List.of(UnusedImportRemovalRule.ID, MissingImportInsertionRule.ID), session.appliedRuleIds());
    }

    @Test
    void heal_ShouldLeaveHealedSourceUntouched() {
        HealingSession healed = engine.heal(SamplePrograms.UNUSED_AND_MISSING_IMPORT);

        HealingSession again = engine.heal(healed.finalSource());

        assertTrue(again.converged());
        assertEquals(0, again.iterationCount());
        assertEquals(healed.finalSource(), again.finalSource());
    }

    @Test
    void heal_ShouldNameComponentsStoredInFieldsAndLocals() {
        HealingSession session = engine.heal(SamplePrograms.UNNAMED_COMPONENTS);

        assertTrue(session.converged(), () -> "unexpected " + session.finalResult().errors());
        assertEquals(List.of(ComponentIdentifierRule.ID), session.appliedRuleIds());
        assertTrue(session.finalSource().contains("    { panel.setName(\"panel\"); }\n"));
        assertTrue(session.finalSource().contains("        ok.setName(\"ok\");\n"));
    }

    @Test
    void heal_ShouldStopAtIterationCeiling() {
        HealingSession session = engine.heal(SamplePrograms.UNUSED_AND_MISSING_IMPORT, 1);

        assertEquals(HealingOutcome.EXHAUSTED, session.outcome());
        assertEquals(1, session.iterationCount());
        assertTrue(session.finalResult().hasCode("W203"));
        assertEquals(1, session.maxIterations());
    }

    @Test
    void heal_ShouldOnlyValidateWhenCeilingIsZero() {
        HealingSession session = engine.heal(SamplePrograms.UNUSED_AND_MISSING_IMPORT, 0);

        assertEquals(HealingOutcome.EXHAUSTED, session.outcome());
        assertEquals(0, session.iterationCount());
        assertEquals(SamplePrograms.UNUSED_AND_MISSING_IMPORT, session.finalSource());
        assertSame(session.initialResult(), session.finalResult());
    }

    @Test
    void heal_ShouldGiveUpWhenNoRuleApplies() {
        String source = """
                import javax.swing.JButton;
                import javax.swing.JPanel;

                public class Dupes {
                    public static void main(String[] args) {
                        JPanel root = new JPanel();
                        root.setName("same");
                        JButton button = new JButton("Go");
                        button.setName("same");
                        root.add(button);
                    }
                }
                """;

        HealingSession session = engine.heal(source);

        assertEquals(HealingOutcome.EXHAUSTED, session.outcome());
        assertEquals(0, session.iterationCount());
        assertTrue(session.finalResult().hasCode("D303"));
    }

    @Test
    void heal_ShouldStopOnInfrastructureFaultDuringInitialValidation() {
        SelfHealingEngine broken = new SelfHealingEngine(
                pipeline(new SwingFrameworkRuntime(), TestDoubles.failingLauncher("no fork")),
                CorrectionRules.defaultEngine(), 5);

        HealingSession session = broken.heal(SamplePrograms.GREETER);

        assertEquals(HealingOutcome.ERROR, session.outcome());
        assertEquals(0, session.iterationCount());
        assertTrue(session.faultDescription().orElseThrow().contains("no fork"));
    }

    @Test
    void heal_ShouldKeepLastGoodResultWhenRevalidationFaults() {
        ValidationError unused = ValidationError.builder()
                .code("W205")
                .severity(Severity.WARNING)
                .message("Unused import 'javax.swing.JCheckBox'")
                .line(1)
                .context(Map.of("import", "javax.swing.JCheckBox", "static", "false", "asterisk", "false"))
                .build();
        ValidationError blocking = ValidationError.builder().code("E202").message("blocking").line(9).build();
        ValidationResult initial = ValidationResult.of(List.of(unused, blocking), null);
        ValidationMetadata faulty = new ValidationMetadata("dev", "17", null, "test", ValidationDepth.FULL,
                null, null, "L4: sandbox vanished");
        ValidationResult fault = ValidationResult.error(
                List.of(ValidationError.builder().code("S499").message("L4 could not run").build()), faulty);
        ScriptedValidator validator = new ScriptedValidator(initial, fault);

        HealingSession session = new SelfHealingEngine(validator, CorrectionRules.defaultEngine(), 5)
                .heal(SamplePrograms.UNUSED_AND_MISSING_IMPORT);

        assertEquals(HealingOutcome.ERROR, session.outcome());
        assertEquals("L4: sandbox vanished", session.fault());
        assertSame(initial, session.finalResult());
        assertEquals(SamplePrograms.UNUSED_AND_MISSING_IMPORT, session.finalSource());
        assertEquals(0, session.iterationCount());
    }

    @Test
    void heal_ShouldRejectNegativeCeiling() {
        assertThrows(IllegalArgumentException.class, () -> engine.heal(SamplePrograms.GREETER, -1));
        assertThrows(IllegalArgumentException.class, () -> new SelfHealingEngine(
                pipeline(new SwingFrameworkRuntime(), ProcessLaunchers.forCurrentPlatform()),
                CorrectionRules.defaultEngine(), -1));
    }

    /** Returns prepared results in order. */
    private static final class ScriptedValidator implements ValidateSourceUseCase {

        private final Deque<ValidationResult> results;

        ScriptedValidator(ValidationResult... results) {
            this.results = new ArrayDeque<>(List.of(results));
        }

        @Override
        public ValidationResult validate(String source, ValidationDepth depth, Duration timeout) {
            return results.pop();
        }

        @Override
        public ValidationResult validate(byte[] source, ValidationDepth depth, Duration timeout) {
            throw new UnsupportedOperationException();
        }
    }
}
