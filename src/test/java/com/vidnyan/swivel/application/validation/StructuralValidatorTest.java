package com.vidnyan.swivel.application.validation;

import com.vidnyan.swivel.SamplePrograms;
import com.vidnyan.swivel.TestDoubles;
import com.vidnyan.swivel.adapter.out.framework.SwingFrameworkRuntime;
import com.vidnyan.swivel.application.port.out.FrameworkRuntime;
import com.vidnyan.swivel.domain.model.TierReport;
import com.vidnyan.swivel.domain.model.ValidationError;
import com.vidnyan.swivel.domain.model.ValidationStatus;
import com.vidnyan.swivel.domain.source.ParsedSource;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StructuralValidatorTest {

    private final StructuralValidator validator = new StructuralValidator(new SwingFrameworkRuntime());

    private static ParsedSource parse(String source) {
        return new SyntaxValidator().validate(source).parsed().orElseThrow();
    }

    private static List<ValidationError> withCode(TierReport report, String code) {
        return report.findings().stream().filter(e -> e.code().equals(code)).toList();
    }

    @Test
    void validate_ShouldAcceptNamedComponentTree() {
        TierReport report = validator.validate(parse(SamplePrograms.GREETER));

        assertEquals(ValidationStatus.PASS, report.status());
        assertTrue(report.findings().isEmpty(), () -> "unexpected " + report.findings());
    }

    @Test
    void validate_ShouldReportUnnamedFieldAndLocalComponents() {
        TierReport report = validator.validate(parse(SamplePrograms.UNNAMED_COMPONENTS));

        List<ValidationError> missing = withCode(report, "D302");
        assertEquals(2, missing.size());

        ValidationError field = missing.get(0);
        assertEquals(6, field.line());
        assertEquals(34, field.column());
        assertEquals("JPanel", field.contextValue("kind").orElseThrow());
        assertEquals(StructuralValidator.BINDING_FIELD, field.contextValue("binding_kind").orElseThrow());
        assertEquals("panel", field.contextValue("binding").orElseThrow());
        assertEquals("false", field.contextValue("static").orElseThrow());

        ValidationError local = missing.get(1);
        assertEquals(10, local.line());
        assertEquals(StructuralValidator.BINDING_LOCAL, local.contextValue("binding_kind").orElseThrow());
        assertEquals("ok", local.contextValue("suggested_id").orElseThrow());
        assertTrue(report.failed());
    }

    @Test
    void validate_ShouldHonourSelfNamingSubclassesAndReportInlineComponents() {
        String source = """
                import javax.swing.JButton;
                import javax.swing.JPanel;

                public class Custom {

                    static class Toolbar extends JPanel {
                        Toolbar() {
                            setName("toolbar");
                            JButton save = new JButton("Save");
                            save.setName("save");
                            add(save);
                        }
                    }

                    public static void main(String[] args) {
                        Toolbar toolbar = new Toolbar();
                        JPanel inline = new JPanel();
                        inline.add(new JButton("Loose"));
                        inline.setName("inline");
                        System.out.println(toolbar.getComponentCount() + inline.getComponentCount());
                    }
                }
                """;

        TierReport report = validator.validate(parse(source));

        List<ValidationError> missing = withCode(report, "D302");
        assertEquals(1, missing.size(), () -> "unexpected " + report.findings());
        assertEquals(18, missing.get(0).line());
        assertEquals(StructuralValidator.BINDING_INLINE, missing.get(0).contextValue("binding_kind").orElseThrow());
        assertTrue(missing.get(0).contextValue("binding").isEmpty());
        assertEquals("button-18", missing.get(0).contextValue("suggested_id").orElseThrow());
    }

    @Test
    void validate_ShouldIgnoreNamesGivenToNonComponents() {
        String source = """
                import javax.swing.JButton;
                import javax.swing.JPanel;

                public class Status {
                    public static void main(String[] args) {
                        JPanel root = new JPanel();
                        root.setName("status");
                        Thread worker = new Thread(() -> System.out.println("tick"));
                        worker.setName("status");
                        Thread.currentThread().setName("status");
                        rename(new JButton("Save"));
                    }

                    static void rename(JButton target) {
                        target.setName("status");
                    }
                }
                """;

        TierReport report = validator.validate(parse(source));

        List<ValidationError> duplicates = withCode(report, "D303");
        assertEquals(1, duplicates.size(), () -> "unexpected " + report.findings());
        assertEquals(15, duplicates.get(0).line());
        assertEquals("7", duplicates.get(0).contextValue("first_line").orElseThrow());
    }

    @Test
    void validate_ShouldReportDuplicateIdentifiers() {
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

        TierReport report = validator.validate(parse(source));

        List<ValidationError> duplicates = withCode(report, "D303");
        assertEquals(1, duplicates.size());
        assertEquals(9, duplicates.get(0).line());
        assertEquals("same", duplicates.get(0).contextValue("id").orElseThrow());
        assertEquals("7", duplicates.get(0).contextValue("first_line").orElseThrow());
    }

    @Test
    void validate_ShouldRejectAbsoluteAndUnknownLayouts() {
        String source = """
                import javax.swing.JPanel;

                public class Layouts {
                    public static void main(String[] args) {
                        JPanel a = new JPanel();
                        a.setName("a");
                        a.setLayout(null);
                        JPanel b = new JPanel();
                        b.setName("b");
                        b.setLayout(new MigLayout());
                    }
                }
                """;

        TierReport report = validator.validate(parse(source));

        List<ValidationError> layouts = withCode(report, "D304");
        assertEquals(2, layouts.size());
        assertEquals(7, layouts.get(0).line());
        assertEquals("null", layouts.get(0).contextValue("layout").orElseThrow());
        assertEquals(10, layouts.get(1).line());
        assertEquals("MigLayout", layouts.get(1).contextValue("layout").orElseThrow());
    }

    @Test
    void validate_ShouldRejectComponentsOutsideTheCatalogue() {
        String source = """
                import javax.swing.JColorChooser;
                import javax.swing.JPanel;

                public class Odd {
                    public static void main(String[] args) {
                        JPanel root = new JPanel();
                        root.setName("root");
                        root.add(new JColorChooser());
                        root.add(new javax.swing.JFancyWidget());
                    }
                }
                """;

        TierReport report = validator.validate(parse(source));

        List<ValidationError> invalid = withCode(report, "D301");
        assertEquals(2, invalid.size());
        assertEquals(8, invalid.get(0).line());
        assertTrue(invalid.get(0).message().contains("not in the supported catalogue"));
        assertEquals(9, invalid.get(1).line());
        assertTrue(invalid.get(1).message().contains("cannot be resolved"));
    }

    @Test
    void validate_ShouldWarnWhenNoComponentIsCreated() {
        String source = """
                public class Plain {
                    public static void main(String[] args) {
                        System.out.println("hi");
                    }
                }
                """;

        TierReport report = validator.validate(parse(source));

        assertEquals(1, report.findings().size());
        assertEquals("D300", report.findings().get(0).code());
        assertFalse(report.failed());
    }

    @Test
    void validate_ShouldSkipWhenSwingIsUnavailable() {
        FrameworkRuntime missing = TestDoubles.unavailableRuntime();

        TierReport report = new StructuralValidator(missing).validate(parse(SamplePrograms.UNNAMED_COMPONENTS));

        assertEquals(ValidationStatus.SKIPPED, report.status());
        assertTrue(report.findings().isEmpty());
        assertTrue(report.notes().get(0).startsWith("L3 skipped"));
    }
}
