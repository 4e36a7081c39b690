package com.vidnyan.swivel.adapter.out.rule;

import com.github.javaparser.Position;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.ClassOrInterfaceDeclaration;
import com.github.javaparser.ast.body.FieldDeclaration;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.ObjectCreationExpr;
import com.github.javaparser.ast.expr.StringLiteralExpr;
import com.github.javaparser.ast.stmt.BlockStmt;
import com.github.javaparser.ast.stmt.ExpressionStmt;
import com.github.javaparser.ast.stmt.Statement;
import com.vidnyan.swivel.application.validation.StructuralValidator;
import com.vidnyan.swivel.domain.model.ErrorCodes;
import com.vidnyan.swivel.domain.model.ValidationError;
import com.vidnyan.swivel.domain.rule.CorrectionRule;
import com.vidnyan.swivel.domain.rule.SourcePatch;
import com.vidnyan.swivel.domain.rule.TextEdit;
import com.vidnyan.swivel.domain.rule.TextSpan;
import com.vidnyan.swivel.domain.source.LineIndex;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Gives unnamed interactive components and containers an identifier by inserting a
 * {@code setName("id")} call right after the place the component is stored:
 * <ul>
 *   <li>local variable: a statement after the declaration</li>
 *   <li>field: an initializer block after the field ({@code static} for static fields)</li>
 *   <li>assignment: a statement after the assignment</li>
 * </ul>
 * Components created inline have nowhere to hang the call and are skipped.
 */
@Slf4j
public class ComponentIdentifierRule implements CorrectionRule {

    public static final String ID = "insert-component-identifier";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public Set<String> codes() {
        return Set.of(ErrorCodes.MISSING_IDENTIFIER);
    }

    @Override
    public boolean matches(ValidationError error) {
        return CorrectionRule.super.matches(error)
                && error.line() != null && error.column() != null
                && error.contextValue("binding").isPresent()
                && !error.contextValue("binding_kind").orElse(StructuralValidator.BINDING_INLINE)
                        .equals(StructuralValidator.BINDING_INLINE);
    }

    @Override
    public Optional<SourcePatch> propose(String source, List<ValidationError> matched) {
        Optional<CompilationUnit> parsed = SourceTrees.parse(source);
        if (parsed.isEmpty()) {
            return Optional.empty();
        }
        CompilationUnit unit = parsed.get();
        LineIndex index = new LineIndex(source);
        Set<String> taken = existingIdentifiers(unit);

        List<TextEdit> edits = new ArrayList<>();
        for (ValidationError error : matched) {
            Optional<ObjectCreationExpr> creation = creationAt(unit, error.line(), error.column());
            if (creation.isEmpty()) {
                log.debug("No component creation at {}:{}, skipping", error.line(), error.column());
                continue;
            }
            String binding = error.contextValue("binding").orElseThrow();
            String id = unique(error.contextValue("suggested_id").orElse(binding), taken);
            String kind = error.contextValue("binding_kind").orElseThrow();
            Optional<TextEdit> edit = kind.equals(StructuralValidator.BINDING_FIELD)
                    ? afterField(creation.get(), binding, id,
                            Boolean.parseBoolean(error.contextValue("static").orElse("false")), index)
                    : afterStatement(creation.get(), binding, id, index);
            if (edit.isPresent()) {
                taken.add(id);
                edits.add(edit.get());
            }
        }
        if (edits.isEmpty()) {
            return Optional.empty();
        }
        TextSpan claimed = edits.stream().map(TextEdit::span).reduce(TextSpan::union).orElseThrow();
        return Optional.of(new SourcePatch(id(), claimed, edits));
    }

    private Optional<TextEdit> afterStatement(ObjectCreationExpr creation, String binding, String id, LineIndex index) {
        Optional<Statement> statement = creation.findAncestor(Statement.class);
        if (statement.isEmpty() || !(statement.get() instanceof ExpressionStmt)
                || statement.get().getParentNode().filter(BlockStmt.class::isInstance).isEmpty()) {
            return Optional.empty();
        }
        String call = binding + ".setName(\"" + escape(id) + "\");";
        return Optional.of(insertAfter(statement.get(), call, index));
    }

    private Optional<TextEdit> afterField(ObjectCreationExpr creation, String binding, String id,
                                          boolean isStatic, LineIndex index) {
        Optional<FieldDeclaration> field = creation.findAncestor(FieldDeclaration.class);
        if (field.isEmpty()) {
            return Optional.empty();
        }
        Optional<Node> owner = field.get().getParentNode();
        if (owner.isPresent() && owner.get() instanceof ClassOrInterfaceDeclaration declaration
                && declaration.isInterface()) {
            return Optional.empty();
        }
        String block = (isStatic ? "static " : "") + "{ " + binding + ".setName(\"" + escape(id) + "\"); }";
        return Optional.of(insertAfter(field.get(), block, index));
    }

    /**
     * Insert {@code code} on its own line after {@code node}, with the node's indentation, or
     * directly behind it when more code follows on the same line.
     */
    private static TextEdit insertAfter(Node node, String code, LineIndex index) {
        Position begin = node.getBegin().orElseThrow();
        int end = index.endOffsetOf(node.getRange().orElseThrow());
        int endLine = node.getEnd().orElseThrow().line;
        int lineEnd = index.nextLineStart(endLine);
        String separator = index.lineSeparator();
        if (index.restOfLineIsBlank(endLine, end)) {
            boolean lastLineWithoutBreak = lineEnd == end;
            String text = (lastLineWithoutBreak ? separator : "") + index.indentationOf(begin.line) + code
                    + (lastLineWithoutBreak ? "" : separator);
            return TextEdit.insert(lineEnd, text);
        }
        return TextEdit.insert(end, " " + code);
    }

    private static Optional<ObjectCreationExpr> creationAt(CompilationUnit unit, int line, int column) {
        return unit.findAll(ObjectCreationExpr.class).stream()
                .filter(creation -> creation.getBegin()
                        .filter(p -> p.line == line && p.column == column)
                        .isPresent())
                .findFirst();
    }

    private static Set<String> existingIdentifiers(CompilationUnit unit) {
        Set<String> ids = new HashSet<>();
        for (MethodCallExpr call : unit.findAll(MethodCallExpr.class)) {
            if (StructuralValidator.isSetName(call)) {
                ids.add(((StringLiteralExpr) call.getArgument(0)).asString());
            }
        }
        return ids;
    }

    private static String unique(String base, Set<String> taken) {
        String id = base;
        int n = 2;
        while (taken.contains(id)) {
            id = base + "-" + n++;
        }
        return id;
    }

    private static String escape(String id) {
        return id.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}
