package com.vidnyan.swivel.adapter.out.rule;

import com.github.javaparser.ast.ImportDeclaration;
import com.vidnyan.swivel.domain.model.ErrorCodes;
import com.vidnyan.swivel.domain.model.ValidationError;
import com.vidnyan.swivel.domain.rule.CorrectionRule;
import com.vidnyan.swivel.domain.rule.SourcePatch;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Adds the import named in {@code context.import} for framework types used without one.
 * Names that would clash with an existing single-type import are left alone.
 */
public class MissingImportInsertionRule implements CorrectionRule {

    public static final String ID = "insert-missing-import";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public Set<String> codes() {
        return Set.of(ErrorCodes.MISSING_IMPORT);
    }

    @Override
    public boolean matches(ValidationError error) {
        return CorrectionRule.super.matches(error) && error.contextValue("import").isPresent();
    }

    @Override
    public Optional<SourcePatch> propose(String source, List<ValidationError> matched) {
        Optional<ImportBlock> parsed = ImportBlock.of(source);
        if (parsed.isEmpty()) {
            return Optional.empty();
        }
        ImportBlock block = parsed.get();
        Set<String> names = new TreeSet<>();
        for (ValidationError error : matched) {
            String name = error.contextValue("import").orElseThrow();
            if (!clashes(block, name)) {
                names.add(name);
            }
        }
        if (names.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new SourcePatch(id(), block.span(), List.of(block.insertion(new ArrayList<>(names)))));
    }

    private static boolean clashes(ImportBlock block, String qualifiedName) {
        String simple = qualifiedName.substring(qualifiedName.lastIndexOf('.') + 1);
        for (ImportDeclaration imp : block.imports()) {
            if (!imp.isStatic() && !imp.isAsterisk() && imp.getName().getIdentifier().equals(simple)) {
                return true;
            }
        }
        return false;
    }
}
