package com.vidnyan.swivel.adapter.out.rule;

import com.github.javaparser.ast.ImportDeclaration;
import com.vidnyan.swivel.domain.model.ValidationError;
import com.vidnyan.swivel.domain.rule.SourcePatch;
import com.vidnyan.swivel.domain.rule.TextEdit;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Shared patch building for the rules that delete imports named in {@code context.import}.
 */
final class ImportRemovals {

    private ImportRemovals() {
    }

    static Optional<SourcePatch> patch(String ruleId, ImportBlock block, List<ValidationError> matched) {
        Set<ImportDeclaration> targets = Collections.newSetFromMap(new IdentityHashMap<>());
        for (ValidationError error : matched) {
            String name = error.contextValue("import").orElseThrow();
            boolean isStatic = Boolean.parseBoolean(error.contextValue("static").orElse("false"));
            boolean asterisk = Boolean.parseBoolean(error.contextValue("asterisk").orElse("false"));
            block.find(name, isStatic, asterisk).ifPresent(targets::add);
        }
        if (targets.isEmpty()) {
            return Optional.empty();
        }
        List<TextEdit> edits = new ArrayList<>();
        for (ImportDeclaration imp : block.imports()) {
            if (targets.contains(imp)) {
                edits.add(block.removal(imp));
            }
        }
        return Optional.of(new SourcePatch(ruleId, block.span(), edits));
    }
}
