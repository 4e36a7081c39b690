package com.vidnyan.swivel.adapter.out.rule;

import com.vidnyan.swivel.domain.model.ErrorCodes;
import com.vidnyan.swivel.domain.model.ValidationError;
import com.vidnyan.swivel.domain.rule.CorrectionRule;
import com.vidnyan.swivel.domain.rule.SourcePatch;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Deletes imports reported as unused.
 */
public class UnusedImportRemovalRule implements CorrectionRule {

    public static final String ID = "remove-unused-import";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public Set<String> codes() {
        return Set.of(ErrorCodes.UNUSED_IMPORT);
    }

    @Override
    public boolean matches(ValidationError error) {
        return CorrectionRule.super.matches(error) && error.contextValue("import").isPresent();
    }

    @Override
    public Optional<SourcePatch> propose(String source, List<ValidationError> matched) {
        return ImportBlock.of(source).flatMap(block -> ImportRemovals.patch(id(), block, matched));
    }
}
