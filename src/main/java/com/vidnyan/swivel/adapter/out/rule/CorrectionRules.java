package com.vidnyan.swivel.adapter.out.rule;

import com.vidnyan.swivel.domain.rule.CorrectionRule;
import com.vidnyan.swivel.domain.rule.RulesEngine;

import java.util.List;

/**
 * The built-in rules in priority order: removals before insertions, imports before identifiers.
 */
public final class CorrectionRules {

    private CorrectionRules() {
    }

    public static List<CorrectionRule> defaults() {
        return List.of(
                new UnusedImportRemovalRule(),
                new ForbiddenImportRemovalRule(),
                new MissingImportInsertionRule(),
                new ComponentIdentifierRule());
    }

    public static RulesEngine defaultEngine() {
        return new RulesEngine(defaults());
    }
}
