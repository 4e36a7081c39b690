package com.vidnyan.swivel.domain.rule;

import java.util.List;

/**
 * Outcome of applying the applicable rules once to a single snapshot.
 *
 * @param source          text after the accepted patches
 * @param appliedRuleIds  rules whose patches were applied, in registry order
 * @param deferredRuleIds rules whose patches touched a region an earlier rule already claimed
 * @param skippedRuleIds  rules that matched a finding but had nothing to change
 */
public record RuleRound(
    String source,
    List<String> appliedRuleIds,
    List<String> deferredRuleIds,
    List<String> skippedRuleIds
) {

    public RuleRound {
        appliedRuleIds = List.copyOf(appliedRuleIds);
        deferredRuleIds = List.copyOf(deferredRuleIds);
        skippedRuleIds = List.copyOf(skippedRuleIds);
    }

    public boolean changed() {
        return !appliedRuleIds.isEmpty();
    }
}
