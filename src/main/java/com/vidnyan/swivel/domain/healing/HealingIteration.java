package com.vidnyan.swivel.domain.healing;

import com.vidnyan.swivel.domain.model.ValidationResult;

import java.util.List;

/**
 * One fix round: the rules applied to the snapshot, the resulting diff and the re-validation.
 */
public record HealingIteration(
    int number,
    List<String> appliedRuleIds,
    List<String> deferredRuleIds,
    String diff,
    ValidationResult result
) {

    public HealingIteration {
        appliedRuleIds = List.copyOf(appliedRuleIds);
        deferredRuleIds = List.copyOf(deferredRuleIds);
    }
}
