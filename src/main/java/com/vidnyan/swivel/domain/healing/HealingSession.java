package com.vidnyan.swivel.domain.healing;

import com.vidnyan.swivel.domain.model.ValidationResult;

import java.util.List;
import java.util.Optional;

/**
 * Record of one bounded validate, fix, re-validate run. Created per invocation and never persisted.
 *
 * @param initialResult  validation of the untouched input
 * @param iterations     fix rounds in order
 * @param finalResult    last good result (for ERROR, the result before the fault)
 * @param finalSource    source matching {@code finalResult}
 * @param outcome        terminal state
 * @param maxIterations  ceiling the session ran under
 * @param fault          infrastructure fault description, only for ERROR
 */
public record HealingSession(
    ValidationResult initialResult,
    List<HealingIteration> iterations,
    ValidationResult finalResult,
    String finalSource,
    HealingOutcome outcome,
    int maxIterations,
    String fault
) {

    public HealingSession {
        iterations = List.copyOf(iterations);
    }

    public boolean converged() {
        return outcome == HealingOutcome.CONVERGED;
    }

    public int iterationCount() {
        return iterations.size();
    }

    public Optional<String> faultDescription() {
        return Optional.ofNullable(fault);
    }

    /**
     * Every rule id applied during the session, in application order.
     */
    public List<String> appliedRuleIds() {
        return iterations.stream().flatMap(it -> it.appliedRuleIds().stream()).toList();
    }
}
