package com.vidnyan.swivel.application.service;

import com.vidnyan.swivel.application.port.in.HealSourceUseCase;
import com.vidnyan.swivel.application.port.in.ValidateSourceUseCase;
import com.vidnyan.swivel.domain.healing.HealingIteration;
import com.vidnyan.swivel.domain.healing.HealingOutcome;
import com.vidnyan.swivel.domain.healing.HealingSession;
import com.vidnyan.swivel.domain.healing.TextDiff;
import com.vidnyan.swivel.domain.model.ValidationDepth;
import com.vidnyan.swivel.domain.model.ValidationResult;
import com.vidnyan.swivel.domain.rule.RuleRound;
import com.vidnyan.swivel.domain.rule.RulesEngine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Bounded validate, fix, re-validate loop. Every validation runs at full depth.
 * <p>
 * Stops when the program passes (CONVERGED), when no rule changes the source or the iteration
 * ceiling is reached (EXHAUSTED), or when a validation hits an infrastructure fault (ERROR). An
 * infrastructure fault is never retried; the session keeps the last good result and source.
 */
@Slf4j
@Service
public class SelfHealingEngine implements HealSourceUseCase {

    private final ValidateSourceUseCase validator;
    private final RulesEngine rulesEngine;
    private final int defaultMaxIterations;

    public SelfHealingEngine(ValidateSourceUseCase validator,
                             RulesEngine rulesEngine,
                             @Value("${swivel.healing.max-iterations:5}") int defaultMaxIterations) {
        if (defaultMaxIterations < 0) {
            throw new IllegalArgumentException("max iterations must not be negative: " + defaultMaxIterations);
        }
        this.validator = validator;
        this.rulesEngine = rulesEngine;
        this.defaultMaxIterations = defaultMaxIterations;
    }

    @Override
    public HealingSession heal(String source) {
        return heal(source, defaultMaxIterations);
    }

    @Override
    public HealingSession heal(String source, int maxIterations) {
        if (maxIterations < 0) {
            throw new IllegalArgumentException("max iterations must not be negative: " + maxIterations);
        }
        ValidationResult initial = validator.validate(source, ValidationDepth.FULL);
        if (initial.isInfrastructureError()) {
            log.error("Initial validation failed with an infrastructure fault: {}", initial.metadata().fault());
            return new HealingSession(initial, List.of(), initial, source, HealingOutcome.ERROR, maxIterations,
                    initial.metadata().fault());
        }

        List<HealingIteration> iterations = new ArrayList<>();
        String current = source;
        ValidationResult result = initial;
        while (true) {
            if (result.isPass()) {
                log.info("Healing converged after {} iteration(s)", iterations.size());
                return session(initial, iterations, result, current, HealingOutcome.CONVERGED, maxIterations, null);
            }
            if (iterations.size() >= maxIterations) {
                log.info("Healing stopped at the ceiling of {} iteration(s)", maxIterations);
                return session(initial, iterations, result, current, HealingOutcome.EXHAUSTED, maxIterations, null);
            }

            RuleRound round = rulesEngine.apply(current, result);
            if (!round.changed() || round.source().equals(current)) {
                log.info("No correction rule applies to the remaining {} finding(s)", result.errors().size());
                return session(initial, iterations, result, current, HealingOutcome.EXHAUSTED, maxIterations, null);
            }

            ValidationResult next = validator.validate(round.source(), ValidationDepth.FULL);
            if (next.isInfrastructureError()) {
                log.error("Re-validation failed with an infrastructure fault: {}", next.metadata().fault());
                return session(initial, iterations, result, current, HealingOutcome.ERROR, maxIterations,
                        next.metadata().fault());
            }

            int number = iterations.size() + 1;
            iterations.add(new HealingIteration(number, round.appliedRuleIds(), round.deferredRuleIds(),
                    TextDiff.unified(current, round.source(), "iteration-" + (number - 1), "iteration-" + number),
                    next));
            log.info("Iteration {}: applied {}, deferred {}, now {}", number, round.appliedRuleIds(),
                    round.deferredRuleIds(), next.status().jsonValue());
            current = round.source();
            result = next;
        }
    }

    private static HealingSession session(ValidationResult initial, List<HealingIteration> iterations,
                                          ValidationResult result, String source, HealingOutcome outcome,
                                          int maxIterations, String fault) {
        return new HealingSession(initial, iterations, result, source, outcome, maxIterations, fault);
    }
}
