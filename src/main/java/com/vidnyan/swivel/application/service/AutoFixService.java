package com.vidnyan.swivel.application.service;

import com.vidnyan.swivel.application.port.in.FixSourceUseCase;
import com.vidnyan.swivel.application.port.in.ValidateSourceUseCase;
import com.vidnyan.swivel.domain.model.ValidationDepth;
import com.vidnyan.swivel.domain.model.ValidationError;
import com.vidnyan.swivel.domain.model.ValidationResult;
import com.vidnyan.swivel.domain.rule.RuleRound;
import com.vidnyan.swivel.domain.rule.RulesEngine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Applies the correction rules without ever running the program: validates up to L3, applies a
 * round, re-validates and repeats while rules still change the source.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AutoFixService implements FixSourceUseCase {

    static final int MAX_ROUNDS = 10;

    private final ValidateSourceUseCase validator;
    private final RulesEngine rulesEngine;

    @Override
    public FixReport fix(String source) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        String current = source;
        ValidationResult result = validator.validate(current, ValidationDepth.STRUCTURAL);

        for (int round = 1; round <= MAX_ROUNDS && !result.isInfrastructureError(); round++) {
            RuleRound applied = rulesEngine.apply(current, result);
            if (!applied.changed() || applied.source().equals(current)) {
                break;
            }
            applied.appliedRuleIds().forEach(id -> counts.merge(id, 1, Integer::sum));
            log.debug("Fix round {} applied {}", round, applied.appliedRuleIds());
            current = applied.source();
            result = validator.validate(current, ValidationDepth.STRUCTURAL);
        }

        log.info("Fix pass applied {} and left {} finding(s)", counts, result.errors().size());
        return new FixReport(current, counts,
                result.errors().stream().map(ValidationError::code).distinct().toList());
    }
}
