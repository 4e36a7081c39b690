package com.vidnyan.swivel.domain.rule;

import com.vidnyan.swivel.domain.model.ValidationError;
import com.vidnyan.swivel.domain.model.ValidationResult;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Ordered registry of correction rules.
 * Registry order is the fixed priority; the registry is immutable once built and safe to share.
 */
@Slf4j
public final class RulesEngine {

    private final List<CorrectionRule> registry;

    public RulesEngine(List<CorrectionRule> rules) {
        Set<String> ids = new HashSet<>();
        for (CorrectionRule rule : rules) {
            if (!ids.add(rule.id())) {
                throw new IllegalArgumentException("Duplicate correction rule id: " + rule.id());
            }
        }
        this.registry = List.copyOf(rules);
    }

    public List<CorrectionRule> rules() {
        return registry;
    }

    /**
     * Rules whose matcher accepts at least one finding of {@code result}, in registry order.
     */
    public List<CorrectionRule> applicableRules(ValidationResult result) {
        return registry.stream()
                .filter(rule -> result.errors().stream().anyMatch(rule::matches))
                .toList();
    }

    /**
     * Apply every applicable rule to the same snapshot. A patch that touches a region claimed by an
     * earlier rule is deferred to the next round instead of being merged.
     */
    public RuleRound apply(String source, ValidationResult result) {
        List<SourcePatch> accepted = new ArrayList<>();
        List<String> applied = new ArrayList<>();
        List<String> deferred = new ArrayList<>();
        List<String> skipped = new ArrayList<>();

        for (CorrectionRule rule : applicableRules(result)) {
            List<ValidationError> matched = result.errors().stream().filter(rule::matches).toList();
            Optional<SourcePatch> patch = propose(rule, source, matched);
            if (patch.isEmpty()) {
                skipped.add(rule.id());
                continue;
            }
            if (accepted.stream().anyMatch(patch.get()::conflictsWith)) {
                log.debug("Deferring {}: claimed span {} already taken", rule.id(), patch.get().claimedSpan());
                deferred.add(rule.id());
                continue;
            }
            accepted.add(patch.get());
            applied.add(rule.id());
        }

        String patched = accepted.isEmpty() ? source : SourcePatch.applyAll(source, accepted);
        log.debug("Rule round: applied={}, deferred={}, skipped={}", applied, deferred, skipped);
        return new RuleRound(patched, applied, deferred, skipped);
    }

    private Optional<SourcePatch> propose(CorrectionRule rule, String source, List<ValidationError> matched) {
        try {
            return rule.propose(source, matched);
        } catch (RuntimeException e) {
            log.warn("Correction rule {} failed, treating it as not applicable: {}", rule.id(), e.getMessage());
            return Optional.empty();
        }
    }
}
