package com.vidnyan.swivel.domain.rule;

import com.vidnyan.swivel.domain.model.ValidationError;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * A deterministic source transformation triggered by specific findings.
 * Implementations are pure: they read the snapshot and the matched findings and either propose a
 * complete patch or nothing. They never apply part of a fix.
 */
public interface CorrectionRule {

    String id();

    /**
     * Error codes this rule addresses.
     */
    Set<String> codes();

    default boolean matches(ValidationError error) {
        return codes().contains(error.code());
    }

    /**
     * Propose a patch for {@code matched} against {@code source}; empty when not applicable.
     */
    Optional<SourcePatch> propose(String source, List<ValidationError> matched);
}
