package com.vidnyan.swivel.application.port.in;

import com.vidnyan.swivel.domain.healing.HealingSession;

/**
 * Validate, fix and re-validate a candidate program until it passes or no further progress is possible.
 */
public interface HealSourceUseCase {

    HealingSession heal(String source, int maxIterations);

    /**
     * Heal with the configured iteration ceiling.
     */
    HealingSession heal(String source);
}
