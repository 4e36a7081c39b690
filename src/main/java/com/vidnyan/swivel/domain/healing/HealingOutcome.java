package com.vidnyan.swivel.domain.healing;

/**
 * Terminal states of a healing session.
 */
public enum HealingOutcome {
    /** The program passes. */
    CONVERGED,
    /** Errors remain but no rule applies, or the iteration ceiling was reached. */
    EXHAUSTED,
    /** A validation run hit an infrastructure fault. */
    ERROR
}
