package com.vidnyan.swivel.application.port.in;

import com.vidnyan.swivel.domain.model.ValidationDepth;
import com.vidnyan.swivel.domain.model.ValidationResult;

import java.time.Duration;

/**
 * Primary use case: run the validation tiers over one candidate program.
 * Implementations never throw; infrastructure faults come back as {@code status = error}.
 */
public interface ValidateSourceUseCase {

    ValidationResult validate(String source, ValidationDepth depth, Duration timeout);

    default ValidationResult validate(String source, ValidationDepth depth) {
        return validate(source, depth, null);
    }

    /**
     * Validate raw bytes that must decode as UTF-8; invalid bytes are reported as a syntax-tier finding.
     */
    ValidationResult validate(byte[] source, ValidationDepth depth, Duration timeout);
}
