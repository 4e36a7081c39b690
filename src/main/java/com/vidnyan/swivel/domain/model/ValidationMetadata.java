package com.vidnyan.swivel.domain.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Tool and environment descriptors attached to every result.
 * {@code tiers} records what each tier did, including tiers that were skipped or never reached.
 */
public record ValidationMetadata(
    String toolVersion,
    String javaVersion,
    String frameworkVersion,
    String platform,
    ValidationDepth depth,
    Map<ValidationLevel, ValidationStatus> tiers,
    List<String> warnings,
    String fault
) {

    public ValidationMetadata {
        tiers = tiers == null || tiers.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new EnumMap<>(tiers));
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public ValidationMetadata withFault(String description) {
        return new ValidationMetadata(toolVersion, javaVersion, frameworkVersion, platform, depth,
                tiers, warnings, description);
    }

    public ValidationMetadata withWarning(String warning) {
        List<String> merged = new ArrayList<>(warnings);
        merged.add(warning);
        return new ValidationMetadata(toolVersion, javaVersion, frameworkVersion, platform, depth,
                tiers, merged, fault);
    }

    public ValidationStatus tierStatus(ValidationLevel level) {
        return tiers.get(level);
    }
}
