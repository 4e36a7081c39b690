package com.vidnyan.swivel.application.port.in;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One-shot fix pass over a candidate program, without running it.
 */
public interface FixSourceUseCase {

    FixReport fix(String source);

    /**
     * Result of a fix pass.
     *
     * @param source      text after the fixes
     * @param ruleCounts  rule id to number of rounds it was applied in, first application first
     * @param remaining   finding codes still present after the pass
     */
    record FixReport(String source, Map<String, Integer> ruleCounts, List<String> remaining) {
        public FixReport {
            ruleCounts = Collections.unmodifiableMap(new LinkedHashMap<>(ruleCounts));
            remaining = List.copyOf(remaining);
        }

        public boolean changed() {
            return !ruleCounts.isEmpty();
        }
    }
}
