package com.rmatrix.batch;

import com.rmatrix.rule.RuleConversion;

import java.util.List;

/**
 * Outcome of converting a rules source.
 *
 * @param conversions Successful conversions in source order
 * @param failures    Lines skipped because they failed to convert
 */
public record BatchResult(List<RuleConversion> conversions, List<RuleFailure> failures) {

    public BatchResult {
        conversions = List.copyOf(conversions);
        failures = List.copyOf(failures);
    }

    public int equationCount() {
        return conversions.stream().mapToInt(c -> c.equations().size()).sum();
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }
}
