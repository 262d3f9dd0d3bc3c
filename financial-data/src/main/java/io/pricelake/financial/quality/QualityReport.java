package io.pricelake.financial.quality;

import io.pricelake.error.DataQualityException;
import io.pricelake.financial.model.PartitionKey;

import java.util.List;

public record QualityReport(PartitionKey key, int rows, List<Violation> violations) {
    public QualityReport {
        violations = List.copyOf(violations);
    }

    public boolean passed() { return violations.isEmpty(); }

    public boolean hasViolation(Check check, String column) {
        return violations.stream().anyMatch(v -> v.check() == check && v.column().equals(column));
    }

    /** No-op when passed. */
    public void throwIfFailed() {
        if (passed()) return;
        throw new DataQualityException("Quality gate rejected " + key + " with " + violations.size() + " violation(s)",
                violations.stream().map(Violation::toString).toList());
    }
}
