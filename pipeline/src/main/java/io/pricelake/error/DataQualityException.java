package io.pricelake.error;

import java.util.List;

/**
 * Input data that cannot be processed as-is. Retrying will not help, so the key is reported and skipped.
 */
public class DataQualityException extends PipelineException {
    private final List<String> violations;

    public DataQualityException(String message) {
        this(message, List.of(message));
    }

    public DataQualityException(String message, List<String> violations) {
        super(message);
        this.violations = List.copyOf(violations);
    }

    public List<String> violations() { return violations; }
}
