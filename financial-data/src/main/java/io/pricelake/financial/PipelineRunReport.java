package io.pricelake.financial;

import io.pricelake.core.StageReport;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Stage reports of one invocation, in execution order.
 */
public final class PipelineRunReport {
    private final List<StageReport<?, ?>> stages = new ArrayList<>();

    public PipelineRunReport add(StageReport<?, ?> stage) {
        stages.add(stage);
        return this;
    }

    public List<StageReport<?, ?>> stages() { return Collections.unmodifiableList(stages); }

    public StageReport<?, ?> stage(String name) {
        return stages.stream().filter(s -> s.stage().equals(name)).findFirst()
                .orElseThrow(() -> new IllegalArgumentException("No stage " + name));
    }

    /** True when some stage attempted keys and none succeeded. */
    public boolean isFailure() { return stages.stream().anyMatch(StageReport::isFailure); }

    public boolean hasFailures() { return stages.stream().anyMatch(StageReport::hasFailures); }

    public List<String> summary() { return stages.stream().map(StageReport::summary).toList(); }

    @Override
    public String toString() { return String.join("\n", summary()); }
}
