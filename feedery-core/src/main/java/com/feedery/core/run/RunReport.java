package com.feedery.core.run;

import com.feedery.core.merge.MergedSequence;

import java.time.Duration;
import java.util.List;

/**
 * Summary of a finished run: per-source outcomes in registry order and the merged output.
 */
public record RunReport(
    RunPhase phase,
    List<SourceOutcome> outcomes,
    MergedSequence merged,
    Duration elapsed
) {
    public RunReport {
        outcomes = List.copyOf(outcomes);
    }

    public long count(SourceOutcome.Kind kind) {
        return outcomes.stream().filter(o -> o.kind() == kind).count();
    }

    public long failures() {
        return outcomes.stream().filter(o -> o.kind().isFailure()).count();
    }

    public boolean isDone() {
        return phase == RunPhase.DONE;
    }
}
