package com.osman.badges.core.pipeline;

import com.osman.badges.core.model.GeneratedArtifact;

import java.util.List;

/**
 * Outcome of one pipeline run. Artifacts and failures are ordered by row index.
 *
 * @param skipped records never started because a stop was requested
 */
public record BatchSummary(int total,
                           int succeeded,
                           int failed,
                           int skipped,
                           List<GeneratedArtifact> artifacts,
                           List<RecordFailure> failures) {

    public BatchSummary {
        artifacts = List.copyOf(artifacts);
        failures = List.copyOf(failures);
    }

    static BatchSummary empty() {
        return new BatchSummary(0, 0, 0, 0, List.of(), List.of());
    }

    public int processed() {
        return succeeded + failed;
    }

    public boolean hasFailures() {
        return failed > 0;
    }
}
