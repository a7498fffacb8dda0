package org.cpoanalyzer.processing;

import java.util.Optional;

/**
 * Outcome of one experiment directory.
 *
 * @param experimentDir experiment directory as configured.
 * @param rendered      figures written.
 * @param missing       (time, particle) requests whose particle did not exist.
 * @param failure       reason the experiment was aborted, empty on success.
 */
public record ExperimentResult(String experimentDir, int rendered, int missing, Optional<String> failure) {

    public static ExperimentResult completed(String experimentDir, int rendered, int missing) {
        return new ExperimentResult(experimentDir, rendered, missing, Optional.empty());
    }

    public static ExperimentResult failed(String experimentDir, int rendered, int missing, String reason) {
        return new ExperimentResult(experimentDir, rendered, missing, Optional.of(reason));
    }

    public boolean isSuccess() {
        return failure.isEmpty();
    }
}
