package org.cpoanalyzer.processing;

import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Progress sink shared by all experiment workers.
 * <p>
 * <strong>Thread Safety:</strong> All methods may be called concurrently. Counters are atomic and
 * output goes through SLF4J, never directly to the console.
 */
public class ProgressReporter {

    private static final Logger log = LoggerFactory.getLogger(ProgressReporter.class);

    private final AtomicInteger rendered = new AtomicInteger();
    private final AtomicInteger missing = new AtomicInteger();
    private final AtomicInteger completedExperiments = new AtomicInteger();
    private final AtomicInteger failedExperiments = new AtomicInteger();

    /**
     * Immutable view of the counters.
     */
    public record Snapshot(int rendered, int missing, int completedExperiments, int failedExperiments) {
    }

    public void experimentStarted(String experimentDir, int requests) {
        log.info("Processing experiment {} ({} time/particle requests)", experimentDir, requests);
    }

    public void figureRendered(String experimentDir, long timestep, long particleId, Path file) {
        rendered.incrementAndGet();
        log.info("[{}] t{} particle {}: wrote {}", experimentDir, timestep, particleId, file);
    }

    public void particleMissing(String experimentDir, long timestep, long particleId, Path lastShard) {
        missing.incrementAndGet();
        log.warn("[{}] Particle {} not found at timestep {}; shards exhausted at {}",
                experimentDir, particleId, timestep, lastShard);
    }

    public void experimentCompleted(ExperimentResult result) {
        completedExperiments.incrementAndGet();
        log.info("Finished experiment {}: {} figures, {} missing particles",
                result.experimentDir(), result.rendered(), result.missing());
    }

    public void experimentFailed(String experimentDir, String reason) {
        failedExperiments.incrementAndGet();
        log.error("Experiment {} failed: {}", experimentDir, reason);
    }

    public Snapshot snapshot() {
        return new Snapshot(rendered.get(), missing.get(), completedExperiments.get(), failedExperiments.get());
    }
}
