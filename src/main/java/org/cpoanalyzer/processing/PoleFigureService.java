package org.cpoanalyzer.processing;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.cpoanalyzer.cli.config.AnalyzerConfiguration;
import org.cpoanalyzer.cli.config.PoleFigureConfiguration;
import org.cpoanalyzer.cli.rendering.IPoleFigureRenderer;
import org.cpoanalyzer.projection.LambertGrid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one {@link ExperimentProcessor} per experiment directory on a fixed thread pool.
 * <p>
 * The sampling grid is built once and shared by all workers. A failure in one experiment,
 * including an unexpected runtime exception, only fails that experiment.
 */
public class PoleFigureService {

    private static final Logger log = LoggerFactory.getLogger(PoleFigureService.class);

    private final IPoleFigureRenderer renderer;
    private final ProgressReporter progress;

    public PoleFigureService(IPoleFigureRenderer renderer, ProgressReporter progress) {
        this.renderer = renderer;
        this.progress = progress;
    }

    /**
     * Processes all experiments and waits for them.
     *
     * @param configuration analyzer configuration with a pole figure section.
     * @param experimentDirs experiment directories, relative to the base directory.
     * @param threads        requested pool size, 0 or less for the number of processors.
     * @return one result per experiment, in input order.
     * @throws InterruptedException if interrupted while waiting; running workers are cancelled.
     */
    public List<ExperimentResult> run(AnalyzerConfiguration configuration, List<String> experimentDirs, int threads)
            throws InterruptedException {
        PoleFigureConfiguration poleFigures = configuration.poleFigures().orElseThrow(
                () -> new IllegalArgumentException("No pole-figures section configured"));
        if (experimentDirs.isEmpty()) {
            log.warn("No experiment directories configured, nothing to do");
            return List.of();
        }

        LambertGrid grid = LambertGrid.build(poleFigures.spherePoints(), poleFigures.hemisphere());
        int poolSize = Math.min(experimentDirs.size(),
                threads > 0 ? threads : Runtime.getRuntime().availableProcessors());
        log.info("Processing {} experiments with {} threads ({}x{} grid, {} hemisphere)",
                experimentDirs.size(), poolSize, grid.size(), grid.size(), grid.hemisphere());

        ExecutorService executor = Executors.newFixedThreadPool(poolSize);
        try {
            List<Future<ExperimentResult>> futures = new ArrayList<>();
            for (String dir : experimentDirs) {
                futures.add(executor.submit(new ExperimentProcessor(dir, configuration.experimentPath(dir),
                        configuration.compressed(), poleFigures, grid, renderer, progress)));
            }

            List<ExperimentResult> results = new ArrayList<>();
            for (int i = 0; i < futures.size(); i++) {
                String dir = experimentDirs.get(i);
                try {
                    results.add(futures.get(i).get());
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause() != null ? e.getCause() : e;
                    log.error("Experiment {} aborted unexpectedly", dir, cause);
                    progress.experimentFailed(dir, String.valueOf(cause.getMessage()));
                    results.add(ExperimentResult.failed(dir, 0, 0, cause.toString()));
                }
            }
            return results;
        } catch (InterruptedException e) {
            executor.shutdownNow();
            throw e;
        } finally {
            executor.shutdown();
        }
    }
}
