package org.cpoanalyzer.processing;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.concurrent.Callable;

import org.cpoanalyzer.cli.config.PoleFigureConfiguration;
import org.cpoanalyzer.cli.rendering.IPoleFigureRenderer;
import org.cpoanalyzer.cli.rendering.PoleFigurePlot;
import org.cpoanalyzer.cli.rendering.RenderOptions;
import org.cpoanalyzer.data.MalformedRecordException;
import org.cpoanalyzer.data.ShardFileNaming;
import org.cpoanalyzer.data.ShardLocator;
import org.cpoanalyzer.data.ShardScanResult;
import org.cpoanalyzer.data.TimeIndexReader;
import org.cpoanalyzer.data.TimeResolver;
import org.cpoanalyzer.data.compression.CompressionCodecFactory;
import org.cpoanalyzer.polefigure.GrainAxisVectors;
import org.cpoanalyzer.polefigure.PoleFigureAssembler;
import org.cpoanalyzer.polefigure.PoleFigureGrid;
import org.cpoanalyzer.projection.LambertGrid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Produces all requested pole figures of one experiment directory.
 * <p>
 * Requested times and particles are processed sequentially: for every time the closest
 * recorded timestep is resolved, then every particle is located, assembled and rendered.
 * A missing particle is reported and skipped. Malformed input or an I/O failure aborts the
 * experiment and yields a failed {@link ExperimentResult} whose reason names the timestep and
 * particle being processed, if any, and the offending file; figures already written stay.
 * <p>
 * <strong>Thread Safety:</strong> One instance per experiment. Instances of different
 * experiments run concurrently and only share the read-only {@link LambertGrid}, the
 * renderer and the progress reporter.
 */
public class ExperimentProcessor implements Callable<ExperimentResult> {

    private static final Logger log = LoggerFactory.getLogger(ExperimentProcessor.class);

    private final String experimentDir;
    private final String experimentPath;
    private final boolean compressed;
    private final PoleFigureConfiguration configuration;
    private final LambertGrid grid;
    private final IPoleFigureRenderer renderer;
    private final ProgressReporter progress;

    /**
     * @param experimentDir  experiment directory as configured, used in messages.
     * @param experimentPath full path prefix of the experiment, ending with a separator.
     * @param compressed     whether grain shards are zlib-compressed.
     * @param configuration  pole figure settings.
     * @param grid           shared sampling grid, built from {@code configuration}.
     * @param renderer       figure renderer.
     * @param progress       shared progress sink.
     */
    public ExperimentProcessor(String experimentDir, String experimentPath, boolean compressed,
                               PoleFigureConfiguration configuration, LambertGrid grid,
                               IPoleFigureRenderer renderer, ProgressReporter progress) {
        this.experimentDir = experimentDir;
        this.experimentPath = experimentPath;
        this.compressed = compressed;
        this.configuration = configuration;
        this.grid = grid;
        this.renderer = renderer;
        this.progress = progress;
    }

    @Override
    public ExperimentResult call() {
        progress.experimentStarted(experimentDir,
                configuration.times().size() * configuration.particleIds().size());
        int rendered = 0;
        int missing = 0;
        String current = null;
        try {
            Path timeFile = Paths.get(experimentPath + configuration.timeDataFile());
            double[] times = TimeIndexReader.read(timeFile, configuration.timeDataMarker());
            if (times.length == 0) {
                throw new MalformedRecordException(timeFile,
                        "no rows marked '" + configuration.timeDataMarker() + "'");
            }

            current = "output directory";
            OutputFileNaming naming = new OutputFileNaming(experimentPath, configuration);
            Files.createDirectories(naming.outputDirectory());

            ShardLocator locator = new ShardLocator(
                    new ShardFileNaming(experimentPath, configuration.grainDataFilePrefix(),
                            configuration.shardFileExtension()),
                    new ShardFileNaming(experimentPath, configuration.particleDataFilePrefix(),
                            configuration.shardFileExtension()),
                    CompressionCodecFactory.forFlag(compressed));
            RenderOptions options = renderOptions();

            for (double requested : configuration.times()) {
                int timestep = TimeResolver.resolve(times, requested);
                double time = times[timestep];
                log.debug("[{}] Requested time {} resolved to timestep {} (time {})",
                        experimentDir, requested, timestep, time);

                for (long particleId : configuration.particleIds()) {
                    current = "timestep " + timestep + ", particle " + particleId;
                    long start = System.nanoTime();
                    ShardScanResult result = locator.locate(timestep, particleId);
                    if (result instanceof ShardScanResult.NotFound notFound) {
                        missing++;
                        progress.particleMissing(experimentDir, timestep, particleId, notFound.missingFile());
                        continue;
                    }
                    ShardScanResult.Found found = (ShardScanResult.Found) result;
                    PoleFigureGrid figures = assemble(found);
                    Path outputFile = naming.figureFile(timestep, particleId);
                    renderer.render(new PoleFigurePlot(figures, grid, found.particle(), timestep, time, options),
                            outputFile);
                    rendered++;
                    progress.figureRendered(experimentDir, timestep, particleId, outputFile);
                    log.debug("[{}] t{} particle {}: {} grains from shard {} in {} ms", experimentDir, timestep,
                            particleId, found.grains().size(), found.shardIndex(),
                            (System.nanoTime() - start) / 1_000_000);
                }
            }
        } catch (MalformedRecordException e) {
            String reason = describe(current, e.getMessage());
            progress.experimentFailed(experimentDir, "malformed input at " + reason);
            return ExperimentResult.failed(experimentDir, rendered, missing, reason);
        } catch (IOException e) {
            String reason = describe(current, e.toString());
            progress.experimentFailed(experimentDir, "I/O failure at " + reason);
            return ExperimentResult.failed(experimentDir, rendered, missing, reason);
        }

        ExperimentResult result = ExperimentResult.completed(experimentDir, rendered, missing);
        progress.experimentCompleted(result);
        return result;
    }

    private String describe(String current, String message) {
        return (current != null ? current : "time index") + ": " + message;
    }

    private PoleFigureGrid assemble(ShardScanResult.Found found) throws MalformedRecordException {
        GrainAxisVectors vectors;
        try {
            vectors = GrainAxisVectors.fromGrains(found.grains(), configuration.minerals());
        } catch (IllegalArgumentException e) {
            throw new MalformedRecordException(found.grainFile(), e.getMessage(), e);
        }
        return PoleFigureAssembler.assemble(configuration.axes(), configuration.minerals(), vectors, grid);
    }

    private RenderOptions renderOptions() {
        return new RenderOptions(configuration.smallFigure(), configuration.noDescriptionText(),
                configuration.elasticityHeader(), configuration.colorScale(), configuration.maxCountMethod(),
                configuration.gamma());
    }
}
