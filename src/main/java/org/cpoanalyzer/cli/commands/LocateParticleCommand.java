package org.cpoanalyzer.cli.commands;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Paths;
import java.util.Locale;
import java.util.concurrent.Callable;

import org.cpoanalyzer.cli.CommandLineInterface;
import org.cpoanalyzer.cli.config.AnalyzerConfiguration;
import org.cpoanalyzer.cli.config.PoleFigureConfiguration;
import org.cpoanalyzer.data.MalformedRecordException;
import org.cpoanalyzer.data.ParticleRecord;
import org.cpoanalyzer.data.ShardFileNaming;
import org.cpoanalyzer.data.ShardLocator;
import org.cpoanalyzer.data.ShardScanResult;
import org.cpoanalyzer.data.TimeIndexReader;
import org.cpoanalyzer.data.TimeResolver;
import org.cpoanalyzer.data.compression.CompressionCodecFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * CLI command that reports where the grains of one particle live at the timestep closest
 * to a requested time.
 * <p>
 * Exit codes: 0 found, 2 not found, 1 configuration error or malformed input.
 */
@Command(
    name = "locate",
    description = "Find the shard holding a particle's grains at the timestep closest to a time"
)
public class LocateParticleCommand implements Callable<Integer> {

    static final int EXIT_NOT_FOUND = 2;

    @Option(
        names = {"-e", "--experiment"},
        required = true,
        description = "Experiment directory relative to base-dir"
    )
    private String experiment;

    @Option(
        names = {"--time"},
        required = true,
        description = "Model time to resolve to the closest recorded timestep"
    )
    private double time;

    @Option(
        names = {"-p", "--particle"},
        required = true,
        description = "Particle id"
    )
    private long particleId;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        AnalyzerConfiguration configuration;
        PoleFigureConfiguration poleFigures;
        try {
            Config config = parent.getConfig();
            configuration = AnalyzerConfiguration.fromConfig(config);
            poleFigures = AnalyzerConfiguration.poleFiguresOrDefaults(config);
        } catch (IllegalArgumentException | ConfigException e) {
            err.println("Error: invalid configuration: " + e.getMessage());
            return 1;
        }

        String experimentPath = configuration.experimentPath(experiment);
        try {
            double[] times = TimeIndexReader.read(Paths.get(experimentPath + poleFigures.timeDataFile()),
                    poleFigures.timeDataMarker());
            if (times.length == 0) {
                err.println("Error: no timesteps marked '" + poleFigures.timeDataMarker() + "' in "
                        + experimentPath + poleFigures.timeDataFile());
                return 1;
            }
            int timestep = TimeResolver.resolve(times, time);
            out.printf(Locale.ROOT, "Time %s resolved to timestep %d (time %.5e)%n", time, timestep, times[timestep]);

            ShardLocator locator = new ShardLocator(
                    new ShardFileNaming(experimentPath, poleFigures.grainDataFilePrefix(),
                            poleFigures.shardFileExtension()),
                    new ShardFileNaming(experimentPath, poleFigures.particleDataFilePrefix(),
                            poleFigures.shardFileExtension()),
                    CompressionCodecFactory.forFlag(configuration.compressed()));

            ShardScanResult result = locator.locate(timestep, particleId);
            if (result instanceof ShardScanResult.Found found) {
                printFound(out, found);
                return 0;
            }
            ShardScanResult.NotFound notFound = (ShardScanResult.NotFound) result;
            out.printf("Particle %d not found at timestep %d: scanned %d shards, %s does not exist%n",
                    particleId, timestep, notFound.shardsScanned(), notFound.missingFile());
            return EXIT_NOT_FOUND;
        } catch (MalformedRecordException e) {
            err.println("Error: malformed input: " + e.getMessage());
            return 1;
        } catch (IOException e) {
            err.println("Error: cannot read " + e.getMessage());
            return 1;
        }
    }

    private void printFound(PrintWriter out, ShardScanResult.Found found) {
        ParticleRecord particle = found.particle();
        out.printf("Particle %d found in shard %d (%s) after scanning %d shards%n",
                particleId, found.shardIndex(), found.grainFile(), found.shardsScanned());
        out.printf("  grains:   %d%n", found.grains().size());
        out.printf(Locale.ROOT, "  position: (%.5e, %.5e, %s)%n", particle.x(), particle.y(),
                particle.z().isPresent() ? String.format(Locale.ROOT, "%.5e", particle.z().getAsDouble()) : "-");
        if (particle.olivineDeformationType().isPresent()) {
            out.printf(Locale.ROOT, "  ODT:      %.4f%n", particle.olivineDeformationType().getAsDouble());
        }
        out.printf("  elastic decomposition: %s%n", particle.elastic().isPresent() ? "yes" : "no");
    }
}
