package org.cpoanalyzer.cli.commands;

import java.io.PrintWriter;
import java.util.List;
import java.util.concurrent.Callable;

import org.cpoanalyzer.cli.CommandLineInterface;
import org.cpoanalyzer.cli.config.AnalyzerConfiguration;
import org.cpoanalyzer.cli.rendering.PoleFigureImageRenderer;
import org.cpoanalyzer.processing.ExperimentResult;
import org.cpoanalyzer.processing.PoleFigureService;
import org.cpoanalyzer.processing.ProgressReporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.ConfigException;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * CLI command that renders the configured pole figures of every experiment directory.
 * <p>
 * Experiments run in parallel; the exit code is 1 if any of them failed.
 */
@Command(
    name = "pole-figures",
    description = "Render pole figures for the configured experiments, times and particles"
)
public class PoleFiguresCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(PoleFiguresCommand.class);

    @Option(
        names = {"-e", "--experiment"},
        description = "Experiment directory relative to base-dir; repeatable, replaces experiment-dirs"
    )
    private List<String> experiments;

    @Option(
        names = {"-t", "--threads"},
        description = "Worker threads (default: cpo-analyzer.threads, 0 = available processors)"
    )
    private Integer threads;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        AnalyzerConfiguration configuration;
        try {
            configuration = AnalyzerConfiguration.fromConfig(parent.getConfig());
        } catch (IllegalArgumentException | ConfigException e) {
            err.println("Error: invalid configuration: " + e.getMessage());
            return 1;
        }
        if (configuration.poleFigures().isEmpty()) {
            err.println("Error: no '" + AnalyzerConfiguration.ROOT_PATH + ".pole-figures' section configured");
            return 1;
        }

        List<String> dirs = experiments != null && !experiments.isEmpty() ? experiments : configuration.experimentDirs();
        int threadCount = threads != null ? threads : configuration.threads();

        ProgressReporter progress = new ProgressReporter();
        PoleFigureService service = new PoleFigureService(new PoleFigureImageRenderer(), progress);
        long start = System.currentTimeMillis();
        List<ExperimentResult> results;
        try {
            results = service.run(configuration, dirs, threadCount);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            err.println("Interrupted");
            return 1;
        }

        out.println("=== Summary ===");
        for (ExperimentResult result : results) {
            out.printf("  %-40s %s: %d figures, %d missing%n", result.experimentDir(),
                    result.isSuccess() ? "OK    " : "FAILED", result.rendered(), result.missing());
            result.failure().ifPresent(reason -> out.println("      " + reason));
        }
        ProgressReporter.Snapshot totals = progress.snapshot();
        out.printf("Total: %d figures, %d missing particles, %d/%d experiments failed (%d ms)%n",
                totals.rendered(), totals.missing(), results.size() - countSuccessful(results), results.size(),
                System.currentTimeMillis() - start);

        boolean failed = countSuccessful(results) < results.size();
        if (failed) {
            log.error("{} of {} experiments failed", results.size() - countSuccessful(results), results.size());
        }
        return failed ? 1 : 0;
    }

    private static int countSuccessful(List<ExperimentResult> results) {
        return (int) results.stream().filter(ExperimentResult::isSuccess).count();
    }
}
