package org.cpoanalyzer.cli;

import java.io.File;
import java.util.concurrent.Callable;

import org.cpoanalyzer.cli.commands.LocateParticleCommand;
import org.cpoanalyzer.cli.commands.PoleFiguresCommand;
import org.cpoanalyzer.cli.config.ConfigLoader;
import org.cpoanalyzer.cli.config.ConfigLoader.LoadedConfig;
import org.cpoanalyzer.cli.config.LoggingConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

/**
 * Root of the {@code cpo-analyzer} command tree.
 * <p>
 * Subcommands reach the batch configuration through {@link #getConfig()}, which loads it on
 * first use and applies its {@code logging} section before anything else is logged.
 */
@Command(
    name = "cpo-analyzer",
    mixinStandardHelpOptions = true,
    version = "CPO Analyzer 1.0",
    description = "Pole figures of crystallographic preferred orientation from particle CPO output",
    subcommands = {
        PoleFiguresCommand.class,
        LocateParticleCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(CommandLineInterface.class);

    @Option(
        names = {"-c", "--config"},
        description = "Batch configuration file (default: $CPO_ANALYZER_CONFIG, then ./"
                + ConfigLoader.DEFAULT_FILE_NAME + ")"
    )
    private File configFile;

    @Spec
    private CommandSpec spec;

    private LoadedConfig loaded;

    @Override
    public Integer call() {
        spec.commandLine().usage(spec.commandLine().getOut());
        return 0;
    }

    public static void main(final String[] args) {
        System.exit(createCommandLine().execute(args));
    }

    /**
     * Builds the command tree used by {@link #main(String[])}; tests execute it directly.
     *
     * @return a configured CommandLine instance.
     */
    public static CommandLine createCommandLine() {
        return new CommandLine(new CommandLineInterface());
    }

    /**
     * Loads the configuration on first use and applies its logging settings.
     *
     * @return the resolved configuration.
     * @throws IllegalArgumentException            if a named batch file does not exist.
     * @throws com.typesafe.config.ConfigException if the configuration cannot be parsed.
     */
    public Config getConfig() {
        if (loaded == null) {
            LoadedConfig result = ConfigLoader.load(configFile);
            LoggingConfigurator.configure(result.config());
            if (result.batchFile().isPresent()) {
                log.info("Using batch configuration {}", result.batchFile().get().toAbsolutePath());
            } else {
                log.warn("No batch configuration given and no ./{} found, using built-in defaults",
                        ConfigLoader.DEFAULT_FILE_NAME);
            }
            loaded = result;
        }
        return loaded.config();
    }
}
