package org.cpoanalyzer.cli.config;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * Loads the batch configuration that drives an analyzer run.
 * <p>
 * A run is described by one HOCON batch file listing the experiments and the pole figures to
 * draw. Layers, highest precedence first:
 * <ol>
 *   <li>JVM system properties, e.g. {@code -Dcpo-analyzer.threads=4}</li>
 *   <li>{@code CPO_ANALYZER_BASE_DIR} and {@code CPO_ANALYZER_THREADS}, so one batch file can be
 *       reused for data sets mounted at different places</li>
 *   <li>the batch file: {@code --config}, else the file named by {@code CPO_ANALYZER_CONFIG},
 *       else {@code cpo-analyzer.conf} in the working directory if it exists</li>
 *   <li>{@code reference.conf} from the classpath</li>
 * </ol>
 * Substitutions are resolved after layering, so overriding a default also changes the values
 * that reference it.
 */
public final class ConfigLoader {

    /** Batch file picked up from the working directory when nothing else is given. */
    public static final String DEFAULT_FILE_NAME = "cpo-analyzer.conf";

    static final String CONFIG_FILE_VARIABLE = "CPO_ANALYZER_CONFIG";

    private static final Map<String, String> ENVIRONMENT_OVERRIDES = Map.of(
            "CPO_ANALYZER_BASE_DIR", "cpo-analyzer.base-dir",
            "CPO_ANALYZER_THREADS", "cpo-analyzer.threads");

    private ConfigLoader() {
    }

    /**
     * @param config    fully resolved configuration.
     * @param batchFile batch file that was layered in, empty when only defaults apply.
     */
    public record LoadedConfig(Config config, Optional<Path> batchFile) {
    }

    /**
     * Loads the configuration for this process.
     *
     * @param explicitFile file given with {@code --config}, or {@code null}.
     * @return the resolved configuration and its batch file.
     * @throws IllegalArgumentException            if a named batch file does not exist.
     * @throws com.typesafe.config.ConfigException if the configuration cannot be parsed or resolved.
     */
    public static LoadedConfig load(File explicitFile) {
        return load(explicitFile, System.getenv(), Paths.get(""));
    }

    static LoadedConfig load(File explicitFile, Map<String, String> environment, Path workingDirectory) {
        Optional<Path> batchFile = locateBatchFile(explicitFile, environment, workingDirectory);

        Config layered = ConfigFactory.systemProperties().withFallback(environmentOverrides(environment));
        if (batchFile.isPresent()) {
            layered = layered.withFallback(ConfigFactory.parseFile(batchFile.get().toFile()));
        }
        Config resolved = layered.withFallback(ConfigFactory.defaultReferenceUnresolved()).resolve();
        return new LoadedConfig(resolved, batchFile);
    }

    static Optional<Path> locateBatchFile(File explicitFile, Map<String, String> environment, Path workingDirectory) {
        if (explicitFile != null) {
            return Optional.of(requireFile(explicitFile.toPath(), "--config"));
        }
        String named = environment.get(CONFIG_FILE_VARIABLE);
        if (named != null && !named.isBlank()) {
            return Optional.of(requireFile(Paths.get(named), CONFIG_FILE_VARIABLE));
        }
        Path local = workingDirectory.resolve(DEFAULT_FILE_NAME);
        return Files.isRegularFile(local) ? Optional.of(local) : Optional.empty();
    }

    static Config environmentOverrides(Map<String, String> environment) {
        Map<String, Object> values = new HashMap<>();
        ENVIRONMENT_OVERRIDES.forEach((variable, path) -> {
            String value = environment.get(variable);
            if (value != null && !value.isBlank()) {
                values.put(path, value);
            }
        });
        return ConfigFactory.parseMap(values, "environment");
    }

    private static Path requireFile(Path file, String origin) {
        if (!Files.isRegularFile(file)) {
            throw new IllegalArgumentException(
                    "Configuration file not found (given by " + origin + "): " + file.toAbsolutePath());
        }
        return file;
    }
}
