package ai.iacgraph.engine;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Engine settings.
 *
 * @param disabledRules      validator rule ids that are not run
 * @param passes             optimization pass ids to run, empty for all of them
 * @param hoistThreshold     minimum number of nodes sharing a literal before it is hoisted
 * @param parallelism        worker threads for parsing, normalization and validation
 * @param ignoredDirectories directory names never walked
 */
public record EngineConfig(
        Set<String> disabledRules,
        List<String> passes,
        int hoistThreshold,
        int parallelism,
        Set<String> ignoredDirectories
) {

    private static final Logger log = LoggerFactory.getLogger(EngineConfig.class);

    public static final String FILE_NAME = ".iacgraph.yml";

    public static final Set<String> DEFAULT_IGNORED = Set.of(
            ".git", ".terraform", "node_modules", "target", "build", "__pycache__");

    public static final EngineConfig DEFAULTS = new EngineConfig(
            Set.of(), List.of(), 3, Math.max(1, Math.min(4, Runtime.getRuntime().availableProcessors())),
            DEFAULT_IGNORED);

    public EngineConfig {
        disabledRules = Set.copyOf(Objects.requireNonNull(disabledRules, "disabledRules"));
        passes = List.copyOf(Objects.requireNonNull(passes, "passes"));
        ignoredDirectories = Set.copyOf(Objects.requireNonNull(ignoredDirectories, "ignoredDirectories"));
        if (hoistThreshold < 2) {
            throw new IllegalArgumentException("hoistThreshold must be at least 2, was " + hoistThreshold);
        }
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be positive, was " + parallelism);
        }
    }

    public EngineConfig withPasses(List<String> newPasses) {
        return new EngineConfig(disabledRules, newPasses, hoistThreshold, parallelism, ignoredDirectories);
    }

    public EngineConfig withDisabledRules(Set<String> newDisabledRules) {
        return new EngineConfig(newDisabledRules, passes, hoistThreshold, parallelism, ignoredDirectories);
    }

    public EngineConfig withParallelism(int newParallelism) {
        return new EngineConfig(disabledRules, passes, hoistThreshold, newParallelism, ignoredDirectories);
    }

    /**
     * Reads a YAML settings file. Keys left out keep their default; unknown keys are an error.
     */
    public static EngineConfig load(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        final ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        final ConfigFile raw = mapper.readValue(file.toFile(), ConfigFile.class);
        if (raw == null) {
            return DEFAULTS;
        }
        try {
            return raw.applyTo(DEFAULTS);
        } catch (IllegalArgumentException ex) {
            throw new IOException("Invalid configuration " + file + ": " + ex.getMessage(), ex);
        }
    }

    /**
     * Settings for one invocation: {@code explicitFile} when given, otherwise {@value #FILE_NAME}
     * at the source root when present, otherwise the defaults.
     */
    public static EngineConfig resolve(Path sourcePath, Path explicitFile) throws IOException {
        if (explicitFile != null) {
            if (!Files.isRegularFile(explicitFile)) {
                throw new IOException("Configuration file not found: " + explicitFile);
            }
            log.info("Using configuration {}", explicitFile);
            return load(explicitFile);
        }
        if (sourcePath != null) {
            final Path root = Files.isDirectory(sourcePath) ? sourcePath : sourcePath.toAbsolutePath().getParent();
            final Path candidate = root == null ? null : root.resolve(FILE_NAME);
            if (candidate != null && Files.isRegularFile(candidate)) {
                log.info("Using configuration {}", candidate);
                return load(candidate);
            }
        }
        return DEFAULTS;
    }

    /**
     * On-disk shape; every field optional.
     */
    public record ConfigFile(
            List<String> disabledRules,
            List<String> passes,
            Integer hoistThreshold,
            Integer parallelism,
            List<String> ignoredDirectories
    ) {
        EngineConfig applyTo(EngineConfig base) {
            return new EngineConfig(
                    disabledRules == null ? base.disabledRules() : Set.copyOf(disabledRules),
                    passes == null ? base.passes() : passes,
                    hoistThreshold == null ? base.hoistThreshold() : hoistThreshold,
                    parallelism == null ? base.parallelism() : parallelism,
                    ignoredDirectories == null ? base.ignoredDirectories() : Set.copyOf(ignoredDirectories));
        }
    }
}
