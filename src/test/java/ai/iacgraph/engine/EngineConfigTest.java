package ai.iacgraph.engine;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static ai.iacgraph.testutil.TestGraphs.write;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EngineConfigTest {

    @TempDir
    Path dir;

    @Test
    void load_partialFile_keepsDefaultsForMissingKeys() throws IOException {
        final Path file = write(dir, "settings.yml", """
                disabledRules:
                  - best-practice.missing-tags
                passes: [merge-duplicates]
                hoistThreshold: 4
                """);

        final EngineConfig config = EngineConfig.load(file);

        assertThat(config.disabledRules()).containsExactly("best-practice.missing-tags");
        assertThat(config.passes()).containsExactly("merge-duplicates");
        assertThat(config.hoistThreshold()).isEqualTo(4);
        assertThat(config.parallelism()).isEqualTo(EngineConfig.DEFAULTS.parallelism());
        assertThat(config.ignoredDirectories()).isEqualTo(EngineConfig.DEFAULT_IGNORED);
    }

    @Test
    void load_unknownKey_fails() throws IOException {
        final Path file = write(dir, "settings.yml", "colour: blue\n");

        assertThatThrownBy(() -> EngineConfig.load(file)).isInstanceOf(IOException.class);
    }

    @Test
    void load_thresholdBelowTwo_fails() throws IOException {
        final Path file = write(dir, "settings.yml", "hoistThreshold: 1\n");

        assertThatThrownBy(() -> EngineConfig.load(file))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("hoistThreshold");
    }

    @Test
    void resolve_fileAtSourceRoot_used() throws IOException {
        write(dir, EngineConfig.FILE_NAME, "passes: [transitive-reduction]\n");

        assertThat(EngineConfig.resolve(dir, null).passes()).containsExactly("transitive-reduction");
    }

    @Test
    void resolve_nothingFound_defaults() throws IOException {
        assertThat(EngineConfig.resolve(dir, null)).isEqualTo(EngineConfig.DEFAULTS);
    }

    @Test
    void resolve_missingExplicitFile_fails() {
        assertThatThrownBy(() -> EngineConfig.resolve(dir, dir.resolve("absent.yml")))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("not found");
    }

    @Test
    void withPasses_replacesOnlyPasses() {
        final EngineConfig config = EngineConfig.DEFAULTS.withPasses(List.of("hoist-literals"));

        assertThat(config.passes()).containsExactly("hoist-literals");
        assertThat(config.hoistThreshold()).isEqualTo(EngineConfig.DEFAULTS.hoistThreshold());
    }
}
