package ai.iacgraph.scan;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ai.iacgraph.model.Dialect;
import ai.iacgraph.parse.yaml.YamlDocument;
import ai.iacgraph.parse.yaml.YamlReader;
import ai.iacgraph.parse.yaml.YamlStream;

/**
 * Infers the dialect of each source file from its extension and structure.
 * <p>
 * Precedence: {@code *.tf} is Terraform; a document with {@code AWSTemplateFormatVersion} or an
 * {@code AWS::} typed {@code Resources} entry is CloudFormation; documents with {@code apiVersion}
 * and {@code kind} are Kubernetes; a list of plays with {@code hosts} is Ansible. Anything else is
 * ignored. YAML or JSON that cannot be read at all is reported as malformed.
 */
public final class DialectDetector {

    private static final Logger log = LoggerFactory.getLogger(DialectDetector.class);

    private static final Set<String> PLAY_SECTIONS = Set.of("tasks", "roles", "handlers", "pre_tasks", "post_tasks");

    private final YamlReader reader = new YamlReader(false);

    public Inference detect(SourceTree tree) {
        final Map<Dialect, List<SourceFile>> byDialect = new EnumMap<>(Dialect.class);
        final List<SourceFile> malformed = new ArrayList<>();
        for (SourceFile file : tree.files()) {
            final Optional<Dialect> d = detect(file);
            if (d.isPresent()) {
                byDialect.computeIfAbsent(d.get(), k -> new ArrayList<>()).add(file);
            } else if ((file.isYaml() || file.isJson()) && isMalformed(file)) {
                malformed.add(file);
            } else {
                log.debug("Ignoring {}: no dialect recognized", file.path());
            }
        }
        return new Inference(tree, byDialect, malformed);
    }

    public Optional<Dialect> detect(SourceFile file) {
        if (file.extension().equals("tf")) {
            return Optional.of(Dialect.TERRAFORM);
        }
        if (!file.isYaml() && !file.isJson()) {
            return Optional.empty();
        }
        final YamlStream stream = reader.read(file.content());
        final List<Object> roots = stream.documents().stream().map(YamlDocument::root).toList();
        if (roots.stream().anyMatch(DialectDetector::isTemplate)) {
            return Optional.of(Dialect.CLOUDFORMATION);
        }
        if (!file.isYaml()) {
            return Optional.empty();
        }
        if (!roots.isEmpty() && roots.stream().anyMatch(DialectDetector::isManifest)) {
            return Optional.of(Dialect.KUBERNETES);
        }
        if (roots.stream().anyMatch(DialectDetector::isPlaybook)) {
            return Optional.of(Dialect.ANSIBLE);
        }
        return Optional.empty();
    }

    private boolean isMalformed(SourceFile file) {
        final YamlStream stream = reader.read(file.content());
        return !stream.errors().isEmpty();
    }

    private static boolean isTemplate(Object root) {
        if (!(root instanceof Map<?, ?> m)) {
            return false;
        }
        if (m.containsKey("AWSTemplateFormatVersion")) {
            return true;
        }
        if (m.get("Resources") instanceof Map<?, ?> resources) {
            for (Object r : resources.values()) {
                if (r instanceof Map<?, ?> res && res.get("Type") instanceof String t && t.startsWith("AWS::")) {
                    return true;
                }
            }
        }
        return false;
    }

    private static boolean isManifest(Object root) {
        return root instanceof Map<?, ?> m && m.get("apiVersion") != null && m.get("kind") instanceof String;
    }

    private static boolean isPlaybook(Object root) {
        if (!(root instanceof List<?> plays)) {
            return false;
        }
        for (Object p : plays) {
            if (p instanceof Map<?, ?> play && play.containsKey("hosts")
                    && play.keySet().stream().anyMatch(PLAY_SECTIONS::contains)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Detection result for a whole tree.
     *
     * @param byDialect recognized files per dialect
     * @param malformed YAML/JSON files that could not be read, attributed to whichever dialect is parsed
     */
    public record Inference(SourceTree tree, Map<Dialect, List<SourceFile>> byDialect, List<SourceFile> malformed) {

        public Set<Dialect> candidates() {
            return byDialect.keySet();
        }

        /**
         * The single dialect present in the tree, empty when none or several are.
         */
        public Optional<Dialect> inferred() {
            return byDialect.size() == 1 ? Optional.of(byDialect.keySet().iterator().next()) : Optional.empty();
        }

        public boolean isAmbiguous() {
            return byDialect.size() > 1;
        }

        /**
         * Files to hand to the parser of {@code dialect}: the recognized ones plus the malformed
         * ones it could have been written in.
         */
        public SourceTree select(Dialect dialect) {
            final List<SourceFile> files = new ArrayList<>(byDialect.getOrDefault(dialect, List.of()));
            if (dialect != Dialect.TERRAFORM) {
                for (SourceFile f : malformed) {
                    if (f.isYaml() || dialect == Dialect.CLOUDFORMATION) {
                        files.add(f);
                    }
                }
            }
            return new SourceTree(tree.root(), files, tree.unreadable());
        }
    }
}
