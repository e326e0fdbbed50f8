package ai.iacgraph.engine;

import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Pattern;

import ai.iacgraph.model.Ids;
import ai.iacgraph.model.ResourceGraph;
import ai.iacgraph.model.ResourceNode;

/**
 * Deployment environments named by directories, file names and variable names of a source tree.
 */
final class Environments {

    private static final Pattern SEPARATORS = Pattern.compile("[^a-z0-9]+");

    private static final Map<String, String> ALIASES = Map.ofEntries(
            Map.entry("dev", "development"),
            Map.entry("development", "development"),
            Map.entry("test", "testing"),
            Map.entry("testing", "testing"),
            Map.entry("staging", "staging"),
            Map.entry("stage", "staging"),
            Map.entry("homolog", "staging"),
            Map.entry("prod", "production"),
            Map.entry("production", "production"),
            Map.entry("qa", "qa"),
            Map.entry("sandbox", "sandbox"));

    // normalized names in report order
    private static final List<String> ORDER = List.of("development", "testing", "staging", "production", "qa", "sandbox");

    private Environments() {
    }

    static List<String> detect(Collection<String> files, ResourceGraph graph) {
        final Set<String> found = new TreeSet<>();
        for (String file : files) {
            final int dot = file.lastIndexOf('.');
            scan(dot > file.lastIndexOf('/') ? file.substring(0, dot) : file, found);
        }
        if (graph != null) {
            for (ResourceNode node : graph.nodes()) {
                if (node.type().equals("config.variable")) {
                    scan(Ids.localName(node.id()), found);
                }
            }
        }
        return ORDER.stream().filter(found::contains).toList();
    }

    private static void scan(String text, Set<String> found) {
        for (String token : SEPARATORS.split(text.toLowerCase(Locale.ROOT))) {
            final String env = ALIASES.get(token);
            if (env != null) {
                found.add(env);
            }
        }
    }
}
