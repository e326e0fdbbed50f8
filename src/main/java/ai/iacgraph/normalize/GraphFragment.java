package ai.iacgraph.normalize;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import ai.iacgraph.model.DependencyEdge;
import ai.iacgraph.model.GraphExtension;
import ai.iacgraph.model.ResourceNode;
import ai.iacgraph.model.SourceLocation;
import ai.iacgraph.parse.ParseError;
import ai.iacgraph.parse.SourceBlock;

/**
 * Partial graph built from one file. Fragments are merged in path order.
 */
public final class GraphFragment {

    /**
     * A node with the edges its declaration adds beyond reference tokens (explicit dependencies,
     * implicit ordering).
     */
    public record Entry(ResourceNode node, List<DependencyEdge> edges) {
        public Entry {
            edges = List.copyOf(edges);
        }
    }

    private final String path;
    private final List<Entry> entries = new ArrayList<>();
    private final List<GraphExtension> extensions = new ArrayList<>();
    private final Map<String, String> aliases = new LinkedHashMap<>();
    private final List<NormalizationWarning> warnings = new ArrayList<>();
    private final List<ParseError> failures = new ArrayList<>();

    public GraphFragment(String path) {
        this.path = path;
    }

    public String path() {
        return path;
    }

    public void add(ResourceNode node, List<DependencyEdge> edges) {
        entries.add(new Entry(node, edges));
    }

    public void addExtension(GraphExtension extension) {
        extensions.add(extension);
    }

    public void addAlias(String oldId, String newId) {
        aliases.put(oldId, newId);
    }

    /**
     * Records the rename of a {@code # moved:} comment block.
     */
    public void addAlias(SourceBlock moved) {
        if (moved.get("from") instanceof String from && moved.get("to") instanceof String to
                && !from.isBlank() && !to.isBlank()) {
            addAlias(from, to);
        } else {
            warn("invalid-moved-block", null, moved.source(), "moved record needs an old and a new id");
        }
    }

    public void warn(String code, String nodeId, SourceLocation source, String message) {
        warnings.add(new NormalizationWarning(code, nodeId, source, message));
    }

    void fail(ParseError error) {
        failures.add(error);
    }

    public List<Entry> entries() {
        return entries;
    }

    public List<GraphExtension> extensions() {
        return extensions;
    }

    public Map<String, String> aliases() {
        return aliases;
    }

    public List<NormalizationWarning> warnings() {
        return warnings;
    }

    public List<ParseError> failures() {
        return failures;
    }
}
