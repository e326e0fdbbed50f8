package ai.iacgraph.parse.yaml;

import java.util.IdentityHashMap;
import java.util.Map;

/**
 * One document of a YAML stream: plain Java values (Map, List, String, Long, BigDecimal, Boolean,
 * null) plus the line where every mapping and sequence starts.
 */
public final class YamlDocument {

    private final int index;
    private final int line;
    private final Object root;
    private final Map<Object, Integer> lines;

    YamlDocument(int index, int line, Object root, IdentityHashMap<Object, Integer> lines) {
        this.index = index;
        this.line = line;
        this.root = root;
        this.lines = lines;
    }

    /**
     * Zero-based position of the document in its file.
     */
    public int index() {
        return index;
    }

    public int line() {
        return line;
    }

    public Object root() {
        return root;
    }

    /**
     * Line of a mapping or sequence of this document, {@code fallback} for anything else.
     */
    public int lineOf(Object node, int fallback) {
        final Integer l = node == null ? null : lines.get(node);
        return l != null ? l : fallback;
    }
}
