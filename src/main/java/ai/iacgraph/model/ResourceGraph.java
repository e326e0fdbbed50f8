package ai.iacgraph.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Canonical resource graph: nodes, edges, the alias (rename) map and graph-level dialect
 * extensions.
 * <p>
 * Nodes and edges are kept sorted by id / edge key so every traversal is deterministic.
 * A graph is owned by a single invocation; once handed to an emitter it is {@link #seal() sealed}
 * and every mutator throws.
 */
public final class ResourceGraph {

    private final Dialect sourceDialect;
    private final TreeMap<String, ResourceNode> nodes = new TreeMap<>();
    private final TreeMap<String, DependencyEdge> edges = new TreeMap<>();
    private final TreeMap<String, String> aliases = new TreeMap<>();
    private final Map<String, GraphExtension> extensions = new LinkedHashMap<>();
    private boolean sealed;

    public ResourceGraph(Dialect sourceDialect) {
        this.sourceDialect = sourceDialect;
    }

    /**
     * Dialect the graph was normalized from; null for graphs assembled by hand.
     */
    public Dialect sourceDialect() {
        return sourceDialect;
    }

    // --- nodes ---

    public Collection<ResourceNode> nodes() {
        return Collections.unmodifiableCollection(nodes.values());
    }

    public Optional<ResourceNode> node(String id) {
        return Optional.ofNullable(nodes.get(id));
    }

    public boolean hasNode(String id) {
        return nodes.containsKey(id);
    }

    public int nodeCount() {
        return nodes.size();
    }

    /**
     * Adds or replaces the node with the same id.
     */
    public void putNode(ResourceNode node) {
        checkMutable();
        Objects.requireNonNull(node, "node");
        nodes.put(node.id(), node);
    }

    /**
     * Removes the node and its outgoing edges. Incoming edges are left for the caller to redirect.
     */
    public Optional<ResourceNode> removeNode(String id) {
        checkMutable();
        final ResourceNode removed = nodes.remove(id);
        if (removed != null) {
            edges.values().removeIf(e -> e.source().equals(id));
        }
        return Optional.ofNullable(removed);
    }

    // --- edges ---

    public Collection<DependencyEdge> edges() {
        return Collections.unmodifiableCollection(edges.values());
    }

    public int edgeCount() {
        return edges.size();
    }

    public Optional<DependencyEdge> edge(String source, EdgeKind kind, String target) {
        return Optional.ofNullable(edges.get(DependencyEdge.key(source, kind, target)));
    }

    /**
     * Adds the edge, merging its origins into an existing edge with the same endpoints and kind.
     */
    public DependencyEdge addEdge(DependencyEdge edge) {
        checkMutable();
        Objects.requireNonNull(edge, "edge");
        return edges.merge(edge.key(), edge, DependencyEdge::merge);
    }

    /**
     * Replaces the edge with the same key (origins are overwritten, not merged).
     */
    public void replaceEdge(DependencyEdge edge) {
        checkMutable();
        edges.put(edge.key(), edge);
    }

    public boolean removeEdge(DependencyEdge edge) {
        checkMutable();
        return edges.remove(edge.key()) != null;
    }

    public List<DependencyEdge> outgoing(String id) {
        final List<DependencyEdge> out = new ArrayList<>();
        for (DependencyEdge e : edges.values()) {
            if (e.source().equals(id)) {
                out.add(e);
            }
        }
        return out;
    }

    public List<DependencyEdge> outgoing(String id, EdgeKind kind) {
        final List<DependencyEdge> out = new ArrayList<>();
        for (DependencyEdge e : edges.values()) {
            if (e.kind() == kind && e.source().equals(id)) {
                out.add(e);
            }
        }
        return out;
    }

    public List<DependencyEdge> incoming(String id) {
        final List<DependencyEdge> out = new ArrayList<>();
        for (DependencyEdge e : edges.values()) {
            if (e.target().equals(id)) {
                out.add(e);
            }
        }
        return out;
    }

    /**
     * Edges whose source or target is not a node of this graph.
     */
    public List<DependencyEdge> danglingEdges() {
        final List<DependencyEdge> out = new ArrayList<>();
        for (DependencyEdge e : edges.values()) {
            if (!nodes.containsKey(e.source()) || !nodes.containsKey(e.target())) {
                out.add(e);
            }
        }
        return out;
    }

    // --- renames ---

    /**
     * Renames a node, rewriting every edge and reference token that names it, in one step.
     */
    public void renameNode(String oldId, String newId) {
        checkMutable();
        if (oldId.equals(newId)) {
            return;
        }
        if (nodes.containsKey(newId)) {
            throw new IllegalArgumentException("Node id already in use: " + newId);
        }
        final ResourceNode node = nodes.remove(oldId);
        if (node == null) {
            throw new IllegalArgumentException("Unknown node: " + oldId);
        }
        nodes.put(newId, node.withId(newId));
        retarget(oldId, newId, true);
        addAlias(oldId, newId);
    }

    /**
     * Folds {@code fromId} into {@code intoId}: the node is removed, its outgoing edges dropped,
     * every edge and token pointing at it redirected, and an alias recorded.
     */
    public void redirect(String fromId, String intoId) {
        checkMutable();
        if (!nodes.containsKey(intoId)) {
            throw new IllegalArgumentException("Unknown node: " + intoId);
        }
        removeNode(fromId);
        retarget(fromId, intoId, false);
        addAlias(fromId, intoId);
    }

    private void retarget(String oldId, String newId, boolean includeOutgoing) {
        final List<DependencyEdge> touched = new ArrayList<>();
        for (DependencyEdge e : edges.values()) {
            if (e.target().equals(oldId) || (includeOutgoing && e.source().equals(oldId))) {
                touched.add(e);
            }
        }
        for (DependencyEdge e : touched) {
            edges.remove(e.key());
            final String s = e.source().equals(oldId) ? newId : e.source();
            final String t = e.target().equals(oldId) ? newId : e.target();
            final DependencyEdge moved = e.withEndpoints(s, t);
            edges.merge(moved.key(), moved, DependencyEdge::merge);
        }
        for (ResourceNode n : new ArrayList<>(nodes.values())) {
            boolean changed = false;
            final Map<String, PropertyValue> rewritten = new LinkedHashMap<>();
            for (var entry : n.properties().entrySet()) {
                final PropertyValue v = entry.getValue();
                final PropertyValue nv = v.mapReferences(r -> r.targetId().equals(oldId)
                        ? new PropertyValue.Reference(newId, r.attribute())
                        : r);
                changed |= !nv.equals(v);
                rewritten.put(entry.getKey(), nv);
            }
            if (changed) {
                nodes.put(n.id(), n.withProperties(rewritten));
            }
        }
    }

    // --- aliases ---

    /**
     * Old id -> surviving id, for every node folded or renamed by the optimizer.
     */
    public Map<String, String> aliases() {
        return Collections.unmodifiableMap(aliases);
    }

    public void addAlias(String oldId, String survivorId) {
        checkMutable();
        aliases.put(oldId, survivorId);
        // keep the map flat: anything that pointed at oldId now points at the survivor
        for (var entry : aliases.entrySet()) {
            if (entry.getValue().equals(oldId)) {
                entry.setValue(survivorId);
            }
        }
        aliases.remove(survivorId);
    }

    /**
     * Resolves an id through the alias map; unknown ids resolve to themselves.
     */
    public String resolve(String id) {
        return aliases.getOrDefault(id, id);
    }

    // --- extensions ---

    public Collection<GraphExtension> extensions() {
        return Collections.unmodifiableCollection(extensions.values());
    }

    public void putExtension(GraphExtension extension) {
        checkMutable();
        extensions.put(extension.identity(), extension);
    }

    // --- lifecycle ---

    public ResourceGraph copy() {
        final ResourceGraph g = new ResourceGraph(sourceDialect);
        g.nodes.putAll(nodes);
        g.edges.putAll(edges);
        g.aliases.putAll(aliases);
        g.extensions.putAll(extensions);
        return g;
    }

    /**
     * Makes the graph read-only. Idempotent.
     */
    public ResourceGraph seal() {
        sealed = true;
        return this;
    }

    public boolean isSealed() {
        return sealed;
    }

    private void checkMutable() {
        if (sealed) {
            throw new IllegalStateException("Resource graph is sealed");
        }
    }
}
