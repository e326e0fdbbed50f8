package ai.iacgraph.emit;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;

import ai.iacgraph.model.Dialect;
import ai.iacgraph.model.PropertyValue;
import ai.iacgraph.model.ResourceGraph;
import ai.iacgraph.model.ResourceNode;
import ai.iacgraph.normalize.schema.PropertyNaming;
import ai.iacgraph.normalize.schema.PropertySchemas;
import ai.iacgraph.normalize.schema.TypeTables;

/**
 * State of one emission: the sealed graph, the native name given to every emitted node and the
 * warnings raised so far.
 */
public final class EmissionContext {

    /**
     * Declaration order inside a file: source line, then id.
     */
    public static final Comparator<ResourceNode> SOURCE_ORDER = Comparator
            .comparingInt((ResourceNode n) -> n.metadata().source().line())
            .thenComparing(ResourceNode::id);

    private final ResourceGraph graph;
    private final Dialect target;
    private final EmitOptions options;
    private final Map<String, String> names = new HashMap<>();
    private final Set<EmissionWarning> warnings = new LinkedHashSet<>();

    public EmissionContext(ResourceGraph graph, Dialect target, EmitOptions options) {
        this.graph = Objects.requireNonNull(graph, "graph").seal();
        this.target = Objects.requireNonNull(target, "target");
        this.options = options == null ? EmitOptions.DEFAULT : options;
    }

    public ResourceGraph graph() {
        return graph;
    }

    public Dialect target() {
        return target;
    }

    /**
     * Whether the node was normalized from the target dialect, so its metadata bag can be written
     * back verbatim.
     */
    public boolean sameDialect(ResourceNode node) {
        return node.metadata().originatesFrom(target) && node.metadata().nativeType() != null;
    }

    /**
     * Native type to write: the original spelling for same-dialect nodes, the primary table entry
     * otherwise. Empty when the target has no equivalent.
     */
    public Optional<String> nativeType(ResourceNode node) {
        if (sameDialect(node)) {
            return Optional.of(node.metadata().nativeType());
        }
        if (node.isUnknownType()) {
            return Optional.empty();
        }
        return TypeTables.nativeType(target, node.type());
    }

    /**
     * Native spelling of a property: the recorded one for same-dialect nodes, the schema or naming
     * convention otherwise.
     */
    public String nativeName(ResourceNode node, String canonical) {
        if (sameDialect(node)) {
            final String recorded = node.metadata().nativeNames().get(canonical);
            if (recorded != null) {
                return recorded;
            }
        }
        return PropertySchemas.forType(node.type()).nativeName(target, canonical);
    }

    // --- names ---

    public void name(String nodeId, String nativeName) {
        names.put(nodeId, nativeName);
    }

    public Optional<String> nameOf(String nodeId) {
        return Optional.ofNullable(names.get(nodeId));
    }

    public boolean isNameTaken(String nativeName) {
        return names.containsValue(nativeName);
    }

    /**
     * Native name of a reference target, or empty (with a dangling-reference warning) when the
     * target is missing or was not emitted.
     */
    public Optional<String> resolve(String fromId, PropertyValue.Reference ref) {
        final String name = names.get(ref.targetId());
        if (name != null) {
            return Optional.of(name);
        }
        final String why = graph.hasNode(ref.targetId()) ? "is not representable in " + target : "is not declared";
        warn(EmissionWarning.DANGLING, fromId,
                "reference to '" + ref.targetId() + "' " + why + "; written as a literal");
        return Optional.empty();
    }

    /**
     * Name of the reference target followed by its attribute path, spelled the target dialect's
     * way when the target node came from another dialect.
     */
    public Optional<String> address(String fromId, PropertyValue.Reference ref) {
        return resolve(fromId, ref).map(name -> nativeAttribute(ref).render(name));
    }

    public PropertyValue.Reference nativeAttribute(PropertyValue.Reference ref) {
        final String attr = ref.attribute();
        if (attr == null || attr.contains(".") || attr.contains("[")) {
            return ref;
        }
        final Optional<ResourceNode> targetNode = graph.node(ref.targetId());
        if (targetNode.isEmpty() || sameDialect(targetNode.get()) || targetNode.get().metadata().origin() == null) {
            return ref;
        }
        final String canonical = PropertyNaming.toCanonical(targetNode.get().metadata().origin(), attr);
        return new PropertyValue.Reference(ref.targetId(), PropertyNaming.toNative(target, canonical));
    }

    // --- warnings ---

    public void warn(String code, String nodeId, String message) {
        warnings.add(new EmissionWarning(code, nodeId, message));
    }

    /**
     * Records the untranslatable-resource warning and returns the stub text lines (without comment
     * markers).
     */
    public List<String> stub(ResourceNode node) {
        warn(EmissionWarning.UNTRANSLATABLE, node.id(),
                node.type() + " has no " + target + " equivalent; written as a comment stub");
        final List<String> lines = new ArrayList<>();
        lines.add(EmissionWarning.UNTRANSLATABLE + ": " + node.id() + " (" + node.type() + ")");
        node.properties().forEach((k, v) -> lines.add("  " + k + " = " + describe(v)));
        return lines;
    }

    /**
     * Warns when a cross-dialect node carries metadata the target cannot express.
     */
    public void lossy(ResourceNode node) {
        if (sameDialect(node)) {
            return;
        }
        final List<String> dropped = new ArrayList<>(node.metadata().opaqueProperties().keySet());
        node.metadata().extensions().keySet().stream()
                .filter(k -> !k.startsWith("@") && !k.equals("name"))
                .forEach(dropped::add);
        if (!dropped.isEmpty()) {
            warn(EmissionWarning.LOSSY, node.id(), "dropped " + node.metadata().origin() + " attributes " + dropped);
        }
    }

    /**
     * Banner lines for graphs with unresolved error findings, empty otherwise.
     */
    public List<String> banner() {
        if (!options.banner()) {
            return List.of();
        }
        return List.of(
                "WARNING: generated from a graph with " + options.errorFindings() + " unresolved error-level finding(s).",
                "Review the validation report before applying this output.");
    }

    /**
     * Prefixes every line with {@code "# "} and adds the banner first.
     */
    public String header(List<String> lines) {
        final StringBuilder sb = new StringBuilder();
        for (String l : banner()) {
            sb.append("# ").append(l).append('\n');
        }
        for (String l : lines) {
            sb.append(l.isEmpty() ? "#" : "# " + l).append('\n');
        }
        return sb.toString();
    }

    /**
     * Alias entries whose old id is gone from the graph, grouped by surviving id.
     */
    public SortedMap<String, List<String>> movedBySurvivor() {
        final SortedMap<String, List<String>> out = new TreeMap<>();
        graph.aliases().forEach((old, survivor) -> {
            if (!graph.hasNode(old) && graph.hasNode(survivor)) {
                out.computeIfAbsent(survivor, k -> new ArrayList<>()).add(old);
            }
        });
        return out;
    }

    public EmissionResult result(Map<String, String> artifacts) {
        return new EmissionResult(artifacts, new ArrayList<>(warnings));
    }

    /**
     * Compact single-line rendering used in stubs and comments.
     */
    public static String describe(PropertyValue v) {
        if (v instanceof PropertyValue.Scalar s) {
            return s.value() instanceof String str ? "\"" + oneLine(str) + "\"" : String.valueOf(s.value());
        }
        if (v instanceof PropertyValue.Reference r) {
            return "${" + r.render(r.targetId()) + "}";
        }
        if (v instanceof PropertyValue.ListValue l) {
            final List<String> items = new ArrayList<>();
            l.items().forEach(i -> items.add(describe(i)));
            return "[" + String.join(", ", items) + "]";
        }
        if (v instanceof PropertyValue.MapValue m) {
            final List<String> items = new ArrayList<>();
            m.entries().forEach((k, i) -> items.add(k + ": " + describe(i)));
            return "{" + String.join(", ", items) + "}";
        }
        final List<PropertyValue> parts = v instanceof PropertyValue.Template t
                ? t.parts()
                : ((PropertyValue.Expression) v).parts();
        final StringBuilder sb = new StringBuilder();
        for (PropertyValue p : parts) {
            if (p instanceof PropertyValue.Scalar s) {
                sb.append(oneLine(s.asText()));
            } else {
                sb.append(describe(p));
            }
        }
        return v instanceof PropertyValue.Template ? "\"" + sb + "\"" : sb.toString();
    }

    private static String oneLine(String s) {
        return s.replace("\n", "\\n").replace("\r", "");
    }
}
