package ai.iacgraph.optimize.passes;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

import ai.iacgraph.model.DependencyEdge;
import ai.iacgraph.model.Dialect;
import ai.iacgraph.model.EdgeOrigin;
import ai.iacgraph.model.Ids;
import ai.iacgraph.model.Metadata;
import ai.iacgraph.model.PropertyValue;
import ai.iacgraph.model.ResourceGraph;
import ai.iacgraph.model.ResourceNode;
import ai.iacgraph.model.SourceLocation;
import ai.iacgraph.normalize.schema.PropertyNaming;
import ai.iacgraph.optimize.OptimizationChange;
import ai.iacgraph.optimize.OptimizationPass;

/**
 * Replaces a string literal repeated on the same top-level property of several resources with a
 * reference to a new variable. Only for dialects that declare variables by name
 * (Terraform variables, CloudFormation parameters).
 */
public final class HoistLiteralsPass implements OptimizationPass {

    public static final String ID = "hoist-literals";

    private final int threshold;

    public HoistLiteralsPass(int threshold) {
        if (threshold < 2) {
            throw new IllegalArgumentException("hoist threshold must be at least 2: " + threshold);
        }
        this.threshold = threshold;
    }

    @Override
    public String id() {
        return ID;
    }

    @Override
    public List<OptimizationChange> apply(ResourceGraph graph) {
        final Dialect dialect = graph.sourceDialect();
        if (dialect != Dialect.TERRAFORM && dialect != Dialect.CLOUDFORMATION) {
            return List.of();
        }
        // (property, literal) -> node ids, both sorted
        final Map<String, Map<String, Set<String>>> uses = new TreeMap<>();
        for (ResourceNode n : graph.nodes()) {
            if (n.category().equals("config") || n.category().equals("module") || n.isUnknownType()) {
                continue;
            }
            for (var p : n.properties().entrySet()) {
                if (p.getValue() instanceof PropertyValue.Scalar s && s.value() instanceof String text && !text.isBlank()) {
                    uses.computeIfAbsent(p.getKey(), k -> new TreeMap<>())
                            .computeIfAbsent(text, k -> new TreeSet<>()).add(n.id());
                }
            }
        }
        final List<OptimizationChange> changes = new ArrayList<>();
        final Set<String> taken = new TreeSet<>();
        graph.nodes().forEach(n -> taken.add(n.id()));
        uses.forEach((property, byLiteral) -> byLiteral.forEach((literal, ids) -> {
            if (ids.size() < threshold) {
                return;
            }
            final String varId = variableId(dialect, property, taken);
            taken.add(varId);
            graph.putNode(variable(dialect, varId, property, literal));
            for (String id : ids) {
                final ResourceNode n = graph.node(id).orElseThrow();
                final Map<String, PropertyValue> props = new LinkedHashMap<>(n.properties());
                props.put(property, PropertyValue.Reference.to(varId));
                graph.putNode(n.withProperties(props));
                graph.addEdge(DependencyEdge.dependsOn(id, varId, EdgeOrigin.REFERENCE));
            }
            changes.add(OptimizationChange.applied(ID, varId,
                    "hoisted \"" + literal + "\" from " + property + " of " + ids.size() + " resources"));
        }));
        return changes;
    }

    private static String variableId(Dialect dialect, String property, Set<String> taken) {
        if (dialect == Dialect.TERRAFORM) {
            return Ids.unique(Ids.variableId(PropertyNaming.toNative(Dialect.TERRAFORM, property)), taken, "_");
        }
        return Ids.unique(Ids.logicalId(PropertyNaming.toNative(Dialect.CLOUDFORMATION, property)), taken, "");
    }

    /**
     * Variable node shaped as the dialect's normalizer would produce it from emitted text.
     */
    private static ResourceNode variable(Dialect dialect, String id, String property, String literal) {
        final Map<String, PropertyValue> props = new LinkedHashMap<>();
        if (dialect == Dialect.TERRAFORM) {
            props.put("type", new PropertyValue.Expression(List.of(PropertyValue.Scalar.of("string"))));
        } else {
            props.put("type", PropertyValue.Scalar.of("String"));
        }
        props.put("default", PropertyValue.Scalar.of(literal));
        props.put("description", PropertyValue.Scalar.of("Shared " + property + " value"));
        final String nativeType = dialect == Dialect.TERRAFORM ? "variable" : "parameter";
        return new ResourceNode(id, "config.variable", props, Metadata.of(dialect, nativeType, SourceLocation.UNKNOWN));
    }
}
