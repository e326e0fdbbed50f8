package ai.iacgraph.optimize.passes;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import ai.iacgraph.model.DependencyEdge;
import ai.iacgraph.model.Metadata;
import ai.iacgraph.model.PropertyValue;
import ai.iacgraph.model.ResourceGraph;
import ai.iacgraph.model.ResourceNode;
import ai.iacgraph.optimize.OptimizationChange;
import ai.iacgraph.optimize.OptimizationPass;

/**
 * Folds resources with the same type, properties, metadata (declaration site aside) and outgoing
 * edges into the one with the smallest id. Repeats until nothing merges, since folding can make
 * the referrers of the folded nodes equal too.
 */
public final class MergeDuplicatesPass implements OptimizationPass {

    public static final String ID = "merge-duplicates";

    private record Fingerprint(String type, Map<String, PropertyValue> properties, Metadata metadata,
                               Set<String> outgoing) {
    }

    @Override
    public String id() {
        return ID;
    }

    @Override
    public List<OptimizationChange> apply(ResourceGraph graph) {
        final List<OptimizationChange> changes = new ArrayList<>();
        boolean merged = true;
        while (merged) {
            merged = false;
            for (List<String> group : groups(graph)) {
                final String survivor = group.get(0);
                for (String duplicate : group.subList(1, group.size())) {
                    graph.redirect(duplicate, survivor);
                    changes.add(OptimizationChange.applied(ID, duplicate, "merged into " + survivor));
                    merged = true;
                }
            }
        }
        return changes;
    }

    private static List<List<String>> groups(ResourceGraph graph) {
        final Map<Fingerprint, List<String>> byPrint = new LinkedHashMap<>();
        for (ResourceNode n : graph.nodes()) {
            if (n.category().equals("config") || n.category().equals("host")) {
                continue;
            }
            final Set<String> outgoing = new TreeSet<>();
            for (DependencyEdge e : graph.outgoing(n.id())) {
                // a self edge would differ between duplicates by id alone
                final String target = e.target().equals(n.id()) ? "<self>" : e.target();
                outgoing.add(e.kind() + " " + target + " " + e.origins());
            }
            final Fingerprint fp = new Fingerprint(n.type(), n.properties(), n.metadata().withoutSource(), outgoing);
            byPrint.computeIfAbsent(fp, k -> new ArrayList<>()).add(n.id());
        }
        final List<List<String>> out = new ArrayList<>();
        for (List<String> ids : byPrint.values()) {
            if (ids.size() > 1 && !containsEachOther(graph, ids)) {
                out.add(ids);
            }
        }
        return out;
    }

    /**
     * Nodes linked to each other are not interchangeable.
     */
    private static boolean containsEachOther(ResourceGraph graph, List<String> ids) {
        for (String id : ids) {
            for (DependencyEdge e : graph.outgoing(id)) {
                if (!e.target().equals(id) && ids.contains(e.target())) {
                    return true;
                }
            }
        }
        return false;
    }
}
