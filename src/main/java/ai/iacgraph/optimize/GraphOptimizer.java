package ai.iacgraph.optimize;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ai.iacgraph.model.ResourceGraph;
import ai.iacgraph.optimize.passes.HoistLiteralsPass;
import ai.iacgraph.optimize.passes.MergeDuplicatesPass;
import ai.iacgraph.optimize.passes.RedundantExplicitDependenciesPass;
import ai.iacgraph.optimize.passes.TransitiveReductionPass;

/**
 * Runs the enabled passes in their fixed order. Each pass works on a copy of the graph; the copy
 * replaces the graph only if it adds no invariant violation.
 */
public final class GraphOptimizer {

    private static final Logger log = LoggerFactory.getLogger(GraphOptimizer.class);

    private final List<OptimizationPass> passes;

    public GraphOptimizer(List<OptimizationPass> passes) {
        this.passes = List.copyOf(passes);
    }

    public static GraphOptimizer withDefaultPasses(int hoistThreshold) {
        return new GraphOptimizer(List.of(
                new MergeDuplicatesPass(),
                new HoistLiteralsPass(hoistThreshold),
                new RedundantExplicitDependenciesPass(),
                new TransitiveReductionPass()));
    }

    /**
     * Pass ids in execution order.
     */
    public List<String> passIds() {
        final List<String> ids = new ArrayList<>();
        passes.forEach(p -> ids.add(p.id()));
        return ids;
    }

    /**
     * @param enabled pass ids to run; empty runs every pass. Order is always the fixed pass order.
     */
    public OptimizationResult optimize(ResourceGraph graph, Collection<String> enabled) {
        Objects.requireNonNull(graph, "graph");
        final Set<String> wanted = new LinkedHashSet<>(enabled == null ? List.of() : enabled);
        for (String id : wanted) {
            if (!passIds().contains(id)) {
                throw new IllegalArgumentException("Unknown optimization pass: " + id);
            }
        }
        ResourceGraph current = graph;
        final List<OptimizationChange> changeLog = new ArrayList<>();
        for (OptimizationPass pass : passes) {
            if (!wanted.isEmpty() && !wanted.contains(pass.id())) {
                continue;
            }
            final Set<String> before = GraphInvariants.violations(current);
            final ResourceGraph candidate = current.copy();
            final List<OptimizationChange> changes = pass.apply(candidate);
            final Set<String> introduced = new TreeSet<>(GraphInvariants.violations(candidate));
            introduced.removeAll(before);
            if (!introduced.isEmpty()) {
                log.warn("Pass {} skipped: {}", pass.id(), introduced);
                changeLog.add(new OptimizationChange(pass.id(), OptimizationChange.INVARIANT_VIOLATION, "",
                        String.join("; ", introduced)));
                continue;
            }
            log.info("Pass {}: {} changes", pass.id(), changes.size());
            changeLog.addAll(changes);
            current = candidate;
        }
        return new OptimizationResult(current, changeLog);
    }
}
