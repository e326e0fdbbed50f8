package ai.iacgraph.emit;

import ai.iacgraph.model.Dialect;
import ai.iacgraph.model.ResourceGraph;

/**
 * Renders a canonical graph as text artifacts of one dialect.
 * <p>
 * The graph is sealed on entry. Nodes whose canonical type has no equivalent in the dialect are
 * written as comment stubs with an {@link EmissionWarning#UNTRANSLATABLE} warning; reference tokens
 * that do not resolve to an emitted node become inert literals with a
 * {@link EmissionWarning#DANGLING} warning.
 */
public interface DialectEmitter {

    Dialect dialect();

    EmissionResult emit(ResourceGraph graph, EmitOptions options);
}
