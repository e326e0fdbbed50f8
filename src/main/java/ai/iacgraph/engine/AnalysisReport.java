package ai.iacgraph.engine;

import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.SortedMap;
import java.util.TreeMap;

import ai.iacgraph.model.AdvisoryHint;
import ai.iacgraph.model.DependencyEdge;
import ai.iacgraph.model.Dialect;
import ai.iacgraph.model.ResourceGraph;
import ai.iacgraph.model.ResourceNode;
import ai.iacgraph.normalize.NormalizationWarning;
import ai.iacgraph.parse.ParseError;
import ai.iacgraph.validate.ValidationFinding;

/**
 * Summary of a normalized graph and everything raised while building and validating it.
 *
 * @param sourceDialect dialect the sources were read as
 * @param files         source-relative paths that were parsed
 * @param nodesByType   node count per canonical type
 * @param edgesByKind   edge count per kind ({@code depends-on}, {@code contains})
 * @param environments  normalized environment names found in paths and variable names
 */
public record AnalysisReport(
        Dialect sourceDialect,
        List<String> files,
        SortedMap<String, Integer> nodesByType,
        SortedMap<String, Integer> edgesByKind,
        List<String> environments,
        List<ParseError> parseErrors,
        List<NormalizationWarning> warnings,
        List<ValidationFinding> findings,
        List<AdvisoryHint> hints
) {

    public AnalysisReport {
        files = List.copyOf(files);
        nodesByType = Collections.unmodifiableSortedMap(new TreeMap<>(nodesByType));
        edgesByKind = Collections.unmodifiableSortedMap(new TreeMap<>(edgesByKind));
        environments = List.copyOf(environments);
        parseErrors = List.copyOf(parseErrors);
        warnings = List.copyOf(warnings);
        findings = List.copyOf(findings);
        hints = List.copyOf(hints);
    }

    static AnalysisReport summarize(Dialect dialect, List<String> files, ResourceGraph graph,
                                    List<ParseError> parseErrors, List<NormalizationWarning> warnings,
                                    List<ValidationFinding> findings, List<AdvisoryHint> hints) {
        final SortedMap<String, Integer> types = new TreeMap<>();
        final SortedMap<String, Integer> edges = new TreeMap<>();
        if (graph != null) {
            for (ResourceNode n : graph.nodes()) {
                types.merge(n.type(), 1, Integer::sum);
            }
            for (DependencyEdge e : graph.edges()) {
                edges.merge(e.kind().name().toLowerCase(Locale.ROOT).replace('_', '-'), 1, Integer::sum);
            }
        }
        return new AnalysisReport(dialect, files, types, edges, Environments.detect(files, graph),
                parseErrors, warnings, findings, hints);
    }

    public int nodeCount() {
        return nodesByType.values().stream().mapToInt(Integer::intValue).sum();
    }

    public int edgeCount() {
        return edgesByKind.values().stream().mapToInt(Integer::intValue).sum();
    }
}
