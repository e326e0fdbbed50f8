package ai.iacgraph.normalize;

import java.util.List;

import ai.iacgraph.model.ResourceGraph;
import ai.iacgraph.parse.ParseError;

/**
 * Normalized graph plus the warnings raised and the declarations that could not be mapped.
 */
public record NormalizationResult(ResourceGraph graph, List<NormalizationWarning> warnings, List<ParseError> failures) {

    public NormalizationResult {
        warnings = List.copyOf(warnings);
        failures = List.copyOf(failures);
    }
}
