package ai.iacgraph.emit;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Rendered text artifacts keyed by relative path, plus the emission warnings.
 */
public record EmissionResult(SortedMap<String, String> artifacts, List<EmissionWarning> warnings) {

    public EmissionResult(Map<String, String> artifacts, List<EmissionWarning> warnings) {
        this(new TreeMap<>(artifacts), warnings);
    }

    public EmissionResult {
        artifacts = Collections.unmodifiableSortedMap(new TreeMap<>(artifacts));
        final List<EmissionWarning> sorted = new ArrayList<>(warnings);
        sorted.sort(EmissionWarning.ORDER);
        warnings = List.copyOf(sorted);
    }
}
