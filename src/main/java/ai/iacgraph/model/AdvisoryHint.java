package ai.iacgraph.model;

import java.util.Objects;

/**
 * Free-text suggestion from the natural-language layer. Never read by validation or optimization.
 */
public record AdvisoryHint(String nodeId, String text) {

    public AdvisoryHint {
        Objects.requireNonNull(nodeId, "nodeId");
        Objects.requireNonNull(text, "text");
    }
}
