package ai.iacgraph.normalize;

import java.util.Comparator;

import ai.iacgraph.model.SourceLocation;

/**
 * Non-fatal normalization problem. The data involved is retained (as opaque metadata, or as a
 * dangling edge the validator reports).
 *
 * @param code    stable identifier: {@code dangling-reference}, {@code schema-mismatch},
 *                {@code conflicting-declaration}, {@code unresolved-dependency}, {@code unsupported-value}
 * @param nodeId  node the warning is about
 * @param source  declaration site
 * @param message human-readable description
 */
public record NormalizationWarning(String code, String nodeId, SourceLocation source, String message) {

    public static final Comparator<NormalizationWarning> ORDER = Comparator
            .comparing((NormalizationWarning w) -> w.source().file())
            .thenComparingInt(w -> w.source().line())
            .thenComparing(NormalizationWarning::nodeId)
            .thenComparing(NormalizationWarning::code)
            .thenComparing(NormalizationWarning::message);

    public NormalizationWarning {
        source = source == null ? SourceLocation.UNKNOWN : source;
        nodeId = nodeId == null ? "" : nodeId;
    }

    @Override
    public String toString() {
        return source + " [" + nodeId + "] " + code + ": " + message;
    }
}
