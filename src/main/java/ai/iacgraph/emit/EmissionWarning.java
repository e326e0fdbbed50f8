package ai.iacgraph.emit;

import java.util.Comparator;
import java.util.Objects;

/**
 * Lossy or untranslatable construct met while rendering. The output is still produced.
 *
 * @param code    {@link #UNTRANSLATABLE}, {@link #DANGLING} or {@link #LOSSY}
 * @param nodeId  node the warning is about
 * @param message human-readable description
 */
public record EmissionWarning(String code, String nodeId, String message) {

    public static final String UNTRANSLATABLE = "untranslatable resource";
    public static final String DANGLING = "dangling reference";
    public static final String LOSSY = "lossy conversion";

    public static final Comparator<EmissionWarning> ORDER = Comparator
            .comparing(EmissionWarning::nodeId)
            .thenComparing(EmissionWarning::code)
            .thenComparing(EmissionWarning::message);

    public EmissionWarning {
        Objects.requireNonNull(code, "code");
        nodeId = nodeId == null ? "" : nodeId;
        message = message == null ? "" : message;
    }

    @Override
    public String toString() {
        return "[" + nodeId + "] " + code + ": " + message;
    }
}
