package ai.iacgraph.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Supported infrastructure-as-code dialects.
 */
public enum Dialect {
    TERRAFORM("terraform", true),
    CLOUDFORMATION("cloudformation", true),
    KUBERNETES("kubernetes", false),
    ANSIBLE("ansible", true);

    private final String tag;
    private final boolean variables;

    Dialect(String tag, boolean variables) {
        this.tag = tag;
        this.variables = variables;
    }

    public String tag() {
        return tag;
    }

    /**
     * Whether the dialect can declare reusable named values (variables, parameters, play vars).
     */
    public boolean supportsVariables() {
        return variables;
    }

    public static Optional<Dialect> fromTag(String tag) {
        if (tag == null || tag.isBlank()) {
            return Optional.empty();
        }
        final String t = tag.trim().toLowerCase(Locale.ROOT);
        for (Dialect d : values()) {
            if (d.tag.equals(t)) {
                return Optional.of(d);
            }
        }
        // common short forms
        return switch (t) {
            case "tf", "hcl" -> Optional.of(TERRAFORM);
            case "cfn" -> Optional.of(CLOUDFORMATION);
            case "k8s" -> Optional.of(KUBERNETES);
            default -> Optional.empty();
        };
    }

    @Override
    public String toString() {
        return tag;
    }
}
