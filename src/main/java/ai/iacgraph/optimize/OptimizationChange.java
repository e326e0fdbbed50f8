package ai.iacgraph.optimize;

import java.util.Objects;

/**
 * One entry of the optimizer change log.
 *
 * @param pass        pass id
 * @param status      {@code applied}, or {@code skipped: <reason>}
 * @param subject     node id or edge key the change touches; empty for pass-level entries
 * @param description what was done
 */
public record OptimizationChange(String pass, String status, String subject, String description) {

    public static final String APPLIED = "applied";
    public static final String INVARIANT_VIOLATION = "skipped: invariant violation";

    public OptimizationChange {
        Objects.requireNonNull(pass, "pass");
        Objects.requireNonNull(status, "status");
        subject = subject == null ? "" : subject;
        description = description == null ? "" : description;
    }

    public static OptimizationChange applied(String pass, String subject, String description) {
        return new OptimizationChange(pass, APPLIED, subject, description);
    }

    public static OptimizationChange skipped(String pass, String reason, String description) {
        return new OptimizationChange(pass, "skipped: " + reason, "", description);
    }

    public boolean isApplied() {
        return APPLIED.equals(status);
    }
}
