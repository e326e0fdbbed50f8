package ai.iacgraph.validate;

import java.util.Comparator;
import java.util.Objects;

/**
 * One rule result.
 *
 * @param severity severity
 * @param ruleId   rule identifier, e.g. {@code security.open-ingress}
 * @param subject  offending node id or edge key
 * @param message  human-readable explanation
 */
public record ValidationFinding(Severity severity, String ruleId, String subject, String message) {

    /**
     * Severity descending, then subject, then rule id, then message.
     */
    public static final Comparator<ValidationFinding> ORDER = Comparator
            .comparing(ValidationFinding::severity, Comparator.reverseOrder())
            .thenComparing(ValidationFinding::subject)
            .thenComparing(ValidationFinding::ruleId)
            .thenComparing(ValidationFinding::message);

    public ValidationFinding {
        Objects.requireNonNull(severity, "severity");
        Objects.requireNonNull(ruleId, "ruleId");
        subject = subject == null ? "" : subject;
        message = message == null ? "" : message;
    }

    public static ValidationFinding error(String ruleId, String subject, String message) {
        return new ValidationFinding(Severity.ERROR, ruleId, subject, message);
    }

    public static ValidationFinding warning(String ruleId, String subject, String message) {
        return new ValidationFinding(Severity.WARNING, ruleId, subject, message);
    }

    public static ValidationFinding info(String ruleId, String subject, String message) {
        return new ValidationFinding(Severity.INFO, ruleId, subject, message);
    }
}
