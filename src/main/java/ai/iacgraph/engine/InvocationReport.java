package ai.iacgraph.engine;

import java.util.Collections;
import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;

import ai.iacgraph.emit.EmissionWarning;
import ai.iacgraph.model.Dialect;
import ai.iacgraph.model.ResourceGraph;
import ai.iacgraph.optimize.OptimizationChange;
import ai.iacgraph.validate.Severity;

/**
 * Structured outcome of one invocation, produced for failed invocations as well.
 *
 * @param stage            {@link Stage#DONE} or {@link Stage#FAILED}
 * @param failedAt         stage the invocation was in when it failed, null unless failed
 * @param failure          fatal error message, null unless failed
 * @param analysis         graph summary, null when the invocation failed before one existed
 * @param graph            final graph (after optimization), null when none was built
 * @param artifacts        emitted text keyed by relative path, empty for analyze and validate
 */
public record InvocationReport(
        Command command,
        Stage stage,
        Stage failedAt,
        String failure,
        Dialect targetDialect,
        AnalysisReport analysis,
        ResourceGraph graph,
        List<OptimizationChange> changes,
        List<EmissionWarning> emissionWarnings,
        SortedMap<String, String> artifacts
) {

    public InvocationReport {
        changes = List.copyOf(changes);
        emissionWarnings = List.copyOf(emissionWarnings);
        artifacts = Collections.unmodifiableSortedMap(new TreeMap<>(artifacts));
    }

    public boolean isFailed() {
        return stage == Stage.FAILED;
    }

    /**
     * Fatal when failed; findings when anything was reported (a warning or error finding, a parse
     * error, a normalization or emission warning, a skipped pass); clean otherwise.
     */
    public ExitStatus exitStatus() {
        if (isFailed()) {
            return ExitStatus.FATAL;
        }
        final boolean reported = !emissionWarnings.isEmpty()
                || changes.stream().anyMatch(c -> !c.isApplied())
                || (analysis != null && (!analysis.parseErrors().isEmpty()
                || !analysis.warnings().isEmpty()
                || analysis.findings().stream().anyMatch(f -> f.severity().atLeast(Severity.WARNING))));
        return reported ? ExitStatus.FINDINGS : ExitStatus.CLEAN;
    }

    public long errorFindings() {
        return analysis == null ? 0 : analysis.findings().stream()
                .filter(f -> f.severity() == Severity.ERROR).count();
    }
}
