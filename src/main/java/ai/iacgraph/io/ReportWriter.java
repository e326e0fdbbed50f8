package ai.iacgraph.io;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import ai.iacgraph.emit.EmissionWarning;
import ai.iacgraph.engine.AnalysisReport;
import ai.iacgraph.engine.InvocationReport;
import ai.iacgraph.model.AdvisoryHint;
import ai.iacgraph.model.Dialect;
import ai.iacgraph.normalize.NormalizationWarning;
import ai.iacgraph.optimize.OptimizationChange;
import ai.iacgraph.parse.ParseError;
import ai.iacgraph.validate.ValidationFinding;

/**
 * Writes emitted artifacts and the JSON invocation report.
 */
public final class ReportWriter {

    public static final String SCHEMA_VERSION = "iac-graph/v1";
    public static final String REPORT_FILE = "report.json";

    private final ObjectMapper jsonMapper;

    public ReportWriter() {
        this.jsonMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * Writes every artifact under {@code outDir} plus {@value #REPORT_FILE}. Artifacts from a
     * previous run with other names are left alone.
     */
    public void writeAll(Path outDir, InvocationReport report, String generatedAt) throws IOException {
        Objects.requireNonNull(outDir, "outDir");
        Objects.requireNonNull(report, "report");

        final Path root = outDir.toAbsolutePath().normalize();
        Files.createDirectories(root);

        for (Map.Entry<String, String> artifact : report.artifacts().entrySet()) {
            final Path target = root.resolve(artifact.getKey()).normalize();
            if (!target.startsWith(root) || target.equals(root.resolve(REPORT_FILE))) {
                throw new IOException("Refusing to write artifact outside the output directory: " + artifact.getKey());
            }
            if (target.getParent() != null) {
                Files.createDirectories(target.getParent());
            }
            Files.writeString(target, artifact.getValue(), StandardCharsets.UTF_8);
        }

        jsonMapper.writeValue(root.resolve(REPORT_FILE).toFile(), toDocument(report, generatedAt));
    }

    /**
     * The report as JSON text, for printing.
     */
    public String render(InvocationReport report, String generatedAt) {
        try {
            return jsonMapper.writeValueAsString(toDocument(report, generatedAt));
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Report is not serializable", ex);
        }
    }

    static ReportDocument toDocument(InvocationReport report, String generatedAt) {
        final AnalysisReport a = report.analysis();
        final Summary summary = a == null ? null : new Summary(
                a.files(),
                a.nodeCount(),
                a.edgeCount(),
                a.nodesByType(),
                a.edgesByKind(),
                a.environments());

        return new ReportDocument(
                SCHEMA_VERSION,
                generatedAt,
                report.command().tag(),
                report.stage().name(),
                report.exitStatus().code(),
                report.failedAt() == null ? null : report.failedAt().name(),
                report.failure(),
                a == null ? null : tag(a.sourceDialect()),
                tag(report.targetDialect()),
                summary,
                a == null ? List.of() : a.parseErrors(),
                a == null ? List.of() : a.warnings().stream().map(ReportWriter::toEntry).toList(),
                a == null ? List.of() : a.findings(),
                report.changes(),
                report.emissionWarnings(),
                report.graph() == null ? Map.of() : report.graph().aliases(),
                new ArrayList<>(report.artifacts().keySet()),
                a == null ? List.of() : a.hints());
    }

    private static WarningEntry toEntry(NormalizationWarning w) {
        return new WarningEntry(w.code(), w.nodeId(), w.source().toString(), w.message());
    }

    private static String tag(Dialect d) {
        return d == null ? null : d.tag();
    }

    // --- report records (written as JSON) ---

    public record ReportDocument(
            String schema,
            String generatedAt,
            String command,
            String stage,
            int exitStatus,
            String failedAt,
            String failure,
            String sourceDialect,
            String targetDialect,
            Summary summary,
            List<ParseError> parseErrors,
            List<WarningEntry> normalizationWarnings,
            List<ValidationFinding> findings,
            List<OptimizationChange> optimizations,
            List<EmissionWarning> emissionWarnings,
            Map<String, String> renames,
            List<String> artifacts,
            List<AdvisoryHint> hints
    ) {
    }

    public record Summary(
            List<String> files,
            int nodes,
            int edges,
            Map<String, Integer> nodesByType,
            Map<String, Integer> edgesByKind,
            List<String> environments
    ) {
    }

    public record WarningEntry(
            String code,
            String nodeId,
            String source,
            String message
    ) {
    }
}
