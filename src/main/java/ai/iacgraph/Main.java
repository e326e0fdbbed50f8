package ai.iacgraph;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import ai.iacgraph.engine.Command;
import ai.iacgraph.engine.ConversionOrchestrator;
import ai.iacgraph.engine.EngineConfig;
import ai.iacgraph.engine.HintProvider;
import ai.iacgraph.engine.InvocationReport;
import ai.iacgraph.engine.InvocationRequest;
import ai.iacgraph.io.ReportWriter;
import ai.iacgraph.model.Dialect;

public final class Main {

    public static void main(String[] args) {
        final int code = run(args);
        if (code != 0) {
            System.exit(code);
        }
    }

    static int run(String[] args) {
        Command command = null;
        Path sourcePath = null;
        Path outDir = null;
        Path configFile = null;
        String source = null;
        String target = null;
        List<String> passes = null;

        try {
            for (String arg : args) {
                if ("--help".equals(arg) || "-h".equals(arg)) {
                    printUsage();
                    return 0;
                }
                if (arg.startsWith("--source=")) {
                    source = arg.substring("--source=".length()).trim();
                    continue;
                }
                if (arg.startsWith("--target=")) {
                    target = arg.substring("--target=".length()).trim();
                    continue;
                }
                if (arg.startsWith("--out=")) {
                    outDir = Paths.get(arg.substring("--out=".length()));
                    continue;
                }
                if (arg.startsWith("--config=")) {
                    configFile = Paths.get(arg.substring("--config=".length()));
                    continue;
                }
                if (arg.startsWith("--passes=")) {
                    final String list = arg.substring("--passes=".length()).trim();
                    passes = list.isEmpty() ? List.of() : Arrays.stream(list.split(","))
                            .map(String::trim)
                            .filter(s -> !s.isEmpty())
                            .toList();
                    continue;
                }
                if (arg.startsWith("--")) {
                    System.err.println("ERROR: unknown argument: " + arg);
                    printUsage();
                    return 2;
                }
                if (command == null) {
                    final Optional<Command> parsed = Command.fromTag(arg);
                    if (parsed.isEmpty()) {
                        System.err.println("ERROR: unknown command: " + arg);
                        printUsage();
                        return 2;
                    }
                    command = parsed.get();
                    continue;
                }
                if (sourcePath == null) {
                    sourcePath = Paths.get(arg);
                    continue;
                }
                System.err.println("ERROR: unexpected argument: " + arg);
                printUsage();
                return 2;
            }

            if (command == null) {
                System.err.println("ERROR: missing command");
                printUsage();
                return 2;
            }
            if (outDir == null && command != Command.ANALYZE && command != Command.VALIDATE) {
                System.err.println("ERROR: " + command.tag() + " needs --out=<dir>");
                printUsage();
                return 2;
            }
            if (sourcePath == null) {
                sourcePath = Paths.get(".");
            }
            sourcePath = sourcePath.toAbsolutePath().normalize();
            if (source != null && Dialect.fromTag(source).isEmpty()) {
                System.err.println("ERROR: unknown dialect: " + source);
                return 2;
            }

            EngineConfig config = EngineConfig.resolve(sourcePath, configFile);
            if (passes != null) {
                config = config.withPasses(passes);
            }

            final InvocationReport report;
            try (ConversionOrchestrator orchestrator = new ConversionOrchestrator(config, HintProvider.NONE)) {
                report = orchestrator.run(new InvocationRequest(command, sourcePath, source, target));
            }

            final ReportWriter writer = new ReportWriter();
            final String generatedAt = Instant.now().toString();
            if (outDir != null) {
                outDir = outDir.toAbsolutePath().normalize();
                writer.writeAll(outDir, report, generatedAt);
                System.out.println("Report written to: " + outDir.resolve(ReportWriter.REPORT_FILE));
            } else {
                System.out.println(writer.render(report, generatedAt));
            }

            printSummary(report);
            return report.exitStatus().code();
        } catch (java.io.IOException ex) {
            System.err.println("ERROR: IO failure: " + safeMsg(ex.getMessage()));
            return 2;
        } catch (Exception ex) {
            System.err.println("ERROR: " + (command == null ? "invocation" : command.tag()) + " failed: "
                    + ex.getClass().getSimpleName() + ": " + safeMsg(ex.getMessage()));
            return 2;
        }
    }

    private static void printSummary(InvocationReport report) {
        if (report.isFailed()) {
            System.err.println("ERROR: " + report.command().tag() + " failed while " + report.failedAt()
                    + ": " + safeMsg(report.failure()));
            return;
        }
        final var analysis = report.analysis();
        System.err.println("Dialect: " + analysis.sourceDialect().tag()
                + ", files: " + analysis.files().size()
                + ", nodes: " + analysis.nodeCount()
                + ", edges: " + analysis.edgeCount());
        System.err.println("Findings: " + analysis.findings().size()
                + " (" + report.errorFindings() + " errors)"
                + ", parse errors: " + analysis.parseErrors().size()
                + ", normalization warnings: " + analysis.warnings().size());
        if (!report.changes().isEmpty()) {
            System.err.println("Optimizations: " + report.changes().size());
        }
        if (!report.artifacts().isEmpty()) {
            System.err.println("Artifacts: " + report.artifacts().size()
                    + " (" + report.targetDialect().tag() + "), emission warnings: "
                    + report.emissionWarnings().size());
        }
    }

    private static void printUsage() {
        System.out.println("Usage: iac-graph <analyze|generate|validate|optimize|convert> <path> [options]");
        System.out.println("Options:");
        System.out.println("  --source=<dialect>   Source dialect: terraform, cloudformation, kubernetes, ansible (default: inferred)");
        System.out.println("  --target=<dialect>   Target dialect for generate and convert");
        System.out.println("  --out=<dir>          Output directory for artifacts and report.json");
        System.out.println("  --config=<file>      Settings file (default: <path>/" + EngineConfig.FILE_NAME + " when present)");
        System.out.println("  --passes=<a,b>       Optimization passes to run (default: all for optimize, none otherwise)");
        System.out.println("  --help, -h           Show this help");
    }

    private static String safeMsg(String msg) {
        if (msg == null) {
            return "";
        }
        return msg.length() > 200 ? msg.substring(0, 200) + "..." : msg;
    }
}
