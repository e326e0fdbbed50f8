package ai.iacgraph.engine;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import ai.iacgraph.model.AdvisoryHint;
import ai.iacgraph.model.Dialect;
import ai.iacgraph.model.EdgeKind;
import ai.iacgraph.model.ResourceGraph;
import ai.iacgraph.normalize.NormalizationWarning;
import ai.iacgraph.optimize.OptimizationChange;
import ai.iacgraph.parse.ParseError;
import ai.iacgraph.validate.Severity;
import ai.iacgraph.validate.ValidationFinding;

import static ai.iacgraph.testutil.TestGraphs.write;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ConversionOrchestratorTest {

    private static final String BUCKET_A = "resource \"aws_s3_bucket\" \"logs_a\" {\n  versioning = true\n}\n";
    private static final String BUCKET_B = "resource \"aws_s3_bucket\" \"logs_b\" {\n  versioning = true\n}\n";

    @TempDir
    Path dir;

    private ConversionOrchestrator orchestrator;

    @AfterEach
    void close() {
        if (orchestrator != null) {
            orchestrator.close();
        }
    }

    private ConversionOrchestrator orchestrator(EngineConfig config, HintProvider hints) {
        orchestrator = new ConversionOrchestrator(config, hints);
        return orchestrator;
    }

    private ConversionOrchestrator orchestrator() {
        return orchestrator(EngineConfig.DEFAULTS.withParallelism(2), HintProvider.NONE);
    }

    @Test
    void generate_danglingDependsOn_bannerAndFindingsExit() throws IOException {
        write(dir, "stack.yaml", """
                Resources:
                  Web:
                    Type: AWS::EC2::Instance
                    DependsOn: Missing
                    Properties:
                      ImageId: ami-123
                """);

        final InvocationReport report = orchestrator().generate(dir, Dialect.TERRAFORM);

        assertThat(report.stage()).isEqualTo(Stage.DONE);
        assertThat(report.analysis().sourceDialect()).isEqualTo(Dialect.CLOUDFORMATION);
        assertThat(report.analysis().warnings()).extracting(NormalizationWarning::code).contains("dangling-reference");
        assertThat(report.analysis().findings())
                .filteredOn(f -> f.severity() == Severity.ERROR)
                .extracting(ValidationFinding::ruleId)
                .contains("structural.dangling-reference");
        assertThat(report.artifacts()).isNotEmpty();
        assertThat(report.artifacts().values()).allSatisfy(text ->
                assertThat(text).startsWith("# WARNING: generated from a graph with"));
        assertThat(report.exitStatus()).isEqualTo(ExitStatus.FINDINGS);
    }

    @Test
    void analyze_noResources_failsWhileNormalizing() throws IOException {
        write(dir, "main.tf", "# nothing here\n");

        final InvocationReport report = orchestrator().analyze(dir, null);

        assertThat(report.stage()).isEqualTo(Stage.FAILED);
        assertThat(report.failedAt()).isEqualTo(Stage.NORMALIZING);
        assertThat(report.failure()).contains("no resources");
        assertThat(report.exitStatus()).isEqualTo(ExitStatus.FATAL);
    }

    @Test
    void analyze_mixedTree_ambiguousInferenceFails() throws IOException {
        write(dir, "main.tf", BUCKET_A);
        write(dir, "k8s/cm.yaml", """
                apiVersion: v1
                kind: ConfigMap
                metadata:
                  name: settings
                """);

        final InvocationReport report = orchestrator().analyze(dir, null);

        assertThat(report.isFailed()).isTrue();
        assertThat(report.failure()).contains("ambiguous").contains("terraform");
        assertThat(report.analysis()).isNull();
    }

    @Test
    void analyze_invalidUtf8File_reportedAsParseError() throws IOException {
        write(dir, "main.tf", BUCKET_A);
        Files.write(dir.resolve("legacy.tf"), new byte[]{'#', ' ', (byte) 0xFF, (byte) 0xFE, '\n'});

        final InvocationReport report = orchestrator().analyze(dir, null);

        assertThat(report.stage()).isEqualTo(Stage.DONE);
        assertThat(report.analysis().files()).containsExactly("main.tf");
        assertThat(report.analysis().parseErrors())
                .extracting(ParseError::file, ParseError::line)
                .containsExactly(tuple("legacy.tf", 0));
    }

    @Test
    void analyze_mixedTree_explicitDialectSelectsFiles() throws IOException {
        write(dir, "main.tf", BUCKET_A);
        write(dir, "k8s/cm.yaml", """
                apiVersion: v1
                kind: ConfigMap
                metadata:
                  name: settings
                """);

        final InvocationReport report = orchestrator().analyze(dir, Dialect.KUBERNETES);

        assertThat(report.stage()).isEqualTo(Stage.DONE);
        assertThat(report.analysis().files()).containsExactly("k8s/cm.yaml");
        assertThat(report.artifacts()).isEmpty();
    }

    @Test
    void run_unknownTarget_fails() throws IOException {
        write(dir, "main.tf", BUCKET_A);

        final InvocationReport report = orchestrator()
                .run(new InvocationRequest(Command.GENERATE, dir, null, "pulumi"));

        assertThat(report.isFailed()).isTrue();
        assertThat(report.failedAt()).isEqualTo(Stage.PARSING);
        assertThat(report.failure()).contains("unknown target dialect 'pulumi'");
    }

    @Test
    void run_unknownPass_fails() throws IOException {
        write(dir, "main.tf", BUCKET_A);

        final InvocationReport report = orchestrator(
                EngineConfig.DEFAULTS.withParallelism(2).withPasses(List.of("inline-everything")), HintProvider.NONE)
                .optimize(dir, null);

        assertThat(report.isFailed()).isTrue();
        assertThat(report.failure()).contains("unknown optimization pass 'inline-everything'");
    }

    @Test
    void optimize_duplicateBuckets_mergedWithMovedBlock() throws IOException {
        write(dir, "a.tf", BUCKET_A);
        write(dir, "b.tf", BUCKET_B);

        final InvocationReport report = orchestrator().optimize(dir, null);

        assertThat(report.stage()).isEqualTo(Stage.DONE);
        assertThat(report.targetDialect()).isEqualTo(Dialect.TERRAFORM);
        assertThat(report.changes()).filteredOn(OptimizationChange::isApplied)
                .extracting(OptimizationChange::subject)
                .contains("aws_s3_bucket.logs_b");
        final ResourceGraph graph = report.graph();
        assertThat(graph.hasNode("aws_s3_bucket.logs_b")).isFalse();
        assertThat(graph.resolve("aws_s3_bucket.logs_b")).isEqualTo("aws_s3_bucket.logs_a");
        assertThat(report.artifacts()).containsOnlyKeys("a.tf");
        assertThat(report.artifacts().get("a.tf")).contains("moved {");
    }

    @Test
    void optimize_explicitDependencyImpliedByReferences_keptInOutput() throws IOException {
        write(dir, "main.tf", """
                resource "aws_vpc" "main" {
                  cidr_block = "10.0.0.0/16"
                }
                resource "aws_subnet" "a" {
                  vpc_id     = aws_vpc.main.id
                  cidr_block = "10.0.1.0/24"
                }
                resource "aws_instance" "web" {
                  ami        = "ami-123"
                  subnet_id  = aws_subnet.a.id
                  depends_on = [aws_vpc.main]
                }
                """);

        final InvocationReport report = orchestrator().optimize(dir, null);

        assertThat(report.stage()).isEqualTo(Stage.DONE);
        assertThat(report.graph().edge("aws_instance.web", EdgeKind.DEPENDS_ON, "aws_vpc.main")).isPresent();
        assertThat(report.changes()).extracting(OptimizationChange::pass).doesNotContain("transitive-reduction");
        assertThat(report.artifacts().get("main.tf")).contains("depends_on = [aws_vpc.main]");
    }

    @Test
    void optimize_ownOutput_noFurtherChanges(@TempDir Path second) throws IOException {
        write(dir, "a.tf", BUCKET_A);
        write(dir, "b.tf", BUCKET_B);
        final InvocationReport first = orchestrator().optimize(dir, null);
        for (Map.Entry<String, String> artifact : first.artifacts().entrySet()) {
            write(second, artifact.getKey(), artifact.getValue());
        }

        final InvocationReport again = orchestrator.optimize(second, null);

        assertThat(again.stage()).isEqualTo(Stage.DONE);
        assertThat(again.changes()).isEmpty();
        assertThat(again.artifacts()).isEqualTo(first.artifacts());
    }

    @Test
    void analyze_completedHints_reported() throws IOException {
        write(dir, "main.tf", BUCKET_A);
        final HintProvider hints = mock(HintProvider.class);
        when(hints.requestHints(any())).thenReturn(CompletableFuture.completedFuture(List.of(
                new AdvisoryHint("aws_s3_bucket.logs_a", "consider lifecycle rules"),
                new AdvisoryHint("aws_s3_bucket.unknown", "dropped"))));

        final InvocationReport report = orchestrator(EngineConfig.DEFAULTS.withParallelism(2), hints).analyze(dir, null);

        assertThat(report.analysis().hints()).extracting(AdvisoryHint::nodeId).containsExactly("aws_s3_bucket.logs_a");
        verify(hints).requestHints(any(ResourceGraph.class));
    }

    @Test
    void optimize_completedHints_attachedToNodes() throws IOException {
        write(dir, "main.tf", BUCKET_A);
        final HintProvider hints = graph -> CompletableFuture.completedFuture(
                List.of(new AdvisoryHint("aws_s3_bucket.logs_a", "consider lifecycle rules")));

        final InvocationReport report = orchestrator(EngineConfig.DEFAULTS.withParallelism(2), hints).optimize(dir, null);

        assertThat(report.graph().node("aws_s3_bucket.logs_a").orElseThrow().hints())
                .extracting(AdvisoryHint::text)
                .containsExactly("consider lifecycle rules");
    }

    @Test
    void analyze_hintsNeverArriving_discardedWithoutWaiting() throws IOException {
        write(dir, "main.tf", BUCKET_A);
        final CompletableFuture<List<AdvisoryHint>> never = new CompletableFuture<>();

        final InvocationReport report = orchestrator(EngineConfig.DEFAULTS.withParallelism(2), graph -> never)
                .analyze(dir, null);

        assertThat(report.stage()).isEqualTo(Stage.DONE);
        assertThat(report.analysis().hints()).isEmpty();
        assertThat(never).isCancelled();
    }

    @Test
    void analyze_failedHints_ignored() throws IOException {
        write(dir, "main.tf", BUCKET_A);
        final HintProvider failing = graph -> CompletableFuture.failedFuture(new IllegalStateException("offline"));

        final InvocationReport report = orchestrator(EngineConfig.DEFAULTS.withParallelism(2), failing)
                .analyze(dir, null);

        assertThat(report.stage()).isEqualTo(Stage.DONE);
        assertThat(report.analysis().hints()).isEmpty();
    }

    @Test
    void analyze_hintProviderSeesSealedSnapshot() throws IOException {
        write(dir, "main.tf", BUCKET_A);
        final ResourceGraph[] seen = new ResourceGraph[1];

        orchestrator(EngineConfig.DEFAULTS.withParallelism(2), graph -> {
            seen[0] = graph;
            return CompletableFuture.completedFuture(List.of());
        }).analyze(dir, null);

        assertThat(seen[0].isSealed()).isTrue();
        assertThat(seen[0].hasNode("aws_s3_bucket.logs_a")).isTrue();
    }
}
