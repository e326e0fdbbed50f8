package ai.iacgraph.emit;

import java.util.List;

import org.junit.jupiter.api.Test;

import ai.iacgraph.model.Dialect;
import ai.iacgraph.model.ResourceGraph;
import ai.iacgraph.normalize.NormalizationResult;
import ai.iacgraph.optimize.GraphOptimizer;
import ai.iacgraph.optimize.passes.MergeDuplicatesPass;
import ai.iacgraph.parse.TerraformParser;
import ai.iacgraph.scan.SourceTree;

import static ai.iacgraph.testutil.GraphAssertions.assertSameNodes;
import static ai.iacgraph.testutil.GraphAssertions.sources;
import static ai.iacgraph.testutil.TestGraphs.EXECUTOR;
import static ai.iacgraph.testutil.TestGraphs.file;
import static ai.iacgraph.testutil.TestGraphs.normalize;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TerraformEmitterTest {

    private final TerraformEmitter emitter = new TerraformEmitter();

    private static final String MAIN = """
            resource "aws_s3_bucket" "logs" {
              bucket = "app-logs"
              tags = {
                team = "ops"
              }
            }

            resource "aws_instance" "web" {
              ami           = var.ami
              instance_type = "t3.micro"
              user_data     = "bucket=${aws_s3_bucket.logs.arn}"
              depends_on    = [aws_s3_bucket.logs]
            }
            """;

    private static final String VARIABLES = """
            variable "ami" {
              type    = string
              default = "ami-123"
            }
            """;

    @Test
    void emit_sameDialect_keepsFilesAndRoundTrips() {
        final ResourceGraph graph = normalize(Dialect.TERRAFORM,
                file("main.tf", MAIN), file("variables.tf", VARIABLES)).graph();

        final EmissionResult result = emitter.emit(graph.copy(), EmitOptions.DEFAULT);

        assertThat(result.artifacts()).containsOnlyKeys("main.tf", "variables.tf");
        assertThat(result.warnings()).isEmpty();
        final ResourceGraph reparsed = normalize(Dialect.TERRAFORM, sources(result.artifacts())).graph();
        assertSameNodes(reparsed, graph);
        assertThat(reparsed.edges()).containsExactlyElementsOf(graph.edges());
    }

    @Test
    void emit_sealsGraph() {
        final ResourceGraph graph = normalize(Dialect.TERRAFORM, file("main.tf", MAIN)).graph();

        emitter.emit(graph, EmitOptions.DEFAULT);

        assertThat(graph.isSealed()).isTrue();
        assertThatThrownBy(() -> graph.putNode(graph.nodes().iterator().next()))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void emit_errorFindings_bannerOnEveryArtifact() {
        final ResourceGraph graph = normalize(Dialect.TERRAFORM,
                file("main.tf", MAIN), file("variables.tf", VARIABLES)).graph();

        final EmissionResult result = emitter.emit(graph, new EmitOptions(2));

        assertThat(result.artifacts().values()).allSatisfy(text -> assertThat(text)
                .startsWith("# WARNING: generated from a graph with 2 unresolved error-level finding(s)."));
    }

    @Test
    void emit_kubernetesDeployment_commentStubAndWarning() {
        final ResourceGraph graph = normalize(Dialect.KUBERNETES, file("app.yaml", """
                apiVersion: v1
                kind: Namespace
                metadata:
                  name: shop
                ---
                apiVersion: apps/v1
                kind: Deployment
                metadata:
                  name: api
                  namespace: shop
                spec:
                  replicas: 2
                """)).graph();

        final EmissionResult result = emitter.emit(graph, EmitOptions.DEFAULT);

        final String main = result.artifacts().get(TerraformEmitter.MAIN);
        assertThat(main).contains("# untranslatable resource: shop/deployment/api (workload.deployment)");
        assertThat(main).contains("resource \"kubernetes_namespace\" \"shop\" {");
        assertThat(result.warnings())
                .filteredOn(w -> w.code().equals(EmissionWarning.UNTRANSLATABLE))
                .extracting(EmissionWarning::nodeId)
                .containsExactly("shop/deployment/api");
    }

    @Test
    void emit_explicitDependencyOnMissingNode_commentAndDanglingWarning() {
        final ResourceGraph graph = normalize(Dialect.TERRAFORM, file("main.tf", """
                resource "aws_s3_bucket" "logs" {
                  bucket     = "logs"
                  depends_on = [aws_s3_bucket.missing]
                }
                """)).graph();

        final EmissionResult result = emitter.emit(graph, EmitOptions.DEFAULT);

        assertThat(result.artifacts().get("main.tf"))
                .contains("# depends_on aws_s3_bucket.missing was not emitted")
                .doesNotContain("depends_on = [");
        assertThat(result.warnings()).extracting(EmissionWarning::code).containsExactly(EmissionWarning.DANGLING);
    }

    @Test
    void emit_afterMerge_movedBlockInSurvivorFile() {
        final NormalizationResult normalized = normalize(Dialect.TERRAFORM,
                file("a.tf", "resource \"aws_s3_bucket\" \"logs_a\" {\n  versioning = true\n}\n"),
                file("b.tf", "resource \"aws_s3_bucket\" \"logs_b\" {\n  versioning = true\n}\n"));
        final ResourceGraph merged = GraphOptimizer.withDefaultPasses(3)
                .optimize(normalized.graph(), List.of(MergeDuplicatesPass.ID)).graph();

        final EmissionResult result = emitter.emit(merged, EmitOptions.DEFAULT);

        assertThat(result.artifacts()).containsOnlyKeys("a.tf");
        assertThat(result.artifacts().get("a.tf"))
                .contains("moved {")
                .contains("from = aws_s3_bucket.logs_b")
                .contains("to   = aws_s3_bucket.logs_a");
        final ResourceGraph reparsed = normalize(Dialect.TERRAFORM, sources(result.artifacts())).graph();
        assertThat(reparsed.resolve("aws_s3_bucket.logs_b")).isEqualTo("aws_s3_bucket.logs_a");
    }

    @Test
    void emit_foreignDependency_writtenAsDependsOn() {
        final ResourceGraph graph = normalize(Dialect.CLOUDFORMATION, file("stack.yaml", """
                Resources:
                  Logs:
                    Type: AWS::S3::Bucket
                    Properties:
                      BucketName: app-logs
                  Web:
                    Type: AWS::EC2::Instance
                    DependsOn: Logs
                    Properties:
                      ImageId: ami-123
                """)).graph();

        final String main = emitter.emit(graph, EmitOptions.DEFAULT).artifacts().get("main.tf");

        assertThat(main)
                .contains("resource \"aws_s3_bucket\" \"logs\" {")
                .contains("bucket = \"app-logs\"")
                .contains("resource \"aws_instance\" \"web\" {")
                .contains("ami        = \"ami-123\"")
                .contains("depends_on = [aws_s3_bucket.logs]");
    }

    @Test
    void emit_quotedLiteralBesideFunctionCall_reparses() {
        final ResourceGraph graph = normalize(Dialect.TERRAFORM, file("main.tf", """
                resource "aws_s3_bucket" "ok" {
                  bucket = "say \\"hi\\" ${upper("x")}"
                }
                """)).graph();

        final EmissionResult result = emitter.emit(graph.copy(), EmitOptions.DEFAULT);

        assertThat(result.artifacts().get("main.tf")).contains("bucket = \"say \\\"hi\\\" ${upper(\"x\")}\"");
        assertThat(new TerraformParser().parse(SourceTree.of(sources(result.artifacts())), EXECUTOR).errors()).isEmpty();
        assertSameNodes(normalize(Dialect.TERRAFORM, sources(result.artifacts())).graph(), graph);
    }

    @Test
    void emit_numbersBeyondLong_writtenExactly() {
        final ResourceGraph graph = normalize(Dialect.TERRAFORM, file("main.tf", """
                resource "aws_s3_bucket" "nums" {
                  big   = 99999999999999999999999
                  small = 0.1
                  neg   = -2.5
                }
                """)).graph();

        final EmissionResult result = emitter.emit(graph.copy(), EmitOptions.DEFAULT);

        assertThat(result.artifacts().get("main.tf"))
                .containsPattern("big += 99999999999999999999999")
                .containsPattern("small += 0\\.1")
                .containsPattern("neg += -2\\.5")
                .doesNotContain("E22")
                .doesNotContain("Infinity");
        assertSameNodes(normalize(Dialect.TERRAFORM, sources(result.artifacts())).graph(), graph);
    }

    @Test
    void emit_twice_identicalArtifacts() {
        final ResourceGraph graph = normalize(Dialect.TERRAFORM,
                file("main.tf", MAIN), file("variables.tf", VARIABLES)).graph();

        assertThat(emitter.emit(graph.copy(), EmitOptions.DEFAULT).artifacts())
                .isEqualTo(emitter.emit(graph.copy(), EmitOptions.DEFAULT).artifacts());
    }
}
