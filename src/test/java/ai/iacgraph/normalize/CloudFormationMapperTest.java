package ai.iacgraph.normalize;

import org.junit.jupiter.api.Test;

import ai.iacgraph.model.Dialect;
import ai.iacgraph.model.EdgeKind;
import ai.iacgraph.model.EdgeOrigin;
import ai.iacgraph.model.PropertyValue;
import ai.iacgraph.model.ResourceGraph;
import ai.iacgraph.model.ResourceNode;

import static ai.iacgraph.testutil.TestGraphs.file;
import static ai.iacgraph.testutil.TestGraphs.map;
import static ai.iacgraph.testutil.TestGraphs.normalize;
import static ai.iacgraph.testutil.TestGraphs.ref;
import static org.assertj.core.api.Assertions.assertThat;

class CloudFormationMapperTest {

    private static final String TEMPLATE = """
            AWSTemplateFormatVersion: "2010-09-09"
            Description: logging stack
            Parameters:
              LogBucketName:
                Type: String
            Resources:
              Logs:
                Type: AWS::S3::Bucket
                DeletionPolicy: Retain
                Properties:
                  BucketName: !Ref LogBucketName
                  Tags:
                    - Key: team
                      Value: ops
              Web:
                Type: AWS::EC2::Instance
                DependsOn: Logs
                Properties:
                  ImageId: ami-123
                  InstanceType: t3.micro
            Outputs:
              LogsArn:
                Value: !GetAtt Logs.Arn
            """;

    @Test
    void normalize_template_logicalIdsAndIntrinsics() {
        final NormalizationResult result = normalize(Dialect.CLOUDFORMATION, file("stack.yaml", TEMPLATE));
        final ResourceGraph g = result.graph();

        assertThat(g.nodes()).extracting(ResourceNode::id)
                .containsExactly("LogBucketName", "Logs", "Web", "output.LogsArn");

        final ResourceNode logs = g.node("Logs").orElseThrow();
        assertThat(logs.type()).isEqualTo("storage.bucket");
        assertThat(logs.property("bucketName")).contains(ref("LogBucketName"));
        assertThat(logs.property("tags")).contains(map("team", "ops"));
        assertThat(logs.metadata().extensions()).containsEntry("DeletionPolicy", "Retain");

        assertThat(g.node("output.LogsArn").orElseThrow().property("value"))
                .contains(new PropertyValue.Reference("Logs", "Arn"));
        assertThat(g.edge("Logs", EdgeKind.DEPENDS_ON, "LogBucketName")).isPresent();
        assertThat(result.warnings()).isEmpty();
    }

    @Test
    void normalize_dependsOn_explicitEdge() {
        final ResourceGraph g = normalize(Dialect.CLOUDFORMATION, file("stack.yaml", TEMPLATE)).graph();

        assertThat(g.edge("Web", EdgeKind.DEPENDS_ON, "Logs"))
                .hasValueSatisfying(e -> assertThat(e.origins()).containsExactly(EdgeOrigin.EXPLICIT));
    }

    @Test
    void normalize_templateHeader_keptAsExtension() {
        final ResourceGraph g = normalize(Dialect.CLOUDFORMATION, file("stack.yaml", TEMPLATE)).graph();

        assertThat(g.extensions()).singleElement().satisfies(ext -> {
            assertThat(ext.kind()).isEqualTo("template");
            assertThat(ext.body()).containsKeys("AWSTemplateFormatVersion", "Description");
        });
    }

    @Test
    void normalize_dependsOnMissingResource_danglingReference() {
        final NormalizationResult result = normalize(Dialect.CLOUDFORMATION, file("stack.yaml", """
                Resources:
                  Logs:
                    Type: AWS::S3::Bucket
                    DependsOn: missing-resource
                """));

        assertThat(result.graph().danglingEdges()).singleElement()
                .satisfies(e -> assertThat(e.target()).isEqualTo("missing-resource"));
        assertThat(result.warnings()).extracting(NormalizationWarning::code).containsExactly("dangling-reference");
    }

    @Test
    void normalize_unknownType_originalBlockKept() {
        final ResourceNode node = normalize(Dialect.CLOUDFORMATION, file("stack.yaml", """
                Resources:
                  Widget:
                    Type: Custom::Widget
                    Properties:
                      Size: 3
                """)).graph().node("Widget").orElseThrow();

        assertThat(node.type()).isEqualTo("unknown.Custom::Widget");
        assertThat(node.metadata().originalBlock()).containsKeys("Type", "Properties");
    }

    @Test
    void normalize_jsonTemplate_sameGraphAsYaml() {
        final String json = """
                {"Resources": {"Logs": {"Type": "AWS::S3::Bucket", "Properties": {"BucketName": "logs"}}}}
                """;

        final ResourceNode logs = normalize(Dialect.CLOUDFORMATION, file("stack.json", json)).graph()
                .node("Logs").orElseThrow();

        assertThat(logs.property("bucketName")).contains(PropertyValue.Scalar.of("logs"));
    }
}
