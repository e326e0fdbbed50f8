package ai.iacgraph.scan;

import org.junit.jupiter.api.Test;

import ai.iacgraph.model.Dialect;

import static ai.iacgraph.testutil.TestGraphs.file;
import static org.assertj.core.api.Assertions.assertThat;

class DialectDetectorTest {

    private final DialectDetector detector = new DialectDetector();

    @Test
    void detect_tfExtension_isTerraform() {
        assertThat(detector.detect(file("main.tf", "resource \"aws_s3_bucket\" \"logs\" {}\n")))
                .contains(Dialect.TERRAFORM);
    }

    @Test
    void detect_templateWithAwsTypes_isCloudFormation() {
        final String yaml = """
                Resources:
                  Logs:
                    Type: AWS::S3::Bucket
                """;
        assertThat(detector.detect(file("stack.yaml", yaml))).contains(Dialect.CLOUDFORMATION);
    }

    @Test
    void detect_jsonTemplate_isCloudFormation() {
        final String json = "{\"AWSTemplateFormatVersion\": \"2010-09-09\", \"Resources\": {}}";
        assertThat(detector.detect(file("stack.json", json))).contains(Dialect.CLOUDFORMATION);
    }

    @Test
    void detect_manifest_isKubernetes() {
        final String yaml = """
                apiVersion: v1
                kind: ConfigMap
                metadata:
                  name: settings
                """;
        assertThat(detector.detect(file("cm.yaml", yaml))).contains(Dialect.KUBERNETES);
    }

    @Test
    void detect_playbook_isAnsible() {
        final String yaml = """
                - hosts: web
                  tasks:
                    - name: Install nginx
                      apt:
                        name: nginx
                """;
        assertThat(detector.detect(file("site.yml", yaml))).contains(Dialect.ANSIBLE);
    }

    @Test
    void detect_unrelatedYaml_ignored() {
        assertThat(detector.detect(file("values.yaml", "replicas: 3\n"))).isEmpty();
        assertThat(detector.detect(file("README.md", "# hi\n"))).isEmpty();
    }

    @Test
    void detect_mixedTree_ambiguous() {
        final SourceTree tree = SourceTree.of(
                file("main.tf", "resource \"aws_s3_bucket\" \"logs\" {}\n"),
                file("cm.yaml", "apiVersion: v1\nkind: ConfigMap\nmetadata:\n  name: x\n"));

        final DialectDetector.Inference inference = detector.detect(tree);

        assertThat(inference.isAmbiguous()).isTrue();
        assertThat(inference.inferred()).isEmpty();
        assertThat(inference.candidates()).containsExactlyInAnyOrder(Dialect.TERRAFORM, Dialect.KUBERNETES);
        assertThat(inference.select(Dialect.KUBERNETES).files())
                .extracting(SourceFile::path)
                .containsExactly("cm.yaml");
    }

    @Test
    void detect_singleDialect_inferred() {
        final SourceTree tree = SourceTree.of(
                file("a.tf", "variable \"region\" {}\n"),
                file("b.tf", "resource \"aws_s3_bucket\" \"logs\" {}\n"),
                file("notes.yaml", "owner: ops\n"));

        final DialectDetector.Inference inference = detector.detect(tree);

        assertThat(inference.inferred()).contains(Dialect.TERRAFORM);
        assertThat(inference.select(Dialect.TERRAFORM).files()).hasSize(2);
    }
}
