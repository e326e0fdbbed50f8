package ai.iacgraph;

import java.io.IOException;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import ai.iacgraph.io.ReportWriter;

import static ai.iacgraph.testutil.TestGraphs.write;
import static org.assertj.core.api.Assertions.assertThat;

class MainTest {

    @TempDir
    Path dir;

    @Test
    void run_help_zero() {
        assertThat(Main.run(new String[]{"--help"})).isZero();
    }

    @Test
    void run_unknownCommand_two() {
        assertThat(Main.run(new String[]{"deploy", "."})).isEqualTo(2);
    }

    @Test
    void run_unknownOption_two() {
        assertThat(Main.run(new String[]{"analyze", ".", "--verbose"})).isEqualTo(2);
    }

    @Test
    void run_generateWithoutOut_two() {
        assertThat(Main.run(new String[]{"generate", ".", "--target=terraform"})).isEqualTo(2);
    }

    @Test
    void run_missingSource_two() {
        assertThat(Main.run(new String[]{"analyze", dir.resolve("absent").toString()})).isEqualTo(2);
    }

    @Test
    void run_convert_writesArtifactsAndReport() throws IOException {
        final Path src = dir.resolve("src");
        write(src, "stack.yaml", """
                Resources:
                  Logs:
                    Type: AWS::S3::Bucket
                    Properties:
                      BucketName: app-logs
                """);
        final Path out = dir.resolve("out");

        final int code = Main.run(new String[]{"convert", src.toString(),
                "--source=cloudformation", "--target=terraform", "--out=" + out});

        assertThat(code).isIn(0, 1);
        assertThat(out.resolve(ReportWriter.REPORT_FILE)).exists();
        assertThat(out.resolve("main.tf")).content().contains("resource \"aws_s3_bucket\" \"logs\"");
    }
}
