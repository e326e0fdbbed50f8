package ai.iacgraph.parse;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import ai.iacgraph.model.RawExpression;
import ai.iacgraph.scan.SourceTree;

import static ai.iacgraph.testutil.TestGraphs.EXECUTOR;
import static ai.iacgraph.testutil.TestGraphs.file;
import static org.assertj.core.api.Assertions.assertThat;

class TerraformParserTest {

    private final TerraformParser parser = new TerraformParser();

    @Test
    void parseFile_resource_bodyValuesTyped() {
        final String tf = """
                resource "aws_s3_bucket" "logs" {
                  bucket        = "app-logs"
                  force_destroy = true
                  retention     = 30
                  acl           = var.acl
                  tags = {
                    team = "ops"
                  }
                  versioning {
                    enabled = true
                  }
                }
                """;

        final FileAst ast = parser.parseFile(file("main.tf", tf));

        assertThat(ast.errors()).isEmpty();
        assertThat(ast.blocks()).singleElement().satisfies(b -> {
            assertThat(b.kind()).isEqualTo(BlockKind.RESOURCE);
            assertThat(b.nativeType()).isEqualTo("aws_s3_bucket");
            assertThat(b.name()).isEqualTo("logs");
            assertThat(b.source().line()).isEqualTo(1);
            assertThat(b.get("bucket")).isEqualTo("app-logs");
            assertThat(b.get("force_destroy")).isEqualTo(true);
            assertThat(b.get("retention")).isEqualTo(30L);
            assertThat(b.get("acl")).isEqualTo(new RawExpression("var.acl"));
            assertThat(b.get("tags")).isEqualTo(Map.of("team", "ops"));
            assertThat(b.get("versioning")).isEqualTo(List.of(Map.of("enabled", true)));
            assertThat(b.blockKeys()).containsExactly("versioning");
        });
    }

    @Test
    void parseFile_syntaxError_reportedAndNextBlockStillParsed() {
        final String tf = """
                resource "aws_s3_bucket" "broken" {
                  = "x"
                }
                resource "aws_s3_bucket" "fine" {
                  bucket = "ok"
                }
                """;

        final FileAst ast = parser.parseFile(file("main.tf", tf));

        assertThat(ast.errors()).singleElement().satisfies(e -> {
            assertThat(e.file()).isEqualTo("main.tf");
            assertThat(e.line()).isEqualTo(2);
            assertThat(e.message()).contains("expected attribute");
        });
        assertThat(ast.blocks()).extracting(SourceBlock::name).containsExactly("fine");
    }

    @Test
    void parseFile_resourceWithOneLabel_isParseError() {
        final FileAst ast = parser.parseFile(file("main.tf", "resource \"aws_s3_bucket\" {\n}\n"));

        assertThat(ast.blocks()).isEmpty();
        assertThat(ast.errors()).singleElement()
                .satisfies(e -> assertThat(e.message()).contains("type and a name label"));
    }

    @Test
    void parseFile_localsAndMoved_splitIntoBlocks() {
        final String tf = """
                locals {
                  env    = "prod"
                  region = "eu-west-1"
                }
                moved {
                  from = aws_s3_bucket.old
                  to   = aws_s3_bucket.new
                }
                provider "aws" {
                  region = "eu-west-1"
                }
                """;

        final FileAst ast = parser.parseFile(file("main.tf", tf));

        assertThat(ast.blocks()).extracting(SourceBlock::kind).containsExactly(
                BlockKind.LOCAL, BlockKind.LOCAL, BlockKind.MOVED, BlockKind.EXTENSION);
        assertThat(ast.blocks().get(0).name()).isEqualTo("env");
        assertThat(ast.blocks().get(3).name()).isEqualTo("\"aws\"");
        assertThat(TerraformParser.extensionLabels(ast.blocks().get(3).name())).containsExactly("aws");
    }

    @Test
    void parse_tree_onlyTfFilesAndErrorsSorted() {
        final ParseResult result = parser.parse(SourceTree.of(
                file("b.tf", "resource \"x\" {\n}\n"),
                file("a.tf", "oops\n"),
                file("values.yaml", "a: 1\n")), EXECUTOR);

        assertThat(result.ast().files()).extracting(FileAst::path).containsExactly("a.tf", "b.tf");
        assertThat(result.errors()).extracting(ParseError::file).containsExactly("a.tf", "b.tf");
    }
}
