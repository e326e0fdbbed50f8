package ai.iacgraph.emit.hcl;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class HclWriterTest {

    @Test
    void attribute_consecutiveAttributes_equalsAligned() {
        final String text = new HclWriter()
                .block("resource", List.of("aws_instance", "web"))
                .attribute("ami", "\"ami-1\"")
                .attribute("instance_type", "\"t3.micro\"")
                .close()
                .text();

        assertThat(text).isEqualTo("""
                resource "aws_instance" "web" {
                  ami           = "ami-1"
                  instance_type = "t3.micro"
                }
                """);
    }

    @Test
    void attribute_blankLineOrNestedBlock_startsNewRun() {
        final String text = new HclWriter()
                .open("moved")
                .attribute("from", "a.b")
                .blank()
                .attribute("to", "a.c")
                .open("lifecycle")
                .attribute("prevent_destroy", "true")
                .close()
                .attribute("x", "1")
                .close()
                .text();

        assertThat(text).isEqualTo("""
                moved {
                  from = a.b

                  to = a.c
                  lifecycle {
                    prevent_destroy = true
                  }
                  x = 1
                }
                """);
    }

    @Test
    void attribute_multiLineValue_endsRun() {
        final Map<String, Object> tags = new LinkedHashMap<>();
        tags.put("env", "dev");
        tags.put("owner", "ops");

        final String text = new HclWriter()
                .open("locals")
                .attribute("a", "1")
                .attribute("tags", HclWriter.raw(tags, 0))
                .attribute("longer_name", "2")
                .close()
                .text();

        assertThat(text).isEqualTo("""
                locals {
                  a    = 1
                  tags = {
                    env   = "dev"
                    owner = "ops"
                  }
                  longer_name = 2
                }
                """);
    }
}
