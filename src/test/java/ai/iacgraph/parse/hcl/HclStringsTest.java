package ai.iacgraph.parse.hcl;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class HclStringsTest {

    @Test
    void quote_literalQuotesEscaped_interpolationCopied() {
        assertThat(HclStrings.quote("say \"hi\" ${upper(\"x\")}"))
                .isEqualTo("\"say \\\"hi\\\" ${upper(\"x\")}\"");
    }

    @Test
    void quote_escapedSequence_staysEscaped() {
        assertThat(HclStrings.quote(HclStrings.escapeTemplates("cost ${5}"))).isEqualTo("\"cost $${5}\"");
    }

    @Test
    void quote_unclosedSequence_escapedAsLiteral() {
        assertThat(HclStrings.quote("a ${b \"c\"")).isEqualTo("\"a ${b \\\"c\\\"\"");
    }

    @Test
    void quote_controlCharacters() {
        assertThat(HclStrings.quote("a\tb\nc\\d")).isEqualTo("\"a\\tb\\nc\\\\d\"");
    }
}
