package ai.iacgraph.parse.hcl;

/**
 * Lexer token. {@code start}/{@code end} are offsets into the source text, {@code value} is the
 * decoded literal for STRING and NUMBER tokens.
 */
record HclToken(HclTokenType type, String text, Object value, int start, int end, int line) {

    boolean is(HclTokenType t) {
        return type == t;
    }

    boolean isIdent(String name) {
        return type == HclTokenType.IDENT && text.equals(name);
    }
}
