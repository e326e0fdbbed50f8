package ai.iacgraph.parse.hcl;

/**
 * Raised inside the parser to abandon the current top-level block; never escapes {@link HclParser}.
 */
final class HclSyntaxException extends RuntimeException {

    private final int line;

    HclSyntaxException(String message, int line) {
        super(message);
        this.line = line;
    }

    int line() {
        return line;
    }
}
