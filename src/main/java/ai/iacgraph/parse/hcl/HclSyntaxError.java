package ai.iacgraph.parse.hcl;

/**
 * Recoverable syntax problem at a 1-based line.
 */
public record HclSyntaxError(int line, String message) {
}
