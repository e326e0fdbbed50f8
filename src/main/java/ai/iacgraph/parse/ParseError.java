package ai.iacgraph.parse;

/**
 * Localized, non-fatal syntax or structure problem. Parsing continues after it.
 *
 * @param file     source-relative path
 * @param line     1-based line, 0 when unknown
 * @param resource name of the enclosing resource, or null
 * @param message  human-readable description
 */
public record ParseError(String file, int line, String resource, String message) {

    @Override
    public String toString() {
        final StringBuilder sb = new StringBuilder(file);
        if (line > 0) {
            sb.append(':').append(line);
        }
        if (resource != null) {
            sb.append(" [").append(resource).append(']');
        }
        return sb.append(": ").append(message).toString();
    }
}
