package ai.iacgraph.model;

/**
 * Source-relative file path (forward slashes) and 1-based line, 0 when unknown.
 */
public record SourceLocation(String file, int line) {

    public static final SourceLocation UNKNOWN = new SourceLocation("", 0);

    public SourceLocation {
        file = file == null ? "" : file.replace('\\', '/');
        line = Math.max(0, line);
    }

    @Override
    public String toString() {
        if (file.isEmpty()) {
            return "<unknown>";
        }
        return line > 0 ? file + ":" + line : file;
    }
}
