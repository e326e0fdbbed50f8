package ai.iacgraph.scan;

import java.util.Locale;
import java.util.Objects;

/**
 * One candidate source file.
 *
 * @param path    path relative to the source root, forward slashes
 * @param content file text (UTF-8)
 */
public record SourceFile(String path, String content) {

    public SourceFile {
        Objects.requireNonNull(path, "path");
        path = path.replace('\\', '/');
        content = content == null ? "" : content;
    }

    public String fileName() {
        final int slash = path.lastIndexOf('/');
        return slash >= 0 ? path.substring(slash + 1) : path;
    }

    /**
     * Lowercase extension without the dot, empty when there is none.
     */
    public String extension() {
        final String name = fileName();
        final int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(dot + 1).toLowerCase(Locale.ROOT) : "";
    }

    public boolean isYaml() {
        final String ext = extension();
        return ext.equals("yaml") || ext.equals("yml");
    }

    public boolean isJson() {
        final String ext = extension();
        return ext.equals("json") || ext.equals("template");
    }
}
