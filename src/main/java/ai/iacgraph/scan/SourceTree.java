package ai.iacgraph.scan;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Predicate;

/**
 * Files discovered under one source root, sorted by relative path.
 *
 * @param unreadable relative paths that had an IaC extension but could not be decoded, with the reason
 */
public record SourceTree(Path root, List<SourceFile> files, Map<String, String> unreadable) {

    public SourceTree {
        final List<SourceFile> sorted = new ArrayList<>(files);
        sorted.sort(Comparator.comparing(SourceFile::path));
        files = List.copyOf(sorted);
        unreadable = unreadable == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(unreadable));
    }

    public SourceTree(Path root, List<SourceFile> files) {
        this(root, files, Map.of());
    }

    public static SourceTree of(SourceFile... files) {
        return new SourceTree(null, List.of(files));
    }

    public SourceTree filter(Predicate<SourceFile> keep) {
        return new SourceTree(root, files.stream().filter(keep).toList(), unreadable);
    }

    public boolean isEmpty() {
        return files.isEmpty();
    }
}
