package ai.iacgraph.scan;

import java.io.IOException;
import java.nio.charset.MalformedInputException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Walks a source path and loads every file with an IaC extension.
 * <p>
 * A single file is accepted as well; its parent becomes the root.
 */
public final class SourceFinder {

    private static final Logger log = LoggerFactory.getLogger(SourceFinder.class);

    public static final Set<String> EXTENSIONS = Set.of("tf", "yaml", "yml", "json", "template");

    static final String UNREADABLE_REASON = "not valid UTF-8, file skipped";

    private final Set<String> ignoredDirectories;

    public SourceFinder(Set<String> ignoredDirectories) {
        this.ignoredDirectories = Set.copyOf(Objects.requireNonNull(ignoredDirectories, "ignoredDirectories"));
    }

    public SourceTree find(Path sourcePath) throws IOException {
        Objects.requireNonNull(sourcePath, "sourcePath");
        final Path start = sourcePath.toAbsolutePath().normalize();
        if (Files.isRegularFile(start)) {
            final Path root = start.getParent();
            final Map<String, String> unreadable = new TreeMap<>();
            final SourceFile single = load(root, start, unreadable);
            return new SourceTree(root, single == null ? List.of() : List.of(single), unreadable);
        }
        if (!Files.isDirectory(start)) {
            throw new IOException("Source path not found: " + sourcePath);
        }

        final List<SourceFile> files = new ArrayList<>();
        final Map<String, String> unreadable = new TreeMap<>();
        Files.walkFileTree(start, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                final String name = dir.getFileName() != null ? dir.getFileName().toString() : "";
                if (!dir.equals(start) && ignoredDirectories.contains(name)) {
                    log.debug("Skipping directory {}", dir);
                    return FileVisitResult.SKIP_SUBTREE;
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                if (attrs.isRegularFile() && hasIacExtension(file)) {
                    final SourceFile loaded = load(start, file, unreadable);
                    if (loaded != null) {
                        files.add(loaded);
                    }
                }
                return FileVisitResult.CONTINUE;
            }
        });
        log.debug("Found {} candidate files under {}", files.size(), start);
        return new SourceTree(start, files, unreadable);
    }

    private static boolean hasIacExtension(Path file) {
        final String name = file.getFileName().toString();
        final int dot = name.lastIndexOf('.');
        return dot > 0 && EXTENSIONS.contains(name.substring(dot + 1).toLowerCase(Locale.ROOT));
    }

    private static SourceFile load(Path root, Path file, Map<String, String> unreadable) throws IOException {
        final String rel = root.relativize(file).toString().replace('\\', '/');
        try {
            return new SourceFile(rel, Files.readString(file, StandardCharsets.UTF_8));
        } catch (MalformedInputException ex) {
            log.warn("Skipping {}: not valid UTF-8", rel);
            unreadable.put(rel, UNREADABLE_REASON);
            return null;
        }
    }
}
