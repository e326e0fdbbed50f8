package ai.iacgraph.parse;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;

import ai.iacgraph.model.Dialect;
import ai.iacgraph.scan.SourceFile;
import ai.iacgraph.scan.SourceTree;

/**
 * Turns source text of one dialect into its AST. Implementations handle syntax and native
 * structure only; cross-resource resolution is the normalizer's job.
 * <p>
 * {@link #parseFile} must not throw: malformed fragments become {@link ParseError}s.
 */
public interface DialectParser {

    Dialect dialect();

    /**
     * Whether the file has an extension this dialect is written in.
     */
    boolean accepts(SourceFile file);

    FileAst parseFile(SourceFile file);

    /**
     * Parses every accepted file of the tree on {@code executor}. The result does not depend on
     * completion order.
     */
    default ParseResult parse(SourceTree tree, ExecutorService executor) {
        final List<CompletableFuture<FileAst>> futures = new ArrayList<>();
        for (SourceFile file : tree.files()) {
            if (accepts(file)) {
                futures.add(CompletableFuture.supplyAsync(() -> parseSafely(file), executor));
            }
        }
        final List<FileAst> files = new ArrayList<>(futures.size());
        futures.forEach(f -> files.add(f.join()));
        files.sort(Comparator.comparing(FileAst::path));

        final List<ParseError> errors = new ArrayList<>();
        files.forEach(f -> errors.addAll(f.errors()));
        errors.sort(Comparator.comparing(ParseError::file).thenComparingInt(ParseError::line));
        return new ParseResult(new DialectAst(dialect(), files), errors);
    }

    private FileAst parseSafely(SourceFile file) {
        try {
            return parseFile(file);
        } catch (RuntimeException ex) {
            return new FileAst(file.path(), List.of(),
                    List.of(new ParseError(file.path(), 0, null, "parser failure: " + ex)));
        }
    }
}
