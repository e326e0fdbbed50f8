package ai.iacgraph.parse;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import ai.iacgraph.model.Dialect;

/**
 * Dialect AST of a whole source tree: per-file ASTs in lexicographic path order.
 */
public record DialectAst(Dialect dialect, List<FileAst> files) {

    public DialectAst {
        final List<FileAst> sorted = new ArrayList<>(files);
        sorted.sort(Comparator.comparing(FileAst::path));
        files = List.copyOf(sorted);
    }

    public List<SourceBlock> blocks() {
        final List<SourceBlock> out = new ArrayList<>();
        files.forEach(f -> out.addAll(f.blocks()));
        return out;
    }
}
