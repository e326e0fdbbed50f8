package ai.iacgraph.parse;

import java.util.List;

/**
 * Output of {@link DialectParser#parse}: the AST plus every parse error, ordered by file then line.
 */
public record ParseResult(DialectAst ast, List<ParseError> errors) {

    public ParseResult {
        errors = List.copyOf(errors);
    }

    public int blockCount() {
        return ast.files().stream().mapToInt(f -> f.blocks().size()).sum();
    }
}
