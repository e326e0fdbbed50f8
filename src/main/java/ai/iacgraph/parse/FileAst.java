package ai.iacgraph.parse;

import java.util.List;

/**
 * Parsed declarations of one file and the errors met while reading it.
 */
public record FileAst(String path, List<SourceBlock> blocks, List<ParseError> errors) {

    public FileAst {
        blocks = List.copyOf(blocks);
        errors = List.copyOf(errors);
    }
}
