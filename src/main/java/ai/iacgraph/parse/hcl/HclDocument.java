package ai.iacgraph.parse.hcl;

import java.util.List;

/**
 * Top-level blocks of one file plus the syntax errors that were skipped over.
 */
public record HclDocument(List<HclBlock> blocks, List<HclSyntaxError> errors) {

    public HclDocument {
        blocks = List.copyOf(blocks);
        errors = List.copyOf(errors);
    }
}
