package ai.iacgraph.normalize;

import ai.iacgraph.model.Dialect;
import ai.iacgraph.parse.DialectAst;
import ai.iacgraph.parse.SourceBlock;

/**
 * Maps the declarations of one dialect onto canonical nodes.
 * <p>
 * {@link #declare} runs once over the whole tree before any block is mapped; {@link #map} is then
 * called for every block, concurrently across files, and must only read the symbol table.
 */
public interface DialectMapper {

    Dialect dialect();

    SymbolTable declare(DialectAst ast);

    void map(SourceBlock block, SymbolTable symbols, GraphFragment out);
}
