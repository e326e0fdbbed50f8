package ai.iacgraph.normalize;

import java.util.Collections;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import ai.iacgraph.parse.SourceBlock;

/**
 * Ids of every declaration in a source tree, built before any block is mapped so references can
 * be resolved from any file:
 * - block -> node id
 * - declared node ids
 * - dialect-local names (register names, play vars, handler names) -> node id
 */
public final class SymbolTable {

    private final Map<SourceBlock, String> idsByBlock = new IdentityHashMap<>();
    private final Set<String> declared = new TreeSet<>();
    private final Map<String, String> names = new HashMap<>();

    /**
     * Records {@code id} for the block. Several blocks may share an id (one resource split across
     * files); the normalizer merges them.
     */
    public String declare(SourceBlock block, String id) {
        idsByBlock.put(block, id);
        declared.add(id);
        return id;
    }

    /**
     * Records the block under {@code candidate}, or {@code candidate_2}, {@code candidate_3} ... if
     * that id is taken.
     */
    public String declareUnique(SourceBlock block, String candidate) {
        String id = candidate;
        int n = 2;
        while (declared.contains(id)) {
            id = candidate + "_" + n++;
        }
        return declare(block, id);
    }

    public String idOf(SourceBlock block) {
        final String id = idsByBlock.get(block);
        if (id == null) {
            throw new IllegalStateException("Block was not declared: " + block.kind() + " " + block.name());
        }
        return id;
    }

    public boolean isDeclared(String id) {
        return declared.contains(id);
    }

    public Set<String> declaredIds() {
        return Collections.unmodifiableSet(declared);
    }

    /**
     * Binds a dialect-local name in a namespace (e.g. {@code register}, {@code handler}). The first
     * binding wins.
     */
    public void bind(String namespace, String name, String id) {
        names.putIfAbsent(namespace + ":" + name, id);
    }

    public String lookup(String namespace, String name) {
        return names.get(namespace + ":" + name);
    }
}
