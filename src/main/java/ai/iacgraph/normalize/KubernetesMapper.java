package ai.iacgraph.normalize;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import ai.iacgraph.model.Dialect;
import ai.iacgraph.model.Ids;
import ai.iacgraph.model.PropertyValue;
import ai.iacgraph.model.ResourceNode;
import ai.iacgraph.normalize.schema.PropertySchema;
import ai.iacgraph.normalize.schema.PropertySchemas;
import ai.iacgraph.normalize.schema.TypeTables;
import ai.iacgraph.parse.BlockKind;
import ai.iacgraph.parse.DialectAst;
import ai.iacgraph.parse.SourceBlock;

/**
 * Manifest objects to canonical nodes, one node per object.
 */
public final class KubernetesMapper implements DialectMapper {

    private final PropertyMapper properties = new PropertyMapper(Dialect.KUBERNETES);

    @Override
    public Dialect dialect() {
        return Dialect.KUBERNETES;
    }

    @Override
    public SymbolTable declare(DialectAst ast) {
        final SymbolTable symbols = new SymbolTable();
        for (SourceBlock b : ast.blocks()) {
            if (b.kind() == BlockKind.RESOURCE) {
                symbols.declare(b, Ids.manifestId(b.nativeType(), b.scope(), b.name()));
            }
        }
        return symbols;
    }

    @Override
    public void map(SourceBlock block, SymbolTable symbols, GraphFragment out) {
        if (block.kind() == BlockKind.MOVED) {
            out.addAlias(block);
            return;
        }
        final String id = symbols.idOf(block);
        final Optional<String> canonical = TypeTables.canonical(Dialect.KUBERNETES, block.nativeType());
        final String type = canonical.orElse(ResourceNode.UNKNOWN_PREFIX + block.nativeType());
        final NodeDraft draft = new NodeDraft(id, type, Dialect.KUBERNETES, block.nativeType(), block.source());
        final KubernetesValues values = new KubernetesValues(symbols, block.scope());

        final Map<String, Object> attributes = new LinkedHashMap<>();
        for (var e : block.body().entrySet()) {
            switch (e.getKey()) {
                case "kind" -> {
                }
                case "apiVersion" -> draft.extension("apiVersion", e.getValue());
                case "metadata" -> metadata(e.getValue(), draft, symbols, values);
                default -> attributes.put(e.getKey(), e.getValue());
            }
        }
        final PropertySchema schema = canonical.isPresent() ? PropertySchemas.forType(type) : PropertySchema.EMPTY;
        properties.map(draft, schema, attributes, Set.of(), values, out);
        if (canonical.isEmpty()) {
            draft.originalBlock(block.body());
        }
        out.add(draft.build(), draft.edges);
    }

    /**
     * Namespace, labels and annotations become properties; other metadata fields are kept as an
     * extension. The name is part of the id.
     */
    private static void metadata(Object raw, NodeDraft draft, SymbolTable symbols, KubernetesValues values) {
        if (!(raw instanceof Map<?, ?> metadata)) {
            return;
        }
        final Map<String, Object> rest = new LinkedHashMap<>();
        for (var e : metadata.entrySet()) {
            final String key = String.valueOf(e.getKey());
            switch (key) {
                case "name" -> {
                }
                case "namespace" -> {
                    final String ns = String.valueOf(e.getValue());
                    final String nsId = Ids.manifestId("Namespace", null, ns);
                    draft.property("namespace", symbols.isDeclared(nsId)
                            ? PropertyValue.Reference.to(nsId)
                            : PropertyValue.Scalar.of(ns));
                }
                case "labels", "annotations" -> draft.property(key, values.convert(e.getValue()));
                default -> rest.put(key, e.getValue());
            }
        }
        if (!rest.isEmpty()) {
            draft.extension("metadata", rest);
        }
    }
}
