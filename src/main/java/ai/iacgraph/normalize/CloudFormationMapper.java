package ai.iacgraph.normalize;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import ai.iacgraph.model.Dialect;
import ai.iacgraph.model.EdgeOrigin;
import ai.iacgraph.model.GraphExtension;
import ai.iacgraph.model.Ids;
import ai.iacgraph.model.ResourceNode;
import ai.iacgraph.normalize.schema.PropertySchema;
import ai.iacgraph.normalize.schema.PropertySchemas;
import ai.iacgraph.normalize.schema.TypeTables;
import ai.iacgraph.parse.DialectAst;
import ai.iacgraph.parse.SourceBlock;

/**
 * CloudFormation parameters, resources and outputs to canonical nodes. Resources and parameters
 * are identified by logical id, outputs by {@code output.<name>}.
 */
public final class CloudFormationMapper implements DialectMapper {

    /**
     * Resource attributes outside {@code Properties} that are kept in the extension bag.
     */
    static final Set<String> RESOURCE_ATTRIBUTES = Set.of(
            "Condition", "DeletionPolicy", "UpdateReplacePolicy", "Metadata", "CreationPolicy", "UpdatePolicy");

    private final PropertyMapper properties = new PropertyMapper(Dialect.CLOUDFORMATION);
    private final CloudFormationValues values = new CloudFormationValues();

    @Override
    public Dialect dialect() {
        return Dialect.CLOUDFORMATION;
    }

    @Override
    public SymbolTable declare(DialectAst ast) {
        final SymbolTable symbols = new SymbolTable();
        for (SourceBlock b : ast.blocks()) {
            switch (b.kind()) {
                case RESOURCE, VARIABLE -> symbols.declare(b, b.name());
                case OUTPUT -> symbols.declare(b, Ids.outputId(b.name()));
                default -> {
                }
            }
        }
        return symbols;
    }

    @Override
    public void map(SourceBlock block, SymbolTable symbols, GraphFragment out) {
        switch (block.kind()) {
            case EXTENSION -> out.addExtension(new GraphExtension(Dialect.CLOUDFORMATION, block.nativeType(),
                    block.name(), block.body(), block.source()));
            case MOVED -> out.addAlias(block);
            case RESOURCE -> resource(block, symbols.idOf(block), out);
            case VARIABLE -> section(block, symbols.idOf(block), "config.variable", out);
            case OUTPUT -> section(block, symbols.idOf(block), "config.output", out);
            default -> throw new IllegalArgumentException("Unexpected cloudformation block " + block.kind());
        }
    }

    private void resource(SourceBlock block, String id, GraphFragment out) {
        final Optional<String> canonical = TypeTables.canonical(Dialect.CLOUDFORMATION, block.nativeType());
        final String type = canonical.orElse(ResourceNode.UNKNOWN_PREFIX + block.nativeType());
        final NodeDraft draft = new NodeDraft(id, type, Dialect.CLOUDFORMATION, block.nativeType(), block.source());
        Map<String, Object> props = Map.of();
        for (var e : block.body().entrySet()) {
            switch (e.getKey()) {
                case "Type" -> {
                }
                case "Properties" -> {
                    if (e.getValue() instanceof Map<?, ?> m) {
                        props = stringKeys(m);
                    } else if (e.getValue() != null) {
                        draft.opaque.put("Properties", e.getValue());
                        out.warn("schema-mismatch", id, block.source(), "Properties is not a mapping");
                    }
                }
                case "DependsOn" -> dependsOn(e.getValue(), draft, out);
                default -> draft.extension(e.getKey(), e.getValue());
            }
        }
        final PropertySchema schema = canonical.isPresent() ? PropertySchemas.forType(type) : PropertySchema.EMPTY;
        properties.map(draft, schema, props, Set.of(), values, out);
        if (canonical.isEmpty()) {
            draft.originalBlock(block.body());
        }
        out.add(draft.build(), draft.edges);
    }

    /**
     * Parameters and outputs: every key is a property except {@code Condition} and {@code Export}.
     */
    private void section(SourceBlock block, String id, String type, GraphFragment out) {
        final NodeDraft draft = new NodeDraft(id, type, Dialect.CLOUDFORMATION, block.nativeType(), block.source());
        final Map<String, Object> attributes = new LinkedHashMap<>();
        for (var e : block.body().entrySet()) {
            if (e.getKey().equals("Condition") || e.getKey().equals("Export")) {
                draft.extension(e.getKey(), e.getValue());
            } else {
                attributes.put(e.getKey(), e.getValue());
            }
        }
        properties.map(draft, PropertySchemas.forType(type), attributes, Set.of(), values, out);
        out.add(draft.build(), draft.edges);
    }

    private static void dependsOn(Object raw, NodeDraft draft, GraphFragment out) {
        final List<?> targets = raw instanceof List<?> l ? l : List.of(raw);
        for (Object t : targets) {
            if (t instanceof String s && !s.isBlank()) {
                draft.dependsOn(s, EdgeOrigin.EXPLICIT);
            } else {
                out.warn("unresolved-dependency", draft.id(), draft.source(),
                        "DependsOn entry '" + t + "' is not a logical id");
            }
        }
    }

    private static Map<String, Object> stringKeys(Map<?, ?> m) {
        final Map<String, Object> out = new LinkedHashMap<>();
        m.forEach((k, v) -> out.put(String.valueOf(k), v));
        return out;
    }
}
