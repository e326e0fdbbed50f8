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
import ai.iacgraph.model.PropertyValue;
import ai.iacgraph.model.RawExpression;
import ai.iacgraph.model.ResourceNode;
import ai.iacgraph.normalize.schema.PropertySchema;
import ai.iacgraph.normalize.schema.PropertySchemas;
import ai.iacgraph.normalize.schema.TerraformTypes;
import ai.iacgraph.parse.BlockKind;
import ai.iacgraph.parse.DialectAst;
import ai.iacgraph.parse.SourceBlock;

/**
 * Terraform blocks to canonical nodes.
 */
public final class TerraformMapper implements DialectMapper {

    /**
     * Meta-arguments and nested blocks kept in the extension bag.
     */
    static final Set<String> META_ARGUMENTS = Set.of(
            "count", "for_each", "provider", "providers", "lifecycle", "connection", "provisioner",
            "dynamic", "validation", "precondition", "postcondition");

    /**
     * Internal extension key marking a data source.
     */
    public static final String MODE = "@mode";

    private final PropertyMapper properties = new PropertyMapper(Dialect.TERRAFORM);

    @Override
    public Dialect dialect() {
        return Dialect.TERRAFORM;
    }

    @Override
    public SymbolTable declare(DialectAst ast) {
        final SymbolTable symbols = new SymbolTable();
        for (SourceBlock b : ast.blocks()) {
            final String id = switch (b.kind()) {
                case RESOURCE -> Ids.resourceId(b.nativeType(), b.name());
                case DATA -> Ids.dataId(b.nativeType(), b.name());
                case VARIABLE -> Ids.variableId(b.name());
                case LOCAL -> Ids.localId(b.name());
                case OUTPUT -> Ids.outputId(b.name());
                case MODULE -> Ids.moduleId(b.name());
                default -> null;
            };
            if (id != null) {
                symbols.declare(b, id);
            }
        }
        return symbols;
    }

    @Override
    public void map(SourceBlock block, SymbolTable symbols, GraphFragment out) {
        final TerraformValues values = new TerraformValues(symbols);
        switch (block.kind()) {
            case EXTENSION -> out.addExtension(new GraphExtension(Dialect.TERRAFORM, block.nativeType(), block.name(),
                    block.body(), block.source()));
            case MOVED -> moved(block, values, out);
            case RESOURCE, DATA -> resource(block, symbols, values, out);
            case VARIABLE -> configNode(block, symbols.idOf(block), "config.variable", values, out);
            case OUTPUT -> configNode(block, symbols.idOf(block), "config.output", values, out);
            case LOCAL -> configNode(block, symbols.idOf(block), "config.local", values, out);
            case MODULE -> configNode(block, symbols.idOf(block), "module.call", values, out);
            default -> throw new IllegalArgumentException("Unexpected terraform block " + block.kind());
        }
    }

    private void resource(SourceBlock block, SymbolTable symbols, TerraformValues values, GraphFragment out) {
        final boolean data = block.kind() == BlockKind.DATA;
        final Optional<TerraformTypes> known = TerraformTypes.lookup(block.nativeType(), data);
        final String type = known.map(TerraformTypes::canonicalType)
                .orElse(ResourceNode.UNKNOWN_PREFIX + block.nativeType());
        final NodeDraft draft = new NodeDraft(symbols.idOf(block), type, Dialect.TERRAFORM, block.nativeType(),
                block.source());
        if (data) {
            draft.extension(MODE, "data");
        }
        final Map<String, Object> attributes = split(block, draft, values, out);
        final PropertySchema schema = known.isPresent() ? PropertySchemas.forType(type) : PropertySchema.EMPTY;
        properties.map(draft, schema, attributes, block.blockKeys(), values, out);
        if (known.isEmpty()) {
            draft.originalBlock(block.body());
        }
        out.add(draft.build(), draft.edges);
    }

    private void configNode(SourceBlock block, String id, String type, TerraformValues values, GraphFragment out) {
        final NodeDraft draft = new NodeDraft(id, type, Dialect.TERRAFORM, block.nativeType(), block.source());
        final Map<String, Object> attributes = split(block, draft, values, out);
        properties.map(draft, PropertySchemas.forType(type), attributes, block.blockKeys(), values, out);
        out.add(draft.build(), draft.edges);
    }

    /**
     * Moves meta-arguments to the extension bag and {@code depends_on} to explicit edges; returns
     * the remaining attributes.
     */
    private static Map<String, Object> split(SourceBlock block, NodeDraft draft, TerraformValues values,
                                             GraphFragment out) {
        final Map<String, Object> attributes = new LinkedHashMap<>();
        for (var e : block.body().entrySet()) {
            final String key = e.getKey();
            if (key.equals("depends_on")) {
                dependsOn(e.getValue(), draft, values, out);
            } else if (META_ARGUMENTS.contains(key) || key.contains(" ")) {
                draft.extension(key, e.getValue());
            } else {
                attributes.put(key, e.getValue());
            }
        }
        return attributes;
    }

    private static void dependsOn(Object raw, NodeDraft draft, TerraformValues values, GraphFragment out) {
        final List<?> items = raw instanceof List<?> l ? l : List.of(raw);
        for (Object item : items) {
            final String text = item instanceof RawExpression r ? r.text() : String.valueOf(item);
            final Optional<PropertyValue.Reference> ref = values.reference(text);
            if (ref.isPresent()) {
                draft.dependsOn(ref.get().targetId(), EdgeOrigin.EXPLICIT);
            } else {
                out.warn("unresolved-dependency", draft.id(), draft.source(),
                        "depends_on entry '" + text + "' does not name a resource");
            }
        }
    }

    private static void moved(SourceBlock block, TerraformValues values, GraphFragment out) {
        final Optional<PropertyValue.Reference> from = address(block.get("from"), values);
        final Optional<PropertyValue.Reference> to = address(block.get("to"), values);
        if (from.isEmpty() || to.isEmpty()) {
            out.warn("invalid-moved-block", null, block.source(), "moved block needs resource addresses in from and to");
            return;
        }
        out.addAlias(from.get().targetId(), to.get().targetId());
    }

    private static Optional<PropertyValue.Reference> address(Object raw, TerraformValues values) {
        if (raw instanceof RawExpression r) {
            return values.reference(r.text());
        }
        return Optional.empty();
    }
}
