package ai.iacgraph.normalize;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import ai.iacgraph.model.DependencyEdge;
import ai.iacgraph.model.Dialect;
import ai.iacgraph.model.EdgeOrigin;
import ai.iacgraph.model.GraphExtension;
import ai.iacgraph.model.Ids;
import ai.iacgraph.model.ResourceNode;
import ai.iacgraph.normalize.schema.AnsibleModules;
import ai.iacgraph.normalize.schema.PropertySchema;
import ai.iacgraph.normalize.schema.PropertySchemas;
import ai.iacgraph.normalize.schema.TypeTables;
import ai.iacgraph.parse.BlockKind;
import ai.iacgraph.parse.DialectAst;
import ai.iacgraph.parse.SourceBlock;

/**
 * Playbook tasks, handlers and play variables to canonical nodes.
 * <p>
 * Consecutive tasks of a play are chained with ordering edges; a handler depends on every task
 * that notifies it.
 */
public final class AnsibleMapper implements DialectMapper {

    static final String VARS = "var";
    static final String REGISTERED = "register";
    static final String HANDLERS = "handler";
    static final String PREVIOUS = "previous";

    /**
     * Internal extension keys: the play section a node belongs to, and how module arguments were
     * written ({@code true} for {@code k=v} or command-line form, a string for other free-form text).
     */
    public static final String SCOPE = "@scope";
    public static final String FREE_FORM = "@freeform";

    private final PropertyMapper properties = new PropertyMapper(Dialect.ANSIBLE);

    @Override
    public Dialect dialect() {
        return Dialect.ANSIBLE;
    }

    @Override
    public SymbolTable declare(DialectAst ast) {
        final SymbolTable symbols = new SymbolTable();
        final Map<String, String> lastTask = new HashMap<>();
        for (SourceBlock b : ast.blocks()) {
            final String play = playOf(b);
            switch (b.kind()) {
                case VARIABLE -> {
                    final String id = symbols.declareUnique(b, Ids.variableId(b.name()));
                    symbols.bind(VARS, play + ":" + b.name(), id);
                    symbols.bind(VARS, b.name(), id);
                }
                case TASK -> {
                    final String id = symbols.declareUnique(b, Ids.taskId(slug(b)));
                    if (b.get("register") instanceof String r) {
                        symbols.bind(REGISTERED, r, id);
                    }
                    final String previous = lastTask.put(play, id);
                    if (previous != null) {
                        symbols.bind(PREVIOUS, id, previous);
                    }
                }
                case HANDLER -> {
                    final String id = symbols.declareUnique(b, Ids.handlerId(slug(b)));
                    symbols.bind(HANDLERS, play + ":" + b.name(), id);
                    if (b.get("listen") instanceof String topic) {
                        symbols.bind(HANDLERS, play + ":" + topic, id);
                    }
                }
                default -> {
                }
            }
        }
        return symbols;
    }

    @Override
    public void map(SourceBlock block, SymbolTable symbols, GraphFragment out) {
        switch (block.kind()) {
            case EXTENSION -> out.addExtension(new GraphExtension(Dialect.ANSIBLE, block.nativeType(), block.name(),
                    block.body(), block.source()));
            case MOVED -> out.addAlias(block);
            case VARIABLE -> variable(block, symbols, out);
            case TASK, HANDLER -> task(block, symbols, out);
            default -> throw new IllegalArgumentException("Unexpected ansible block " + block.kind());
        }
    }

    private void variable(SourceBlock block, SymbolTable symbols, GraphFragment out) {
        final String type = "config.variable";
        final NodeDraft draft = new NodeDraft(symbols.idOf(block), type, Dialect.ANSIBLE, block.nativeType(),
                block.source());
        draft.extension(SCOPE, block.scope());
        if (!block.name().equals(Ids.localName(draft.id()))) {
            draft.extension("name", block.name());
        }
        properties.map(draft, PropertySchemas.forType(type), block.body(), Set.of(),
                new AnsibleValues(symbols, playOf(block)), out);
        out.add(draft.build(), draft.edges);
    }

    private void task(SourceBlock block, SymbolTable symbols, GraphFragment out) {
        final String id = symbols.idOf(block);
        final String module = block.nativeType();
        final Optional<String> canonical = TypeTables.canonical(Dialect.ANSIBLE, module);
        final String type = canonical.orElse(ResourceNode.UNKNOWN_PREFIX + module);
        final NodeDraft draft = new NodeDraft(id, type, Dialect.ANSIBLE, module, block.source());
        draft.extension(SCOPE, block.scope());

        Map<String, Object> arguments = Map.of();
        for (var e : block.body().entrySet()) {
            if (e.getKey().equals(module)) {
                arguments = arguments(module, e.getValue(), draft);
            } else {
                draft.extension(e.getKey(), e.getValue());
            }
        }
        final PropertySchema schema = canonical.isPresent() ? PropertySchemas.forType(type) : PropertySchema.EMPTY;
        properties.map(draft, schema, arguments, Set.of(), new AnsibleValues(symbols, playOf(block)), out);
        if (canonical.isEmpty()) {
            draft.originalBlock(block.body());
        }

        final String previous = symbols.lookup(PREVIOUS, id);
        if (previous != null) {
            draft.dependsOn(previous, EdgeOrigin.ORDERING);
        }
        if (block.kind() == BlockKind.TASK) {
            notify(block, draft, symbols, out);
        }
        out.add(draft.build(), draft.edges);
    }

    /**
     * Module arguments as a map. Free-form text becomes {@code cmd} for command modules and is split
     * on {@code k=v} pairs otherwise.
     */
    private static Map<String, Object> arguments(String module, Object raw, NodeDraft draft) {
        if (raw instanceof Map<?, ?> m) {
            final Map<String, Object> args = new LinkedHashMap<>();
            m.forEach((k, v) -> args.put(String.valueOf(k), v));
            return args;
        }
        if (!(raw instanceof String s)) {
            if (raw != null) {
                draft.extension(FREE_FORM, raw);
            }
            return Map.of();
        }
        if (AnsibleModules.isCommandModule(module)) {
            draft.extension(FREE_FORM, Boolean.TRUE);
            return Map.of("cmd", s);
        }
        final Map<String, Object> pairs = keyValues(s);
        if (pairs.isEmpty()) {
            draft.extension(FREE_FORM, s);
            return Map.of();
        }
        draft.extension(FREE_FORM, Boolean.TRUE);
        return pairs;
    }

    /**
     * {@code name=nginx state=present}; empty unless every token is a pair.
     */
    static Map<String, Object> keyValues(String s) {
        final Map<String, Object> out = new LinkedHashMap<>();
        for (String token : s.trim().split("\\s+")) {
            final int eq = token.indexOf('=');
            if (eq <= 0) {
                return Map.of();
            }
            out.put(token.substring(0, eq), token.substring(eq + 1));
        }
        return out;
    }

    private static void notify(SourceBlock block, NodeDraft task, SymbolTable symbols, GraphFragment out) {
        final Object raw = block.get("notify");
        if (raw == null) {
            return;
        }
        final List<?> names = raw instanceof List<?> l ? l : List.of(raw);
        for (Object n : names) {
            final String handler = symbols.lookup(HANDLERS, playOf(block) + ":" + n);
            if (handler == null) {
                out.warn("unresolved-handler", task.id(), block.source(), "no handler named '" + n + "' in this play");
                continue;
            }
            // recorded on the task, sourced at the handler
            task.edge(DependencyEdge.dependsOn(handler, task.id(), EdgeOrigin.ORDERING));
        }
    }

    private static String slug(SourceBlock b) {
        final String s = Ids.slug(b.name());
        if (!s.isEmpty()) {
            return s;
        }
        return Ids.slug(b.nativeType().substring(b.nativeType().lastIndexOf('.') + 1));
    }

    /**
     * File and play a block belongs to, e.g. {@code site.yml#play-0}.
     */
    static String playOf(SourceBlock b) {
        final String scope = b.scope() == null ? "" : b.scope();
        final int colon = scope.indexOf(':');
        return b.source().file() + "#" + (colon >= 0 ? scope.substring(0, colon) : scope);
    }
}
