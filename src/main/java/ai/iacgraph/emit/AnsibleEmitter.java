package ai.iacgraph.emit;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ai.iacgraph.emit.yaml.YamlValues;
import ai.iacgraph.emit.yaml.YamlWriter;
import ai.iacgraph.model.DependencyEdge;
import ai.iacgraph.model.Dialect;
import ai.iacgraph.model.EdgeKind;
import ai.iacgraph.model.GraphExtension;
import ai.iacgraph.model.Ids;
import ai.iacgraph.model.PropertyValue;
import ai.iacgraph.model.ResourceGraph;
import ai.iacgraph.model.ResourceNode;
import ai.iacgraph.normalize.AnsibleMapper;
import ai.iacgraph.normalize.schema.AnsibleModules;
import ai.iacgraph.parse.AnsibleParser;

/**
 * Writes a graph as Ansible playbooks. Tasks read from a playbook return to their play and
 * section; resources from other dialects become tasks of a local play in {@code playbook.yml},
 * ordered by their dependencies.
 */
public final class AnsibleEmitter implements DialectEmitter {

    private static final Logger log = LoggerFactory.getLogger(AnsibleEmitter.class);

    public static final String PLAYBOOK = "playbook.yml";

    private static final int CONVERTED_PLAY = Integer.MAX_VALUE;
    private static final String TASKS = "tasks";

    /**
     * One play under construction.
     */
    private static final class Play {
        Map<String, Object> header;
        final List<ResourceNode> vars = new ArrayList<>();
        final Map<String, List<ResourceNode>> sections = new LinkedHashMap<>();

        List<ResourceNode> section(String name) {
            return sections.computeIfAbsent(name, k -> new ArrayList<>());
        }
    }

    private final YamlWriter yaml = new YamlWriter();

    @Override
    public Dialect dialect() {
        return Dialect.ANSIBLE;
    }

    @Override
    public EmissionResult emit(ResourceGraph graph, EmitOptions options) {
        final EmissionContext ctx = new EmissionContext(graph, Dialect.ANSIBLE, options);
        final SortedMap<String, SortedMap<Integer, Play>> playbooks = new TreeMap<>();
        final List<ResourceNode> untranslatable = new ArrayList<>();
        final Map<String, String> modules = new HashMap<>();
        final Map<String, String> varNames = new HashMap<>();
        final Set<String> takenVars = new HashSet<>();

        // Step 1: place every node in a play
        final List<ResourceNode> ordered = new ArrayList<>(graph.nodes());
        ordered.sort(Comparator.comparing((ResourceNode n) -> !ctx.sameDialect(n)).thenComparing(ResourceNode::id));
        for (ResourceNode node : ordered) {
            final boolean same = ctx.sameDialect(node);
            final String file = same && !node.metadata().source().file().isEmpty()
                    ? node.metadata().source().file()
                    : PLAYBOOK;
            final String scope = same && node.metadata().extension(AnsibleMapper.SCOPE) instanceof String s ? s : "";
            final int playIndex = same ? playIndex(scope) : CONVERTED_PLAY;
            if (node.type().equals("config.variable")) {
                final String name = same && node.metadata().extension("name") instanceof String n
                        ? n
                        : Ids.unique(same ? Ids.localName(node.id()) : Ids.terraformName(Ids.localName(node.id())),
                        takenVars, "_");
                takenVars.add(name);
                varNames.put(node.id(), name);
                ctx.name(node.id(), name);
                play(playbooks, file, playIndex).vars.add(node);
                continue;
            }
            final Optional<String> module = node.type().startsWith("config.") || node.type().startsWith("module.")
                    ? Optional.empty()
                    : ctx.nativeType(node);
            if (module.isEmpty()) {
                untranslatable.add(node);
                continue;
            }
            modules.put(node.id(), module.get());
            final int colon = scope.indexOf(':');
            final String section = colon >= 0 ? scope.substring(colon + 1) : TASKS;
            play(playbooks, file, playIndex).section(section).add(node);
        }
        for (GraphExtension ext : graph.extensions()) {
            if (ext.dialect() == Dialect.ANSIBLE && ext.kind().equals("play")) {
                final int hash = ext.key().lastIndexOf('#');
                if (hash > 0) {
                    play(playbooks, ext.key().substring(0, hash), parseIndex(ext.key().substring(hash + 1))).header = ext.body();
                    continue;
                }
            }
            ctx.warn(EmissionWarning.LOSSY, "", "dropped " + ext.dialect() + " " + ext.kind() + " block");
        }

        // Step 2: register names for tasks whose results are referenced
        final Map<String, String> registers = registerNames(graph, modules, takenVars, ctx);

        // Step 3: write playbooks
        if (!untranslatable.isEmpty()) {
            playbooks.computeIfAbsent(PLAYBOOK, f -> new TreeMap<>());
        }
        final SortedMap<String, List<String>> moved = ctx.movedBySurvivor();
        final Map<String, String> artifacts = new LinkedHashMap<>();
        for (var book : playbooks.entrySet()) {
            final List<String> comments = new ArrayList<>();
            final List<Object> plays = new ArrayList<>();
            for (var p : book.getValue().entrySet()) {
                final Play play = p.getValue();
                if (p.getKey() == CONVERTED_PLAY) {
                    play.sections.replaceAll((k, tasks) -> dependencyOrder(tasks, graph));
                } else {
                    play.sections.values().forEach(tasks -> tasks.sort(EmissionContext.SOURCE_ORDER));
                }
                plays.add(writePlay(p.getKey(), play, modules, varNames, registers, ctx));
                play.sections.values().forEach(tasks -> tasks.forEach(t -> {
                    for (String old : moved.getOrDefault(t.id(), List.of())) {
                        comments.add("moved: " + old + " -> " + t.id());
                    }
                }));
            }
            if (book.getKey().equals(PLAYBOOK)) {
                for (ResourceNode n : untranslatable) {
                    comments.addAll(ctx.stub(n));
                }
            }
            final String header = ctx.header(comments);
            artifacts.put(book.getKey(), plays.isEmpty() ? header : yaml.documents(header, List.of(plays)));
        }
        log.debug("Ansible emission: {} tasks, {} stubs, {} playbooks",
                modules.size(), untranslatable.size(), artifacts.size());
        return ctx.result(artifacts);
    }

    private static Play play(SortedMap<String, SortedMap<Integer, Play>> playbooks, String file, int index) {
        return playbooks.computeIfAbsent(file, f -> new TreeMap<>()).computeIfAbsent(index, i -> new Play());
    }

    /**
     * Play number of a scope such as {@code play-2:tasks}.
     */
    static int playIndex(String scope) {
        if (!scope.startsWith("play-")) {
            return 0;
        }
        final int colon = scope.indexOf(':');
        return parseIndex(scope.substring(5, colon >= 0 ? colon : scope.length()));
    }

    private static int parseIndex(String s) {
        try {
            return Integer.parseInt(s);
        } catch (NumberFormatException ex) {
            return 0;
        }
    }

    private static Map<String, String> registerNames(ResourceGraph graph, Map<String, String> modules,
                                                     Set<String> taken, EmissionContext ctx) {
        final Set<String> referenced = new TreeSet<>();
        for (ResourceNode n : graph.nodes()) {
            n.properties().values().forEach(v -> v.references().forEach(r -> {
                if (modules.containsKey(r.targetId())) {
                    referenced.add(r.targetId());
                }
            }));
        }
        final Map<String, String> registers = new HashMap<>();
        for (String id : referenced) {
            final ResourceNode task = graph.node(id).orElseThrow();
            final String existing = ctx.sameDialect(task) && task.metadata().extension("register") instanceof String r ? r : null;
            final String name = existing != null
                    ? existing
                    : Ids.unique(Ids.terraformName(Ids.localName(id)), taken, "_");
            taken.add(name);
            registers.put(id, name);
            ctx.name(id, name);
        }
        return registers;
    }

    /**
     * Tasks ordered so that every task follows the tasks it depends on; ties and cycles fall back
     * to id order.
     */
    static List<ResourceNode> dependencyOrder(List<ResourceNode> tasks, ResourceGraph graph) {
        final Map<String, ResourceNode> byId = new LinkedHashMap<>();
        tasks.forEach(t -> byId.put(t.id(), t));
        final Map<String, Integer> pending = new HashMap<>();
        final Map<String, List<String>> dependents = new HashMap<>();
        for (String id : byId.keySet()) {
            pending.put(id, 0);
        }
        for (String id : byId.keySet()) {
            for (DependencyEdge e : graph.outgoing(id, EdgeKind.DEPENDS_ON)) {
                if (byId.containsKey(e.target()) && !e.target().equals(id)) {
                    pending.merge(id, 1, Integer::sum);
                    dependents.computeIfAbsent(e.target(), k -> new ArrayList<>()).add(id);
                }
            }
        }
        final TreeSet<String> ready = new TreeSet<>();
        pending.forEach((id, count) -> {
            if (count == 0) {
                ready.add(id);
            }
        });
        final List<ResourceNode> out = new ArrayList<>();
        while (!ready.isEmpty()) {
            final String id = ready.pollFirst();
            out.add(byId.get(id));
            for (String d : dependents.getOrDefault(id, List.of())) {
                if (pending.merge(d, -1, Integer::sum) == 0) {
                    ready.add(d);
                }
            }
        }
        if (out.size() < byId.size()) {
            new TreeSet<>(byId.keySet()).forEach(id -> {
                if (!out.contains(byId.get(id))) {
                    out.add(byId.get(id));
                }
            });
        }
        return out;
    }

    private Map<String, Object> writePlay(int index, Play play, Map<String, String> modules, Map<String, String> varNames,
                                     Map<String, String> registers, EmissionContext ctx) {
        final Map<String, Object> out = new LinkedHashMap<>();
        if (play.header != null) {
            play.header.forEach((k, v) -> out.put(k, YamlValues.raw(v)));
        } else if (index == CONVERTED_PLAY) {
            out.put("hosts", "localhost");
            out.put("connection", "local");
        } else {
            out.put("hosts", "all");
        }
        if (!play.vars.isEmpty()) {
            play.vars.sort(EmissionContext.SOURCE_ORDER);
            final Map<String, Object> vars = new LinkedHashMap<>();
            for (ResourceNode v : play.vars) {
                final Values values = new Values(ctx, v);
                vars.put(varNames.get(v.id()), values.plain(v.property("default").orElse(PropertyValue.Scalar.NULL)));
                ctx.lossy(v);
            }
            out.put("vars", vars);
        }
        for (String section : AnsibleParser.TASK_SECTIONS) {
            final List<ResourceNode> tasks = play.sections.get(section);
            if (tasks == null || tasks.isEmpty()) {
                continue;
            }
            final List<Object> written = new ArrayList<>();
            for (ResourceNode t : tasks) {
                written.add(task(t, modules.get(t.id()), registers.get(t.id()), ctx));
            }
            out.put(section, written);
        }
        return out;
    }

    private static Map<String, Object> task(ResourceNode node, String module, String register, EmissionContext ctx) {
        final boolean same = ctx.sameDialect(node);
        final Values values = new Values(ctx, node);
        final Map<String, Object> task = new LinkedHashMap<>();
        final Map<String, Object> extensions = same ? node.metadata().extensions() : Map.of();
        if (extensions.get("name") != null) {
            task.put("name", extensions.get("name"));
        } else if (!same) {
            task.put("name", Ids.localName(node.id()));
        }
        task.put(module, arguments(node, module, values, ctx));
        extensions.forEach((k, v) -> {
            if (!k.startsWith("@") && !k.equals("name")) {
                task.put(k, YamlValues.raw(v));
            }
        });
        if (register != null && !task.containsKey("register")) {
            task.put("register", register);
        }
        if (!same) {
            ctx.lossy(node);
        }
        return task;
    }

    private static Object arguments(ResourceNode node, String module, Values values, EmissionContext ctx) {
        final boolean same = ctx.sameDialect(node);
        final Object freeForm = same ? node.metadata().extension(AnsibleMapper.FREE_FORM) : null;
        if (Boolean.TRUE.equals(freeForm)) {
            if (AnsibleModules.isCommandModule(module)) {
                return node.property("cmd").map(values::plain).orElse("");
            }
            final List<String> pairs = new ArrayList<>();
            node.properties().forEach((canonical, value) ->
                    pairs.add(ctx.nativeName(node, canonical) + "=" + values.plain(value)));
            return String.join(" ", pairs);
        }
        if (freeForm != null) {
            return YamlValues.raw(freeForm);
        }
        final Map<String, Object> args = new LinkedHashMap<>();
        node.properties().forEach((canonical, value) -> args.put(ctx.nativeName(node, canonical), values.plain(value)));
        if (same) {
            node.metadata().opaqueProperties().forEach((k, v) -> args.put(k, YamlValues.raw(v)));
        }
        return args.isEmpty() ? null : args;
    }

    /**
     * Jinja spelling of references: {@code {{ name }}}, {@code {{ name.attr }}}.
     */
    private static final class Values extends YamlValues {

        private final EmissionContext ctx;
        private final ResourceNode node;

        Values(EmissionContext ctx, ResourceNode node) {
            this.ctx = ctx;
            this.node = node;
        }

        @Override
        protected Object reference(PropertyValue.Reference ref) {
            return ctx.address(node.id(), ref)
                    .map(a -> "{{ " + a + " }}")
                    .orElse(ref.render(ref.targetId()));
        }

        @Override
        protected Object template(PropertyValue.Template template) {
            final StringBuilder sb = new StringBuilder();
            for (PropertyValue p : template.parts()) {
                if (p instanceof PropertyValue.Scalar s) {
                    sb.append(s.asText());
                } else if (p instanceof PropertyValue.Reference r) {
                    sb.append(reference(r));
                } else if (p instanceof PropertyValue.Expression e) {
                    sb.append(text(e));
                }
            }
            return sb.toString();
        }

        @Override
        protected Object expression(PropertyValue.Expression expression) {
            final String text = text(expression);
            ctx.warn(EmissionWarning.LOSSY, node.id(), "expression '" + text + "' written as a literal string");
            return text;
        }

        private String text(PropertyValue.Expression e) {
            return e.text(id -> ctx.nameOf(id).orElse(id));
        }
    }
}
