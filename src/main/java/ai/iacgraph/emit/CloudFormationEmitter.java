package ai.iacgraph.emit;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ai.iacgraph.emit.yaml.YamlValues;
import ai.iacgraph.emit.yaml.YamlWriter;
import ai.iacgraph.model.DependencyEdge;
import ai.iacgraph.model.Dialect;
import ai.iacgraph.model.EdgeKind;
import ai.iacgraph.model.EdgeOrigin;
import ai.iacgraph.model.GraphExtension;
import ai.iacgraph.model.Ids;
import ai.iacgraph.model.PropertyValue;
import ai.iacgraph.model.ResourceGraph;
import ai.iacgraph.model.ResourceNode;
import ai.iacgraph.normalize.schema.PropertySchemas;
import ai.iacgraph.normalize.schema.PropertySpec;
import ai.iacgraph.normalize.schema.ValueKind;

/**
 * Writes a graph as CloudFormation YAML templates. Nodes read from CloudFormation go back to their
 * template (JSON templates are rewritten as YAML next to the original name); everything else lands
 * in {@code template.yaml}.
 */
public final class CloudFormationEmitter implements DialectEmitter {

    private static final Logger log = LoggerFactory.getLogger(CloudFormationEmitter.class);

    public static final String TEMPLATE = "template.yaml";
    public static final String FORMAT_VERSION = "2010-09-09";

    private static final String SUB = "Fn::Sub";

    private enum Section { PARAMETER, RESOURCE, OUTPUT }

    private record Entry(ResourceNode node, Section section, String nativeType, String name, String file) {
    }

    private final YamlWriter yaml = new YamlWriter();

    @Override
    public Dialect dialect() {
        return Dialect.CLOUDFORMATION;
    }

    @Override
    public EmissionResult emit(ResourceGraph graph, EmitOptions options) {
        final EmissionContext ctx = new EmissionContext(graph, Dialect.CLOUDFORMATION, options);

        // Step 1: sections and logical ids
        final List<Entry> entries = new ArrayList<>();
        final List<ResourceNode> untranslatable = new ArrayList<>();
        final Set<String> logicalIds = new HashSet<>();
        final Set<String> outputNames = new HashSet<>();
        final Set<String> resourceNames = new HashSet<>();
        final List<ResourceNode> ordered = new ArrayList<>(graph.nodes());
        ordered.sort(Comparator.comparing((ResourceNode n) -> !ctx.sameDialect(n)).thenComparing(ResourceNode::id));
        for (ResourceNode node : ordered) {
            final boolean same = ctx.sameDialect(node);
            final String file = same ? templateFile(node.metadata().source().file()) : TEMPLATE;
            switch (node.type()) {
                case "config.variable" -> {
                    final String name = logicalName(node, same, logicalIds);
                    entries.add(new Entry(node, Section.PARAMETER, null, name, file));
                    ctx.name(node.id(), name);
                }
                case "config.output" -> {
                    final String base = same ? Ids.localName(node.id()) : Ids.logicalId(Ids.localName(node.id()));
                    final String name = same ? base : Ids.unique(base, outputNames, "");
                    outputNames.add(name);
                    entries.add(new Entry(node, Section.OUTPUT, null, name, file));
                }
                default -> {
                    final Optional<String> nativeType = node.type().startsWith("config.") || node.type().startsWith("module.")
                            ? Optional.empty()
                            : ctx.nativeType(node);
                    if (nativeType.isEmpty()) {
                        untranslatable.add(node);
                        continue;
                    }
                    final String name = logicalName(node, same, logicalIds);
                    entries.add(new Entry(node, Section.RESOURCE, nativeType.get(), name, file));
                    resourceNames.add(name);
                    ctx.name(node.id(), name);
                }
            }
        }

        // Step 2: templates
        final SortedMap<String, List<Entry>> byFile = new TreeMap<>();
        entries.forEach(e -> byFile.computeIfAbsent(e.file(), f -> new ArrayList<>()).add(e));
        final Map<String, GraphExtension> headers = new LinkedHashMap<>();
        for (GraphExtension ext : graph.extensions()) {
            if (ext.dialect() == Dialect.CLOUDFORMATION && ext.kind().equals("template")) {
                headers.put(templateFile(ext.key()), ext);
                byFile.computeIfAbsent(templateFile(ext.key()), f -> new ArrayList<>());
            } else {
                ctx.warn(EmissionWarning.LOSSY, "", "dropped " + ext.dialect() + " " + ext.kind() + " block");
            }
        }
        if (!untranslatable.isEmpty() || byFile.isEmpty()) {
            byFile.computeIfAbsent(TEMPLATE, f -> new ArrayList<>());
        }

        // Step 3: write
        final SortedMap<String, List<String>> moved = ctx.movedBySurvivor();
        final Map<String, String> artifacts = new LinkedHashMap<>();
        for (var f : byFile.entrySet()) {
            final List<Entry> templateEntries = f.getValue();
            templateEntries.sort(Comparator.comparing(Entry::node, EmissionContext.SOURCE_ORDER));
            final List<String> comments = new ArrayList<>();
            for (Entry e : templateEntries) {
                for (String old : moved.getOrDefault(e.node().id(), List.of())) {
                    comments.add("moved: " + old + " -> " + (e.section() == Section.OUTPUT
                            ? Ids.outputId(e.name())
                            : e.name()));
                }
            }
            if (f.getKey().equals(TEMPLATE)) {
                for (ResourceNode n : untranslatable) {
                    comments.addAll(ctx.stub(n));
                }
            }
            final Map<String, Object> root = new LinkedHashMap<>();
            final GraphExtension header = headers.get(f.getKey());
            if (header != null) {
                header.body().forEach((k, v) -> root.put(k, YamlValues.raw(v)));
            } else {
                root.put("AWSTemplateFormatVersion", FORMAT_VERSION);
            }
            final Map<String, Object> parameters = new LinkedHashMap<>();
            final Map<String, Object> resources = new LinkedHashMap<>();
            final Map<String, Object> outputs = new LinkedHashMap<>();
            for (Entry e : templateEntries) {
                switch (e.section()) {
                    case PARAMETER -> parameters.put(e.name(), parameter(e, ctx));
                    case RESOURCE -> resources.put(e.name(), resource(e, ctx, resourceNames));
                    case OUTPUT -> outputs.put(e.name(), output(e, ctx));
                }
            }
            if (!parameters.isEmpty()) {
                root.put("Parameters", parameters);
            }
            root.put("Resources", resources);
            if (!outputs.isEmpty()) {
                root.put("Outputs", outputs);
            }
            artifacts.put(f.getKey(), yaml.documents(ctx.header(comments), List.of(root)));
        }
        log.debug("CloudFormation emission: {} entries, {} stubs, {} templates",
                entries.size(), untranslatable.size(), artifacts.size());
        return ctx.result(artifacts);
    }

    private static String logicalName(ResourceNode node, boolean same, Set<String> taken) {
        final String name = same ? node.id() : Ids.unique(Ids.logicalId(Ids.localName(node.id())), taken, "");
        taken.add(name);
        return name;
    }

    /**
     * Output path of a source template: YAML files keep their name, JSON templates get a
     * {@code .yaml} extension.
     */
    static String templateFile(String source) {
        if (source == null || source.isEmpty()) {
            return TEMPLATE;
        }
        if (source.endsWith(".yaml") || source.endsWith(".yml")) {
            return source;
        }
        final int dot = source.lastIndexOf('.');
        final int slash = source.lastIndexOf('/');
        if (dot > slash + 1) {
            return source.substring(0, dot) + ".yaml";
        }
        return source + ".yaml";
    }

    private Map<String, Object> parameter(Entry e, EmissionContext ctx) {
        final ResourceNode node = e.node();
        final Values values = new Values(ctx, node);
        final Map<String, Object> body = new LinkedHashMap<>();
        final boolean same = ctx.sameDialect(node);
        if (!same) {
            body.put("Type", parameterType(node.property("type").orElse(null)));
        }
        node.properties().forEach((canonical, value) -> {
            if (same || !canonical.equals("type")) {
                body.put(ctx.nativeName(node, canonical), values.plain(value));
            }
        });
        extras(node, ctx, body);
        return body;
    }

    private Map<String, Object> output(Entry e, EmissionContext ctx) {
        final ResourceNode node = e.node();
        final Values values = new Values(ctx, node);
        final Map<String, Object> body = new LinkedHashMap<>();
        node.properties().forEach((canonical, value) ->
                body.put(ctx.nativeName(node, canonical), values.plain(value)));
        extras(node, ctx, body);
        return body;
    }

    private Map<String, Object> resource(Entry e, EmissionContext ctx, Set<String> resourceNames) {
        final ResourceNode node = e.node();
        final Values values = new Values(ctx, node);
        final boolean same = ctx.sameDialect(node);
        final Map<String, Object> body = new LinkedHashMap<>();
        body.put("Type", e.nativeType());
        if (same) {
            node.metadata().extensions().forEach((k, v) -> {
                if (!k.startsWith("@")) {
                    body.put(k, YamlValues.raw(v));
                }
            });
        }
        final Map<String, Object> opaque = same ? node.metadata().opaqueProperties() : Map.of();
        if (opaque.containsKey("Properties")) {
            body.put("Properties", YamlValues.raw(opaque.get("Properties")));
        } else {
            final Map<String, Object> properties = new LinkedHashMap<>();
            node.properties().forEach((canonical, value) -> {
                final Optional<PropertySpec> spec = PropertySchemas.forType(node.type()).spec(canonical);
                final boolean tags = spec.isPresent() && spec.get().kind() == ValueKind.TAGS;
                properties.put(ctx.nativeName(node, canonical),
                        tags && value instanceof PropertyValue.MapValue m ? tagList(m, values) : values.plain(value));
            });
            opaque.forEach((k, v) -> properties.put(k, YamlValues.raw(v)));
            if (!properties.isEmpty()) {
                body.put("Properties", properties);
            }
        }
        if (!same) {
            ctx.lossy(node);
        }
        final List<String> dependsOn = new ArrayList<>();
        for (DependencyEdge edge : ctx.graph().outgoing(node.id(), EdgeKind.DEPENDS_ON)) {
            if (!edge.hasOrigin(EdgeOrigin.EXPLICIT) && !edge.hasOrigin(EdgeOrigin.ORDERING)) {
                continue;
            }
            final Optional<String> target = ctx.nameOf(edge.target()).filter(resourceNames::contains);
            if (target.isPresent()) {
                dependsOn.add(target.get());
            } else {
                ctx.warn(EmissionWarning.DANGLING, node.id(), "dependency on '" + edge.target() + "' dropped");
            }
        }
        if (dependsOn.size() == 1) {
            body.put("DependsOn", dependsOn.get(0));
        } else if (!dependsOn.isEmpty()) {
            body.put("DependsOn", dependsOn);
        }
        return body;
    }

    private static void extras(ResourceNode node, EmissionContext ctx, Map<String, Object> body) {
        if (ctx.sameDialect(node)) {
            node.metadata().extensions().forEach((k, v) -> {
                if (!k.startsWith("@")) {
                    body.put(k, YamlValues.raw(v));
                }
            });
            node.metadata().opaqueProperties().forEach((k, v) -> body.put(k, YamlValues.raw(v)));
        } else {
            ctx.lossy(node);
        }
    }

    private static List<Object> tagList(PropertyValue.MapValue tags, Values values) {
        final List<Object> out = new ArrayList<>();
        tags.entries().forEach((k, v) -> {
            final Map<String, Object> pair = new LinkedHashMap<>();
            pair.put("Key", k);
            pair.put("Value", values.plain(v));
            out.add(pair);
        });
        return out;
    }

    /**
     * Parameter type for a variable of another dialect.
     */
    static String parameterType(PropertyValue type) {
        final String t = type instanceof PropertyValue.Expression e ? e.text(id -> id).strip()
                : type instanceof PropertyValue.Scalar s ? s.asText() : "";
        if (t.equals("number")) {
            return "Number";
        }
        if (t.startsWith("list(") || t.startsWith("set(")) {
            return "CommaDelimitedList";
        }
        return "String";
    }

    /**
     * Intrinsic-function spelling of references: {@code Ref}, {@code Fn::GetAtt} and
     * {@code Fn::Sub}.
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
            final Optional<String> name = ctx.resolve(node.id(), ref);
            if (name.isEmpty()) {
                return ref.render(ref.targetId());
            }
            final PropertyValue.Reference nativeRef = ctx.nativeAttribute(ref);
            if (nativeRef.attribute() == null || isParameter(ref.targetId())) {
                return Map.of("Ref", name.get());
            }
            return Map.of("Fn::GetAtt", List.of(name.get(), nativeRef.attribute()));
        }

        @Override
        protected Object template(PropertyValue.Template template) {
            final StringBuilder sb = new StringBuilder();
            for (PropertyValue p : template.parts()) {
                if (p instanceof PropertyValue.Scalar s) {
                    sb.append(escape(s.asText()));
                } else if (p instanceof PropertyValue.Reference r) {
                    final Optional<String> name = ctx.resolve(node.id(), r);
                    if (name.isPresent()) {
                        sb.append("${").append(ctx.nativeAttribute(r).render(name.get())).append('}');
                    } else {
                        sb.append(escape(r.render(r.targetId())));
                    }
                } else if (p instanceof PropertyValue.Expression e) {
                    if (ctx.sameDialect(node)) {
                        sb.append("${").append(e.text(id -> id)).append('}');
                    } else {
                        sb.append(escape(e.text(id -> ctx.nameOf(id).orElse(id))));
                    }
                }
            }
            return Map.of(SUB, sb.toString());
        }

        @Override
        protected Object expression(PropertyValue.Expression expression) {
            if (ctx.sameDialect(node)) {
                return Map.of(SUB, "${" + expression.text(id -> id) + "}");
            }
            final String text = expression.text(id -> ctx.nameOf(id).orElse(id));
            ctx.warn(EmissionWarning.LOSSY, node.id(), "expression '" + text + "' written as a literal string");
            return text;
        }

        private boolean isParameter(String targetId) {
            return ctx.graph().node(targetId).map(n -> n.type().equals("config.variable")).orElse(false);
        }

        private static String escape(String literal) {
            return literal.replace("${", "${!");
        }
    }
}
