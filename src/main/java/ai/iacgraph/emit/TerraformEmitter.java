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
import java.util.TreeSet;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ai.iacgraph.emit.hcl.HclExpressions;
import ai.iacgraph.emit.hcl.HclWriter;
import ai.iacgraph.model.DependencyEdge;
import ai.iacgraph.model.Dialect;
import ai.iacgraph.model.EdgeKind;
import ai.iacgraph.model.EdgeOrigin;
import ai.iacgraph.model.GraphExtension;
import ai.iacgraph.model.Ids;
import ai.iacgraph.model.PropertyValue;
import ai.iacgraph.model.ResourceGraph;
import ai.iacgraph.model.ResourceNode;
import ai.iacgraph.normalize.TerraformMapper;
import ai.iacgraph.normalize.schema.TerraformTypes;
import ai.iacgraph.parse.TerraformParser;

/**
 * Writes a graph as Terraform configuration: resources and data sources in {@code main.tf},
 * variables, outputs and providers in their conventional files. Nodes read from Terraform go back
 * to the file they came from.
 */
public final class TerraformEmitter implements DialectEmitter {

    private static final Logger log = LoggerFactory.getLogger(TerraformEmitter.class);

    public static final String MAIN = "main.tf";
    public static final String VARIABLES = "variables.tf";
    public static final String OUTPUTS = "outputs.tf";
    public static final String PROVIDERS = "providers.tf";

    private static final Pattern MOVABLE = Pattern.compile(
            "module\\.[A-Za-z_][\\w-]*|[a-z][a-z0-9]*_[a-z0-9_]+\\.[A-Za-z_][\\w-]*");

    enum Kind {
        RESOURCE("resource"),
        DATA("data"),
        VARIABLE("variable"),
        OUTPUT("output"),
        LOCAL("locals"),
        MODULE("module");

        final String keyword;

        Kind(String keyword) {
            this.keyword = keyword;
        }
    }

    private record Declaration(ResourceNode node, Kind kind, String nativeType, String name, String file) {

        String address() {
            return switch (kind) {
                case RESOURCE -> nativeType + "." + name;
                case DATA -> "data." + nativeType + "." + name;
                case VARIABLE -> Ids.variableId(name);
                case OUTPUT -> Ids.outputId(name);
                case LOCAL -> Ids.localId(name);
                case MODULE -> Ids.moduleId(name);
            };
        }

        List<String> labels() {
            return kind == Kind.RESOURCE || kind == Kind.DATA ? List.of(nativeType, name) : List.of(name);
        }
    }

    @Override
    public Dialect dialect() {
        return Dialect.TERRAFORM;
    }

    @Override
    public EmissionResult emit(ResourceGraph graph, EmitOptions options) {
        final EmissionContext ctx = new EmissionContext(graph, Dialect.TERRAFORM, options);

        // Step 1: decide kind, address and file of every node
        final List<Declaration> declarations = new ArrayList<>();
        final List<ResourceNode> untranslatable = new ArrayList<>();
        final Set<String> taken = new HashSet<>();
        final List<ResourceNode> ordered = new ArrayList<>(graph.nodes());
        ordered.sort(Comparator.comparing((ResourceNode n) -> !ctx.sameDialect(n)).thenComparing(ResourceNode::id));
        for (ResourceNode node : ordered) {
            final Optional<Declaration> d = declare(node, ctx, taken);
            if (d.isEmpty()) {
                untranslatable.add(node);
                continue;
            }
            declarations.add(d.get());
            taken.add(d.get().address());
            if (d.get().kind() != Kind.OUTPUT) {
                ctx.name(node.id(), d.get().address());
            }
        }

        // Step 2: group declarations and graph-level blocks per file
        final SortedMap<String, List<Declaration>> byFile = new TreeMap<>();
        for (Declaration d : declarations) {
            byFile.computeIfAbsent(d.file(), f -> new ArrayList<>()).add(d);
        }
        final SortedMap<String, List<GraphExtension>> extensionsByFile = new TreeMap<>();
        for (GraphExtension ext : graph.extensions()) {
            if (ext.dialect() != Dialect.TERRAFORM) {
                ctx.warn(EmissionWarning.LOSSY, "", "dropped " + ext.dialect() + " " + ext.kind() + " block");
                continue;
            }
            final String file = ext.source().file().endsWith(".tf") ? ext.source().file() : PROVIDERS;
            extensionsByFile.computeIfAbsent(file, f -> new ArrayList<>()).add(ext);
        }

        final Set<String> files = new TreeSet<>(byFile.keySet());
        files.addAll(extensionsByFile.keySet());
        if (!untranslatable.isEmpty() || files.isEmpty()) {
            files.add(MAIN);
        }

        // Step 3: write each file
        final Map<String, String> artifacts = new LinkedHashMap<>();
        final SortedMap<String, List<String>> moved = ctx.movedBySurvivor();
        for (String file : files) {
            final HclWriter w = new HclWriter();
            ctx.banner().forEach(w::comment);
            if (file.equals(MAIN)) {
                for (ResourceNode n : untranslatable) {
                    w.blank();
                    ctx.stub(n).forEach(w::comment);
                }
            }
            final List<GraphExtension> exts = new ArrayList<>(extensionsByFile.getOrDefault(file, List.of()));
            exts.sort(Comparator.comparingInt((GraphExtension e) -> e.source().line()).thenComparing(GraphExtension::identity));
            for (GraphExtension ext : exts) {
                w.blank();
                w.block(ext.kind(), TerraformParser.extensionLabels(ext.key()));
                w.body(ext.body());
                w.close();
            }
            final List<Declaration> decls = new ArrayList<>(byFile.getOrDefault(file, List.of()));
            decls.sort(Comparator.comparing(Declaration::node, EmissionContext.SOURCE_ORDER));
            boolean localsWritten = false;
            for (Declaration d : decls) {
                if (d.kind() == Kind.LOCAL) {
                    if (!localsWritten) {
                        locals(w, decls, ctx);
                        localsWritten = true;
                    }
                    continue;
                }
                w.blank();
                w.block(d.kind().keyword, d.labels());
                body(w, d, ctx);
                w.close();
            }
            for (Declaration d : decls) {
                movedBlocks(w, d, moved.getOrDefault(d.node().id(), List.of()));
            }
            artifacts.put(file, w.text());
        }
        log.debug("Terraform emission: {} declarations, {} stubs, {} files",
                declarations.size(), untranslatable.size(), artifacts.size());
        return ctx.result(artifacts);
    }

    private static Optional<Declaration> declare(ResourceNode node, EmissionContext ctx, Set<String> taken) {
        final boolean same = ctx.sameDialect(node);
        final Kind kind;
        String nativeType = null;
        switch (node.type()) {
            case "config.variable" -> kind = Kind.VARIABLE;
            case "config.output" -> kind = Kind.OUTPUT;
            case "config.local" -> kind = Kind.LOCAL;
            case "module.call" -> kind = Kind.MODULE;
            default -> {
                if (same) {
                    kind = "data".equals(node.metadata().extension(TerraformMapper.MODE)) ? Kind.DATA : Kind.RESOURCE;
                    nativeType = node.metadata().nativeType();
                } else {
                    final Optional<TerraformTypes> t = node.isUnknownType()
                            ? Optional.empty()
                            : TerraformTypes.forCanonical(node.type());
                    if (t.isEmpty()) {
                        return Optional.empty();
                    }
                    kind = t.get().dataSource() ? Kind.DATA : Kind.RESOURCE;
                    nativeType = t.get().nativeType();
                }
            }
        }
        String name = same ? Ids.localName(node.id()) : Ids.terraformName(Ids.localName(node.id()));
        if (!same) {
            final String type = nativeType;
            final String base = name;
            int i = 2;
            while (taken.contains(new Declaration(node, kind, type, name, "").address())) {
                name = base + "_" + i++;
            }
        }
        return Optional.of(new Declaration(node, kind, nativeType, name, fileOf(node, kind, same)));
    }

    private static String fileOf(ResourceNode node, Kind kind, boolean same) {
        final String file = node.metadata().source().file();
        if (same && file.endsWith(".tf")) {
            return file;
        }
        return switch (kind) {
            case VARIABLE -> VARIABLES;
            case OUTPUT -> OUTPUTS;
            default -> MAIN;
        };
    }

    private static void body(HclWriter w, Declaration d, EmissionContext ctx) {
        final ResourceNode node = d.node();
        final boolean same = ctx.sameDialect(node);
        final HclExpressions expressions = new HclExpressions(r -> ctx.address(node.id(), r), same);
        final Map<String, Object> extensions = node.metadata().extensions();
        if (same) {
            extensions.forEach((k, v) -> {
                if (!k.startsWith("@") && !HclWriter.isBlockList(k, v)) {
                    w.rawEntry(k, v);
                }
            });
        }
        node.properties().forEach((canonical, value) -> {
            final String name = ctx.nativeName(node, canonical);
            if (same && node.metadata().blockProperties().contains(canonical) && isBlockList(value)) {
                nestedBlocks(w, name, (PropertyValue.ListValue) value, expressions);
            } else if (!same && d.kind() == Kind.VARIABLE && canonical.equals("type")) {
                w.attribute(name, typeConstraint(value));
            } else {
                w.attribute(name, expressions.render(value, 0));
            }
        });
        if (same) {
            node.metadata().opaqueProperties().forEach(w::rawEntry);
            extensions.forEach((k, v) -> {
                if (!k.startsWith("@") && HclWriter.isBlockList(k, v)) {
                    w.rawEntry(k, v);
                }
            });
        } else {
            ctx.lossy(node);
        }
        dependsOn(w, d, ctx);
    }

    private static void dependsOn(HclWriter w, Declaration d, EmissionContext ctx) {
        if (d.kind() == Kind.VARIABLE || d.kind() == Kind.LOCAL) {
            return;
        }
        final List<String> addresses = new ArrayList<>();
        for (DependencyEdge e : ctx.graph().outgoing(d.node().id(), EdgeKind.DEPENDS_ON)) {
            if (!e.hasOrigin(EdgeOrigin.EXPLICIT) && !e.hasOrigin(EdgeOrigin.ORDERING)) {
                continue;
            }
            final Optional<String> target = ctx.nameOf(e.target());
            if (target.isPresent()) {
                addresses.add(target.get());
            } else {
                w.comment("depends_on " + e.target() + " was not emitted");
                ctx.warn(EmissionWarning.DANGLING, d.node().id(), "dependency on '" + e.target() + "' dropped");
            }
        }
        if (!addresses.isEmpty()) {
            w.attribute("depends_on", "[" + String.join(", ", addresses) + "]");
        }
    }

    private static void locals(HclWriter w, List<Declaration> decls, EmissionContext ctx) {
        w.blank();
        w.open("locals");
        for (Declaration d : decls) {
            if (d.kind() != Kind.LOCAL) {
                continue;
            }
            final ResourceNode node = d.node();
            final HclExpressions expressions = new HclExpressions(r -> ctx.address(node.id(), r), ctx.sameDialect(node));
            w.attribute(d.name(), expressions.render(node.property("value").orElse(PropertyValue.Scalar.NULL), 0));
            ctx.lossy(node);
        }
        w.close();
    }

    private static void movedBlocks(HclWriter w, Declaration d, List<String> oldIds) {
        if (d.kind() != Kind.RESOURCE && d.kind() != Kind.MODULE) {
            return;
        }
        for (String old : oldIds) {
            if (!MOVABLE.matcher(old).matches() || old.equals(d.address())) {
                continue;
            }
            w.blank();
            w.open("moved");
            w.attribute("from", old);
            w.attribute("to", d.address());
            w.close();
        }
    }

    private static boolean isBlockList(PropertyValue value) {
        return value instanceof PropertyValue.ListValue l && !l.items().isEmpty()
                && l.items().stream().allMatch(i -> i instanceof PropertyValue.MapValue);
    }

    private static void nestedBlocks(HclWriter w, String name, PropertyValue.ListValue blocks, HclExpressions expressions) {
        for (PropertyValue item : blocks.items()) {
            w.open(name);
            ((PropertyValue.MapValue) item).entries().forEach((k, v) -> {
                if (isBlockList(v) && HclWriter.IDENTIFIER.matcher(k).matches()) {
                    nestedBlocks(w, k, (PropertyValue.ListValue) v, expressions);
                } else {
                    w.attribute(k, expressions.render(v, 0));
                }
            });
            w.close();
        }
    }

    /**
     * Terraform type constraint for a parameter type of another dialect.
     */
    static String typeConstraint(PropertyValue type) {
        final String t = type instanceof PropertyValue.Scalar s ? s.asText() : "";
        if (t.equals("Number")) {
            return "number";
        }
        if (t.startsWith("List<") || t.equals("CommaDelimitedList")) {
            return "list(string)";
        }
        return "string";
    }
}
