package ai.iacgraph.emit;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ai.iacgraph.emit.yaml.YamlValues;
import ai.iacgraph.emit.yaml.YamlWriter;
import ai.iacgraph.model.Dialect;
import ai.iacgraph.model.GraphExtension;
import ai.iacgraph.model.Ids;
import ai.iacgraph.model.PropertyValue;
import ai.iacgraph.model.ResourceGraph;
import ai.iacgraph.model.ResourceNode;
import ai.iacgraph.normalize.schema.KubernetesKinds;

/**
 * Writes a graph as Kubernetes manifests, one document per object.
 */
public final class KubernetesEmitter implements DialectEmitter {

    private static final Logger log = LoggerFactory.getLogger(KubernetesEmitter.class);

    public static final String UNTRANSLATABLE_FILE = "untranslatable.yaml";

    private static final Set<String> METADATA_PROPERTIES = Set.of("namespace", "labels", "annotations");
    private static final Set<String> RESERVED = Set.of("apiVersion", "kind", "metadata");

    private record Manifest(ResourceNode node, String kind, String name, String file) {
    }

    private final YamlWriter yaml = new YamlWriter();

    @Override
    public Dialect dialect() {
        return Dialect.KUBERNETES;
    }

    @Override
    public EmissionResult emit(ResourceGraph graph, EmitOptions options) {
        final EmissionContext ctx = new EmissionContext(graph, Dialect.KUBERNETES, options);

        // Step 1: kinds and object names
        final List<Manifest> manifests = new ArrayList<>();
        final List<ResourceNode> untranslatable = new ArrayList<>();
        final Set<String> taken = new HashSet<>();
        final List<ResourceNode> ordered = new ArrayList<>(graph.nodes());
        ordered.sort(Comparator.comparing((ResourceNode n) -> !ctx.sameDialect(n)).thenComparing(ResourceNode::id));
        for (ResourceNode node : ordered) {
            final Optional<String> kind = ctx.nativeType(node);
            if (kind.isEmpty()) {
                untranslatable.add(node);
                continue;
            }
            final boolean same = ctx.sameDialect(node);
            String name = same ? Ids.localName(node.id()) : Ids.dnsLabel(Ids.localName(node.id()));
            if (!same) {
                final String base = name;
                int i = 2;
                while (taken.contains(kind.get() + "/" + name)) {
                    name = base + "-" + i++;
                }
            }
            taken.add(kind.get() + "/" + name);
            final String file = same && !node.metadata().source().file().isEmpty()
                    ? node.metadata().source().file()
                    : kind.get().toLowerCase(Locale.ROOT) + "-" + name + ".yaml";
            manifests.add(new Manifest(node, kind.get(), name, file));
            ctx.name(node.id(), name);
        }
        for (GraphExtension ext : graph.extensions()) {
            ctx.warn(EmissionWarning.LOSSY, "", "dropped " + ext.dialect() + " " + ext.kind() + " block");
        }

        // Step 2: documents per file
        final SortedMap<String, List<Manifest>> byFile = new TreeMap<>();
        manifests.forEach(m -> byFile.computeIfAbsent(m.file(), f -> new ArrayList<>()).add(m));
        final SortedMap<String, List<String>> moved = ctx.movedBySurvivor();
        final Map<String, String> artifacts = new LinkedHashMap<>();
        for (var f : byFile.entrySet()) {
            final List<Manifest> docs = f.getValue();
            docs.sort(Comparator.comparing(Manifest::node, EmissionContext.SOURCE_ORDER));
            final List<String> comments = new ArrayList<>();
            final List<Object> roots = new ArrayList<>();
            for (Manifest m : docs) {
                final Map<String, Object> root = document(m, ctx);
                roots.add(root);
                for (String old : moved.getOrDefault(m.node().id(), List.of())) {
                    comments.add("moved: " + old + " -> " + emittedId(m, root));
                }
            }
            artifacts.put(f.getKey(), yaml.documents(ctx.header(comments), roots));
        }
        if (!untranslatable.isEmpty()) {
            final List<String> comments = new ArrayList<>();
            for (ResourceNode n : untranslatable) {
                comments.addAll(ctx.stub(n));
            }
            artifacts.put(UNTRANSLATABLE_FILE, ctx.header(comments));
        }
        log.debug("Kubernetes emission: {} objects, {} stubs", manifests.size(), untranslatable.size());
        return ctx.result(artifacts);
    }

    private static Map<String, Object> document(Manifest m, EmissionContext ctx) {
        final ResourceNode node = m.node();
        final boolean same = ctx.sameDialect(node);
        final Values values = new Values(ctx, node);
        final Map<String, Object> root = new LinkedHashMap<>();
        root.put("apiVersion", apiVersion(m, same));
        root.put("kind", m.kind());

        final Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("name", m.name());
        node.property("namespace").ifPresent(ns -> metadata.put("namespace", values.plain(ns)));
        node.property("labels").ifPresent(v -> metadata.put("labels", values.plain(v)));
        node.property("annotations").ifPresent(v -> metadata.put("annotations", values.plain(v)));
        if (same && node.metadata().extension("metadata") instanceof Map<?, ?> rest) {
            rest.forEach((k, v) -> metadata.put(String.valueOf(k), YamlValues.raw(v)));
        }
        root.put("metadata", metadata);

        node.properties().forEach((canonical, value) -> {
            if (METADATA_PROPERTIES.contains(canonical)) {
                return;
            }
            final String key = ctx.nativeName(node, canonical);
            if (RESERVED.contains(key)) {
                ctx.warn(EmissionWarning.LOSSY, node.id(), "property '" + key + "' clashes with the object envelope; dropped");
                return;
            }
            root.put(key, values.plain(value));
        });
        if (same) {
            node.metadata().opaqueProperties().forEach((k, v) -> root.put(k, YamlValues.raw(v)));
        } else {
            ctx.lossy(node);
        }
        return root;
    }

    private static Object apiVersion(Manifest m, boolean same) {
        if (same && m.node().metadata().extension("apiVersion") != null) {
            return m.node().metadata().extension("apiVersion");
        }
        for (KubernetesKinds k : KubernetesKinds.values()) {
            if (k.nativeType().equals(m.kind())) {
                return k.apiVersion();
            }
        }
        return "v1";
    }

    private static String emittedId(Manifest m, Map<String, Object> root) {
        final Object ns = root.get("metadata") instanceof Map<?, ?> md ? md.get("namespace") : null;
        return Ids.manifestId(m.kind(), ns == null ? null : String.valueOf(ns), m.name());
    }

    /**
     * Object names stand in for references; templates are joined into plain strings.
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
            return ctx.resolve(node.id(), ref).orElse(ref.targetId());
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
            ctx.warn(EmissionWarning.LOSSY, node.id(), "interpolated string flattened to '" + sb + "'");
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
