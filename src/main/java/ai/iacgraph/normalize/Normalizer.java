package ai.iacgraph.normalize;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ai.iacgraph.model.DependencyEdge;
import ai.iacgraph.model.Dialect;
import ai.iacgraph.model.EdgeKind;
import ai.iacgraph.model.EdgeOrigin;
import ai.iacgraph.model.GraphExtension;
import ai.iacgraph.model.PropertyValue;
import ai.iacgraph.model.ResourceGraph;
import ai.iacgraph.model.ResourceNode;
import ai.iacgraph.normalize.schema.PropertySchema;
import ai.iacgraph.normalize.schema.PropertySchemas;
import ai.iacgraph.normalize.schema.PropertySpec;
import ai.iacgraph.parse.DialectAst;
import ai.iacgraph.parse.FileAst;
import ai.iacgraph.parse.ParseError;
import ai.iacgraph.parse.SourceBlock;

/**
 * Builds the canonical resource graph from a dialect AST.
 * <p>
 * Files are mapped into independent fragments in parallel; fragments are merged in lexicographic
 * path order, so the graph does not depend on completion order. A declaration repeated with equal
 * content is merged silently; with different content the later file wins and a
 * {@code conflicting-declaration} warning is raised.
 */
public final class Normalizer {

    private static final Logger log = LoggerFactory.getLogger(Normalizer.class);

    private final Map<Dialect, DialectMapper> mappers = new EnumMap<>(Dialect.class);
    private final ExecutorService executor;

    public Normalizer(List<DialectMapper> mappers, ExecutorService executor) {
        mappers.forEach(m -> this.mappers.put(m.dialect(), m));
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    public static Normalizer withDefaultMappers(ExecutorService executor) {
        return new Normalizer(List.of(
                new TerraformMapper(),
                new CloudFormationMapper(),
                new KubernetesMapper(),
                new AnsibleMapper()), executor);
    }

    public NormalizationResult normalize(DialectAst ast, Dialect dialect) {
        Objects.requireNonNull(ast, "ast");
        final DialectMapper mapper = mappers.get(dialect);
        if (mapper == null) {
            throw new IllegalArgumentException("No normalizer for dialect " + dialect);
        }

        // Step 1: declare every block so references resolve across files
        final SymbolTable symbols = mapper.declare(ast);

        // Step 2: one fragment per file, in parallel
        final List<CompletableFuture<GraphFragment>> futures = new ArrayList<>();
        for (FileAst file : ast.files()) {
            futures.add(CompletableFuture.supplyAsync(() -> fragment(mapper, file, symbols), executor));
        }
        final List<GraphFragment> fragments = new ArrayList<>(futures.size());
        futures.forEach(f -> fragments.add(f.join()));
        fragments.sort(Comparator.comparing(GraphFragment::path));

        // Step 3: merge in path order (single serialization point)
        final List<NormalizationWarning> warnings = new ArrayList<>();
        final List<ParseError> failures = new ArrayList<>();
        final Map<String, GraphFragment.Entry> entries = new LinkedHashMap<>();
        final ResourceGraph graph = new ResourceGraph(dialect);
        final Map<String, String> aliases = new LinkedHashMap<>();
        for (GraphFragment fragment : fragments) {
            warnings.addAll(fragment.warnings());
            failures.addAll(fragment.failures());
            for (GraphFragment.Entry entry : fragment.entries()) {
                merge(entries, entry, warnings);
            }
            for (GraphExtension ext : fragment.extensions()) {
                graph.putExtension(ext);
            }
            aliases.putAll(fragment.aliases());
        }

        // Step 4: nodes, then edges: declared ones, one per reference token, ownership
        entries.values().forEach(e -> graph.putNode(e.node()));
        for (GraphFragment.Entry entry : entries.values()) {
            entry.edges().forEach(graph::addEdge);
            for (DependencyEdge e : referenceEdges(entry.node())) {
                // an undeclared owner yields no containment, only the dangling depends-on edge
                if (e.kind() == EdgeKind.DEPENDS_ON || graph.hasNode(e.source())) {
                    graph.addEdge(e);
                }
            }
        }
        aliases.forEach((from, to) -> {
            if (!graph.hasNode(from)) {
                graph.addAlias(from, to);
            }
        });

        // Step 5: dangling references stay in the graph as edges; the validator reports them
        for (DependencyEdge e : graph.danglingEdges()) {
            if (e.kind() != EdgeKind.DEPENDS_ON) {
                continue;
            }
            final ResourceNode src = graph.node(e.source()).orElse(null);
            warnings.add(new NormalizationWarning("dangling-reference", e.source(),
                    src == null ? null : src.metadata().source(),
                    "reference to undeclared '" + e.target() + "'"));
        }

        warnings.sort(NormalizationWarning.ORDER);
        failures.sort(Comparator.comparing(ParseError::file).thenComparingInt(ParseError::line));
        log.info("Normalized {} {} nodes, {} edges ({} warnings)",
                graph.nodeCount(), dialect, graph.edgeCount(), warnings.size());
        return new NormalizationResult(graph, warnings, failures);
    }

    private static GraphFragment fragment(DialectMapper mapper, FileAst file, SymbolTable symbols) {
        final GraphFragment out = new GraphFragment(file.path());
        for (SourceBlock block : file.blocks()) {
            try {
                mapper.map(block, symbols, out);
            } catch (RuntimeException ex) {
                // the declaration is excluded and surfaced, never half-mapped
                log.debug("Mapping failed for {} {}", block.nativeType(), block.name(), ex);
                out.fail(new ParseError(file.path(), block.source().line(), block.name(),
                        "could not normalize " + block.nativeType() + ": " + ex.getMessage()));
            }
        }
        return out;
    }

    private static void merge(Map<String, GraphFragment.Entry> entries, GraphFragment.Entry entry,
                              List<NormalizationWarning> warnings) {
        final ResourceNode node = entry.node();
        final GraphFragment.Entry existing = entries.get(node.id());
        if (existing == null) {
            entries.put(node.id(), entry);
            return;
        }
        final ResourceNode previous = existing.node();
        if (sameDeclaration(previous, node) && existing.edges().equals(entry.edges())) {
            log.debug("Merged repeated declaration of {} from {}", node.id(), node.metadata().source());
            return;
        }
        warnings.add(new NormalizationWarning("conflicting-declaration", node.id(), node.metadata().source(),
                "also declared at " + previous.metadata().source() + " with different content; keeping "
                        + node.metadata().source()));
        entries.put(node.id(), entry);
    }

    static boolean sameDeclaration(ResourceNode a, ResourceNode b) {
        return a.type().equals(b.type())
                && a.properties().equals(b.properties())
                && a.metadata().withoutSource().equals(b.metadata().withoutSource());
    }

    /**
     * A depends-on edge per reference token, and a contains edge from the target of every owner
     * property.
     */
    static List<DependencyEdge> referenceEdges(ResourceNode node) {
        final List<DependencyEdge> out = new ArrayList<>();
        final PropertySchema schema = PropertySchemas.forType(node.type());
        for (var e : node.properties().entrySet()) {
            for (PropertyValue.Reference r : e.getValue().references()) {
                out.add(DependencyEdge.dependsOn(node.id(), r.targetId(), EdgeOrigin.REFERENCE));
            }
            final boolean owner = schema.spec(e.getKey()).map(PropertySpec::owner).orElse(false);
            if (owner && e.getValue() instanceof PropertyValue.Reference r && !r.targetId().equals(node.id())) {
                out.add(DependencyEdge.contains(r.targetId(), node.id()));
            }
        }
        return out;
    }
}
