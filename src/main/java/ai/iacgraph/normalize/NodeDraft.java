package ai.iacgraph.normalize;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import ai.iacgraph.model.DependencyEdge;
import ai.iacgraph.model.Dialect;
import ai.iacgraph.model.EdgeOrigin;
import ai.iacgraph.model.Metadata;
import ai.iacgraph.model.PropertyValue;
import ai.iacgraph.model.ResourceNode;
import ai.iacgraph.model.SourceLocation;

/**
 * Mutable node under construction by a mapper.
 */
public final class NodeDraft {

    final String id;
    final String type;
    final Dialect dialect;
    final String nativeType;
    final SourceLocation source;
    final Map<String, PropertyValue> properties = new LinkedHashMap<>();
    final Map<String, String> nativeNames = new LinkedHashMap<>();
    final Set<String> blockProperties = new LinkedHashSet<>();
    final Map<String, Object> opaque = new LinkedHashMap<>();
    final Map<String, Object> extensions = new LinkedHashMap<>();
    final List<DependencyEdge> edges = new ArrayList<>();
    Map<String, Object> originalBlock = Map.of();

    public NodeDraft(String id, String type, Dialect dialect, String nativeType, SourceLocation source) {
        this.id = id;
        this.type = type;
        this.dialect = dialect;
        this.nativeType = nativeType;
        this.source = source;
    }

    public String id() {
        return id;
    }

    public String type() {
        return type;
    }

    public SourceLocation source() {
        return source;
    }

    public void property(String name, PropertyValue value) {
        properties.put(name, value);
    }

    public void extension(String key, Object raw) {
        extensions.put(key, raw);
    }

    public void dependsOn(String targetId, EdgeOrigin origin) {
        edges.add(DependencyEdge.dependsOn(id, targetId, origin));
    }

    public void edge(DependencyEdge edge) {
        edges.add(edge);
    }

    public void originalBlock(Map<String, Object> block) {
        this.originalBlock = block;
    }

    public ResourceNode build() {
        final Metadata metadata = new Metadata(dialect, nativeType, source, nativeNames, blockProperties,
                opaque, extensions, originalBlock);
        return new ResourceNode(id, type, properties, metadata);
    }
}
