package ai.iacgraph.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A single infrastructure unit in the canonical graph.
 *
 * @param id         unique within the graph
 * @param type       provider-qualified canonical type, e.g. {@code compute.instance}
 * @param properties ordered property name -> typed value
 * @param metadata   dialect-specific leftovers
 * @param hints      advisory annotations, never read by validation or optimization
 */
public record ResourceNode(
        String id,
        String type,
        Map<String, PropertyValue> properties,
        Metadata metadata,
        List<AdvisoryHint> hints
) {

    public static final String UNKNOWN_PREFIX = "unknown.";

    public ResourceNode {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(type, "type");
        properties = properties == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(properties));
        metadata = metadata == null ? Metadata.EMPTY : metadata;
        hints = hints == null ? List.of() : List.copyOf(hints);
    }

    public ResourceNode(String id, String type, Map<String, PropertyValue> properties, Metadata metadata) {
        this(id, type, properties, metadata, List.of());
    }

    public Optional<PropertyValue> property(String name) {
        return Optional.ofNullable(properties.get(name));
    }

    public boolean isUnknownType() {
        return type.startsWith(UNKNOWN_PREFIX);
    }

    /**
     * First segment of the canonical type, e.g. {@code network} for {@code network.subnet}.
     */
    public String category() {
        final int dot = type.indexOf('.');
        return dot > 0 ? type.substring(0, dot) : type;
    }

    public ResourceNode withId(String newId) {
        return new ResourceNode(newId, type, properties, metadata, hints);
    }

    public ResourceNode withProperties(Map<String, PropertyValue> newProperties) {
        return new ResourceNode(id, type, newProperties, metadata, hints);
    }

    public ResourceNode withMetadata(Metadata newMetadata) {
        return new ResourceNode(id, type, properties, newMetadata, hints);
    }

    public ResourceNode withHints(List<AdvisoryHint> newHints) {
        return new ResourceNode(id, type, properties, metadata, newHints);
    }
}
