package ai.iacgraph.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Graph-level dialect construct with no canonical equivalent (a provider block, a template
 * header, a play header), re-emitted verbatim by its own dialect.
 *
 * @param dialect dialect that produced it
 * @param kind    construct kind, e.g. {@code provider}, {@code template}, {@code play}
 * @param key     identifies the construct among those of the same kind
 * @param body    raw dialect values
 * @param source  declaration site
 */
public record GraphExtension(
        Dialect dialect,
        String kind,
        String key,
        Map<String, Object> body,
        SourceLocation source
) {

    public GraphExtension {
        Objects.requireNonNull(dialect, "dialect");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(key, "key");
        body = body == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(body));
        source = source == null ? SourceLocation.UNKNOWN : source;
    }

    public String identity() {
        return dialect.tag() + ":" + kind + ":" + key;
    }
}
