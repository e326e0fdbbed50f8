package ai.iacgraph.parse;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import ai.iacgraph.model.SourceLocation;

/**
 * One dialect-native declaration, before any cross-resource resolution.
 *
 * @param kind       construct kind
 * @param nativeType dialect type name ({@code aws_instance}, {@code AWS::S3::Bucket},
 *                   {@code Deployment}, {@code ansible.builtin.apt}); for extensions the
 *                   extension kind ({@code provider}, {@code template}, {@code play})
 * @param name       dialect-local name (label, logical id, object name, task name)
 * @param body       raw attribute values
 * @param blockKeys  body keys written with nested block syntax (HCL only)
 * @param scope      grouping within the file (the play of an Ansible task, the namespace of a manifest), or null
 * @param source     declaration site
 */
public record SourceBlock(
        BlockKind kind,
        String nativeType,
        String name,
        Map<String, Object> body,
        Set<String> blockKeys,
        String scope,
        SourceLocation source
) {

    public SourceBlock {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(nativeType, "nativeType");
        name = name == null ? "" : name;
        body = body == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(body));
        blockKeys = blockKeys == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(blockKeys));
        source = source == null ? SourceLocation.UNKNOWN : source;
    }

    public SourceBlock(BlockKind kind, String nativeType, String name, Map<String, Object> body, SourceLocation source) {
        this(kind, nativeType, name, body, Set.of(), null, source);
    }

    public Object get(String key) {
        return body.get(key);
    }
}
