package ai.iacgraph.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Metadata bag of a resource: everything the canonical model has no slot for, preserved verbatim
 * so the originating dialect can re-emit it.
 * <p>
 * Raw values are dialect AST values: String, Long, BigDecimal, Boolean, null, List, Map and
 * {@link RawExpression}.
 *
 * @param origin           dialect the resource was normalized from (null for synthesized nodes)
 * @param nativeType       dialect type name (e.g. {@code aws_instance}, {@code AWS::EC2::Instance})
 * @param source           where the resource was declared
 * @param nativeNames      canonical property name -> native spelling, when not derivable by convention
 * @param blockProperties  properties written with nested block syntax in the origin dialect
 * @param opaqueProperties native property name -> raw value that did not match the property schema
 * @param extensions       dialect-only attributes (count, deletion policies, task keywords ...)
 * @param originalBlock    complete raw block, kept for unknown types
 */
public record Metadata(
        Dialect origin,
        String nativeType,
        SourceLocation source,
        Map<String, String> nativeNames,
        Set<String> blockProperties,
        Map<String, Object> opaqueProperties,
        Map<String, Object> extensions,
        Map<String, Object> originalBlock
) {

    public static final Metadata EMPTY = new Metadata(null, null, SourceLocation.UNKNOWN,
            Map.of(), Set.of(), Map.of(), Map.of(), Map.of());

    public Metadata {
        source = source == null ? SourceLocation.UNKNOWN : source;
        nativeNames = ordered(nativeNames);
        blockProperties = blockProperties == null
                ? Set.of()
                : Collections.unmodifiableSet(new LinkedHashSet<>(blockProperties));
        opaqueProperties = ordered(opaqueProperties);
        extensions = ordered(extensions);
        originalBlock = ordered(originalBlock);
    }

    public static Metadata of(Dialect origin, String nativeType, SourceLocation source) {
        return new Metadata(origin, nativeType, source, Map.of(), Set.of(), Map.of(), Map.of(), Map.of());
    }

    public boolean originatesFrom(Dialect dialect) {
        return origin != null && origin == dialect;
    }

    public Metadata withSource(SourceLocation newSource) {
        return new Metadata(origin, nativeType, newSource, nativeNames, blockProperties,
                opaqueProperties, extensions, originalBlock);
    }

    public Metadata withExtensions(Map<String, Object> newExtensions) {
        return new Metadata(origin, nativeType, source, nativeNames, blockProperties,
                opaqueProperties, newExtensions, originalBlock);
    }

    public Metadata withNativeNames(Map<String, String> names) {
        return new Metadata(origin, nativeType, source, names, blockProperties,
                opaqueProperties, extensions, originalBlock);
    }

    public Metadata withBlockProperties(Set<String> names) {
        return new Metadata(origin, nativeType, source, nativeNames, names,
                opaqueProperties, extensions, originalBlock);
    }

    public Metadata withOpaqueProperties(Map<String, Object> opaque) {
        return new Metadata(origin, nativeType, source, nativeNames, blockProperties,
                opaque, extensions, originalBlock);
    }

    public Metadata withOriginalBlock(Map<String, Object> block) {
        return new Metadata(origin, nativeType, source, nativeNames, blockProperties,
                opaqueProperties, extensions, block);
    }

    /**
     * Same bag without the declaration site; two declarations are "the same" when these match.
     */
    public Metadata withoutSource() {
        return withSource(SourceLocation.UNKNOWN);
    }

    public Object extension(String key) {
        return extensions.get(key);
    }

    private static <V> Map<String, V> ordered(Map<String, V> in) {
        if (in == null || in.isEmpty()) {
            return Map.of();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(in));
    }
}
