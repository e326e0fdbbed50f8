package ai.iacgraph.parse.hcl;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A block such as {@code resource "aws_vpc" "main" { ... }}.
 * <p>
 * Body values are String, Long, BigDecimal, Boolean, null, List, Map or
 * {@link ai.iacgraph.model.RawExpression}. Repeated nested blocks are collected into a List of Maps
 * under their type; labeled nested blocks use the key {@code type "label"}.
 *
 * @param nestedBlocks body keys written with block syntax
 */
public record HclBlock(String type, List<String> labels, Map<String, Object> body,
                       Set<String> nestedBlocks, int line) {

    public HclBlock {
        labels = List.copyOf(labels);
        body = Collections.unmodifiableMap(new LinkedHashMap<>(body));
        nestedBlocks = Collections.unmodifiableSet(new LinkedHashSet<>(nestedBlocks));
    }

    public String label(int i) {
        return i < labels.size() ? labels.get(i) : null;
    }
}
