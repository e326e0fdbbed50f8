package ai.iacgraph.model;

import java.util.Collections;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Directed relation between two nodes. At most one edge exists per (source, kind, target);
 * several reasons for the same relation are merged into {@link #origins()}.
 */
public record DependencyEdge(String source, String target, EdgeKind kind, Set<EdgeOrigin> origins) {

    public static final Comparator<DependencyEdge> ORDER = Comparator
            .comparing(DependencyEdge::source)
            .thenComparing(DependencyEdge::kind)
            .thenComparing(DependencyEdge::target);

    public DependencyEdge {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(kind, "kind");
        final EnumSet<EdgeOrigin> copy = EnumSet.noneOf(EdgeOrigin.class);
        if (origins != null) {
            copy.addAll(origins);
        }
        origins = Collections.unmodifiableSet(copy);
    }

    public static DependencyEdge dependsOn(String source, String target, EdgeOrigin origin) {
        return new DependencyEdge(source, target, EdgeKind.DEPENDS_ON, EnumSet.of(origin));
    }

    public static DependencyEdge contains(String owner, String owned) {
        return new DependencyEdge(owner, owned, EdgeKind.CONTAINS, EnumSet.of(EdgeOrigin.OWNERSHIP));
    }

    public String key() {
        return key(source, kind, target);
    }

    public static String key(String source, EdgeKind kind, String target) {
        return source + " -" + (kind == EdgeKind.CONTAINS ? "contains" : "depends-on") + "-> " + target;
    }

    public boolean hasOrigin(EdgeOrigin origin) {
        return origins.contains(origin);
    }

    public DependencyEdge withOrigins(Set<EdgeOrigin> newOrigins) {
        return new DependencyEdge(source, target, kind, newOrigins);
    }

    public DependencyEdge merge(DependencyEdge other) {
        final EnumSet<EdgeOrigin> all = EnumSet.noneOf(EdgeOrigin.class);
        all.addAll(origins);
        all.addAll(other.origins);
        return withOrigins(all);
    }

    public DependencyEdge withEndpoints(String newSource, String newTarget) {
        return new DependencyEdge(newSource, newTarget, kind, origins);
    }

    @Override
    public String toString() {
        return key();
    }
}
