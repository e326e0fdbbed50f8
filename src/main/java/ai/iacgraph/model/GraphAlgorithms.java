package ai.iacgraph.model;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Cycle and reachability queries over one edge kind. Edges touching a missing node are ignored.
 */
public final class GraphAlgorithms {

    private GraphAlgorithms() {
    }

    /**
     * Adjacency over existing nodes, targets sorted.
     */
    public static Map<String, Set<String>> adjacency(ResourceGraph graph, EdgeKind kind) {
        final Map<String, Set<String>> adj = new TreeMap<>();
        for (ResourceNode n : graph.nodes()) {
            adj.put(n.id(), new TreeSet<>());
        }
        for (DependencyEdge e : graph.edges()) {
            if (e.kind() == kind && adj.containsKey(e.source()) && adj.containsKey(e.target())) {
                adj.get(e.source()).add(e.target());
            }
        }
        return adj;
    }

    /**
     * Every cycle as a strongly connected component (self loops included), members sorted,
     * components ordered by their first member.
     */
    public static List<List<String>> cycles(ResourceGraph graph, EdgeKind kind) {
        final Map<String, Set<String>> adj = adjacency(graph, kind);
        final List<List<String>> out = new ArrayList<>();
        for (List<String> scc : new Tarjan(adj).run()) {
            if (scc.size() > 1 || adj.get(scc.get(0)).contains(scc.get(0))) {
                final List<String> sorted = new ArrayList<>(scc);
                Collections.sort(sorted);
                out.add(sorted);
            }
        }
        out.sort(Comparator.comparing(l -> l.get(0)));
        return out;
    }

    public static boolean hasCycle(ResourceGraph graph, EdgeKind kind) {
        return !cycles(graph, kind).isEmpty();
    }

    /**
     * Whether {@code to} is reachable from {@code from} without using the direct edge between them.
     */
    public static boolean reachableAvoidingDirect(Map<String, Set<String>> adj, String from, String to) {
        final Deque<String> queue = new ArrayDeque<>();
        final Set<String> seen = new HashSet<>();
        for (String next : adj.getOrDefault(from, Set.of())) {
            if (!next.equals(to) && seen.add(next)) {
                queue.add(next);
            }
        }
        while (!queue.isEmpty()) {
            final String cur = queue.poll();
            if (cur.equals(to)) {
                return true;
            }
            for (String next : adj.getOrDefault(cur, Set.of())) {
                if (seen.add(next)) {
                    queue.add(next);
                }
            }
        }
        return false;
    }

    /**
     * Iterative Tarjan, so deep chains do not overflow the stack.
     */
    private static final class Tarjan {
        private final Map<String, Set<String>> adj;
        private final Map<String, Integer> index = new HashMap<>();
        private final Map<String, Integer> low = new HashMap<>();
        private final Deque<String> stack = new ArrayDeque<>();
        private final Set<String> onStack = new HashSet<>();
        private final List<List<String>> result = new ArrayList<>();
        private int counter;

        Tarjan(Map<String, Set<String>> adj) {
            this.adj = adj;
        }

        List<List<String>> run() {
            for (String v : adj.keySet()) {
                if (!index.containsKey(v)) {
                    visit(v);
                }
            }
            return result;
        }

        private void visit(String root) {
            final Deque<Object[]> work = new ArrayDeque<>();
            enter(root);
            work.push(new Object[]{root, adj.get(root).iterator()});
            while (!work.isEmpty()) {
                final Object[] frame = work.peek();
                final String v = (String) frame[0];
                @SuppressWarnings("unchecked")
                final Iterator<String> it = (Iterator<String>) frame[1];
                if (it.hasNext()) {
                    final String w = it.next();
                    if (!index.containsKey(w)) {
                        enter(w);
                        work.push(new Object[]{w, adj.get(w).iterator()});
                    } else if (onStack.contains(w)) {
                        low.put(v, Math.min(low.get(v), index.get(w)));
                    }
                    continue;
                }
                work.pop();
                if (!work.isEmpty()) {
                    final String parent = (String) work.peek()[0];
                    low.put(parent, Math.min(low.get(parent), low.get(v)));
                }
                if (low.get(v).equals(index.get(v))) {
                    final List<String> scc = new ArrayList<>();
                    String w;
                    do {
                        w = stack.pop();
                        onStack.remove(w);
                        scc.add(w);
                    } while (!w.equals(v));
                    result.add(scc);
                }
            }
        }

        private void enter(String v) {
            index.put(v, counter);
            low.put(v, counter);
            counter++;
            stack.push(v);
            onStack.add(v);
        }
    }
}
