package com.hcltech.causal.dag;

import com.hcltech.causal.dag.exceptions.CycleViolationException;
import com.hcltech.causal.dag.exceptions.DuplicateVariableException;
import com.hcltech.causal.dag.exceptions.UnknownVariableException;

import java.util.*;
import java.util.function.Consumer;

/**
 * Immutable directed acyclic graph over named variables.
 * <p>
 * Variables live in a fixed indexed array (construction order); edges are parent/child bit sets keyed
 * by index. Every mutator returns a new graph and leaves the receiver untouched, so a graph can be shared
 * freely between threads. Acyclicity is checked on every insertion: {@code from -> to} is refused when
 * {@code to} already reaches {@code from}.
 */
public final class CausalGraph {
    private final List<String> variables;
    private final Map<String, Integer> indexOf;
    private final BitSet[] parents;
    private final BitSet[] children;

    private CausalGraph(List<String> variables, Map<String, Integer> indexOf, BitSet[] parents, BitSet[] children) {
        this.variables = variables;
        this.indexOf = indexOf;
        this.parents = parents;
        this.children = children;
    }

    /** An edgeless graph over {@code variables}. Names must be non-blank and unique. */
    public static CausalGraph create(List<String> variables) {
        Objects.requireNonNull(variables, "variables");
        Map<String, Integer> indexOf = new HashMap<>();
        for (String v : variables) {
            if (v == null || v.isBlank()) throw new IllegalArgumentException("Variable names must be non-blank: " + variables);
            if (indexOf.putIfAbsent(v, indexOf.size()) != null) throw new DuplicateVariableException(v);
        }
        int n = variables.size();
        BitSet[] parents = new BitSet[n];
        BitSet[] children = new BitSet[n];
        for (int i = 0; i < n; i++) {
            parents[i] = new BitSet(n);
            children[i] = new BitSet(n);
        }
        return new CausalGraph(List.copyOf(variables), Collections.unmodifiableMap(indexOf), parents, children);
    }

    public static CausalGraph create(String... variables) {
        return create(Arrays.asList(variables));
    }

    /**
     * A graph over {@code variables} holding every edge in {@code edges}, built in one pass: the adjacency
     * arrays are allocated once and each edge is cycle-checked against the edges inserted before it.
     *
     * @throws UnknownVariableException if an edge names a variable not in {@code variables}
     * @throws CycleViolationException  on the first edge that would close a cycle
     */
    public static CausalGraph create(List<String> variables, Collection<Edge> edges) {
        return assemble(variables, edges, cycle -> {
            throw cycle;
        });
    }

    /**
     * As {@link #create(List, Collection)}, but an edge that would close a cycle is handed to {@code onCycle}
     * and skipped, so later edges are still inserted and checked.
     */
    static CausalGraph assemble(List<String> variables, Collection<Edge> edges, Consumer<CycleViolationException> onCycle) {
        Objects.requireNonNull(edges, "edges");
        CausalGraph graph = create(variables);
        for (Edge e : edges) {
            int i = graph.index(e.from());
            int j = graph.index(e.to());
            if (graph.children[i].get(j)) continue;
            List<Integer> existing = Traversal.path(graph.children, j, i);
            if (!existing.isEmpty()) {
                onCycle.accept(new CycleViolationException(e.from(), e.to(), graph.names(existing)));
                continue;
            }
            graph.children[i].set(j);
            graph.parents[j].set(i);
        }
        return graph;
    }

    // ---------- mutators (copy on write) ----------

    /**
     * Adds {@code from -> to}. Adding an edge that is already present returns this graph.
     *
     * @throws UnknownVariableException if either endpoint is not in the graph
     * @throws CycleViolationException  if {@code to} already has a directed path to {@code from} (self loops included)
     */
    public CausalGraph addEdge(String from, String to) {
        int i = index(from);
        int j = index(to);
        if (children[i].get(j)) return this;
        List<Integer> existing = Traversal.path(children, j, i);
        if (!existing.isEmpty()) throw new CycleViolationException(from, to, names(existing));

        BitSet[] p = copy(parents);
        BitSet[] c = copy(children);
        c[i].set(j);
        p[j].set(i);
        return new CausalGraph(variables, indexOf, p, c);
    }

    public CausalGraph addEdge(Edge edge) {
        return addEdge(edge.from(), edge.to());
    }

    /** Removes {@code from -> to}; returns this graph unchanged when the edge is absent. */
    public CausalGraph removeEdge(String from, String to) {
        int i = index(from);
        int j = index(to);
        if (!children[i].get(j)) return this;
        BitSet[] p = copy(parents);
        BitSet[] c = copy(children);
        c[i].clear(j);
        p[j].clear(i);
        return new CausalGraph(variables, indexOf, p, c);
    }

    /** Same variables, with every edge into {@code target} removed. */
    public CausalGraph withoutIncomingEdges(String target) {
        int t = index(target);
        if (parents[t].isEmpty()) return this;
        BitSet[] p = copy(parents);
        BitSet[] c = copy(children);
        for (int i = p[t].nextSetBit(0); i >= 0; i = p[t].nextSetBit(i + 1)) c[i].clear(t);
        p[t].clear();
        return new CausalGraph(variables, indexOf, p, c);
    }

    /** Same variables, with every edge out of any of {@code sources} removed. */
    public CausalGraph withoutOutgoingEdges(Collection<String> sources) {
        BitSet[] p = copy(parents);
        BitSet[] c = copy(children);
        for (String s : sources) {
            int i = index(s);
            for (int j = c[i].nextSetBit(0); j >= 0; j = c[i].nextSetBit(j + 1)) p[j].clear(i);
            c[i].clear();
        }
        return new CausalGraph(variables, indexOf, p, c);
    }

    /** Every edge flipped. Acyclicity is preserved by reversal. */
    public CausalGraph reverse() {
        return new CausalGraph(variables, indexOf, copy(children), copy(parents));
    }

    /** The subgraph induced by {@code keep}: those variables, in this graph's order, and the edges among them. */
    public CausalGraph inducedSubgraph(Collection<String> keep) {
        BitSet k = indices(keep);
        List<String> names = new ArrayList<>();
        for (int i = k.nextSetBit(0); i >= 0; i = k.nextSetBit(i + 1)) names.add(variables.get(i));
        CausalGraph sub = create(names);
        for (int i = k.nextSetBit(0); i >= 0; i = k.nextSetBit(i + 1)) {
            int si = sub.indexOf.get(variables.get(i));
            for (int j = children[i].nextSetBit(0); j >= 0; j = children[i].nextSetBit(j + 1)) {
                if (!k.get(j)) continue;
                int sj = sub.indexOf.get(variables.get(j));
                sub.children[si].set(sj);
                sub.parents[sj].set(si);
            }
        }
        return sub;
    }

    // ---------- queries ----------

    public List<String> variables() {
        return variables;
    }

    public int size() {
        return variables.size();
    }

    public boolean contains(String variable) {
        return indexOf.containsKey(variable);
    }

    public boolean hasEdge(String from, String to) {
        return children[index(from)].get(index(to));
    }

    public Set<String> parents(String variable) {
        return names(parents[index(variable)]);
    }

    public Set<String> children(String variable) {
        return names(children[index(variable)]);
    }

    /** All edges, ordered by source then target construction index. */
    public List<Edge> edges() {
        List<Edge> edges = new ArrayList<>();
        for (int i = 0; i < children.length; i++) {
            for (int j = children[i].nextSetBit(0); j >= 0; j = children[i].nextSetBit(j + 1)) {
                edges.add(new Edge(variables.get(i), variables.get(j)));
            }
        }
        return edges;
    }

    public int edgeCount() {
        int count = 0;
        for (BitSet c : children) count += c.cardinality();
        return count;
    }

    // ---------- index-level access for the kernels in this package ----------

    int index(String variable) {
        Integer i = indexOf.get(Objects.requireNonNull(variable, "variable"));
        if (i == null) throw new UnknownVariableException(variable);
        return i;
    }

    BitSet indices(Collection<String> names) {
        Objects.requireNonNull(names, "variables");
        BitSet bits = new BitSet(variables.size());
        for (String name : names) bits.set(index(name));
        return bits;
    }

    String name(int index) {
        return variables.get(index);
    }

    Set<String> names(BitSet bits) {
        Set<String> out = new LinkedHashSet<>();
        for (int i = bits.nextSetBit(0); i >= 0; i = bits.nextSetBit(i + 1)) out.add(variables.get(i));
        return out;
    }

    private List<String> names(List<Integer> path) {
        List<String> out = new ArrayList<>(path.size());
        for (int i : path) out.add(variables.get(i));
        return out;
    }

    /** Read-only by convention: callers in this package must not mutate the returned arrays. */
    BitSet[] parentIndex() {
        return parents;
    }

    BitSet[] childIndex() {
        return children;
    }

    private static BitSet[] copy(BitSet[] source) {
        BitSet[] out = new BitSet[source.length];
        for (int i = 0; i < source.length; i++) out[i] = (BitSet) source[i].clone();
        return out;
    }

    // ---------- value semantics ----------

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CausalGraph other)) return false;
        return variables.equals(other.variables) && Arrays.equals(children, other.children);
    }

    @Override
    public int hashCode() {
        return 31 * variables.hashCode() + Arrays.hashCode(children);
    }

    @Override
    public String toString() {
        return "CausalGraph(variables=" + variables + ", edges=" + edges() + ")";
    }
}
