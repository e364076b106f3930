package com.hcltech.causal.dag;

import java.util.BitSet;
import java.util.Collection;
import java.util.Objects;
import java.util.Set;

/**
 * Ancestor, descendant and path queries. All results are freshly computed sets in graph order;
 * the graph is never modified. Each traversal is a worklist walk bounded by {@code O(|V| + |E|)}.
 */
public final class Reachability {
    private Reachability() {}

    /** Every variable with a directed path to {@code v}, excluding {@code v}. */
    public static Set<String> ancestors(CausalGraph g, String v) {
        return g.names(ancestorIndices(g, v));
    }

    /** Every variable reachable from {@code v} by a directed path, excluding {@code v}. */
    public static Set<String> descendants(CausalGraph g, String v) {
        return g.names(descendantIndices(g, v));
    }

    /** Descendants of any member of {@code vs}, excluding members that no other member reaches. */
    public static Set<String> descendants(CausalGraph g, Collection<String> vs) {
        return g.names(Traversal.reach(g.childIndex(), g.indices(vs), new BitSet()));
    }

    /** Parents, children and the children's other parents of {@code v}. */
    public static Set<String> markovBlanket(CausalGraph g, String v) {
        int i = g.index(v);
        BitSet blanket = new BitSet(g.size());
        blanket.or(g.parentIndex()[i]);
        BitSet kids = g.childIndex()[i];
        blanket.or(kids);
        for (int c = kids.nextSetBit(0); c >= 0; c = kids.nextSetBit(c + 1)) blanket.or(g.parentIndex()[c]);
        blanket.clear(i);
        return g.names(blanket);
    }

    /** The subgraph induced on {@code s} together with all ancestors of its members. */
    public static CausalGraph ancestralSubgraph(CausalGraph g, Collection<String> s) {
        return g.inducedSubgraph(g.names(ancestralClosure(g, g.indices(s))));
    }

    /**
     * Whether a directed path {@code from -> ... -> to} exists whose interior nodes avoid {@code avoiding}.
     * A variable trivially reaches itself. The endpoints themselves are never treated as blocked.
     */
    public static boolean hasDirectedPath(CausalGraph g, String from, String to, Collection<String> avoiding) {
        int i = g.index(from);
        int j = g.index(to);
        if (i == j) return true;
        BitSet blocked = g.indices(Objects.requireNonNull(avoiding, "avoiding"));
        blocked.clear(i);
        blocked.clear(j);
        BitSet start = new BitSet(g.size());
        start.set(i);
        return Traversal.reach(g.childIndex(), start, blocked).get(j);
    }

    public static boolean hasDirectedPath(CausalGraph g, String from, String to) {
        return hasDirectedPath(g, from, to, Set.of());
    }

    // ---------- index level, shared with d-separation ----------

    static BitSet ancestorIndices(CausalGraph g, String v) {
        return Traversal.reach(g.parentIndex(), g.index(v));
    }

    static BitSet descendantIndices(CausalGraph g, String v) {
        return Traversal.reach(g.childIndex(), g.index(v));
    }

    /** {@code s} united with the ancestors of its members. */
    static BitSet ancestralClosure(CausalGraph g, BitSet s) {
        BitSet closure = Traversal.reach(g.parentIndex(), s, new BitSet());
        closure.or(s);
        return closure;
    }
}
