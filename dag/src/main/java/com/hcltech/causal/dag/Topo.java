package com.hcltech.causal.dag;

import java.util.*;

/** Topological layering of a {@link CausalGraph}: parents always come before children. */
public final class Topo {
    private Topo() {}

    /**
     * Kahn's algorithm by generation. Generation 0 holds the roots; every other variable sits one
     * generation after its latest parent. Within a generation, variables keep construction order.
     */
    public static List<Set<String>> generations(CausalGraph g) {
        int n = g.size();
        BitSet[] children = g.childIndex();
        int[] indeg = new int[n];
        for (int i = 0; i < n; i++) indeg[i] = g.parentIndex()[i].cardinality();

        List<Set<String>> gens = new ArrayList<>();
        BitSet current = new BitSet(n);
        for (int i = 0; i < n; i++) if (indeg[i] == 0) current.set(i);

        while (!current.isEmpty()) {
            gens.add(g.names(current));
            BitSet next = new BitSet(n);
            for (int i = current.nextSetBit(0); i >= 0; i = current.nextSetBit(i + 1)) {
                for (int m = children[i].nextSetBit(0); m >= 0; m = children[i].nextSetBit(m + 1)) {
                    if (--indeg[m] == 0) next.set(m);
                }
            }
            current = next;
        }
        return gens;
    }

    /** {@link #generations} flattened: an order in which structural equations can be evaluated. */
    public static List<String> order(CausalGraph g) {
        List<String> order = new ArrayList<>(g.size());
        for (Set<String> gen : generations(g)) order.addAll(gen);
        return order;
    }
}
