package com.hcltech.causal.dag;

import java.util.BitSet;

/**
 * Undirected moral graph of the subgraph of a {@link CausalGraph} induced by an ancestral set:
 * every parent-child edge made undirected, plus an edge between every pair of co-parents.
 * Indices are the source graph's indices; nodes outside the ancestral set have no neighbours.
 */
final class MoralGraph {
    private final BitSet[] neighbours;

    private MoralGraph(BitSet[] neighbours) {
        this.neighbours = neighbours;
    }

    /** @param ancestral must be closed under parents in {@code g} */
    static MoralGraph of(CausalGraph g, BitSet ancestral) {
        int n = g.size();
        BitSet[] parents = g.parentIndex();
        BitSet[] nb = new BitSet[n];
        for (int i = 0; i < n; i++) nb[i] = new BitSet(n);

        for (int v = ancestral.nextSetBit(0); v >= 0; v = ancestral.nextSetBit(v + 1)) {
            BitSet ps = parents[v];
            for (int p = ps.nextSetBit(0); p >= 0; p = ps.nextSetBit(p + 1)) {
                nb[p].set(v);
                nb[v].set(p);
                // marry co-parents
                for (int q = ps.nextSetBit(p + 1); q >= 0; q = ps.nextSetBit(q + 1)) {
                    nb[p].set(q);
                    nb[q].set(p);
                }
            }
        }
        return new MoralGraph(nb);
    }

    boolean adjacent(int a, int b) {
        return neighbours[a].get(b);
    }

    /** True iff removing {@code z} leaves no undirected path from any node of {@code x} to any node of {@code y}. */
    boolean separated(BitSet x, BitSet y, BitSet z) {
        BitSet reached = Traversal.reach(neighbours, x, z);
        reached.or(x);
        return !reached.intersects(y);
    }
}
