package com.hcltech.causal.dag;

import java.util.BitSet;
import java.util.Set;

/**
 * Conditional independence read off a DAG, via the ancestral moral graph:
 * <ol>
 *     <li>restrict to the ancestral subgraph of {@code X ∪ Y ∪ Z};</li>
 *     <li>moralize it (marry co-parents, drop directions);</li>
 *     <li>{@code X ⊥ Y | Z} iff {@code Z} separates {@code X} from {@code Y} in the result.</li>
 * </ol>
 * Conditioning on a collider, or on one of its descendants, pulls the collider into the ancestral set,
 * where moralization links its parents; that is what makes its parents dependent.
 */
public final class DSeparation {
    private DSeparation() {}

    /**
     * @return whether {@code x} and {@code y} are d-separated given {@code z}. Vacuously true when {@code x} or {@code y} is empty.
     * @throws com.hcltech.causal.dag.exceptions.UnknownVariableException         if any variable is not in {@code g}
     * @throws com.hcltech.causal.dag.exceptions.OverlappingVariableSetsException if the three sets are not pairwise disjoint
     */
    public static boolean dSeparated(CausalGraph g, Set<String> x, Set<String> y, Set<String> z) {
        VariableSets.requireKnown(g, x, y, z);
        VariableSets.requireDisjoint(x, y, z);
        if (x.isEmpty() || y.isEmpty()) return true;

        BitSet xs = g.indices(x);
        BitSet ys = g.indices(y);
        BitSet zs = g.indices(z);

        BitSet relevant = new BitSet(g.size());
        relevant.or(xs);
        relevant.or(ys);
        relevant.or(zs);
        BitSet ancestral = Reachability.ancestralClosure(g, relevant);

        return MoralGraph.of(g, ancestral).separated(xs, ys, zs);
    }

    public static boolean dSeparated(CausalGraph g, String x, String y, Set<String> z) {
        return dSeparated(g, Set.of(x), Set.of(y), z);
    }
}
