package com.hcltech.causal.docalculus;

import com.hcltech.causal.dag.CausalGraph;
import com.hcltech.causal.dag.DSeparation;
import com.hcltech.causal.dag.Reachability;
import com.hcltech.causal.dag.VariableSets;

import java.util.Collections;
import java.util.Set;

/**
 * Backdoor and frontdoor criteria, decided with full d-separation.
 */
public final class IdentificationCriteria {
    private IdentificationCriteria() {}

    /**
     * {@code z} is a valid backdoor adjustment set for the effect of {@code x} on {@code y} iff
     * no member of {@code z} descends from {@code x}, and {@code z} d-separates {@code x} from {@code y}
     * once every edge out of {@code x} has been removed.
     *
     * @throws com.hcltech.causal.dag.exceptions.UnknownVariableException         for variables not in {@code g}
     * @throws com.hcltech.causal.dag.exceptions.OverlappingVariableSetsException if x, y and z are not pairwise disjoint
     */
    public static boolean backdoorCriterion(CausalGraph g, Set<String> x, Set<String> y, Set<String> z) {
        VariableSets.requireKnown(g, x, y, z);
        VariableSets.requireDisjoint(x, y, z);
        if (!Collections.disjoint(Reachability.descendants(g, x), z)) return false;
        return DSeparation.dSeparated(g.withoutOutgoingEdges(x), x, y, z);
    }

    public static boolean backdoorCriterion(CausalGraph g, String x, String y, Set<String> z) {
        return backdoorCriterion(g, Set.of(x), Set.of(y), z);
    }

    /**
     * {@code m} is a valid frontdoor set for the effect of {@code x} on {@code y} iff
     * <ol>
     *     <li>every directed path from {@code x} to {@code y} passes through {@code m};</li>
     *     <li>there is no open backdoor path from {@code x} to {@code m};</li>
     *     <li>{@code x} blocks every backdoor path from {@code m} to {@code y}.</li>
     * </ol>
     * An empty {@code m} is never a frontdoor set.
     */
    public static boolean frontdoorCriterion(CausalGraph g, String x, String y, Set<String> m) {
        VariableSets.requireKnown(g, Set.of(x), Set.of(y), m);
        VariableSets.requireDisjoint(Set.of(x), Set.of(y), m);
        if (m.isEmpty()) return false;
        if (Reachability.hasDirectedPath(g, x, y, m)) return false;
        if (!backdoorCriterion(g, Set.of(x), m, Set.of())) return false;
        return backdoorCriterion(g, m, Set.of(y), Set.of(x));
    }
}
