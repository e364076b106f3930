package com.hcltech.causal.docalculus;

import com.hcltech.causal.dag.CausalGraph;

import java.util.Objects;

public final class Interventions {
    private Interventions() {}

    /**
     * {@code do(x = value)}: a new graph equal to {@code g} minus every edge into {@code x}. The input graph is
     * untouched, and intervening again on the same variable changes nothing further.
     *
     * @throws com.hcltech.causal.dag.exceptions.UnknownVariableException if {@code x} is not in {@code g}
     */
    public static <V> MutilatedGraph<V> intervene(CausalGraph g, String x, V value) {
        Objects.requireNonNull(g, "graph");
        return new MutilatedGraph<>(g.withoutIncomingEdges(x), x, value);
    }
}
