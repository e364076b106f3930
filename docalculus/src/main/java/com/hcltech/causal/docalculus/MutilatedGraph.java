package com.hcltech.causal.docalculus;

import com.hcltech.causal.dag.CausalGraph;

import java.util.Objects;

/**
 * The graph after {@code do(target = value)}: no edges enter {@code target}.
 * {@code value} is carried for structural-equation evaluators and does not affect the topology; it may be
 * {@code null}.
 */
public record MutilatedGraph<V>(CausalGraph graph, String target, V value) {
    public MutilatedGraph {
        Objects.requireNonNull(graph, "graph");
        Objects.requireNonNull(target, "target");
    }
}
