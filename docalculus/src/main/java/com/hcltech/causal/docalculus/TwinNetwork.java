package com.hcltech.causal.docalculus;

import com.hcltech.causal.dag.CausalGraph;
import com.hcltech.causal.dag.Edge;

import java.util.ArrayList;
import java.util.List;

/**
 * Factual and counterfactual worlds side by side: every variable {@code v} gets a counterpart {@code v'}
 * and each edge is copied into both worlds. The worlds share their exogenous noise, which lives outside
 * the graph.
 */
public final class TwinNetwork {
    public static final String COUNTERPART_SUFFIX = "'";

    private TwinNetwork() {}

    public static String counterpart(String variable) {
        return variable + COUNTERPART_SUFFIX;
    }

    /**
     * @throws com.hcltech.causal.dag.exceptions.DuplicateVariableException if a counterpart name already exists in {@code g}
     */
    public static CausalGraph of(CausalGraph g) {
        List<String> names = new ArrayList<>(g.variables());
        for (String v : g.variables()) names.add(counterpart(v));
        List<Edge> edges = new ArrayList<>(g.edges());
        for (Edge e : g.edges()) edges.add(new Edge(counterpart(e.from()), counterpart(e.to())));
        return CausalGraph.create(names, edges);
    }
}
