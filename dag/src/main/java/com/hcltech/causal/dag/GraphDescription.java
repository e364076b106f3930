package com.hcltech.causal.dag;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * Caller-supplied variable and edge lists, before any validation.
 * Missing lists (e.g. absent JSON fields) are treated as empty.
 */
@JsonPropertyOrder({"variables", "edges"})
public record GraphDescription(List<String> variables, List<Edge> edges) {
    public GraphDescription {
        variables = variables == null ? List.of() : List.copyOf(variables);
        edges = edges == null ? List.of() : List.copyOf(edges);
    }

    public static GraphDescription of(CausalGraph graph) {
        return new GraphDescription(graph.variables(), graph.edges());
    }
}
