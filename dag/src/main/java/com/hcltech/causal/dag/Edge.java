package com.hcltech.causal.dag;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/** Directed edge {@code from -> to} between two named variables. */
@JsonPropertyOrder({"from", "to"})
public record Edge(String from, String to) {
    public Edge {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
    }

    @Override
    public String toString() {
        return from + " -> " + to;
    }
}
