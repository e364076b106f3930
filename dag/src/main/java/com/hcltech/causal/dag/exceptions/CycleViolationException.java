package com.hcltech.causal.dag.exceptions;

import java.util.List;

public final class CycleViolationException extends CausalGraphException {
    private final String from;
    private final String to;
    private final List<String> existingPath;

    /**
     * @param existingPath the directed path {@code to -> ... -> from} already in the graph
     */
    public CycleViolationException(String from, String to, List<String> existingPath) {
        super("Edge " + from + " -> " + to + " would close a cycle; existing path " + String.join(" -> ", existingPath));
        this.from = from;
        this.to = to;
        this.existingPath = List.copyOf(existingPath);
    }

    public String from() { return from; }

    public String to() { return to; }

    public List<String> existingPath() { return existingPath; }
}
