package com.hcltech.causal.dag.exceptions;

import java.util.Set;

public final class OverlappingVariableSetsException extends CausalGraphException {
    private final Set<String> shared;

    public OverlappingVariableSetsException(Set<String> shared) {
        super("Variable sets must be pairwise disjoint; shared: " + shared);
        this.shared = Set.copyOf(shared);
    }

    public Set<String> shared() { return shared; }
}
