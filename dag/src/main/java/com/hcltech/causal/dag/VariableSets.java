package com.hcltech.causal.dag;

import com.hcltech.causal.dag.exceptions.OverlappingVariableSetsException;
import com.hcltech.causal.dag.exceptions.UnknownVariableException;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/** Argument checks shared by the query operations. */
public final class VariableSets {
    private VariableSets() {}

    /** @throws UnknownVariableException for the first member of any set that is not in {@code g} */
    @SafeVarargs
    public static void requireKnown(CausalGraph g, Collection<String>... sets) {
        for (Collection<String> set : sets) {
            for (String v : Objects.requireNonNull(set, "variable set")) {
                if (!g.contains(v)) throw new UnknownVariableException(v);
            }
        }
    }

    /** @throws OverlappingVariableSetsException naming every variable found in more than one set */
    @SafeVarargs
    public static void requireDisjoint(Collection<String>... sets) {
        Set<String> seen = new LinkedHashSet<>();
        Set<String> shared = new LinkedHashSet<>();
        for (Collection<String> set : sets) {
            for (String v : new LinkedHashSet<>(set)) {
                if (!seen.add(v)) shared.add(v);
            }
        }
        if (!shared.isEmpty()) throw new OverlappingVariableSetsException(shared);
    }
}
