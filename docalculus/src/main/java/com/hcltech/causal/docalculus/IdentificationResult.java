package com.hcltech.causal.docalculus;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/** Outcome of an effect identification search. {@code adjustmentSet} is empty when unidentifiable. */
public record IdentificationResult(String treatment, String outcome, IdentificationStrategy strategy, Set<String> adjustmentSet) {
    public IdentificationResult {
        Objects.requireNonNull(treatment, "treatment");
        Objects.requireNonNull(outcome, "outcome");
        Objects.requireNonNull(strategy, "strategy");
        adjustmentSet = Collections.unmodifiableSet(new LinkedHashSet<>(Objects.requireNonNull(adjustmentSet, "adjustmentSet")));
    }

    public static IdentificationResult backdoor(String treatment, String outcome, Set<String> adjustmentSet) {
        return new IdentificationResult(treatment, outcome, IdentificationStrategy.BACKDOOR, adjustmentSet);
    }

    public static IdentificationResult frontdoor(String treatment, String outcome, Set<String> mediators) {
        return new IdentificationResult(treatment, outcome, IdentificationStrategy.FRONTDOOR, mediators);
    }

    public static IdentificationResult unidentifiable(String treatment, String outcome) {
        return new IdentificationResult(treatment, outcome, IdentificationStrategy.UNIDENTIFIABLE, Set.of());
    }

    public boolean isIdentifiable() {
        return strategy != IdentificationStrategy.UNIDENTIFIABLE;
    }
}
