package com.hcltech.causal.docalculus;

import com.hcltech.causal.common.errorsor.ErrorsOr;
import com.hcltech.causal.dag.CausalGraph;
import com.hcltech.causal.dag.DSeparation;
import com.hcltech.causal.dag.Reachability;
import com.hcltech.causal.dag.VariableSets;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Checks a proposed adjustment set before it is handed to an estimator of
 * {@code P(y | do(x)) = Σ_z P(y | x, z) P(z)}.
 */
public final class AdjustmentFormula {
    private AdjustmentFormula() {}

    /**
     * @return {@code z} when it satisfies the backdoor criterion, otherwise every reason it does not.
     * Unknown or overlapping variables are reported as errors too.
     */
    public static ErrorsOr<Set<String>> adjustmentSet(CausalGraph g, String x, String y, Set<String> z) {
        return ErrorsOr.trying(() -> {
            VariableSets.requireKnown(g, Set.of(x), Set.of(y), z);
            VariableSets.requireDisjoint(Set.of(x), Set.of(y), z);
            return Boolean.TRUE;
        }).flatMap(ok -> {
            List<String> errors = new ArrayList<>();
            Set<String> descendants = new LinkedHashSet<>(Reachability.descendants(g, x));
            descendants.retainAll(z);
            if (!descendants.isEmpty()) {
                errors.add("Adjustment set " + z + " contains descendants of " + x + ": " + descendants);
            }
            if (!DSeparation.dSeparated(g.withoutOutgoingEdges(Set.of(x)), Set.of(x), Set.of(y), z)) {
                errors.add("Adjustment set " + z + " leaves a backdoor path from " + x + " to " + y + " open");
            }
            return errors.isEmpty() ? ErrorsOr.lift(Set.copyOf(z)) : ErrorsOr.errors(errors);
        });
    }
}
