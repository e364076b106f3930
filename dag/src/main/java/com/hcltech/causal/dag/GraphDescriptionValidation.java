package com.hcltech.causal.dag;

import com.hcltech.causal.common.errorsor.ErrorsOr;

import java.util.*;

/**
 * Structural checks on a {@link GraphDescription}: blank or duplicate names, edges naming unknown
 * variables, and self loops. Longer cycles are found while the graph is built.
 */
public interface GraphDescriptionValidation {

    /** Validate and return success (Boolean.TRUE) or all errors via ErrorsOr. Never throws. */
    static ErrorsOr<Boolean> validate(GraphDescription description) {
        Objects.requireNonNull(description);
        List<String> errors = new ArrayList<>();

        Set<String> known = new LinkedHashSet<>();
        for (String v : description.variables()) {
            if (v.isBlank()) {
                errors.add("Blank variable name");
            } else if (!known.add(v)) {
                errors.add("Duplicate variable " + v);
            }
        }

        for (Edge e : description.edges()) {
            if (!known.contains(e.from())) errors.add("Edge " + e + " references unknown variable " + e.from());
            if (!known.contains(e.to())) errors.add("Edge " + e + " references unknown variable " + e.to());
            if (e.from().equals(e.to())) errors.add("Self loop on " + e.from());
        }

        return errors.isEmpty() ? ErrorsOr.lift(Boolean.TRUE) : ErrorsOr.errors(errors);
    }
}
