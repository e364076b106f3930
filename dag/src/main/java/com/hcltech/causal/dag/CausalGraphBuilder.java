package com.hcltech.causal.dag;

import com.hcltech.causal.common.errorsor.ErrorsOr;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

public final class CausalGraphBuilder {
    private static final Logger log = LoggerFactory.getLogger(CausalGraphBuilder.class);

    private CausalGraphBuilder() {}

    /**
     * Builds a graph from a description, reporting every problem rather than the first one.
     * Edges are inserted in description order; an edge that would close a cycle is reported and skipped
     * so later edges are still checked. Repeated edges collapse into one.
     */
    public static ErrorsOr<CausalGraph> build(GraphDescription description) {
        Objects.requireNonNull(description);

        ErrorsOr<CausalGraph> result = GraphDescriptionValidation.validate(description).flatMap(v -> {
            List<String> errors = new ArrayList<>();
            CausalGraph graph = CausalGraph.assemble(description.variables(), description.edges(),
                    cycle -> errors.add(cycle.getMessage()));
            return errors.isEmpty() ? ErrorsOr.lift(graph) : ErrorsOr.errors(errors);
        });
        result.ifError(errors -> log.debug("Rejected graph description with {} variables: {}", description.variables().size(), errors));
        return result;
    }

    public static ErrorsOr<CausalGraph> build(List<String> variables, List<Edge> edges) {
        return build(new GraphDescription(variables, edges));
    }
}
