package com.hcltech.causal.docalculus;

import com.hcltech.causal.dag.CausalGraph;
import com.hcltech.causal.dag.VariableSets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.function.Predicate;
import java.util.stream.Stream;

/**
 * Searches for a set that identifies the effect of a treatment on an outcome: backdoor sets first,
 * then frontdoor sets, smallest first in both phases. Failing both is an {@link IdentificationStrategy#UNIDENTIFIABLE}
 * result, never an exception.
 */
public final class EffectIdentifier {
    private static final Logger log = LoggerFactory.getLogger(EffectIdentifier.class);

    private EffectIdentifier() {}

    /**
     * Tries caller-supplied candidates. They are ordered by size (stably) and each is tried as a backdoor set,
     * then each non-empty one as a frontdoor set. Candidates containing the treatment or outcome are skipped.
     *
     * @throws com.hcltech.causal.dag.exceptions.UnknownVariableException         if a candidate names a variable not in {@code g}
     * @throws com.hcltech.causal.dag.exceptions.OverlappingVariableSetsException if treatment and outcome are the same variable
     */
    public static IdentificationResult identifyEffect(CausalGraph g, String x, String y, Collection<? extends Set<String>> candidates) {
        requireQuery(g, x, y);
        List<Set<String>> ordered = new ArrayList<>();
        for (Set<String> c : candidates) {
            VariableSets.requireKnown(g, c);
            if (c.contains(x) || c.contains(y)) {
                log.debug("Skipping candidate {} for {} -> {}: contains treatment or outcome", c, x, y);
                continue;
            }
            ordered.add(c);
        }
        ordered.sort(Comparator.comparingInt(Set::size));
        return search(g, x, y, ordered.stream(), ordered.stream(), true);
    }

    /** Enumerates candidates from the graph, bounded by {@code config}. All variables count as observed. */
    public static IdentificationResult identifyEffect(CausalGraph g, String x, String y, IdentificationConfig config) {
        return identifyEffect(g, x, y, config, Set.of());
    }

    /**
     * Enumerates candidates from the graph, bounded by {@code config}; {@code unobserved} variables are never
     * proposed for adjustment (they stay in the graph and still open or block paths).
     */
    public static IdentificationResult identifyEffect(CausalGraph g, String x, String y, IdentificationConfig config, Set<String> unobserved) {
        requireQuery(g, x, y);
        Objects.requireNonNull(config, "config");
        VariableSets.requireKnown(g, unobserved);
        return search(g, x, y,
                CandidateSets.backdoor(g, x, y, unobserved, config.maxAdjustmentSetSize()),
                CandidateSets.frontdoor(g, x, y, unobserved, config.maxAdjustmentSetSize()),
                config.frontdoorEnabled());
    }

    private static IdentificationResult search(CausalGraph g, String x, String y,
                                               Stream<Set<String>> backdoorCandidates,
                                               Stream<Set<String>> frontdoorCandidates,
                                               boolean tryFrontdoor) {
        Predicate<Set<String>> validBackdoor = z -> IdentificationCriteria.backdoorCriterion(g, x, y, z);
        Optional<Set<String>> backdoor = backdoorCandidates.filter(validBackdoor).findFirst();
        if (backdoor.isPresent()) {
            log.debug("Effect {} -> {} identified by backdoor set {}", x, y, backdoor.get());
            return IdentificationResult.backdoor(x, y, backdoor.get());
        }
        if (tryFrontdoor) {
            Predicate<Set<String>> validFrontdoor = m -> !m.isEmpty() && IdentificationCriteria.frontdoorCriterion(g, x, y, m);
            Optional<Set<String>> frontdoor = frontdoorCandidates.filter(validFrontdoor).findFirst();
            if (frontdoor.isPresent()) {
                log.debug("Effect {} -> {} identified by frontdoor set {}", x, y, frontdoor.get());
                return IdentificationResult.frontdoor(x, y, frontdoor.get());
            }
        }
        log.debug("Effect {} -> {} is not identifiable from the candidates tried", x, y);
        return IdentificationResult.unidentifiable(x, y);
    }

    private static void requireQuery(CausalGraph g, String x, String y) {
        Objects.requireNonNull(g, "graph");
        VariableSets.requireKnown(g, Set.of(x), Set.of(y));
        VariableSets.requireDisjoint(Set.of(x), Set.of(y));
    }
}
