package com.hcltech.causal.docalculus;

import com.hcltech.causal.dag.CausalGraph;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static com.hcltech.causal.docalculus.IdentificationFixture.*;
import static org.junit.jupiter.api.Assertions.assertEquals;

/** Graphs are immutable and queries keep no shared state, so one graph can be queried from many threads. */
class ConcurrentIdentificationTest {

    @Test
    void parallelQueriesOnOneGraphAgreeWithSequentialOnes() {
        CausalGraph g = twoConfounders();
        List<Set<String>> candidates = CandidateSets.backdoor(g, "X", "Y", Set.of(), 3).collect(Collectors.toList());
        List<Boolean> sequential = candidates.stream()
                .map(z -> IdentificationCriteria.backdoorCriterion(g, "X", "Y", z))
                .collect(Collectors.toList());

        for (int round = 0; round < 20; round++) {
            List<Boolean> parallel = candidates.parallelStream()
                    .map(z -> IdentificationCriteria.backdoorCriterion(g, "X", "Y", z))
                    .collect(Collectors.toList());
            assertEquals(sequential, parallel);
        }
    }

    @Test
    void parallelEffectIdentification() {
        CausalGraph g = frontdoor();
        List<IdentificationResult> results = IntStream.range(0, 200).parallel()
                .mapToObj(i -> EffectIdentifier.identifyEffect(g, "X", "Y", IdentificationConfig.DEFAULT, Set.of("U")))
                .collect(Collectors.toList());
        results.forEach(r -> assertEquals(IdentificationResult.frontdoor("X", "Y", Set.of("M")), r));
    }
}
