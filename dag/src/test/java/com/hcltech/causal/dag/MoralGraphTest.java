package com.hcltech.causal.dag;

import org.junit.jupiter.api.Test;

import java.util.BitSet;
import java.util.Set;

import static com.hcltech.causal.dag.CausalGraphFixture.*;
import static org.junit.jupiter.api.Assertions.*;

class MoralGraphTest {

    private static BitSet all(CausalGraph g) {
        BitSet b = new BitSet();
        b.set(0, g.size());
        return b;
    }

    @Test
    void coParentsAreMarried_andDirectionIsDropped() {
        var g = collider();
        var m = MoralGraph.of(g, all(g));
        int a = g.index("A"), b = g.index("B"), c = g.index("C");
        assertTrue(m.adjacent(a, b));
        assertTrue(m.adjacent(b, a));
        assertTrue(m.adjacent(c, a));
        assertTrue(m.adjacent(a, c));
    }

    @Test
    void onlyTheAncestralSetIsMoralized() {
        // ancestral set of {A, B} excludes C, so A and B stay unmarried
        var g = collider();
        var ancestral = Reachability.ancestralClosure(g, g.indices(Set.of("A", "B")));
        var m = MoralGraph.of(g, ancestral);
        assertFalse(m.adjacent(g.index("A"), g.index("B")));
    }

    @Test
    void separation_removesConditionedNodes() {
        var g = chain();
        var m = MoralGraph.of(g, all(g));
        assertTrue(m.separated(g.indices(Set.of("A")), g.indices(Set.of("C")), g.indices(Set.of("B"))));
        assertFalse(m.separated(g.indices(Set.of("A")), g.indices(Set.of("C")), new BitSet()));
    }
}
