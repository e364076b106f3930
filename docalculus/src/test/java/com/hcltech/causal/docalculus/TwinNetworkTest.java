package com.hcltech.causal.docalculus;

import com.hcltech.causal.dag.CausalGraph;
import com.hcltech.causal.dag.DSeparation;
import com.hcltech.causal.dag.Edge;
import com.hcltech.causal.dag.exceptions.DuplicateVariableException;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static com.hcltech.causal.docalculus.IdentificationFixture.*;
import static org.junit.jupiter.api.Assertions.*;

class TwinNetworkTest {

    @Test
    void counterpartAppendsAPrime() {
        assertEquals("X'", TwinNetwork.counterpart("X"));
    }

    @Test
    void everyVariableAndEdgeIsDuplicated() {
        CausalGraph twin = TwinNetwork.of(mediator());
        assertEquals(List.of("X", "M", "Y", "X'", "M'", "Y'"), twin.variables());
        assertEquals(2 * mediator().edgeCount(), twin.edgeCount());
        assertTrue(twin.hasEdge("X", "M"));
        assertTrue(twin.hasEdge("X'", "M'"));
        assertFalse(twin.hasEdge("X", "M'"));
    }

    @Test
    void worldsAreDisconnectedInTheGraph() {
        CausalGraph twin = TwinNetwork.of(confounded());
        assertTrue(DSeparation.dSeparated(twin, Set.of("X", "Y", "C"), Set.of("X'", "Y'", "C'"), Set.of()));
    }

    @Test
    void emptyGraph_givesEmptyTwin() {
        assertEquals(0, TwinNetwork.of(CausalGraph.create(List.of())).size());
    }

    @Test
    void nameClash_isRejected() {
        CausalGraph g = CausalGraph.create("X", "X'");
        assertThrows(DuplicateVariableException.class, () -> TwinNetwork.of(g));
    }

    @Test
    void largeGraph_isDuplicatedQuickly() {
        List<String> names = new ArrayList<>();
        for (int i = 0; i < 2000; i++) names.add("v" + i);
        List<Edge> edges = new ArrayList<>();
        for (int i = 0; i + 1 < names.size(); i++) {
            edges.add(new Edge(names.get(i), names.get(i + 1)));
            if (i + 7 < names.size()) edges.add(new Edge(names.get(i), names.get(i + 7)));
        }
        CausalGraph g = CausalGraph.create(names, edges);

        CausalGraph twin = assertTimeoutPreemptively(Duration.ofSeconds(3), () -> TwinNetwork.of(g));
        assertEquals(4000, twin.size());
        assertEquals(2 * g.edgeCount(), twin.edgeCount());
        assertTrue(twin.hasEdge("v10'", "v17'"));
    }
}
