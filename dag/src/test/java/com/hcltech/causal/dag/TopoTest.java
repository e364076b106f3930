package com.hcltech.causal.dag;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static com.hcltech.causal.dag.CausalGraphFixture.*;
import static org.junit.jupiter.api.Assertions.*;

public class TopoTest {

  @Test
  void chain_oneNodePerGeneration() {
    assertEquals(List.of(Set.of("A"), Set.of("B"), Set.of("C")), Topo.generations(chain()));
  }

  @Test
  void join_parentsShareAGeneration() {
    assertEquals(List.of(Set.of("A", "B"), Set.of("C")), Topo.generations(collider()));
  }

  @Test
  void nodeWaitsForItsLatestParent() {
    // C -> X -> Y and C -> Y: Y must come after X even though C is already placed
    assertEquals(List.of(Set.of("C"), Set.of("X"), Set.of("Y")), Topo.generations(confounded()));
  }

  @Test
  void noEdges_allInFirstGen() {
    assertEquals(List.of(Set.of("X1", "Y1")), Topo.generations(CausalGraph.create("X1", "Y1")));
  }

  @Test
  void emptyGraph_hasNoGenerations() {
    assertEquals(List.of(), Topo.generations(CausalGraph.create(List.of())));
  }

  @Test
  void order_tiesBrokenByConstructionOrder() {
    assertEquals(List.of("Season", "Sprinkler", "Rain", "Wet", "Slippery"), Topo.order(sprinkler()));
    assertEquals(List.of("A", "B", "M", "X", "Y"), Topo.order(mBias()));
  }
}
