package com.hybridgames.synthesis;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;

import com.hybridgames.algorithm.EquilibriumRegion;
import com.hybridgames.geometry.Regions;
import com.hybridgames.graph.ActionLabel;
import com.hybridgames.graph.AugmentedTransitionGraph;
import com.hybridgames.graph.Owner;
import com.hybridgames.graph.TransitionGraph;
import com.hybridgames.model.Mode;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class SpecificationBuilderTest {
  @Test
  void oneAssumptionPerProgressGroup() {
    AugmentedTransitionGraph<String> graph = AugmentedTransitionGraph.closed("modes", "mode0");
    graph.addStates(List.of("s0", "s1", "s2"));
    graph.setProgressGroups(ActionLabel.of(TransitionGraph.SYSTEM_ACTIONS, "mode0"),
        List.of(List.of("s0", "s1"), List.of("s2")));

    assertEquals(List.of(
            "!(sys_actions = \"mode0\") || (sloc = \"s0\" || sloc = \"s1\")",
            "!(sys_actions = \"mode0\") || (sloc = \"s2\")"),
        SpecificationBuilder.progressAssumptions(graph));
  }

  @Test
  void environmentGraphsUseEnvironmentLocation() {
    AugmentedTransitionGraph<String> graph = AugmentedTransitionGraph.open("plant", Owner.ENVIRONMENT);
    graph.actions().addValues(TransitionGraph.ENVIRONMENT_ACTIONS, List.of("wind"));
    graph.actions().addValues(TransitionGraph.SYSTEM_ACTIONS, List.of("brake"));
    graph.addStates(List.of("p0", "p1"));
    graph.setProgressGroups(ActionLabel.of(TransitionGraph.ENVIRONMENT_ACTIONS, "wind",
        TransitionGraph.SYSTEM_ACTIONS, "brake"), List.of(List.of("p1"), List.of()));

    assertEquals(List.of(
            "!(env_actions = \"wind\" && sys_actions = \"brake\") || (eloc = \"p1\")",
            "!(env_actions = \"wind\" && sys_actions = \"brake\") || (False)"),
        SpecificationBuilder.progressAssumptions(graph));
  }

  @Test
  void equilibriumProgressPerMode() {
    Map<String, EquilibriumRegion> regions = new LinkedHashMap<>();
    regions.put("eqpnt_cool", new EquilibriumRegion("eqpnt_cool", new Mode("0", "cool"), Regions.interval(0, 1),
        EquilibriumRegion.Kind.UNIQUE_POINT));
    assertEquals(List.of("(eqpnt_cool || sys_actions != \"cool\")"),
        SpecificationBuilder.equilibriumProgress(regions));
  }

  @Test
  void augmentAddsEnvironmentProgress() {
    AugmentedTransitionGraph<String> graph = AugmentedTransitionGraph.closed("modes", "mode0");
    graph.addState("s0");
    assertSame(Gr1Specification.EMPTY, SpecificationBuilder.augment(Gr1Specification.EMPTY, graph));

    graph.setProgressGroups(ActionLabel.of(TransitionGraph.SYSTEM_ACTIONS, "mode0"), List.of(List.of("s0")));
    Gr1Specification specification = Gr1Specification.EMPTY.withSysProgress(List.of("sloc = \"s0\""));
    Gr1Specification augmented = SpecificationBuilder.augment(specification, graph);
    assertEquals(List.of("!(sys_actions = \"mode0\") || (sloc = \"s0\")"), augmented.environmentProgress());
    assertEquals(specification.systemProgress(), augmented.systemProgress());
  }
}
