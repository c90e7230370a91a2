package com.hybridgames.synthesis;

import com.hybridgames.algorithm.EquilibriumRegion;
import com.hybridgames.graph.ActionLabel;
import com.hybridgames.graph.AugmentedTransitionGraph;
import com.hybridgames.graph.Owner;
import com.hybridgames.graph.TransitionGraph;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/** Turns progress maps and equilibrium propositions into GR(1) formulas. */
public final class SpecificationBuilder {
  private SpecificationBuilder() {}

  /** The variable holding the current location of a graph, {@code sloc} or {@code eloc}. */
  public static String locationVariable(Owner owner) {
    return owner == Owner.ENVIRONMENT ? "eloc" : "sloc";
  }

  /**
   * One justice assumption per progress group: whenever the actions of the key are taken
   * forever, a state of the group is visited infinitely often.
   */
  public static <S> List<String> progressAssumptions(AugmentedTransitionGraph<S> graph) {
    String location = locationVariable(graph.owner());
    List<String> formulas = new ArrayList<>();
    for (Map.Entry<ActionLabel, List<Set<S>>> entry : graph.progressMap().entrySet()) {
      String taken = entry.getKey().values().entrySet().stream()
          .map(value -> "%s = \"%s\"".formatted(value.getKey(), value.getValue()))
          .collect(Collectors.joining(" && "));
      for (Set<S> group : entry.getValue()) {
        String visited = group.isEmpty()
            ? "False"
            : group.stream().map(state -> "%s = \"%s\"".formatted(location, state)).collect(Collectors.joining(" || "));
        formulas.add("!(%s) || (%s)".formatted(taken, visited));
      }
    }
    return formulas;
  }

  /** Requires each mode, when kept forever, to end up in its equilibrium region. */
  public static List<String> equilibriumProgress(Map<String, EquilibriumRegion> regions) {
    return regions.values().stream()
        .map(region -> "(%s || %s != \"%s\")".formatted(region.proposition(), TransitionGraph.SYSTEM_ACTIONS,
            region.mode().system()))
        .toList();
  }

  /** Adds the progress assumptions of the graph to the environment progress of the specification. */
  public static <S> Gr1Specification augment(Gr1Specification specification, AugmentedTransitionGraph<S> graph) {
    List<String> assumptions = progressAssumptions(graph);
    return assumptions.isEmpty() ? specification : specification.withEnvProgress(assumptions);
  }
}
