package com.hybridgames.synthesis;

import com.hybridgames.graph.TransitionGraph;

/** An external GR(1) solver. Calls block until the solver is done. */
@FunctionalInterface
public interface GameSolver {
  SynthesisResult solve(TransitionGraph<?> graph, Gr1Specification specification, SynthesisOptions options);
}
