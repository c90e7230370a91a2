package com.hybridgames.synthesis;

import static java.util.Objects.requireNonNull;

import com.google.common.base.Stopwatch;
import com.hybridgames.graph.ActionConstraints;
import com.hybridgames.graph.AugmentedTransitionGraph;
import com.hybridgames.graph.TransitionGraph;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/** Validates a graph, completes the specification and hands both to the solver. */
public final class Synthesizer {
  private static final Logger logger = Logger.getLogger(Synthesizer.class.getName());

  private final GameSolver solver;

  public Synthesizer(GameSolver solver) {
    this.solver = requireNonNull(solver);
  }

  /**
   * @throws com.hybridgames.model.ActionConstraintException if an edge violates the selection mode
   *     of an action group
   */
  public SynthesisResult synthesize(TransitionGraph<?> graph, Gr1Specification specification,
      SynthesisOptions options) {
    ActionConstraints.validate(graph);
    Gr1Specification complete = graph instanceof AugmentedTransitionGraph<?> augmented
        ? SpecificationBuilder.augment(specification, augmented)
        : specification;

    Stopwatch stopwatch = Stopwatch.createStarted();
    SynthesisResult result = requireNonNull(solver.solve(graph, complete, options), "solver result");
    logger.log(Level.INFO, () -> "Solver %s finished on %s in %d ms, realizable: %s".formatted(options.solver(),
        graph.name(), stopwatch.elapsed(TimeUnit.MILLISECONDS), result.isRealizable()));
    if (result instanceof SynthesisResult.Unrealizable unrealizable) {
      logger.log(Level.FINE, () -> "Unrealizable: " + unrealizable.reason());
    }
    return result;
  }
}
