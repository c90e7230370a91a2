package com.hybridgames.synthesis;

import static java.util.Objects.requireNonNull;

public record SynthesisOptions(String solver, boolean ignoreEnvironmentInit, boolean removeDeadEnds) {
  public static final SynthesisOptions DEFAULT = new SynthesisOptions("omega", false, false);

  public SynthesisOptions {
    requireNonNull(solver);
  }

  public SynthesisOptions withSolver(String solver) {
    return new SynthesisOptions(solver, ignoreEnvironmentInit, removeDeadEnds);
  }
}
