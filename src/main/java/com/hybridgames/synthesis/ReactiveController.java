package com.hybridgames.synthesis;

import static java.util.Objects.requireNonNull;

import java.util.Map;

/** A synthesized strategy, stepped one environment input at a time. */
public interface ReactiveController {
  record Reaction(String nextLocation, Map<String, Object> outputs) {
    public Reaction {
      requireNonNull(nextLocation);
      outputs = Map.copyOf(outputs);
    }
  }

  /**
   * @throws IllegalArgumentException if the inputs are not allowed by the environment in this
   *     location
   */
  Reaction reaction(String location, Map<String, Object> inputs);
}
