package com.hybridgames.model;

import static java.util.Objects.requireNonNull;

/** A discrete (environment label, system label) pair selecting the active dynamics. */
public record Mode(String environment, String system) implements Comparable<Mode> {
  public Mode {
    requireNonNull(environment, "environment label");
    requireNonNull(system, "system label");
  }

  public static Mode of(Object environment, Object system) {
    return new Mode(String.valueOf(environment), String.valueOf(system));
  }

  @Override
  public int compareTo(Mode o) {
    int environmentComparison = environment.compareTo(o.environment);
    return environmentComparison != 0 ? environmentComparison : system.compareTo(o.system);
  }

  @Override
  public String toString() {
    return "(%s,%s)".formatted(environment, system);
  }
}
