package com.hybridgames.synthesis;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * A GR(1) specification, kept as formula strings in the input syntax of the solver. Variables map
 * to their domain, for example {@code "boolean"} or {@code "{a, b}"}.
 */
public record Gr1Specification(
    Map<String, String> environmentVariables,
    Map<String, String> systemVariables,
    List<String> environmentInit,
    List<String> systemInit,
    List<String> environmentSafety,
    List<String> systemSafety,
    List<String> environmentProgress,
    List<String> systemProgress) {
  public static final Gr1Specification EMPTY = new Gr1Specification(Map.of(), Map.of(), List.of(), List.of(),
      List.of(), List.of(), List.of(), List.of());

  public Gr1Specification {
    environmentVariables = ImmutableMap.copyOf(requireNonNull(environmentVariables));
    systemVariables = ImmutableMap.copyOf(requireNonNull(systemVariables));
    environmentInit = ImmutableList.copyOf(environmentInit);
    systemInit = ImmutableList.copyOf(systemInit);
    environmentSafety = ImmutableList.copyOf(environmentSafety);
    systemSafety = ImmutableList.copyOf(systemSafety);
    environmentProgress = ImmutableList.copyOf(environmentProgress);
    systemProgress = ImmutableList.copyOf(systemProgress);
  }

  public Gr1Specification withEnvProgress(Collection<String> formulas) {
    return new Gr1Specification(environmentVariables, systemVariables, environmentInit, systemInit,
        environmentSafety, systemSafety, concat(environmentProgress, formulas), systemProgress);
  }

  public Gr1Specification withSysProgress(Collection<String> formulas) {
    return new Gr1Specification(environmentVariables, systemVariables, environmentInit, systemInit,
        environmentSafety, systemSafety, environmentProgress, concat(systemProgress, formulas));
  }

  private static List<String> concat(List<String> existing, Collection<String> added) {
    return ImmutableList.<String>builder().addAll(existing).addAll(added).build();
  }
}
