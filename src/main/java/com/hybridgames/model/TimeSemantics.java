package com.hybridgames.model;

import java.util.Locale;

public enum TimeSemantics {
  /** The system is discrete-time by nature. */
  DISCRETE,
  /** The system is sampled from a continuous-time system with a fixed timestep. */
  SAMPLED,
  UNSET;

  public String id() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static TimeSemantics parse(String string) {
    return switch (string.toLowerCase(Locale.ROOT)) {
      case "discrete" -> DISCRETE;
      case "sampled" -> SAMPLED;
      case "unset", "none" -> UNSET;
      default -> throw new TimeSemanticsException(
          "Time semantics must be discrete or sampled (sampled from continuous time system), got " + string);
    };
  }
}
