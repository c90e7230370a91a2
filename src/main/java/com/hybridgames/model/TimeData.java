package com.hybridgames.model;

import java.util.Objects;
import javax.annotation.Nullable;

/**
 * Time semantics together with its timestep. A timestep is present exactly for sampled
 * semantics and is always positive.
 */
public record TimeData(TimeSemantics semantics, @Nullable Double timestep) {
  public static final TimeData UNSET = new TimeData(TimeSemantics.UNSET, null);
  public static final TimeData DISCRETE = new TimeData(TimeSemantics.DISCRETE, null);

  public TimeData {
    Objects.requireNonNull(semantics);
    if (timestep != null && (timestep.isNaN() || timestep <= 0.0)) {
      throw new TimeSemanticsException("Timestep must be a positive real number or unspecified, got " + timestep);
    }
    if (semantics == TimeSemantics.DISCRETE && timestep != null) {
      throw new TimeSemanticsException("Discrete semantics must not have a timestep");
    }
    if (semantics == TimeSemantics.SAMPLED && timestep == null) {
      throw new TimeSemanticsException("Sampled semantics require a timestep");
    }
    if (semantics == TimeSemantics.UNSET && timestep != null) {
      throw new TimeSemanticsException("A timestep needs sampled semantics");
    }
  }

  public static TimeData sampled(double timestep) {
    return new TimeData(TimeSemantics.SAMPLED, timestep);
  }

  public boolean isUnset() {
    return semantics == TimeSemantics.UNSET;
  }

  @Override
  public String toString() {
    return timestep == null ? semantics.id() : "%s(%s)".formatted(semantics.id(), timestep);
  }
}
