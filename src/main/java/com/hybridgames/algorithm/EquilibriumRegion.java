package com.hybridgames.algorithm;

import static java.util.Objects.requireNonNull;

import com.hybridgames.geometry.Region;
import com.hybridgames.model.Mode;

public record EquilibriumRegion(String proposition, Mode mode, Region region, Kind kind) {
  public enum Kind {
    UNIQUE_POINT, SUBSPACE, OUT_OF_DOMAIN, DIVERGENT;

    /** Whether the region is a marker outside the state space instead of a set of fixed points. */
    public boolean isMarker() {
      return this == OUT_OF_DOMAIN || this == DIVERGENT;
    }
  }

  public EquilibriumRegion {
    requireNonNull(proposition);
    requireNonNull(mode);
    requireNonNull(region);
    requireNonNull(kind);
  }
}
