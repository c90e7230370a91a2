package com.hybridgames.geometry;

import java.util.List;

/**
 * A finite union of convex polytopes in {@code R^n}.
 *
 * <p>Regions are immutable. Emptiness is measured in terms of volume: a region without a
 * full-dimensional piece (a point, a facet, an infeasible system) is empty.
 */
public interface Region {
  int dimension();

  /** The convex pieces of this region. A convex region is its own single piece. */
  List<Polytope> pieces();

  Region intersect(Region other);

  Region difference(Region other);

  boolean isFullDimensional();

  default boolean isEmpty() {
    return !isFullDimensional();
  }

  boolean contains(double[] point);

  /**
   * Per-axis {@code [lower, upper]} bounds. Unbounded directions are reported as infinities.
   *
   * @throws IllegalStateException if the region has no point
   */
  double[][] boundingBox();
}
