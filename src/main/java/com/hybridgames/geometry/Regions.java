package com.hybridgames.geometry;

import static com.google.common.base.Preconditions.checkArgument;

import java.util.Collection;
import java.util.List;
import java.util.stream.Stream;

public final class Regions {
  private Regions() {}

  public static Region box(double[][] bounds) {
    return Polytope.box(bounds);
  }

  /** Closed interval {@code [lower, upper]} as a one-dimensional box. */
  public static Region interval(double lower, double upper) {
    return Polytope.box(new double[][] {{lower, upper}});
  }

  public static Region empty(int dimension) {
    checkArgument(dimension > 0, "Dimension must be positive");
    return new PolytopeUnion(dimension, List.of());
  }

  public static Region union(int dimension, Collection<Polytope> pieces) {
    if (pieces.size() == 1) {
      Polytope single = pieces.iterator().next();
      checkArgument(single.dimension() == dimension, "Piece has dimension %s, expected %s",
          single.dimension(), dimension);
      return single;
    }
    return new PolytopeUnion(dimension, List.copyOf(pieces));
  }

  public static Region union(Region first, Region second) {
    checkArgument(first.dimension() == second.dimension(), "Dimension mismatch: %s vs %s",
        first.dimension(), second.dimension());
    return new PolytopeUnion(first.dimension(),
        Stream.concat(first.pieces().stream(), second.pieces().stream()).toList());
  }
}
