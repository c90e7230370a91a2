package com.hybridgames.geometry;

import static com.google.common.base.Preconditions.checkArgument;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/** Union of convex polytopes of the same dimension. The pieces may overlap. */
public final class PolytopeUnion implements Region {
  private final int dimension;
  private final List<Polytope> pieces;

  PolytopeUnion(int dimension, List<Polytope> pieces) {
    checkArgument(pieces.stream().allMatch(p -> p.dimension() == dimension),
        "All pieces must have dimension %s", dimension);
    this.dimension = dimension;
    this.pieces = List.copyOf(pieces);
  }

  @Override
  public int dimension() {
    return dimension;
  }

  @Override
  public List<Polytope> pieces() {
    return pieces;
  }

  @Override
  public Region intersect(Region other) {
    checkArgument(dimension == other.dimension(), "Dimension mismatch: %s vs %s", dimension, other.dimension());
    List<Polytope> intersections = new ArrayList<>();
    for (Polytope piece : pieces) {
      for (Polytope otherPiece : other.pieces()) {
        Polytope intersection = piece.intersect(otherPiece);
        if (intersection.isFullDimensional()) {
          intersections.add(intersection);
        }
      }
    }
    return Regions.union(dimension, intersections);
  }

  @Override
  public Region difference(Region other) {
    List<Polytope> remainder = new ArrayList<>();
    for (Polytope piece : pieces) {
      remainder.addAll(piece.difference(other).pieces());
    }
    return Regions.union(dimension, remainder);
  }

  @Override
  public boolean isFullDimensional() {
    return pieces.stream().anyMatch(Polytope::isFullDimensional);
  }

  @Override
  public boolean contains(double[] point) {
    return pieces.stream().anyMatch(p -> p.contains(point));
  }

  @Override
  public double[][] boundingBox() {
    double[][] bounds = null;
    for (Polytope piece : pieces) {
      if (!piece.isFeasible()) {
        continue;
      }
      double[][] pieceBounds = piece.boundingBox();
      if (bounds == null) {
        bounds = pieceBounds;
      } else {
        for (int i = 0; i < dimension; i++) {
          bounds[i][0] = Math.min(bounds[i][0], pieceBounds[i][0]);
          bounds[i][1] = Math.max(bounds[i][1], pieceBounds[i][1]);
        }
      }
    }
    if (bounds == null) {
      throw new IllegalStateException("Empty region has no bounding box");
    }
    return bounds;
  }

  @Override
  public boolean equals(Object o) {
    return this == o || (o instanceof PolytopeUnion that && dimension == that.dimension
        && pieces.equals(that.pieces));
  }

  @Override
  public int hashCode() {
    return 31 * dimension + pieces.hashCode();
  }

  @Override
  public String toString() {
    return pieces.isEmpty()
        ? "EMPTY^" + dimension
        : pieces.stream().map(Polytope::toString).collect(Collectors.joining(" | "));
  }
}
