package com.hybridgames.geometry;

import static com.google.common.base.Preconditions.checkArgument;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import javax.annotation.Nullable;
import org.apache.commons.math3.optim.MaxIter;
import org.apache.commons.math3.optim.PointValuePair;
import org.apache.commons.math3.optim.linear.LinearConstraint;
import org.apache.commons.math3.optim.linear.LinearConstraintSet;
import org.apache.commons.math3.optim.linear.LinearObjectiveFunction;
import org.apache.commons.math3.optim.linear.NoFeasibleSolutionException;
import org.apache.commons.math3.optim.linear.NonNegativeConstraint;
import org.apache.commons.math3.optim.linear.Relationship;
import org.apache.commons.math3.optim.linear.SimplexSolver;
import org.apache.commons.math3.optim.linear.UnboundedSolutionException;
import org.apache.commons.math3.optim.nonlinear.scalar.GoalType;

/** Convex polytope in half-space representation {@code A x <= b}. */
public final class Polytope implements Region {
  /** Tolerance for membership and full-dimensionality tests. */
  public static final double ABS_TOLERANCE = 1.0e-7;

  private final int dimension;
  private final double[][] a;
  private final double[] b;
  private final int hashCode;
  @Nullable
  private ChebyshevBall ball;

  private Polytope(int dimension, double[][] a, double[] b) {
    this.dimension = dimension;
    this.a = a;
    this.b = b;
    this.hashCode = 31 * Arrays.deepHashCode(a) + Arrays.hashCode(b);
  }

  public static Polytope of(double[][] a, double[] b) {
    checkArgument(a.length > 0, "Use universe(dimension) for a polytope without constraints");
    return of(a[0].length, a, b);
  }

  public static Polytope of(int dimension, double[][] a, double[] b) {
    checkArgument(dimension > 0, "Dimension must be positive");
    checkArgument(a.length == b.length, "A has %s rows but b has %s entries", a.length, b.length);
    List<double[]> rows = new ArrayList<>(a.length);
    List<Double> offsets = new ArrayList<>(b.length);
    for (int i = 0; i < a.length; i++) {
      checkArgument(a[i].length == dimension, "Row %s has %s columns, expected %s", i, a[i].length, dimension);
      if (ChebyshevBall.norm(a[i]) == 0.0) {
        // 0 <= b_i holds everywhere or nowhere
        checkArgument(b[i] >= 0.0, "Row %s is zero but its offset %s is negative", i, (Object) b[i]);
        continue;
      }
      rows.add(a[i].clone());
      offsets.add(b[i]);
    }
    return new Polytope(dimension, rows.toArray(double[][]::new),
        offsets.stream().mapToDouble(Double::doubleValue).toArray());
  }

  public static Polytope universe(int dimension) {
    checkArgument(dimension > 0, "Dimension must be positive");
    return new Polytope(dimension, new double[0][], new double[0]);
  }

  /** Axis-aligned box, {@code bounds[i] = {lower_i, upper_i}}. */
  public static Polytope box(double[][] bounds) {
    checkArgument(bounds.length > 0, "Box needs at least one axis");
    int dimension = bounds.length;
    double[][] rows = new double[2 * dimension][dimension];
    double[] offsets = new double[2 * dimension];
    for (int i = 0; i < dimension; i++) {
      checkArgument(bounds[i].length == 2, "Bounds of axis %s must be an interval", i);
      checkArgument(bounds[i][0] <= bounds[i][1], "Lower bound exceeds upper bound on axis %s", i);
      rows[2 * i][i] = 1.0;
      offsets[2 * i] = bounds[i][1];
      rows[2 * i + 1][i] = -1.0;
      offsets[2 * i + 1] = -bounds[i][0];
    }
    return new Polytope(dimension, rows, offsets);
  }

  @Override
  public int dimension() {
    return dimension;
  }

  public int constraints() {
    return a.length;
  }

  public double[] row(int index) {
    return a[index].clone();
  }

  public double offset(int index) {
    return b[index];
  }

  public double[][] matrix() {
    return Arrays.stream(a).map(double[]::clone).toArray(double[][]::new);
  }

  public double[] offsets() {
    return b.clone();
  }

  @Override
  public List<Polytope> pieces() {
    return List.of(this);
  }

  Polytope withConstraint(double[] row, double offset) {
    double[][] rows = Arrays.copyOf(a, a.length + 1);
    rows[a.length] = row;
    double[] offsets = Arrays.copyOf(b, b.length + 1);
    offsets[b.length] = offset;
    return new Polytope(dimension, rows, offsets);
  }

  Polytope intersect(Polytope other) {
    checkArgument(dimension == other.dimension, "Dimension mismatch: %s vs %s", dimension, other.dimension);
    double[][] rows = new double[a.length + other.a.length][];
    System.arraycopy(a, 0, rows, 0, a.length);
    System.arraycopy(other.a, 0, rows, a.length, other.a.length);
    double[] offsets = new double[b.length + other.b.length];
    System.arraycopy(b, 0, offsets, 0, b.length);
    System.arraycopy(other.b, 0, offsets, b.length, other.b.length);
    return new Polytope(dimension, rows, offsets);
  }

  @Override
  public Region intersect(Region other) {
    if (other instanceof Polytope polytope) {
      return intersect(polytope);
    }
    return other.intersect(this);
  }

  /**
   * Splits this polytope along the facets of {@code other}: the i-th piece violates the
   * i-th facet and satisfies all earlier ones. Pieces without volume are dropped.
   */
  List<Polytope> minus(Polytope other) {
    checkArgument(dimension == other.dimension, "Dimension mismatch: %s vs %s", dimension, other.dimension);
    if (!isFullDimensional()) {
      return List.of();
    }
    List<Polytope> pieces = new ArrayList<>();
    Polytope remaining = this;
    for (int i = 0; i < other.a.length; i++) {
      double[] negated = Arrays.stream(other.a[i]).map(v -> -v).toArray();
      Polytope outside = remaining.withConstraint(negated, -other.b[i]);
      if (outside.isFullDimensional()) {
        pieces.add(outside);
      }
      remaining = remaining.withConstraint(other.a[i].clone(), other.b[i]);
      if (!remaining.isFullDimensional()) {
        break;
      }
    }
    return pieces;
  }

  @Override
  public Region difference(Region other) {
    checkArgument(dimension == other.dimension(), "Dimension mismatch: %s vs %s", dimension, other.dimension());
    List<Polytope> current = List.of(this);
    for (Polytope subtrahend : other.pieces()) {
      List<Polytope> next = new ArrayList<>();
      for (Polytope piece : current) {
        next.addAll(piece.minus(subtrahend));
      }
      current = next;
      if (current.isEmpty()) {
        break;
      }
    }
    return Regions.union(dimension, current);
  }

  ChebyshevBall chebyshevBall() {
    if (ball == null) {
      ball = ChebyshevBall.of(a, b, dimension);
    }
    return ball;
  }

  public double chebyshevRadius() {
    return chebyshevBall().radius();
  }

  @Override
  public boolean isFullDimensional() {
    ChebyshevBall inscribed = chebyshevBall();
    return inscribed.isFeasible() && inscribed.radius() > ABS_TOLERANCE;
  }

  /** Whether the constraint system has any solution at all, including lower-dimensional ones. */
  public boolean isFeasible() {
    return chebyshevBall().isFeasible();
  }

  @Override
  public boolean contains(double[] point) {
    checkArgument(point.length == dimension, "Point has dimension %s, expected %s", point.length, dimension);
    for (int i = 0; i < a.length; i++) {
      double value = 0.0;
      for (int j = 0; j < dimension; j++) {
        value += a[i][j] * point[j];
      }
      if (value > b[i] + ABS_TOLERANCE) {
        return false;
      }
    }
    return true;
  }

  @Override
  public double[][] boundingBox() {
    if (!isFeasible()) {
      throw new IllegalStateException("Infeasible polytope has no bounding box");
    }
    double[][] bounds = new double[dimension][2];
    for (int axis = 0; axis < dimension; axis++) {
      bounds[axis][0] = extent(axis, GoalType.MINIMIZE);
      bounds[axis][1] = extent(axis, GoalType.MAXIMIZE);
    }
    return bounds;
  }

  private double extent(int axis, GoalType goal) {
    double unbounded = goal == GoalType.MAXIMIZE ? Double.POSITIVE_INFINITY : Double.NEGATIVE_INFINITY;
    if (a.length == 0) {
      return unbounded;
    }
    double[] objective = new double[dimension];
    objective[axis] = 1.0;
    List<LinearConstraint> constraints = IntStream.range(0, a.length)
        .mapToObj(i -> new LinearConstraint(a[i], Relationship.LEQ, b[i]))
        .toList();
    try {
      PointValuePair solution = new SimplexSolver().optimize(
          new MaxIter(10_000),
          new LinearObjectiveFunction(objective, 0.0),
          new LinearConstraintSet(constraints),
          goal,
          new NonNegativeConstraint(false));
      return solution.getValue();
    } catch (UnboundedSolutionException e) {
      return unbounded;
    } catch (NoFeasibleSolutionException e) {
      throw new IllegalStateException("Infeasible polytope has no bounding box", e);
    }
  }

  @Override
  public boolean equals(Object o) {
    return this == o || (o instanceof Polytope that && hashCode == that.hashCode
        && dimension == that.dimension && Arrays.deepEquals(a, that.a) && Arrays.equals(b, that.b));
  }

  @Override
  public int hashCode() {
    return hashCode;
  }

  @Override
  public String toString() {
    if (a.length == 0) {
      return "R^" + dimension;
    }
    return IntStream.range(0, a.length)
        .mapToObj(i -> "%s <= %s".formatted(Arrays.toString(a[i]), b[i]))
        .collect(Collectors.joining(", ", "{", "}"));
  }
}
