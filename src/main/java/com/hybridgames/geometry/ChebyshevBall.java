package com.hybridgames.geometry;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import javax.annotation.Nullable;
import org.apache.commons.math3.exception.TooManyIterationsException;
import org.apache.commons.math3.optim.MaxIter;
import org.apache.commons.math3.optim.PointValuePair;
import org.apache.commons.math3.optim.linear.LinearConstraint;
import org.apache.commons.math3.optim.linear.LinearConstraintSet;
import org.apache.commons.math3.optim.linear.LinearObjectiveFunction;
import org.apache.commons.math3.optim.linear.NoFeasibleSolutionException;
import org.apache.commons.math3.optim.linear.NonNegativeConstraint;
import org.apache.commons.math3.optim.linear.Relationship;
import org.apache.commons.math3.optim.linear.SimplexSolver;
import org.apache.commons.math3.optim.nonlinear.scalar.GoalType;

/**
 * Largest ball inscribed in a polytope, computed by the usual linear program
 * {@code max r  s.t.  a_i x + |a_i| r <= b_i, r >= 0}.
 *
 * <p>The radius is capped at {@link #RADIUS_CAP}, which keeps the program bounded for
 * unbounded polytopes.
 */
record ChebyshevBall(@Nullable double[] center, double radius) {
  static final double RADIUS_CAP = 1.0e6;
  static final ChebyshevBall INFEASIBLE = new ChebyshevBall(null, -1.0);
  private static final int MAX_ITERATIONS = 10_000;

  boolean isFeasible() {
    return center != null && radius >= 0.0;
  }

  static ChebyshevBall of(double[][] a, double[] b, int dimension) {
    if (a.length == 0) {
      return new ChebyshevBall(new double[dimension], RADIUS_CAP);
    }
    List<LinearConstraint> constraints = new ArrayList<>(a.length + 2);
    for (int i = 0; i < a.length; i++) {
      double[] coefficients = Arrays.copyOf(a[i], dimension + 1);
      coefficients[dimension] = norm(a[i]);
      constraints.add(new LinearConstraint(coefficients, Relationship.LEQ, b[i]));
    }
    double[] radiusOnly = new double[dimension + 1];
    radiusOnly[dimension] = 1.0;
    constraints.add(new LinearConstraint(radiusOnly, Relationship.GEQ, 0.0));
    constraints.add(new LinearConstraint(radiusOnly, Relationship.LEQ, RADIUS_CAP));

    PointValuePair solution;
    try {
      solution = new SimplexSolver().optimize(
          new MaxIter(MAX_ITERATIONS),
          new LinearObjectiveFunction(radiusOnly, 0.0),
          new LinearConstraintSet(constraints),
          GoalType.MAXIMIZE,
          new NonNegativeConstraint(false));
    } catch (NoFeasibleSolutionException e) {
      return INFEASIBLE;
    } catch (TooManyIterationsException e) {
      throw new IllegalStateException("Chebyshev ball computation did not converge", e);
    }
    double[] point = solution.getPoint();
    return new ChebyshevBall(Arrays.copyOf(point, dimension), point[dimension]);
  }

  static double norm(double[] row) {
    double sum = 0.0;
    for (double value : row) {
      sum += value * value;
    }
    return Math.sqrt(sum);
  }
}
