package com.hybridgames.dynamics;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.hybridgames.geometry.Regions;
import com.hybridgames.model.ShapeException;
import org.ejml.simple.SimpleMatrix;

/**
 * Linear dynamics observed through an output map {@code y[t] = C s[t]} instead of the full
 * state.
 */
public final class OutputLinearDynamics {
  private final LinearDynamics dynamics;
  private final SimpleMatrix c;

  public OutputLinearDynamics(LinearDynamics dynamics, double[][] c) {
    this(dynamics, Matrices.of(c));
  }

  public OutputLinearDynamics(LinearDynamics dynamics, SimpleMatrix c) {
    this.dynamics = requireNonNull(dynamics);
    if (c.numCols() != dynamics.stateDimension()) {
      throw new ShapeException("A and C must have same number of columns (%d vs %d)"
          .formatted(dynamics.stateDimension(), c.numCols()));
    }
    this.c = c.copy();
  }

  public LinearDynamics dynamics() {
    return dynamics;
  }

  public SimpleMatrix c() {
    return c.copy();
  }

  public int outputDimension() {
    return c.numRows();
  }

  /**
   * Dynamics of the linear observer {@code s'[t+1] = (A - LC) s'[t] + B u[t] + K + L y[t]},
   * expressed as the plant dynamics disturbed by {@code L C e[t]} where the estimation error
   * {@code e[t]} stays in the box {@code [-errorBound, errorBound]^n}.
   *
   * @param gain observer gain {@code L}, of size (states x outputs)
   * @param errorBound bound on the estimation error, chosen such that the observer keeps it
   */
  public LinearDynamics observerDynamics(double[][] gain, double errorBound) {
    return observerDynamics(Matrices.of(gain), errorBound);
  }

  public LinearDynamics observerDynamics(SimpleMatrix gain, double errorBound) {
    checkArgument(errorBound > 0.0, "Error bound must be positive, got %s", errorBound);
    int n = dynamics.stateDimension();
    if (gain.numRows() != n || gain.numCols() != c.numRows()) {
      throw new ShapeException("Observer gain must be %dx%d, got %dx%d"
          .formatted(n, c.numRows(), gain.numRows(), gain.numCols()));
    }
    double[][] bounds = new double[n][];
    for (int i = 0; i < n; i++) {
      bounds[i] = new double[] {-errorBound, errorBound};
    }
    return LinearDynamics.builder(dynamics.a())
        .input(dynamics.b())
        .disturbance(gain.mult(c))
        .offset(dynamics.k())
        .controlSet(dynamics.controlSet().orElse(null))
        .disturbanceSet(Regions.box(bounds))
        .domain(dynamics.domain().orElse(null))
        .timeData(dynamics.timeData())
        .build();
  }
}
