package com.hybridgames.dynamics;

import static java.util.Objects.requireNonNull;

import com.hybridgames.geometry.Region;
import com.hybridgames.geometry.Regions;
import com.hybridgames.model.DomainException;
import com.hybridgames.model.ShapeException;
import com.hybridgames.model.TimeData;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nullable;
import org.ejml.simple.SimpleMatrix;

/**
 * Discrete-time affine dynamics {@code s[t+1] = A s[t] + B u[t] + E d[t] + K}, subject to
 * {@code u[t]} in the control set, {@code d[t]} in the disturbance set and {@code s[t]} in the
 * domain.
 *
 * <p>The control set may also bound {@code [u[t]; s[t]]}, which expresses state-dependent input
 * constraints; its dimension is then the input dimension plus the state dimension.
 *
 * <p>Everything but the time data is fixed at construction. A missing {@code E} is replaced by a
 * zero column with an empty disturbance set, a missing {@code B} by a matrix without columns and a
 * missing {@code K} by zero.
 */
public final class LinearDynamics implements TimedDynamics {
  private static final Logger logger = Logger.getLogger(LinearDynamics.class.getName());

  private final SimpleMatrix a;
  private final SimpleMatrix b;
  private final SimpleMatrix e;
  private final SimpleMatrix k;
  @Nullable
  private final Region controlSet;
  @Nullable
  private final Region disturbanceSet;
  @Nullable
  private final Region domain;
  private TimeData timeData;

  private LinearDynamics(Builder builder) {
    SimpleMatrix a = requireNonNull(builder.a, "A");
    int n = a.numRows();
    if (n == 0 || n != a.numCols()) {
      throw new ShapeException("A must be square, got %dx%d".formatted(a.numRows(), a.numCols()));
    }
    if (builder.controlSet == null) {
      logger.log(Level.WARNING, "Control set not given to linear dynamics");
    }
    if (builder.domain == null) {
      logger.log(Level.WARNING, "Domain not given to linear dynamics");
    } else if (builder.domain.dimension() != n) {
      throw new DomainException("Domain has dimension %d, but A has %d columns"
          .formatted(builder.domain.dimension(), n));
    }

    SimpleMatrix b = builder.b == null ? new SimpleMatrix(n, 0) : builder.b;
    if (b.numRows() != n) {
      throw new ShapeException("A and B must have same number of rows (%d vs %d)".formatted(n, b.numRows()));
    }
    if (builder.controlSet != null) {
      int dimension = builder.controlSet.dimension();
      if (dimension != b.numCols() && dimension != b.numCols() + n) {
        throw new ShapeException("Control set has dimension %d, expected %d or %d"
            .formatted(dimension, b.numCols(), b.numCols() + n));
      }
    }

    SimpleMatrix e;
    Region disturbanceSet;
    if (builder.e == null) {
      e = new SimpleMatrix(n, 1);
      disturbanceSet = Regions.empty(1);
    } else {
      e = builder.e;
      disturbanceSet = builder.disturbanceSet;
      if (e.numRows() != n) {
        throw new ShapeException("A and E must have same number of rows (%d vs %d)".formatted(n, e.numRows()));
      }
      if (disturbanceSet != null && disturbanceSet.dimension() != e.numCols()) {
        throw new ShapeException("Disturbance set has dimension %d, but E has %d columns"
            .formatted(disturbanceSet.dimension(), e.numCols()));
      }
    }

    SimpleMatrix k = builder.k == null ? new SimpleMatrix(n, 1) : builder.k;
    if (k.numRows() != n) {
      throw new ShapeException("A and K must have same number of rows (%d vs %d)".formatted(n, k.numRows()));
    }
    if (k.numCols() != 1) {
      throw new ShapeException("K must be a column vector, got %d columns".formatted(k.numCols()));
    }

    this.a = a.copy();
    this.b = b.copy();
    this.e = e.copy();
    this.k = k.copy();
    this.controlSet = builder.controlSet;
    this.disturbanceSet = disturbanceSet;
    this.domain = builder.domain;
    this.timeData = builder.timeData;
  }

  public static Builder builder(double[][] a) {
    return new Builder(Matrices.of(a));
  }

  public static Builder builder(SimpleMatrix a) {
    return new Builder(a);
  }

  public SimpleMatrix a() {
    return a.copy();
  }

  public SimpleMatrix b() {
    return b.copy();
  }

  public SimpleMatrix e() {
    return e.copy();
  }

  public SimpleMatrix k() {
    return k.copy();
  }

  public Optional<Region> controlSet() {
    return Optional.ofNullable(controlSet);
  }

  public Optional<Region> disturbanceSet() {
    return Optional.ofNullable(disturbanceSet);
  }

  public Optional<Region> domain() {
    return Optional.ofNullable(domain);
  }

  public int stateDimension() {
    return a.numRows();
  }

  public int inputDimension() {
    return b.numCols();
  }

  public int disturbanceDimension() {
    return e.numCols();
  }

  @Override
  public TimeData timeData() {
    return timeData;
  }

  @Override
  public void overwriteTimeData(TimeData timeData) {
    this.timeData = requireNonNull(timeData);
  }

  /** Applies the affine map. A {@code null} input or disturbance counts as zero. */
  public double[] successor(double[] state, @Nullable double[] input, @Nullable double[] disturbance) {
    SimpleMatrix next = a.mult(Matrices.column(state)).plus(k);
    if (input != null && inputDimension() > 0) {
      next = next.plus(b.mult(Matrices.column(input)));
    }
    if (disturbance != null) {
      next = next.plus(e.mult(Matrices.column(disturbance)));
    }
    return Matrices.toVector(next);
  }

  @Override
  public String toString() {
    return "A =\n" + Matrices.format(a)
        + "B =\n" + Matrices.format(b)
        + "E =\n" + Matrices.format(e)
        + "K =\n" + Matrices.format(k)
        + "controlSet = " + controlSet + "\n"
        + "disturbanceSet = " + disturbanceSet + "\n"
        + "time = " + timeData;
  }

  public static final class Builder {
    private final SimpleMatrix a;
    @Nullable
    private SimpleMatrix b;
    @Nullable
    private SimpleMatrix e;
    @Nullable
    private SimpleMatrix k;
    @Nullable
    private Region controlSet;
    @Nullable
    private Region disturbanceSet;
    @Nullable
    private Region domain;
    private TimeData timeData = TimeData.UNSET;

    private Builder(SimpleMatrix a) {
      this.a = a;
    }

    public Builder input(double[][] b) {
      return input(Matrices.of(b));
    }

    public Builder input(SimpleMatrix b) {
      this.b = b;
      return this;
    }

    public Builder disturbance(double[][] e) {
      return disturbance(Matrices.of(e));
    }

    public Builder disturbance(SimpleMatrix e) {
      this.e = e;
      return this;
    }

    public Builder offset(double... k) {
      return offset(Matrices.column(k));
    }

    public Builder offset(double[][] k) {
      return offset(Matrices.of(k));
    }

    public Builder offset(SimpleMatrix k) {
      this.k = k;
      return this;
    }

    public Builder controlSet(@Nullable Region controlSet) {
      this.controlSet = controlSet;
      return this;
    }

    public Builder disturbanceSet(@Nullable Region disturbanceSet) {
      this.disturbanceSet = disturbanceSet;
      return this;
    }

    public Builder domain(@Nullable Region domain) {
      this.domain = domain;
      return this;
    }

    public Builder timeData(TimeData timeData) {
      this.timeData = requireNonNull(timeData);
      return this;
    }

    public LinearDynamics build() {
      return new LinearDynamics(this);
    }
  }
}
