package com.hybridgames.algorithm;

import static com.google.common.base.Preconditions.checkArgument;

import com.hybridgames.dynamics.LinearDynamics;
import com.hybridgames.dynamics.Matrices;
import com.hybridgames.dynamics.PiecewiseAffineDynamics;
import com.hybridgames.dynamics.SwitchedDynamics;
import com.hybridgames.geometry.Polytope;
import com.hybridgames.geometry.Region;
import com.hybridgames.model.DomainException;
import com.hybridgames.model.Mode;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.ejml.simple.SimpleMatrix;

/**
 * Computes, for every mode of a switched system, a region around the fixed points of the mode's
 * dynamics. The regions serve as auxiliary propositions {@code eqpnt_<system label>} which a
 * specification can use to require that the system eventually settles.
 *
 * <p>Modes without a (bounded, in-domain) fixed point get a small marker box just outside the
 * state space, so that the proposition exists but can never hold.
 */
public final class EquilibriumFinder {
  private static final Logger logger = Logger.getLogger(EquilibriumFinder.class.getName());

  public static final String PROPOSITION_PREFIX = "eqpnt_";
  private static final double ROW_NORM_TOLERANCE = 1.0e-10;

  public record Settings(double padding, double rankTolerance, double absoluteTolerance, double fallbackOffset) {
    public static final Settings DEFAULT = new Settings(0.0, 1.0e-10, 1.0e-7, 1.0);

    public Settings {
      checkArgument(padding >= 0.0, "Padding must be non-negative, got %s", padding);
      checkArgument(rankTolerance > 0.0, "Rank tolerance must be positive, got %s", rankTolerance);
      checkArgument(absoluteTolerance > 0.0, "Absolute tolerance must be positive, got %s", absoluteTolerance);
      checkArgument(fallbackOffset > 0.0, "Fallback offset must be positive, got %s", fallbackOffset);
    }

    public Settings withPadding(double padding) {
      return new Settings(padding, rankTolerance, absoluteTolerance, fallbackOffset);
    }

    public Settings withFallbackOffset(double fallbackOffset) {
      return new Settings(padding, rankTolerance, absoluteTolerance, fallbackOffset);
    }
  }

  private final Settings settings;

  public EquilibriumFinder(Settings settings) {
    this.settings = settings;
  }

  public EquilibriumFinder() {
    this(Settings.DEFAULT);
  }

  public Settings settings() {
    return settings;
  }

  public static String proposition(Mode mode) {
    return PROPOSITION_PREFIX + mode.system();
  }

  /**
   * Equilibrium regions keyed by proposition, in mode order. Modes sharing a system label share
   * the proposition, the later mode wins.
   */
  public Map<String, EquilibriumRegion> find(SwitchedDynamics system) {
    Map<String, EquilibriumRegion> regions = new LinkedHashMap<>();
    for (Map.Entry<Mode, PiecewiseAffineDynamics> entry : system.dynamics().entrySet()) {
      Mode mode = entry.getKey();
      List<LinearDynamics> subsystems = entry.getValue().subsystems();
      if (subsystems.isEmpty()) {
        logger.log(Level.WARNING, () -> "Mode %s has no subsystems, skipping".formatted(mode));
        continue;
      }
      EquilibriumRegion region = find(mode, subsystems.get(0), system.stateSpace());
      regions.put(region.proposition(), region);
    }
    return regions;
  }

  public static Map<String, Region> propositions(Map<String, EquilibriumRegion> regions) {
    Map<String, Region> propositions = new LinkedHashMap<>();
    regions.forEach((name, region) -> propositions.put(name, region.region()));
    return propositions;
  }

  public EquilibriumRegion find(Mode mode, LinearDynamics dynamics, Region stateSpace) {
    int n = dynamics.stateDimension();
    if (stateSpace.dimension() != n) {
      throw new DomainException("State space has dimension %d, but dynamics have %d states"
          .formatted(stateSpace.dimension(), n));
    }
    String proposition = proposition(mode);
    SimpleMatrix a = dynamics.a();
    SimpleMatrix k = dynamics.k();
    SimpleMatrix identityMinusA = SimpleMatrix.identity(n).minus(a);

    int coefficientRank = Matrices.rank(identityMinusA, settings.rankTolerance());
    int augmentedRank = Matrices.rank(Matrices.concatColumns(identityMinusA, k), settings.rankTolerance());

    if (coefficientRank != augmentedRank) {
      logger.log(Level.INFO, () -> "No equilibrium for mode %s, trajectories go to infinity".formatted(mode));
      return new EquilibriumRegion(proposition, mode, fallbackMarker(stateSpace), EquilibriumRegion.Kind.DIVERGENT);
    }

    if (coefficientRank == n) {
      double[] equilibrium = Matrices.toVector(identityMinusA.solve(k));
      if (!stateSpace.contains(equilibrium)) {
        logger.log(Level.INFO, () -> "Equilibrium %s of mode %s lies outside the state space"
            .formatted(Arrays.toString(equilibrium), mode));
        return new EquilibriumRegion(proposition, mode, fallbackMarker(stateSpace),
            EquilibriumRegion.Kind.OUT_OF_DOMAIN);
      }
      double[][] bounds = new double[n][];
      for (int i = 0; i < n; i++) {
        double halfWidth = boxHalfWidth(equilibrium[i]);
        bounds[i] = new double[] {equilibrium[i] - halfWidth, equilibrium[i] + halfWidth};
      }
      logger.log(Level.FINE, () -> "Mode %s has the unique equilibrium %s".formatted(mode, Arrays.toString(equilibrium)));
      return new EquilibriumRegion(proposition, mode, Polytope.box(bounds), EquilibriumRegion.Kind.UNIQUE_POINT);
    }

    Polytope slab = slab(identityMinusA, a, k);
    Region region = stateSpace.intersect(slab);
    if (region.isEmpty() && !slab.isEmpty()) {
      logger.log(Level.INFO, () -> "Equilibrium subspace of mode %s misses the state space".formatted(mode));
      return new EquilibriumRegion(proposition, mode, fallbackMarker(stateSpace), EquilibriumRegion.Kind.OUT_OF_DOMAIN);
    }
    return new EquilibriumRegion(proposition, mode, region, EquilibriumRegion.Kind.SUBSPACE);
  }

  /** {@code |row · x - k_row| <= eps} for every non-zero row of {@code I - A}, rows normalized. */
  private Polytope slab(SimpleMatrix identityMinusA, SimpleMatrix a, SimpleMatrix k) {
    int n = identityMinusA.numRows();
    double width = slabWidth(a, k);
    List<double[]> rows = new ArrayList<>();
    List<Double> offsets = new ArrayList<>();
    for (int i = 0; i < n; i++) {
      double[] row = new double[n];
      double norm = 0.0;
      for (int j = 0; j < n; j++) {
        row[j] = identityMinusA.get(i, j);
        norm += row[j] * row[j];
      }
      norm = Math.sqrt(norm);
      if (norm <= ROW_NORM_TOLERANCE) {
        continue;
      }
      double[] negated = new double[n];
      for (int j = 0; j < n; j++) {
        row[j] /= norm;
        negated[j] = -row[j];
      }
      double offset = k.get(i, 0) / norm;
      rows.add(row);
      offsets.add(offset + width);
      rows.add(negated);
      offsets.add(-offset + width);
    }
    if (rows.isEmpty()) {
      return Polytope.universe(n);
    }
    return Polytope.of(n, rows.toArray(double[][]::new), offsets.stream().mapToDouble(Double::doubleValue).toArray());
  }

  private double slabWidth(SimpleMatrix a, SimpleMatrix k) {
    if (settings.padding() > 0.0) {
      return settings.padding();
    }
    int n = a.numRows();
    double minimum = Double.POSITIVE_INFINITY;
    for (int i = 0; i < n; i++) {
      minimum = Math.min(minimum, -k.get(i, 0));
      for (int j = 0; j < n; j++) {
        minimum = Math.min(minimum, a.get(i, j) - (i == j ? 1.0 : 0.0));
      }
    }
    double width = Math.abs(minimum);
    return width > 0.0 ? width : settings.absoluteTolerance();
  }

  /**
   * Padding plus one percent of the coordinate's magnitude, but never thinner than twice the
   * tolerance of the full-dimensionality test, so the box keeps its volume at the origin.
   */
  private double boxHalfWidth(double coordinate) {
    double halfWidth = settings.padding() + Math.abs(coordinate) / 100.0;
    return Math.max(halfWidth, 2 * Math.max(settings.absoluteTolerance(), Polytope.ABS_TOLERANCE));
  }

  /** Box {@code [u_i, u_i + offset]} per axis, {@code u_i} being the upper bound of the state space. */
  private Polytope fallbackMarker(Region stateSpace) {
    double[][] boundingBox = stateSpace.boundingBox();
    double[][] bounds = new double[boundingBox.length][];
    for (int i = 0; i < boundingBox.length; i++) {
      double upper = boundingBox[i][1];
      if (!Double.isFinite(upper)) {
        throw new DomainException("State space is unbounded along axis %d, cannot place a marker region".formatted(i));
      }
      bounds[i] = new double[] {upper, upper + settings.fallbackOffset()};
    }
    return Polytope.box(bounds);
  }
}
