package com.hybridgames.dynamics;

import static java.util.Objects.requireNonNull;

import com.hybridgames.geometry.Region;
import com.hybridgames.model.CoverageException;
import com.hybridgames.model.DomainException;
import com.hybridgames.model.OverlapException;
import com.hybridgames.model.ShapeException;
import com.hybridgames.model.TimeData;
import java.util.List;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Polytopic piecewise-affine system: a list of linear subsystems whose domains cover the domain of
 * the whole system and are mutually exclusive up to intersections without interior.
 */
public final class PiecewiseAffineDynamics implements TimedDynamics {
  private static final Logger logger = Logger.getLogger(PiecewiseAffineDynamics.class.getName());

  private final List<LinearDynamics> subsystems;
  private final Region domain;
  private TimeData timeData;

  /**
   * @param overwriteTime if set, the given time data replaces the time data of all subsystems;
   *     otherwise the subsystems must already agree with it
   */
  public PiecewiseAffineDynamics(List<LinearDynamics> subsystems, Region domain, TimeData timeData,
      boolean overwriteTime) {
    this.subsystems = List.copyOf(subsystems);
    this.domain = requireNonNull(domain, "domain");
    this.timeData = requireNonNull(timeData, "time data");

    if (this.subsystems.isEmpty()) {
      if (domain.isFullDimensional()) {
        throw new CoverageException("No subsystems cover the domain " + domain);
      }
    } else {
      validatePartition();
    }
    TimeDataPropagation.reconcile(this.subsystems, timeData, overwriteTime);
  }

  public PiecewiseAffineDynamics(List<LinearDynamics> subsystems, Region domain) {
    this(subsystems, domain, TimeData.UNSET, true);
  }

  public static PiecewiseAffineDynamics fromLinear(LinearDynamics dynamics) {
    Region domain = dynamics.domain().orElseThrow(() -> new DomainException("Linear dynamics have no domain"));
    return new PiecewiseAffineDynamics(List.of(dynamics), domain, dynamics.timeData(), true);
  }

  private void validatePartition() {
    LinearDynamics first = subsystems.get(0);
    int n = first.stateDimension();
    int m = first.inputDimension();
    int p = first.disturbanceDimension();
    if (domain.dimension() != n) {
      throw new DomainException("Domain has dimension %d, but subsystems have %d states"
          .formatted(domain.dimension(), n));
    }

    Region uncovered = domain;
    for (int i = 0; i < subsystems.size(); i++) {
      LinearDynamics subsystem = subsystems.get(i);
      if (n != subsystem.stateDimension() || m != subsystem.inputDimension()
          || p != subsystem.disturbanceDimension()) {
        throw new ShapeException("State, input and disturbance dimensions have to be the same for all subsystems");
      }
      int index = i;
      Region subdomain = subsystem.domain()
          .orElseThrow(() -> new DomainException("Subsystem %d has no domain".formatted(index)));
      uncovered = uncovered.difference(subdomain);
    }
    if (!uncovered.isEmpty()) {
      throw new CoverageException("Subdomains must cover the domain, uncovered: " + uncovered);
    }

    for (int i = 0; i < subsystems.size(); i++) {
      Region left = subsystems.get(i).domain().orElseThrow();
      for (int j = i + 1; j < subsystems.size(); j++) {
        if (left.intersect(subsystems.get(j).domain().orElseThrow()).isFullDimensional()) {
          throw new OverlapException(i, j);
        }
      }
    }
    logger.log(Level.FINE, () -> "Validated partition of %d subsystems".formatted(subsystems.size()));
  }

  public List<LinearDynamics> subsystems() {
    return subsystems;
  }

  public Region domain() {
    return domain;
  }

  public int stateDimension() {
    return subsystems.isEmpty() ? domain.dimension() : subsystems.get(0).stateDimension();
  }

  /** The first subsystem whose domain contains the given state. */
  public Optional<LinearDynamics> subsystemAt(double[] state) {
    return subsystems.stream()
        .filter(s -> s.domain().map(d -> d.contains(state)).orElse(false))
        .findFirst();
  }

  @Override
  public TimeData timeData() {
    return timeData;
  }

  @Override
  public void overwriteTimeData(TimeData timeData) {
    this.timeData = requireNonNull(timeData);
  }

  @Override
  public String toString() {
    StringBuilder builder = new StringBuilder("Piecewise-Affine System Dynamics\n")
        .append("Domain: ").append(domain).append('\n');
    for (int i = 0; i < subsystems.size(); i++) {
      builder.append("Subsystem ").append(i).append(":\n").append(subsystems.get(i)).append('\n');
    }
    return builder.toString();
  }
}
