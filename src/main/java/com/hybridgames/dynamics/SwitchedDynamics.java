package com.hybridgames.dynamics;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.Lists;
import com.hybridgames.geometry.Region;
import com.hybridgames.model.DomainException;
import com.hybridgames.model.Mode;
import com.hybridgames.model.TimeData;
import com.hybridgames.model.UnknownKeyException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import javax.annotation.Nullable;

/**
 * Hybrid system switching between piecewise-affine dynamics. The active dynamics are selected by
 * a {@link Mode}, combining an uncontrolled environment label and a controlled system label. Both
 * label sets are assumed to switch independently of each other.
 *
 * <p>The dynamics table may leave modes undefined, which is reported but accepted: switching
 * tables are often built up incrementally.
 */
public final class SwitchedDynamics {
  private static final Logger logger = Logger.getLogger(SwitchedDynamics.class.getName());

  private final List<String> environmentLabels;
  private final List<String> systemLabels;
  private final Map<Mode, PiecewiseAffineDynamics> dynamics;
  private final Region stateSpace;
  private final TimeData timeData;

  private SwitchedDynamics(Builder builder) {
    this.stateSpace = requireNonNull(builder.stateSpace, "continuous state space");
    this.environmentLabels = checkLabels("environment", builder.environmentModes, builder.environmentLabels);
    this.systemLabels = checkLabels("system", builder.systemModes, builder.systemLabels);
    this.timeData = builder.timeData;

    List<Mode> allModes = allModes();
    List<Mode> undefinedModes = builder.dynamics.keySet().stream()
        .filter(mode -> !allModes.contains(mode))
        .sorted()
        .toList();
    if (!undefinedModes.isEmpty()) {
      throw new UnknownKeyException("Dynamics keys inconsistent with discrete mode labels, undefined modes",
          undefinedModes);
    }
    List<Mode> missingModes = allModes.stream().filter(mode -> !builder.dynamics.containsKey(mode)).toList();
    if (!missingModes.isEmpty()) {
      logger.log(Level.WARNING, () -> "Missing the modes %s. Make sure you did not forget any modes, otherwise this is fine"
          .formatted(missingModes));
    }

    Map<Mode, PiecewiseAffineDynamics> ordered = new LinkedHashMap<>();
    for (Mode mode : allModes) {
      PiecewiseAffineDynamics modeDynamics = builder.dynamics.get(mode);
      if (modeDynamics == null) {
        continue;
      }
      if (modeDynamics.stateDimension() != stateSpace.dimension()) {
        throw new DomainException("Dynamics of mode %s have %d states, but the state space has dimension %d"
            .formatted(mode, modeDynamics.stateDimension(), stateSpace.dimension()));
      }
      ordered.put(mode, modeDynamics);
    }
    this.dynamics = Collections.unmodifiableMap(ordered);

    TimeDataPropagation.reconcile(List.copyOf(this.dynamics.values()), timeData, builder.overwriteTime);
  }

  private static List<String> checkLabels(String kind, int count, @Nullable List<String> labels) {
    checkArgument(count > 0, "Number of %s modes must be positive, got %s", kind, count);
    List<String> defaults = IntStream.range(0, count).mapToObj(String::valueOf).toList();
    if (labels == null) {
      return defaults;
    }
    if (labels.size() != count) {
      logger.log(Level.WARNING, () -> ("Number of %s labels (%d) is inconsistent with discrete domain size %d. "
          + "Ignoring given labels, defaulting to integer labels").formatted(kind, labels.size(), count));
      return defaults;
    }
    checkArgument(labels.stream().distinct().count() == labels.size(), "Duplicate %s labels %s", kind, labels);
    return List.copyOf(labels);
  }

  public static Builder builder(Region stateSpace) {
    return new Builder(stateSpace);
  }

  public static SwitchedDynamics fromPiecewise(PiecewiseAffineDynamics dynamics) {
    return builder(dynamics.domain())
        .dynamics(new Mode("0", "0"), dynamics)
        .timeData(dynamics.timeData())
        .build();
  }

  public static SwitchedDynamics fromLinear(LinearDynamics dynamics) {
    return fromPiecewise(PiecewiseAffineDynamics.fromLinear(dynamics));
  }

  /** All label combinations, environment-major, in label order. */
  public List<Mode> allModes() {
    return Lists.cartesianProduct(environmentLabels, systemLabels).stream()
        .map(pair -> new Mode(pair.get(0), pair.get(1)))
        .toList();
  }

  /** The modes with defined dynamics, in label order. */
  public List<Mode> modes() {
    return List.copyOf(dynamics.keySet());
  }

  public Optional<PiecewiseAffineDynamics> dynamics(Mode mode) {
    return Optional.ofNullable(dynamics.get(mode));
  }

  public Map<Mode, PiecewiseAffineDynamics> dynamics() {
    return dynamics;
  }

  public List<String> environmentLabels() {
    return environmentLabels;
  }

  public List<String> systemLabels() {
    return systemLabels;
  }

  public int environmentModes() {
    return environmentLabels.size();
  }

  public int systemModes() {
    return systemLabels.size();
  }

  public Region stateSpace() {
    return stateSpace;
  }

  public TimeData timeData() {
    return timeData;
  }

  @Override
  public String toString() {
    return "Hybrid System Dynamics\n"
        + "Environment (%d modes): %s\n".formatted(environmentModes(), environmentLabels)
        + "System (%d modes): %s\n".formatted(systemModes(), systemLabels)
        + "Continuous State Space: " + stateSpace + "\n"
        + dynamics.entrySet().stream()
            .map(entry -> "mode: %s\n%s".formatted(entry.getKey(), entry.getValue()))
            .collect(Collectors.joining("\n"));
  }

  public static final class Builder {
    private final Region stateSpace;
    private int environmentModes = 1;
    private int systemModes = 1;
    @Nullable
    private List<String> environmentLabels;
    @Nullable
    private List<String> systemLabels;
    private final Map<Mode, PiecewiseAffineDynamics> dynamics = new LinkedHashMap<>();
    private TimeData timeData = TimeData.UNSET;
    private boolean overwriteTime = true;

    private Builder(Region stateSpace) {
      this.stateSpace = stateSpace;
    }

    public Builder modeCounts(int environmentModes, int systemModes) {
      this.environmentModes = environmentModes;
      this.systemModes = systemModes;
      return this;
    }

    public Builder environmentLabels(List<String> labels) {
      this.environmentLabels = new ArrayList<>(labels);
      return this;
    }

    public Builder systemLabels(List<String> labels) {
      this.systemLabels = new ArrayList<>(labels);
      return this;
    }

    public Builder dynamics(Mode mode, PiecewiseAffineDynamics modeDynamics) {
      this.dynamics.put(requireNonNull(mode), requireNonNull(modeDynamics));
      return this;
    }

    public Builder dynamics(Map<Mode, PiecewiseAffineDynamics> table) {
      table.forEach(this::dynamics);
      return this;
    }

    public Builder timeData(TimeData timeData) {
      this.timeData = requireNonNull(timeData);
      return this;
    }

    public Builder overwriteTime(boolean overwriteTime) {
      this.overwriteTime = overwriteTime;
      return this;
    }

    public SwitchedDynamics build() {
      return new SwitchedDynamics(this);
    }
  }
}
