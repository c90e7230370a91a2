package com.hybridgames.dynamics;

import com.hybridgames.model.TimeData;
import com.hybridgames.model.TimeSemanticsException;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

final class TimeDataPropagation {
  private static final Logger logger = Logger.getLogger(TimeDataPropagation.class.getName());

  private TimeDataPropagation() {}

  static void reconcile(List<? extends TimedDynamics> children, TimeData parent, boolean overwrite) {
    if (overwrite) {
      push(children, parent);
    } else {
      check(children, parent);
    }
  }

  /** Overwrites the time data of all children, descending into piecewise-affine children. */
  static void push(List<? extends TimedDynamics> children, TimeData parent) {
    for (TimedDynamics child : children) {
      TimeData existing = child.timeData();
      if (existing.semantics() != parent.semantics() && !existing.isUnset()) {
        logger.log(Level.WARNING, () -> "Overwriting existing time semantics data %s with %s"
            .formatted(existing.semantics().id(), parent.semantics().id()));
      }
      if (!Objects.equals(existing.timestep(), parent.timestep()) && existing.timestep() != null) {
        logger.log(Level.WARNING, () -> "Overwriting existing timestep data %s with %s"
            .formatted(existing.timestep(), parent.timestep()));
      }
      child.overwriteTimeData(parent);
      if (child instanceof PiecewiseAffineDynamics piecewise) {
        push(piecewise.subsystems(), parent);
      }
    }
  }

  /** Requires all children to agree with each other and with the parent. Modifies nothing. */
  static void check(List<? extends TimedDynamics> children, TimeData parent) {
    for (int i = 0; i + 1 < children.size(); i++) {
      TimeData current = children.get(i).timeData();
      TimeData next = children.get(i + 1).timeData();
      if (!Objects.equals(current.timestep(), next.timestep())) {
        throw new TimeSemanticsException("Not all timesteps in child systems are the same");
      }
      if (current.semantics() != next.semantics()) {
        throw new TimeSemanticsException("Not all time semantics are the same");
      }
    }
    if (children.isEmpty()) {
      return;
    }
    TimeData first = children.get(0).timeData();
    if (!Objects.equals(first.timestep(), parent.timestep())) {
      throw new TimeSemanticsException("Timestep of subsystems does not match specified timestep");
    }
    if (first.semantics() != parent.semantics()) {
      throw new TimeSemanticsException("Time semantics of subsystems do not match specified time semantics");
    }
  }
}
