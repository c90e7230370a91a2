package com.hybridgames.dynamics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.hybridgames.LogRecorder;
import com.hybridgames.geometry.Region;
import com.hybridgames.geometry.Regions;
import com.hybridgames.model.DomainException;
import com.hybridgames.model.Mode;
import com.hybridgames.model.TimeData;
import com.hybridgames.model.UnknownKeyException;
import java.util.List;
import java.util.logging.Level;
import org.junit.jupiter.api.Test;

class SwitchedDynamicsTest {
  private static final Region DOMAIN = Regions.interval(-10, 10);

  private static PiecewiseAffineDynamics scalar(double a, double k) {
    return PiecewiseAffineDynamics.fromLinear(LinearDynamics.builder(new double[][] {{a}})
        .offset(k)
        .controlSet(Regions.empty(1))
        .domain(DOMAIN)
        .build());
  }

  @Test
  void keepsModesInLabelOrder() {
    SwitchedDynamics system = SwitchedDynamics.builder(DOMAIN)
        .modeCounts(1, 2)
        .environmentLabels(List.of("nominal"))
        .systemLabels(List.of("heat", "cool"))
        .dynamics(new Mode("nominal", "cool"), scalar(0.5, -1))
        .dynamics(new Mode("nominal", "heat"), scalar(0.5, 1))
        .build();
    assertEquals(List.of(new Mode("nominal", "heat"), new Mode("nominal", "cool")), system.modes());
    assertEquals(2, system.allModes().size());
    assertTrue(system.dynamics(new Mode("nominal", "heat")).isPresent());
    assertFalse(system.dynamics(new Mode("other", "heat")).isPresent());
  }

  @Test
  void undefinedModesAreRejected() {
    UnknownKeyException exception = assertThrows(UnknownKeyException.class, () -> SwitchedDynamics.builder(DOMAIN)
        .modeCounts(1, 1)
        .dynamics(new Mode("0", "0"), scalar(0.5, 1))
        .dynamics(new Mode("1", "0"), scalar(0.5, 1))
        .build());
    assertEquals(List.of(new Mode("1", "0")), exception.keys());
  }

  @Test
  void missingModesOnlyWarn() {
    try (LogRecorder recorder = LogRecorder.attach(SwitchedDynamics.class)) {
      SwitchedDynamics system = SwitchedDynamics.builder(DOMAIN)
          .modeCounts(2, 1)
          .dynamics(Mode.of(0, 0), scalar(0.5, 1))
          .build();
      assertEquals(1, system.modes().size());
      assertTrue(recorder.contains(Level.WARNING, "Missing the modes [(1,0)]"));
    }
  }

  @Test
  void mismatchedLabelCountFallsBackToIntegers() {
    try (LogRecorder recorder = LogRecorder.attach(SwitchedDynamics.class)) {
      SwitchedDynamics system = SwitchedDynamics.builder(DOMAIN)
          .modeCounts(1, 2)
          .systemLabels(List.of("only"))
          .dynamics(Mode.of(0, 0), scalar(0.5, 1))
          .dynamics(Mode.of(0, 1), scalar(0.5, 1))
          .build();
      assertEquals(List.of("0", "1"), system.systemLabels());
      assertTrue(recorder.contains(Level.WARNING, "Number of system labels (1) is inconsistent"));
    }
  }

  @Test
  void stateSpaceDimensionMustMatch() {
    assertThrows(DomainException.class, () -> SwitchedDynamics.builder(Regions.box(new double[][] {{0, 1}, {0, 1}}))
        .dynamics(Mode.of(0, 0), scalar(0.5, 1))
        .build());
  }

  @Test
  void pushesTimeDataIntoSubsystems() {
    PiecewiseAffineDynamics mode = scalar(0.5, 1);
    SwitchedDynamics.builder(DOMAIN)
        .dynamics(Mode.of(0, 0), mode)
        .timeData(TimeData.DISCRETE)
        .build();
    assertEquals(TimeData.DISCRETE, mode.timeData());
    assertEquals(TimeData.DISCRETE, mode.subsystems().get(0).timeData());
  }

  @Test
  void wrapsSingleLinearSystem() {
    SwitchedDynamics system = SwitchedDynamics.fromLinear(scalar(0.5, 1).subsystems().get(0));
    assertEquals(List.of(Mode.of(0, 0)), system.modes());
    assertEquals(DOMAIN, system.stateSpace());
  }
}
