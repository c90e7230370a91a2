package com.hybridgames.dynamics;

import com.hybridgames.model.TimeData;

/** Dynamics whose time data may be overwritten by an enclosing system. */
interface TimedDynamics {
  TimeData timeData();

  void overwriteTimeData(TimeData timeData);
}
