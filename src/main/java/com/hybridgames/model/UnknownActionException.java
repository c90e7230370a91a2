package com.hybridgames.model;

import java.util.List;

/** An action value, action group or progress-map key outside the declared action universe. */
public class UnknownActionException extends UnknownKeyException {
  public UnknownActionException(String message, List<?> keys) {
    super(message, keys);
  }
}
