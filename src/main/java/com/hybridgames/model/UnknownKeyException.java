package com.hybridgames.model;

import java.util.List;

/** A key outside the declared label or action universe. */
public class UnknownKeyException extends ModelException {
  private final List<?> keys;

  public UnknownKeyException(String message, List<?> keys) {
    super(message + ": " + keys);
    this.keys = List.copyOf(keys);
  }

  public List<?> keys() {
    return keys;
  }
}
