package com.hybridgames.model;

/** Base class of all validation failures raised while building dynamics and graphs. */
public class ModelException extends RuntimeException {
  public ModelException(String message) {
    super(message);
  }

  public ModelException(String message, Throwable cause) {
    super(message, cause);
  }
}
