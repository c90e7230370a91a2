package com.hybridgames.model;

/** Malformed matrix or constraint set dimensions. */
public class ShapeException extends ModelException {
  public ShapeException(String message) {
    super(message);
  }
}
