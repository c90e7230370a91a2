package com.hybridgames.model;

/** Two subsystem domains of a piecewise-affine system share a full-dimensional intersection. */
public class OverlapException extends ModelException {
  private final int first;
  private final int second;

  public OverlapException(int first, int second) {
    super("Subdomains %d and %d are not mutually exclusive".formatted(first, second));
    this.first = first;
    this.second = second;
  }

  public int first() {
    return first;
  }

  public int second() {
    return second;
  }
}
