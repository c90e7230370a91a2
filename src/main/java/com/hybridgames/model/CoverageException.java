package com.hybridgames.model;

/** The subsystem domains of a piecewise-affine system leave part of its domain uncovered. */
public class CoverageException extends ModelException {
  public CoverageException(String message) {
    super(message);
  }
}
