package com.hybridgames.model;

public class TimeSemanticsException extends ModelException {
  public TimeSemanticsException(String message) {
    super(message);
  }
}
