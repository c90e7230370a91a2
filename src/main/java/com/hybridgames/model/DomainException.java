package com.hybridgames.model;

public class DomainException extends ModelException {
  public DomainException(String message) {
    super(message);
  }
}
