package com.hybridgames.model;

import java.util.List;

public class ActionConstraintException extends ModelException {
  private final List<String> violations;

  public ActionConstraintException(List<String> violations) {
    super("Action selection constraints violated:\n  " + String.join("\n  ", violations));
    this.violations = List.copyOf(violations);
  }

  public List<String> violations() {
    return violations;
  }
}
