package com.hybridgames.synthesis;

import static java.util.Objects.requireNonNull;

public interface SynthesisResult {
  boolean isRealizable();

  record Realizable(ReactiveController controller) implements SynthesisResult {
    public Realizable {
      requireNonNull(controller);
    }

    @Override
    public boolean isRealizable() {
      return true;
    }
  }

  record Unrealizable(String reason) implements SynthesisResult {
    public Unrealizable {
      requireNonNull(reason);
    }

    @Override
    public boolean isRealizable() {
      return false;
    }
  }
}
