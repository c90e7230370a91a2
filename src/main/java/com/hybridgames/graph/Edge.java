package com.hybridgames.graph;

import static java.util.Objects.requireNonNull;

public record Edge<S>(S source, S target, ActionLabel label) {
    public Edge {
        requireNonNull(source);
        requireNonNull(target);
        requireNonNull(label);
    }

    public boolean isLabeled() {
        return !label.isEmpty();
    }
}
