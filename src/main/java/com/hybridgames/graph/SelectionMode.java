package com.hybridgames.graph;

import java.util.Locale;

/** How many values of an action group an outgoing edge has to select. */
public enum SelectionMode {
    /** No constraint. */
    NONE,
    /** At most one value. */
    MUTEX,
    /** Exactly one value. */
    XOR;

    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static SelectionMode parse(String id) {
        return switch (id.toLowerCase(Locale.ROOT)) {
            case "none" -> NONE;
            case "mutex" -> MUTEX;
            case "xor" -> XOR;
            default -> throw new IllegalArgumentException("Unknown selection mode " + id);
        };
    }
}
