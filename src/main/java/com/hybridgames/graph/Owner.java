package com.hybridgames.graph;

import java.util.Locale;

/** The player controlling an action group, or the player whose locations a graph describes. */
public enum Owner {
    SYSTEM("sys"), ENVIRONMENT("env");

    private final String prefix;

    Owner(String prefix) {
        this.prefix = prefix;
    }

    /** Short prefix used in variable names, {@code sys} or {@code env}. */
    public String prefix() {
        return prefix;
    }

    public static Owner parse(String id) {
        return switch (id.toLowerCase(Locale.ROOT)) {
            case "sys", "system" -> SYSTEM;
            case "env", "environment" -> ENVIRONMENT;
            default -> throw new IllegalArgumentException("Unknown owner " + id);
        };
    }
}
