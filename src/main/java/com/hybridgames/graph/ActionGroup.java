package com.hybridgames.graph;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableSet;
import java.util.Collection;
import java.util.Set;

/**
 * A named, independent set of actions. An edge picks at most one value from every group; the
 * selection mode decides whether the group may also be left out.
 */
public record ActionGroup(String name, Set<String> values, SelectionMode mode, Owner owner) {
    public ActionGroup {
        requireNonNull(name);
        checkArgument(!name.isBlank(), "Action group name must not be blank");
        values = ImmutableSet.copyOf(values);
        requireNonNull(mode);
        requireNonNull(owner);
    }

    public static ActionGroup of(String name, Owner owner, SelectionMode mode, String... values) {
        return new ActionGroup(name, ImmutableSet.copyOf(values), mode, owner);
    }

    public boolean contains(String value) {
        return values.contains(value);
    }

    public ActionGroup withValues(Collection<String> additional) {
        return new ActionGroup(name, ImmutableSet.<String>builder().addAll(values).addAll(additional).build(), mode,
                owner);
    }
}
