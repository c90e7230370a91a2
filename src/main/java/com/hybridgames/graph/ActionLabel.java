package com.hybridgames.graph;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableSortedMap;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Assignment of one value to each of some action groups, ordered by group name. The empty label
 * marks an unlabeled edge. Labels also serve as keys of progress maps, a single action being a label
 * with one entry.
 */
public record ActionLabel(ImmutableSortedMap<String, String> values) {
    public static final ActionLabel EMPTY = new ActionLabel(ImmutableSortedMap.of());

    public ActionLabel {
        values.forEach((group, value) -> checkArgument(!value.isEmpty(), "Empty action value for group %s", group));
    }

    public static ActionLabel of(String group, String value) {
        return new ActionLabel(ImmutableSortedMap.of(group, value));
    }

    public static ActionLabel of(String group, String value, String otherGroup, String otherValue) {
        return new ActionLabel(ImmutableSortedMap.of(group, value, otherGroup, otherValue));
    }

    public static ActionLabel of(Map<String, String> values) {
        return values.isEmpty() ? EMPTY : new ActionLabel(ImmutableSortedMap.copyOf(values));
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public Optional<String> value(String group) {
        return Optional.ofNullable(values.get(group));
    }

    @Override
    public String toString() {
        return values.entrySet().stream()
                .map(entry -> entry.getKey() + ":" + entry.getValue())
                .collect(Collectors.joining(",", "{", "}"));
    }
}
