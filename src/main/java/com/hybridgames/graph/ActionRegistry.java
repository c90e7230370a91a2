package com.hybridgames.graph;

import static com.google.common.base.Preconditions.checkArgument;

import com.hybridgames.model.UnknownActionException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** The action universe of a graph: its action groups, in declaration order. */
public final class ActionRegistry {
    /** Reserved, the synthesis encoding uses it for its own variable. */
    public static final String RESERVED_NAME = "actions";

    private final Map<String, ActionGroup> groups = new LinkedHashMap<>();

    public void declare(ActionGroup group) {
        checkArgument(!RESERVED_NAME.equals(group.name()), "Action group name '%s' is reserved", RESERVED_NAME);
        checkArgument(!groups.containsKey(group.name()), "Action group %s already declared", group.name());
        groups.put(group.name(), group);
    }

    /** Adds values to an already declared group. */
    public void addValues(String group, Collection<String> values) {
        ActionGroup existing = groups.get(group);
        if (existing == null) {
            throw new UnknownActionException("Unknown action group", List.of(group));
        }
        groups.put(group, existing.withValues(values));
    }

    public Optional<ActionGroup> group(String name) {
        return Optional.ofNullable(groups.get(name));
    }

    public List<ActionGroup> groups() {
        return List.copyOf(groups.values());
    }

    public boolean isEmpty() {
        return groups.isEmpty();
    }

    /** Entries of the label whose group is undeclared or whose value is not in the group. */
    public List<String> unknownEntries(ActionLabel label) {
        List<String> unknown = new ArrayList<>();
        label.values().forEach((group, value) -> {
            ActionGroup declared = groups.get(group);
            if (declared == null || !declared.contains(value)) {
                unknown.add(group + ":" + value);
            }
        });
        return unknown;
    }

    public void validate(ActionLabel label) {
        List<String> unknown = unknownEntries(label);
        if (!unknown.isEmpty()) {
            throw new UnknownActionException("Actions not in the action universe", unknown);
        }
    }

    /** The single-entry label for a value, located in the unique group containing it. */
    public ActionLabel labelOf(String value) {
        List<ActionGroup> containing = groups.values().stream().filter(g -> g.contains(value)).toList();
        if (containing.isEmpty()) {
            throw new UnknownActionException("Action not in the action universe", List.of(value));
        }
        checkArgument(containing.size() == 1, "Action %s is ambiguous, it belongs to groups %s", value,
                containing.stream().map(ActionGroup::name).toList());
        return ActionLabel.of(containing.get(0).name(), value);
    }
}
