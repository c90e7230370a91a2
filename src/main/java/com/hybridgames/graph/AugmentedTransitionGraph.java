package com.hybridgames.graph;

import static com.google.common.base.Preconditions.checkArgument;

import com.hybridgames.model.UnknownActionException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Transition graph with a progress map: for an action (or a combination of actions of several
 * groups) a family of state subsets, each of which has to be revisited as long as the action keeps
 * being taken. Every subset is a separate obligation; subsets of one action are never merged.
 */
public class AugmentedTransitionGraph<S> extends TransitionGraph<S> {
    private Map<ActionLabel, List<Set<S>>> progressMap = Map.of();

    public AugmentedTransitionGraph(String name, Owner owner, ActionRegistry actions) {
        super(name, owner, actions);
    }

    public static <S> AugmentedTransitionGraph<S> closed(String name, String... systemActions) {
        return new AugmentedTransitionGraph<>(name, Owner.SYSTEM, closedActions(systemActions));
    }

    public static <S> AugmentedTransitionGraph<S> open(String name, Owner owner) {
        return new AugmentedTransitionGraph<>(name, owner, openActions());
    }

    /**
     * Replaces the progress map. Nothing changes if a key is not in the action universe or a subset
     * mentions an unknown state.
     *
     * @throws UnknownActionException listing all offending keys
     */
    public void setProgressMap(Map<ActionLabel, ? extends Collection<? extends Collection<S>>> map) {
        List<ActionLabel> unknown = map.keySet().stream()
                .filter(key -> key.isEmpty() || !actions().unknownEntries(key).isEmpty())
                .toList();
        if (!unknown.isEmpty()) {
            throw new UnknownActionException("Progress map keys not in the action universe", unknown);
        }
        Map<ActionLabel, List<Set<S>>> replacement = new LinkedHashMap<>();
        map.forEach((key, subsets) -> replacement.put(key, checkedSubsets(key, subsets)));
        this.progressMap = Collections.unmodifiableMap(replacement);
    }

    /** Single-action keys, one subset each. The group of an action is the unique group containing it. */
    public void setProgressMapByAction(Map<String, ? extends Collection<S>> map) {
        List<String> unknown = map.keySet().stream()
                .filter(value -> actions().groups().stream().noneMatch(group -> group.contains(value)))
                .toList();
        if (!unknown.isEmpty()) {
            throw new UnknownActionException("Progress map keys not in the action universe", unknown);
        }
        Map<ActionLabel, List<Collection<S>>> labeled = new LinkedHashMap<>();
        map.forEach((value, subset) -> labeled.put(actions().labelOf(value), List.of(subset)));
        setProgressMap(labeled);
    }

    /** Sets the subsets of one key, keeping the other keys. */
    public void setProgressGroups(ActionLabel key, Collection<? extends Collection<S>> subsets) {
        Map<ActionLabel, Collection<? extends Collection<S>>> updated = new LinkedHashMap<>(progressMap);
        updated.put(key, subsets);
        setProgressMap(updated);
    }

    private List<Set<S>> checkedSubsets(ActionLabel key, Collection<? extends Collection<S>> subsets) {
        List<Set<S>> checked = new ArrayList<>(subsets.size());
        for (Collection<S> subset : subsets) {
            for (S state : subset) {
                checkArgument(hasState(state), "Progress group of %s contains unknown state %s", key, state);
            }
            checked.add(Collections.unmodifiableSet(new LinkedHashSet<>(subset)));
        }
        return List.copyOf(checked);
    }

    public Map<ActionLabel, List<Set<S>>> progressMap() {
        return progressMap;
    }

    public List<Set<S>> progressGroups(ActionLabel key) {
        return progressMap.getOrDefault(key, List.of());
    }

    /** Also drops the state from every progress group. */
    @Override
    public void removeState(S state) {
        super.removeState(state);
        Map<ActionLabel, List<Set<S>>> updated = new LinkedHashMap<>();
        progressMap.forEach((key, subsets) -> updated.put(key, subsets.stream()
                .map(subset -> {
                    Set<S> copy = new LinkedHashSet<>(subset);
                    copy.remove(state);
                    return Collections.unmodifiableSet(copy);
                })
                .toList()));
        this.progressMap = Collections.unmodifiableMap(updated);
    }
}
