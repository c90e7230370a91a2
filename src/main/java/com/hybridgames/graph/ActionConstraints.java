package com.hybridgames.graph;

import com.hybridgames.model.ActionConstraintException;
import java.util.ArrayList;
import java.util.List;

/**
 * Checks the selection modes of the action groups of a finished graph. An edge selects at most one
 * value per group, so {@link SelectionMode#MUTEX} holds for every edge; {@link SelectionMode#XOR}
 * additionally requires every outgoing edge to select a value of the group. Groups without values
 * are not constrained.
 */
public final class ActionConstraints {
    private ActionConstraints() {
    }

    public static <S> List<String> violations(TransitionGraph<S> graph) {
        List<ActionGroup> constrained = graph.actions().groups().stream()
                .filter(group -> group.mode() == SelectionMode.XOR)
                .filter(group -> !group.values().isEmpty())
                .toList();
        List<String> violations = new ArrayList<>();
        if (constrained.isEmpty()) {
            return violations;
        }
        for (S state : graph.states()) {
            for (Edge<S> edge : graph.edges(state)) {
                for (ActionGroup group : constrained) {
                    if (edge.label().value(group.name()).isEmpty()) {
                        violations.add("edge %s -> %s %s selects no value of %s group %s".formatted(edge.source(),
                                edge.target(), edge.label(), group.mode().id(), group.name()));
                    }
                }
            }
        }
        return violations;
    }

    public static <S> void validate(TransitionGraph<S> graph) {
        List<String> violations = violations(graph);
        if (!violations.isEmpty()) {
            throw new ActionConstraintException(violations);
        }
    }
}
