package com.hybridgames.graph;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.hybridgames.model.ActionConstraintException;
import java.util.List;
import org.junit.jupiter.api.Test;

class ActionConstraintsTest {
    private static TransitionGraph<String> graph(SelectionMode mode) {
        ActionRegistry registry = new ActionRegistry();
        registry.declare(ActionGroup.of("env_actions", Owner.ENVIRONMENT, mode, "rain", "sun"));
        registry.declare(ActionGroup.of("sys_actions", Owner.SYSTEM, SelectionMode.NONE, "open", "close"));
        TransitionGraph<String> graph = new TransitionGraph<>("weather", Owner.SYSTEM, registry);
        graph.addStates(List.of("a", "b"));
        return graph;
    }

    @Test
    void xorRequiresAValueOnEveryEdge() {
        TransitionGraph<String> graph = graph(SelectionMode.XOR);
        graph.addEdge("a", "b", ActionLabel.of("env_actions", "rain", "sys_actions", "open"));
        graph.addEdge("b", "a", ActionLabel.of("sys_actions", "close"));
        graph.addEdge("b", "b");

        List<String> violations = ActionConstraints.violations(graph);
        assertEquals(2, violations.size());
        assertTrue(violations.get(0).contains("b -> a"));
        ActionConstraintException exception = assertThrows(ActionConstraintException.class,
                () -> ActionConstraints.validate(graph));
        assertEquals(violations, exception.violations());
    }

    @Test
    void mutexAllowsMissingValues() {
        TransitionGraph<String> graph = graph(SelectionMode.MUTEX);
        graph.addEdge("a", "b", ActionLabel.of("env_actions", "sun"));
        graph.addEdge("b", "a", ActionLabel.of("sys_actions", "close"));
        assertDoesNotThrow(() -> ActionConstraints.validate(graph));
    }

    @Test
    void xorGroupsWithoutValuesAreIgnored() {
        TransitionGraph<String> graph = TransitionGraph.line(List.of(List.of(), List.of()));
        assertTrue(ActionConstraints.violations(graph).isEmpty());
    }
}
