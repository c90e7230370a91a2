package com.hybridgames.graph;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.hybridgames.model.UnknownActionException;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;

class TransitionGraphTest {
    private static TransitionGraph<String> thermostat() {
        TransitionGraph<String> graph = TransitionGraph.closed("thermostat", "heat", "cool");
        graph.addAtomicPropositions(List.of("cold", "warm"));
        graph.addState("s0", Set.of("cold"));
        graph.addState("s1", Set.of("warm"));
        graph.addInitialState("s0");
        return graph;
    }

    private static ActionLabel system(String value) {
        return ActionLabel.of(TransitionGraph.SYSTEM_ACTIONS, value);
    }

    @Test
    void addingAnEdgeTwiceKeepsOneEdge() {
        TransitionGraph<String> graph = thermostat();
        graph.addEdge("s0", "s1", system("heat"));
        graph.addEdge("s0", "s1", system("heat"));
        assertEquals(1, graph.edgeCount());
        graph.addEdge("s0", "s1", system("cool"));
        assertEquals(2, graph.edgeCount());
        assertEquals(Set.of("s1"), graph.successors("s0", system("cool")));
    }

    @Test
    void labeledAndUnlabeledEdgesExcludeEachOther() {
        TransitionGraph<String> graph = thermostat();
        graph.addEdge("s0", "s1");
        assertThrows(IllegalStateException.class, () -> graph.addEdge("s0", "s1", system("heat")));
        graph.removeEdge("s0", "s1");
        graph.addEdge("s0", "s1", system("heat"));
        assertThrows(IllegalStateException.class, () -> graph.addEdge("s0", "s1"));
        graph.addEdge("s1", "s0");
        assertEquals(2, graph.edgeCount());
    }

    @Test
    void unknownStatesAndActionsAreRejected() {
        TransitionGraph<String> graph = thermostat();
        assertThrows(IllegalArgumentException.class, () -> graph.addEdge("s0", "s9"));
        UnknownActionException exception = assertThrows(UnknownActionException.class,
                () -> graph.addEdge("s0", "s1", system("fan")));
        assertEquals(List.of("sys_actions:fan"), exception.keys());
        assertThrows(UnknownActionException.class,
                () -> graph.addEdge("s0", "s1", ActionLabel.of("env_actions", "heat")));
        assertEquals(0, graph.edgeCount());
    }

    @Test
    void labelsMustBeDeclared() {
        TransitionGraph<String> graph = thermostat();
        assertThrows(IllegalArgumentException.class, () -> graph.addState("s2", Set.of("hot")));
        assertThrows(IllegalArgumentException.class, () -> graph.addState("s0"));
        assertThrows(IllegalArgumentException.class, () -> graph.addInitialState("s9"));
    }

    @Test
    void removingAStateRemovesIncidentEdges() {
        TransitionGraph<String> graph = thermostat();
        graph.addEdge("s0", "s1", system("heat"));
        graph.addEdge("s1", "s0", system("cool"));
        graph.removeState("s0");
        assertEquals(Set.of("s1"), graph.states());
        assertEquals(0, graph.edgeCount());
        assertTrue(graph.initialStates().isEmpty());
    }

    @Test
    void stateViewIsReadOnly() {
        TransitionGraph<String> graph = thermostat();
        graph.addEdge("s0", "s1");
        assertThrows(UnsupportedOperationException.class, () -> graph.states().remove("s0"));
        assertTrue(graph.hasState("s0"));
        assertEquals(1, graph.edgeCount());
    }

    @Test
    void queriesKeepInsertionOrder() {
        TransitionGraph<String> graph = thermostat();
        graph.addState("s2", Set.of());
        graph.addState("s3", Set.of());
        graph.addInitialState("s3");
        graph.addInitialState("s2");
        graph.addEdge("s0", "s3", system("heat"));
        graph.addEdge("s0", "s1", system("cool"));
        graph.addEdge("s0", "s2", system("heat"));
        assertEquals(List.of("s0", "s3", "s2"), List.copyOf(graph.initialStates()));
        assertEquals(List.of("s3", "s1", "s2"), graph.edges("s0").stream().map(Edge::target).toList());
        assertEquals(List.of("s0", "s1", "s2", "s3"), List.copyOf(graph.states()));
    }

    @Test
    void removesSingleLabeledEdge() {
        TransitionGraph<String> graph = thermostat();
        graph.addEdge("s0", "s1", system("heat"));
        graph.addEdge("s0", "s1", system("cool"));
        graph.removeEdge("s0", "s1", system("heat"));
        assertEquals(List.of(new Edge<>("s0", "s1", system("cool"))), graph.edges("s0", "s1"));
    }

    @Test
    void queriesByLabel() {
        TransitionGraph<String> graph = thermostat();
        graph.setLabels("s1", Set.of("warm", "cold"));
        assertEquals(Set.of("s0", "s1"), graph.statesLabeledWith("cold"));
        assertEquals(Set.of("s1"), graph.statesLabeledWith(Set.of("cold", "warm")));
        graph.markInitialByLabel(Set.of("warm"));
        assertEquals(Set.of("s0", "s1"), graph.initialStates());
    }

    @Test
    void lineAndCycle() {
        List<Set<String>> labels = List.of(Set.of("a"), Set.of("b"), Set.of("a", "c"));
        TransitionGraph<String> line = TransitionGraph.line(labels);
        assertEquals(Set.of("s0", "s1", "s2"), line.states());
        assertEquals(2, line.edgeCount());
        assertTrue(line.successors("s2").isEmpty());
        assertEquals(Set.of("s0"), line.initialStates());
        assertEquals(Set.of("a", "c"), line.labels("s2"));

        TransitionGraph<String> cycle = TransitionGraph.cycle(labels);
        assertEquals(3, cycle.edgeCount());
        assertEquals(Set.of("s0"), cycle.successors("s2"));
    }

    @Test
    void buildsFromTuple() {
        TransitionGraph<String> graph = TransitionGraph.fromTuple("tuple", "x", List.of("0", "1"), List.of("0"),
                List.of("p"), Map.of("1", Set.of("p")), List.of("go"),
                List.of(List.of("0", "1", "go"), List.of("1", "1")));
        assertEquals(Set.of("x0", "x1"), graph.states());
        assertEquals(Set.of("x0"), graph.initialStates());
        assertEquals(Set.of("x1"), graph.statesLabeledWith("p"));
        assertEquals(Set.of("x1"), graph.successors("x0", system("go")));
        assertFalse(graph.edges("x1", "x1").get(0).isLabeled());
        assertThrows(IllegalArgumentException.class, () -> TransitionGraph.fromTuple("bad", "", List.of("0"),
                List.of(), List.of(), Map.of(), List.of(), List.of(List.of("0"))));
    }

    @Test
    void openGraphHasBothGroups() {
        TransitionGraph<Integer> graph = TransitionGraph.open("open", Owner.ENVIRONMENT);
        assertEquals(List.of("env_actions", "sys_actions"),
                graph.actions().groups().stream().map(ActionGroup::name).toList());
        graph.actions().addValues("env_actions", List.of("rain"));
        graph.addState(1);
        graph.addEdge(1, 1, ActionLabel.of("env_actions", "rain"));
        assertEquals(1, graph.edgeCount());
    }

    @Test
    void labelsOrderGroupsByName() {
        ActionLabel written = ActionLabel.of("sys_actions", "heat", "env_actions", "rain");
        assertEquals(ActionLabel.of("env_actions", "rain", "sys_actions", "heat"), written);
        assertEquals("{env_actions:rain,sys_actions:heat}", written.toString());
    }

    @Test
    void reservedGroupName() {
        ActionRegistry registry = new ActionRegistry();
        assertThrows(IllegalArgumentException.class,
                () -> registry.declare(ActionGroup.of("actions", Owner.SYSTEM, SelectionMode.NONE, "a")));
        registry.declare(ActionGroup.of("modes", Owner.SYSTEM, SelectionMode.NONE, "a"));
        assertThrows(IllegalArgumentException.class,
                () -> registry.declare(ActionGroup.of("modes", Owner.SYSTEM, SelectionMode.NONE, "b")));
    }
}
