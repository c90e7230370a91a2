package com.hybridgames.graph;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.hybridgames.model.UnknownActionException;
import com.hybridgames.model.UnknownKeyException;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;

class AugmentedTransitionGraphTest {
    private static AugmentedTransitionGraph<String> closed() {
        AugmentedTransitionGraph<String> graph = AugmentedTransitionGraph.closed("modes", "mode0", "mode1");
        graph.addStates(List.of("s0", "s1", "s2"));
        return graph;
    }

    private static ActionLabel system(String value) {
        return ActionLabel.of(TransitionGraph.SYSTEM_ACTIONS, value);
    }

    @Test
    void singleActionKeysMapToOneSubset() {
        AugmentedTransitionGraph<String> graph = closed();
        graph.setProgressMapByAction(Map.of("mode0", List.of("s0", "s1")));
        assertEquals(List.of(Set.of("s0", "s1")), graph.progressGroups(system("mode0")));
        assertTrue(graph.progressGroups(system("mode1")).isEmpty());
    }

    @Test
    void multipleSubsetsStayIndependent() {
        AugmentedTransitionGraph<String> graph = closed();
        graph.setProgressMap(Map.of(system("mode0"), List.of(Set.of("s0"), Set.of("s1"), Set.of("s0"))));
        List<Set<String>> groups = graph.progressGroups(system("mode0"));
        assertEquals(3, groups.size());
        assertEquals(List.of(Set.of("s0"), Set.of("s1"), Set.of("s0")), groups);
    }

    @Test
    void unknownKeysAreListedAndOldMapKept() {
        AugmentedTransitionGraph<String> graph = closed();
        graph.setProgressMapByAction(Map.of("mode0", List.of("s0")));
        UnknownActionException exception = assertThrows(UnknownActionException.class,
                () -> graph.setProgressMapByAction(Map.of("mode0", List.of("s1"), "mode7", List.of("s1"))));
        assertEquals(List.of("mode7"), exception.keys());
        assertEquals(List.of(Set.of("s0")), graph.progressGroups(system("mode0")));

        assertThrows(UnknownKeyException.class, () -> graph.setProgressMap(
                Map.of(ActionLabel.of("env_actions", "mode0"), List.of(List.of("s0")))));
        assertThrows(UnknownActionException.class, () -> graph.setProgressMap(
                Map.of(ActionLabel.EMPTY, List.of(List.of("s0")))));
    }

    @Test
    void subsetsMustNameStates() {
        AugmentedTransitionGraph<String> graph = closed();
        assertThrows(IllegalArgumentException.class,
                () -> graph.setProgressGroups(system("mode0"), List.of(List.of("s9"))));
        assertTrue(graph.progressMap().isEmpty());
    }

    @Test
    void environmentAndSystemCombinationKey() {
        AugmentedTransitionGraph<String> graph = AugmentedTransitionGraph.open("open", Owner.SYSTEM);
        graph.actions().addValues(TransitionGraph.ENVIRONMENT_ACTIONS, List.of("env_m0", "env_m1"));
        graph.actions().addValues(TransitionGraph.SYSTEM_ACTIONS, List.of("sys_m0", "sys_m1"));
        graph.addStates(List.of("s0", "s1"));

        ActionLabel key = ActionLabel.of(TransitionGraph.ENVIRONMENT_ACTIONS, "env_m0",
                TransitionGraph.SYSTEM_ACTIONS, "sys_m0");
        graph.setProgressGroups(key, List.of(List.of("s0"), List.of("s1")));
        graph.setProgressGroups(system("sys_m1"), List.of(List.of("s1")));

        assertEquals(2, graph.progressMap().size());
        assertEquals(List.of(Set.of("s0"), Set.of("s1")), graph.progressGroups(key));
        assertThrows(UnknownActionException.class, () -> graph.setProgressGroups(
                ActionLabel.of(TransitionGraph.ENVIRONMENT_ACTIONS, "env_m0", TransitionGraph.SYSTEM_ACTIONS, "sys_m7"),
                List.of(List.of("s0"))));
    }

    @Test
    void removingAStateShrinksProgressGroups() {
        AugmentedTransitionGraph<String> graph = closed();
        graph.setProgressGroups(system("mode1"), List.of(List.of("s0", "s2")));
        graph.removeState("s2");
        assertEquals(List.of(Set.of("s0")), graph.progressGroups(system("mode1")));
    }

    @Test
    void progressMapIsReadOnly() {
        AugmentedTransitionGraph<String> graph = closed();
        graph.setProgressGroups(system("mode1"), List.of(List.of("s0")));
        assertThrows(UnsupportedOperationException.class, () -> graph.progressMap().clear());
    }
}
