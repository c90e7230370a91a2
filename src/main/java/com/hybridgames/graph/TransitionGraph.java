package com.hybridgames.graph;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableSet;
import com.google.common.collect.LinkedHashMultimap;
import com.google.common.collect.SetMultimap;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Finite transition system whose edges are labeled with actions. States carry sets of atomic
 * propositions; actions are partitioned into the groups of the {@link ActionRegistry}.
 *
 * <p>Insertion only checks that states and actions are declared. Selection modes are checked by
 * {@link ActionConstraints} once the graph is complete.
 */
public class TransitionGraph<S> {
    public static final String SYSTEM_ACTIONS = "sys_actions";
    public static final String ENVIRONMENT_ACTIONS = "env_actions";

    private final String name;
    private final Owner owner;
    private final ActionRegistry actions;
    private final Set<String> atomicPropositions = new LinkedHashSet<>();
    private final Map<S, Set<String>> labels = new LinkedHashMap<>();
    private final Set<S> initialStates = new LinkedHashSet<>();
    private final SetMultimap<S, Edge<S>> outgoing = LinkedHashMultimap.create();

    public TransitionGraph(String name, Owner owner, ActionRegistry actions) {
        this.name = requireNonNull(name);
        this.owner = requireNonNull(owner);
        this.actions = requireNonNull(actions);
    }

    /** A graph describing the system alone, with the single action group {@value #SYSTEM_ACTIONS}. */
    public static <S> TransitionGraph<S> closed(String name, String... systemActions) {
        return new TransitionGraph<>(name, Owner.SYSTEM, closedActions(systemActions));
    }

    static ActionRegistry closedActions(String... systemActions) {
        ActionRegistry registry = new ActionRegistry();
        registry.declare(ActionGroup.of(SYSTEM_ACTIONS, Owner.SYSTEM, SelectionMode.XOR, systemActions));
        return registry;
    }

    /** A graph where the environment and the system both pick an action on every step. */
    public static <S> TransitionGraph<S> open(String name, Owner owner) {
        return new TransitionGraph<>(name, owner, openActions());
    }

    static ActionRegistry openActions() {
        ActionRegistry registry = new ActionRegistry();
        registry.declare(ActionGroup.of(ENVIRONMENT_ACTIONS, Owner.ENVIRONMENT, SelectionMode.XOR));
        registry.declare(ActionGroup.of(SYSTEM_ACTIONS, Owner.SYSTEM, SelectionMode.XOR));
        return registry;
    }

    /** States {@code s0 -> s1 -> ... -> s(n-1)}, state {@code i} labeled with {@code labels.get(i)}. */
    public static TransitionGraph<String> line(List<? extends Collection<String>> labels) {
        TransitionGraph<String> graph = closed("line");
        for (int i = 0; i < labels.size(); i++) {
            graph.addAtomicPropositions(labels.get(i));
            graph.addState("s" + i, labels.get(i));
        }
        for (int i = 0; i + 1 < labels.size(); i++) {
            graph.addEdge("s" + i, "s" + (i + 1));
        }
        if (!labels.isEmpty()) {
            graph.addInitialState("s0");
        }
        return graph;
    }

    /** Like {@link #line(List)}, with an additional edge from the last state back to {@code s0}. */
    public static TransitionGraph<String> cycle(List<? extends Collection<String>> labels) {
        TransitionGraph<String> graph = line(labels);
        if (!labels.isEmpty()) {
            graph.addEdge("s" + (labels.size() - 1), "s0");
        }
        return graph;
    }

    /**
     * Builds a closed graph from plain collections.
     *
     * @param prefix prepended to every state name, may be empty
     * @param transitions {@code [from, to]} for unlabeled or {@code [from, to, action]} for edges
     *     labeled with a system action
     */
    public static TransitionGraph<String> fromTuple(String name, String prefix, List<String> states,
            Collection<String> initial, Collection<String> propositions, Map<String, ? extends Collection<String>> labeling,
            Collection<String> systemActions, Collection<List<String>> transitions) {
        TransitionGraph<String> graph = closed(name, systemActions.toArray(String[]::new));
        graph.addAtomicPropositions(propositions);
        for (String state : states) {
            graph.addState(prefix + state, labeling.containsKey(state) ? labeling.get(state) : Set.of());
        }
        initial.forEach(state -> graph.addInitialState(prefix + state));
        for (List<String> transition : transitions) {
            checkArgument(transition.size() == 2 || transition.size() == 3,
                    "Transition %s must be [from, to] or [from, to, action]", transition);
            String source = prefix + transition.get(0);
            String target = prefix + transition.get(1);
            if (transition.size() == 2) {
                graph.addEdge(source, target);
            } else {
                graph.addEdge(source, target, ActionLabel.of(SYSTEM_ACTIONS, transition.get(2)));
            }
        }
        return graph;
    }

    public String name() {
        return name;
    }

    public Owner owner() {
        return owner;
    }

    public ActionRegistry actions() {
        return actions;
    }

    public Set<String> atomicPropositions() {
        return ImmutableSet.copyOf(atomicPropositions);
    }

    public void addAtomicPropositions(Collection<String> propositions) {
        atomicPropositions.addAll(propositions);
    }

    public void addState(S state) {
        addState(state, Set.of());
    }

    public void addState(S state, Collection<String> stateLabels) {
        requireNonNull(state);
        checkArgument(!labels.containsKey(state), "State %s already exists", state);
        labels.put(state, checkedLabels(stateLabels));
    }

    public void addStates(Collection<S> states) {
        states.forEach(this::addState);
    }

    public void setLabels(S state, Collection<String> stateLabels) {
        checkArgument(labels.containsKey(state), "Unknown state %s", state);
        labels.put(state, checkedLabels(stateLabels));
    }

    private Set<String> checkedLabels(Collection<String> stateLabels) {
        Set<String> undeclared = stateLabels.stream()
                .filter(proposition -> !atomicPropositions.contains(proposition))
                .collect(Collectors.toCollection(LinkedHashSet::new));
        checkArgument(undeclared.isEmpty(), "Undeclared atomic propositions %s", undeclared);
        return ImmutableSet.copyOf(stateLabels);
    }

    public void removeState(S state) {
        checkArgument(labels.containsKey(state), "Unknown state %s", state);
        labels.remove(state);
        initialStates.remove(state);
        outgoing.removeAll(state);
        outgoing.values().removeIf(edge -> edge.target().equals(state));
    }

    public void addInitialState(S state) {
        checkArgument(labels.containsKey(state), "Initial state %s is not a state", state);
        initialStates.add(state);
    }

    /** Marks every state whose label contains all the given propositions as initial. */
    public void markInitialByLabel(Set<String> propositions) {
        statesLabeledWith(propositions).forEach(initialStates::add);
    }

    public void addEdge(S source, S target) {
        addEdge(source, target, ActionLabel.EMPTY);
    }

    public void addEdge(S source, S target, ActionLabel label) {
        checkArgument(labels.containsKey(source), "Unknown source state %s", source);
        checkArgument(labels.containsKey(target), "Unknown target state %s", target);
        actions.validate(label);
        for (Edge<S> existing : edges(source, target)) {
            checkState(existing.isLabeled() == !label.isEmpty(),
                    "Cannot add %s edge %s -> %s, an %s edge exists. Remove it first",
                    label.isEmpty() ? "an unlabeled" : "a labeled", source, target,
                    existing.isLabeled() ? "labeled" : "unlabeled");
        }
        outgoing.put(source, new Edge<>(source, target, label));
    }

    /** Removes all edges from {@code source} to {@code target}. */
    public void removeEdge(S source, S target) {
        outgoing.get(source).removeIf(edge -> edge.target().equals(target));
    }

    public void removeEdge(S source, S target, ActionLabel label) {
        outgoing.remove(source, new Edge<>(source, target, label));
    }

    public Set<S> states() {
        return ImmutableSet.copyOf(labels.keySet());
    }

    public boolean hasState(S state) {
        return labels.containsKey(state);
    }

    public Set<S> initialStates() {
        return ImmutableSet.copyOf(initialStates);
    }

    public Set<String> labels(S state) {
        Set<String> stateLabels = labels.get(state);
        checkArgument(stateLabels != null, "Unknown state %s", state);
        return stateLabels;
    }

    public List<Edge<S>> edges() {
        return List.copyOf(outgoing.values());
    }

    public Set<Edge<S>> edges(S source) {
        return ImmutableSet.copyOf(outgoing.get(source));
    }

    public List<Edge<S>> edges(S source, S target) {
        return outgoing.get(source).stream().filter(edge -> edge.target().equals(target)).toList();
    }

    public Set<S> successors(S source) {
        return outgoing.get(source).stream().map(Edge::target).collect(Collectors.toCollection(LinkedHashSet::new));
    }

    public Set<S> successors(S source, ActionLabel label) {
        return outgoing.get(source).stream()
                .filter(edge -> edge.label().equals(label))
                .map(Edge::target)
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    public Set<S> statesLabeledWith(String proposition) {
        return statesLabeledWith(Set.of(proposition));
    }

    public Set<S> statesLabeledWith(Set<String> propositions) {
        return labels.entrySet().stream()
                .filter(entry -> entry.getValue().containsAll(propositions))
                .map(Map.Entry::getKey)
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    public int edgeCount() {
        return outgoing.size();
    }

    @Override
    public String toString() {
        return "%s graph %s: %d states (%d initial), %d edges, actions %s".formatted(owner.prefix(), name,
                labels.size(), initialStates.size(), outgoing.size(),
                actions.groups().stream()
                        .map(group -> group.name() + "=" + group.values())
                        .collect(Collectors.joining(", ")));
    }
}
