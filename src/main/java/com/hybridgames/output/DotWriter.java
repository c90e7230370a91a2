package com.hybridgames.output;

import com.google.common.collect.LinkedHashMultimap;
import com.google.common.collect.SetMultimap;
import com.hybridgames.graph.ActionLabel;
import com.hybridgames.graph.AugmentedTransitionGraph;
import com.hybridgames.graph.Edge;
import com.hybridgames.graph.TransitionGraph;
import it.unimi.dsi.fastutil.objects.Object2IntLinkedOpenHashMap;
import it.unimi.dsi.fastutil.objects.Object2IntMap;
import java.io.PrintStream;
import java.util.Set;
import java.util.stream.Collectors;

public final class DotWriter {
    private DotWriter() {
    }

    public static <S> void writeGraph(TransitionGraph<S> graph, PrintStream writer) {
        Object2IntMap<S> ids = new Object2IntLinkedOpenHashMap<>();
        graph.states().forEach(s -> ids.put(s, ids.size()));
        Set<S> initialStates = graph.initialStates();

        writer.append("digraph \"%s\" {\n".formatted(escape(graph.name())));
        writer.append("node [shape=box]\n");
        for (Object2IntMap.Entry<S> entry : ids.object2IntEntrySet()) {
            S state = entry.getKey();
            String labels = graph.labels(state).stream().sorted().collect(Collectors.joining(", "));
            writer.append("S_%d [label=\"%s%s\"%s]\n".formatted(entry.getIntValue(), escape(String.valueOf(state)),
                    labels.isEmpty() ? "" : "\\n" + escape(labels),
                    initialStates.contains(state) ? ",peripheries=2" : ""));
        }
        for (Object2IntMap.Entry<S> entry : ids.object2IntEntrySet()) {
            SetMultimap<S, ActionLabel> labelsBySuccessor = LinkedHashMultimap.create();
            for (Edge<S> edge : graph.edges(entry.getKey())) {
                labelsBySuccessor.put(edge.target(), edge.label());
            }
            for (var successorEntry : labelsBySuccessor.asMap().entrySet()) {
                String label = successorEntry.getValue().stream()
                        .filter(actions -> !actions.isEmpty())
                        .map(DotWriter::actionString)
                        .collect(Collectors.joining("\\n"));
                writer.append("S_%d -> S_%d%s\n".formatted(entry.getIntValue(), ids.getInt(successorEntry.getKey()),
                        label.isEmpty() ? "" : " [label=\"%s\"]".formatted(label)));
            }
        }
        if (graph instanceof AugmentedTransitionGraph<S> augmented && !augmented.progressMap().isEmpty()) {
            writer.append("// progress groups\n");
            augmented.progressMap().forEach((key, subsets) -> subsets.forEach(subset ->
                    writer.append("// %s: %s\n".formatted(actionString(key), subset.stream()
                            .map(s -> "S_" + ids.getInt(s))
                            .collect(Collectors.joining(" "))))));
        }
        writer.append("}\n");
    }

    private static String actionString(ActionLabel label) {
        return label.values().entrySet().stream()
                .map(entry -> escape(entry.getKey() + ":" + entry.getValue()))
                .collect(Collectors.joining(", "));
    }

    private static String escape(String string) {
        return string.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}
