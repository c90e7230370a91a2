package com.hybridgames.output;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.hybridgames.algorithm.EquilibriumRegion;
import com.hybridgames.dynamics.LinearDynamics;
import com.hybridgames.dynamics.Matrices;
import com.hybridgames.dynamics.PiecewiseAffineDynamics;
import com.hybridgames.dynamics.SwitchedDynamics;
import com.hybridgames.geometry.Polytope;
import com.hybridgames.geometry.Region;
import com.hybridgames.graph.ActionGroup;
import com.hybridgames.graph.ActionLabel;
import com.hybridgames.graph.AugmentedTransitionGraph;
import com.hybridgames.graph.Edge;
import com.hybridgames.graph.TransitionGraph;
import com.hybridgames.model.TimeData;
import java.io.IOException;
import java.util.Collection;
import java.util.Map;
import java.util.Set;
import org.ejml.simple.SimpleMatrix;

/** Writes models in the JSON format read by {@link com.hybridgames.parser.ModelParser}. */
public final class JsonWriter {
    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().create();

    private JsonWriter() {
    }

    public static void write(JsonObject json, Appendable writer) throws IOException {
        GSON.toJson(json, writer);
        writer.append('\n');
    }

    public static String toString(JsonObject json) {
        return GSON.toJson(json);
    }

    public static JsonObject region(Region region) {
        JsonObject json = new JsonObject();
        json.addProperty("dimension", region.dimension());
        JsonArray polytopes = new JsonArray();
        for (Polytope piece : region.pieces()) {
            JsonObject polytope = new JsonObject();
            polytope.add("A", matrix(piece.matrix()));
            polytope.add("b", vector(piece.offsets()));
            polytopes.add(polytope);
        }
        json.add("polytopes", polytopes);
        return json;
    }

    public static JsonObject linear(LinearDynamics dynamics) {
        JsonObject json = new JsonObject();
        json.add("A", matrix(dynamics.a()));
        json.add("B", matrix(dynamics.b()));
        json.add("E", matrix(dynamics.e()));
        json.add("K", matrix(dynamics.k()));
        dynamics.controlSet().ifPresent(set -> json.add("controlSet", region(set)));
        dynamics.disturbanceSet().ifPresent(set -> json.add("disturbanceSet", region(set)));
        dynamics.domain().ifPresent(domain -> json.add("domain", region(domain)));
        addTimeData(json, dynamics.timeData());
        return json;
    }

    public static JsonObject piecewise(PiecewiseAffineDynamics dynamics) {
        JsonObject json = new JsonObject();
        json.add("domain", region(dynamics.domain()));
        JsonArray subsystems = new JsonArray();
        dynamics.subsystems().forEach(subsystem -> subsystems.add(linear(subsystem)));
        json.add("subsystems", subsystems);
        addTimeData(json, dynamics.timeData());
        return json;
    }

    public static JsonObject switched(SwitchedDynamics dynamics) {
        JsonObject json = new JsonObject();
        json.add("environmentLabels", strings(dynamics.environmentLabels()));
        json.add("systemLabels", strings(dynamics.systemLabels()));
        json.add("stateSpace", region(dynamics.stateSpace()));
        JsonArray modes = new JsonArray();
        dynamics.dynamics().forEach((mode, modeDynamics) -> {
            JsonObject modeJson = new JsonObject();
            modeJson.addProperty("env", mode.environment());
            modeJson.addProperty("sys", mode.system());
            modeJson.add("dynamics", piecewise(modeDynamics));
            modes.add(modeJson);
        });
        json.add("modes", modes);
        addTimeData(json, dynamics.timeData());
        return json;
    }

    public static JsonObject equilibria(Map<String, EquilibriumRegion> regions) {
        JsonObject json = new JsonObject();
        regions.forEach((proposition, region) -> {
            JsonObject regionJson = new JsonObject();
            regionJson.addProperty("env", region.mode().environment());
            regionJson.addProperty("sys", region.mode().system());
            regionJson.addProperty("kind", region.kind().name());
            regionJson.add("region", region(region.region()));
            json.add(proposition, regionJson);
        });
        return json;
    }

    public static <S> JsonObject graph(TransitionGraph<S> graph) {
        JsonObject json = new JsonObject();
        json.addProperty("name", graph.name());
        json.addProperty("type", graph instanceof AugmentedTransitionGraph ? "augmented" : "plain");
        json.addProperty("owner", graph.owner().prefix());
        json.add("ap", strings(graph.atomicPropositions().stream().sorted().toList()));

        JsonArray groups = new JsonArray();
        for (ActionGroup group : graph.actions().groups()) {
            JsonObject groupJson = new JsonObject();
            groupJson.addProperty("name", group.name());
            groupJson.addProperty("owner", group.owner().prefix());
            groupJson.addProperty("mode", group.mode().id());
            groupJson.add("values", strings(group.values()));
            groups.add(groupJson);
        }
        json.add("actionGroups", groups);

        JsonArray states = new JsonArray();
        for (S state : graph.states()) {
            JsonObject stateJson = new JsonObject();
            stateJson.addProperty("name", String.valueOf(state));
            stateJson.add("labels", strings(graph.labels(state).stream().sorted().toList()));
            states.add(stateJson);
        }
        json.add("states", states);
        json.add("initial", strings(graph.initialStates().stream().map(String::valueOf).sorted().toList()));

        JsonArray transitions = new JsonArray();
        for (Edge<S> edge : graph.edges()) {
            JsonObject transition = new JsonObject();
            transition.addProperty("from", String.valueOf(edge.source()));
            transition.addProperty("to", String.valueOf(edge.target()));
            if (edge.isLabeled()) {
                transition.add("actions", label(edge.label()));
            }
            transitions.add(transition);
        }
        json.add("transitions", transitions);

        if (graph instanceof AugmentedTransitionGraph<S> augmented) {
            JsonArray progress = new JsonArray();
            augmented.progressMap().forEach((key, subsets) -> {
                JsonObject entry = new JsonObject();
                entry.add("actions", label(key));
                JsonArray subsetsJson = new JsonArray();
                for (Set<S> subset : subsets) {
                    subsetsJson.add(strings(subset.stream().map(String::valueOf).toList()));
                }
                entry.add("groups", subsetsJson);
                progress.add(entry);
            });
            json.add("progress", progress);
        }
        return json;
    }

    private static JsonObject label(ActionLabel label) {
        JsonObject json = new JsonObject();
        label.values().forEach((group, value) -> json.addProperty(group, value));
        return json;
    }

    private static void addTimeData(JsonObject json, TimeData timeData) {
        json.addProperty("timeSemantics", timeData.semantics().id());
        if (timeData.timestep() != null) {
            json.addProperty("timestep", timeData.timestep());
        }
    }

    private static JsonArray matrix(SimpleMatrix matrix) {
        return matrix(Matrices.toArray(matrix));
    }

    private static JsonArray matrix(double[][] rows) {
        JsonArray json = new JsonArray();
        for (double[] row : rows) {
            json.add(vector(row));
        }
        return json;
    }

    private static JsonArray vector(double[] values) {
        JsonArray json = new JsonArray();
        for (double value : values) {
            json.add(value);
        }
        return json;
    }

    private static JsonArray strings(Collection<String> values) {
        JsonArray json = new JsonArray();
        values.forEach(value -> json.add(value));
        return json;
    }
}
