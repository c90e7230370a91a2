package com.hybridgames.parser;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableSet;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;
import com.hybridgames.algorithm.EquilibriumRegion;
import com.hybridgames.dynamics.LinearDynamics;
import com.hybridgames.dynamics.PiecewiseAffineDynamics;
import com.hybridgames.dynamics.SwitchedDynamics;
import com.hybridgames.geometry.Polytope;
import com.hybridgames.geometry.Region;
import com.hybridgames.geometry.Regions;
import com.hybridgames.graph.ActionGroup;
import com.hybridgames.graph.ActionLabel;
import com.hybridgames.graph.ActionRegistry;
import com.hybridgames.graph.AugmentedTransitionGraph;
import com.hybridgames.graph.Owner;
import com.hybridgames.graph.SelectionMode;
import com.hybridgames.graph.TransitionGraph;
import com.hybridgames.model.Mode;
import com.hybridgames.model.TimeData;
import com.hybridgames.model.TimeSemantics;
import java.io.IOException;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;
import javax.annotation.Nullable;

/** Reads dynamics, graphs and equilibrium regions from the JSON written by the output writer. */
public final class ModelParser {
  private ModelParser() {}

  public static JsonObject read(Path path) throws IOException {
    try (Reader reader = Files.newBufferedReader(path)) {
      return JsonParser.parseReader(reader).getAsJsonObject();
    }
  }

  public static Region parseRegion(JsonObject json) {
    int dimension = requireNonNull(json.getAsJsonPrimitive("dimension"), "Missing region dimension").getAsInt();
    List<Polytope> pieces = stream(requireNonNull(json.getAsJsonArray("polytopes"), "Missing polytopes"))
        .map(JsonElement::getAsJsonObject)
        .map(piece -> Polytope.of(dimension,
            parseMatrix(requireNonNull(piece.getAsJsonArray("A"), "Missing polytope matrix A")),
            parseVector(requireNonNull(piece.getAsJsonArray("b"), "Missing polytope offsets b"))))
        .toList();
    return pieces.isEmpty() ? Regions.empty(dimension) : Regions.union(dimension, pieces);
  }

  public static LinearDynamics parseLinear(JsonObject json) {
    LinearDynamics.Builder builder = LinearDynamics.builder(
        parseMatrix(requireNonNull(json.getAsJsonArray("A"), "Missing dynamics matrix A")));
    if (json.has("B")) {
      builder.input(parseMatrix(json.getAsJsonArray("B")));
    }
    if (json.has("E")) {
      builder.disturbance(parseMatrix(json.getAsJsonArray("E")));
    }
    if (json.has("K")) {
      builder.offset(parseMatrix(json.getAsJsonArray("K")));
    }
    return builder
        .controlSet(optionalRegion(json, "controlSet"))
        .disturbanceSet(optionalRegion(json, "disturbanceSet"))
        .domain(optionalRegion(json, "domain"))
        .timeData(parseTimeData(json))
        .build();
  }

  public static PiecewiseAffineDynamics parsePiecewise(JsonObject json) {
    Region domain = parseRegion(requireNonNull(json.getAsJsonObject("domain"), "Missing piecewise domain"));
    List<LinearDynamics> subsystems = stream(requireNonNull(json.getAsJsonArray("subsystems"), "Missing subsystems"))
        .map(JsonElement::getAsJsonObject)
        .map(ModelParser::parseLinear)
        .toList();
    return new PiecewiseAffineDynamics(subsystems, domain, parseTimeData(json), overwriteTime(json));
  }

  public static SwitchedDynamics parseSwitched(JsonObject json) {
    List<String> environmentLabels = strings(requireNonNull(json.getAsJsonArray("environmentLabels"),
        "Missing environment labels"));
    List<String> systemLabels = strings(requireNonNull(json.getAsJsonArray("systemLabels"), "Missing system labels"));
    SwitchedDynamics.Builder builder = SwitchedDynamics.builder(
            parseRegion(requireNonNull(json.getAsJsonObject("stateSpace"), "Missing continuous state space")))
        .modeCounts(environmentLabels.size(), systemLabels.size())
        .environmentLabels(environmentLabels)
        .systemLabels(systemLabels)
        .timeData(parseTimeData(json))
        .overwriteTime(overwriteTime(json));
    stream(requireNonNull(json.getAsJsonArray("modes"), "Missing modes")).map(JsonElement::getAsJsonObject)
        .forEach(modeData -> {
          Mode mode = new Mode(requireNonNull(modeData.getAsJsonPrimitive("env"), "Missing environment label").getAsString(),
              requireNonNull(modeData.getAsJsonPrimitive("sys"), "Missing system label").getAsString());
          builder.dynamics(mode, parsePiecewise(requireNonNull(modeData.getAsJsonObject("dynamics"),
              () -> "Missing dynamics of mode %s".formatted(mode))));
        });
    return builder.build();
  }

  public static Map<String, EquilibriumRegion> parseEquilibria(JsonObject json) {
    Map<String, EquilibriumRegion> regions = new LinkedHashMap<>();
    for (var entry : json.entrySet()) {
      String proposition = entry.getKey();
      JsonObject data = entry.getValue().getAsJsonObject();
      Mode mode = new Mode(requireNonNull(data.getAsJsonPrimitive("env"),
          () -> "Missing environment label of %s".formatted(proposition)).getAsString(),
          requireNonNull(data.getAsJsonPrimitive("sys"),
              () -> "Missing system label of %s".formatted(proposition)).getAsString());
      EquilibriumRegion.Kind kind = EquilibriumRegion.Kind.valueOf(requireNonNull(data.getAsJsonPrimitive("kind"),
          () -> "Missing kind of %s".formatted(proposition)).getAsString());
      Region region = parseRegion(requireNonNull(data.getAsJsonObject("region"),
          () -> "Missing region of %s".formatted(proposition)));
      regions.put(proposition, new EquilibriumRegion(proposition, mode, region, kind));
    }
    return regions;
  }

  /** A graph with string states. Graphs of type {@code augmented} also read their progress map. */
  public static TransitionGraph<String> parseGraph(JsonObject json) {
    String name = requireNonNull(json.getAsJsonPrimitive("name"), "Missing name").getAsString();
    String type = json.has("type") ? json.getAsJsonPrimitive("type").getAsString() : "plain";
    Owner owner = json.has("owner") ? Owner.parse(json.getAsJsonPrimitive("owner").getAsString()) : Owner.SYSTEM;

    ActionRegistry actions = new ActionRegistry();
    if (json.has("actionGroups")) {
      stream(json.getAsJsonArray("actionGroups")).map(JsonElement::getAsJsonObject).forEach(groupData -> {
        String groupName = requireNonNull(groupData.getAsJsonPrimitive("name"), "Missing action group name")
            .getAsString();
        actions.declare(new ActionGroup(groupName,
            ImmutableSet.copyOf(strings(requireNonNull(groupData.getAsJsonArray("values"),
                () -> "Missing values of action group %s".formatted(groupName)))),
            groupData.has("mode") ? SelectionMode.parse(groupData.getAsJsonPrimitive("mode").getAsString())
                : SelectionMode.XOR,
            groupData.has("owner") ? Owner.parse(groupData.getAsJsonPrimitive("owner").getAsString()) : Owner.SYSTEM));
      });
    }

    TransitionGraph<String> graph = switch (type) {
      case "plain" -> new TransitionGraph<>(name, owner, actions);
      case "augmented" -> new AugmentedTransitionGraph<>(name, owner, actions);
      default -> throw new IllegalArgumentException("Unknown graph type " + type);
    };
    if (json.has("ap")) {
      graph.addAtomicPropositions(strings(json.getAsJsonArray("ap")));
    }
    stream(requireNonNull(json.getAsJsonArray("states"), "Missing states")).map(JsonElement::getAsJsonObject)
        .forEach(stateData -> {
          String state = requireNonNull(stateData.getAsJsonPrimitive("name"), "Missing state name").getAsString();
          graph.addState(state, stateData.has("labels") ? strings(stateData.getAsJsonArray("labels")) : List.of());
        });
    if (json.has("initial")) {
      strings(json.getAsJsonArray("initial")).forEach(graph::addInitialState);
    }
    if (json.has("transitions")) {
      stream(json.getAsJsonArray("transitions")).map(JsonElement::getAsJsonObject).forEach(transition -> {
        String source = requireNonNull(transition.getAsJsonPrimitive("from"), "Missing transition source").getAsString();
        String target = requireNonNull(transition.getAsJsonPrimitive("to"),
            () -> "Missing target of transition from %s".formatted(source)).getAsString();
        graph.addEdge(source, target, transition.has("actions")
            ? parseLabel(transition.getAsJsonObject("actions"))
            : ActionLabel.EMPTY);
      });
    }
    if (graph instanceof AugmentedTransitionGraph<String> augmented && json.has("progress")) {
      Map<ActionLabel, List<List<String>>> progress = new LinkedHashMap<>();
      stream(json.getAsJsonArray("progress")).map(JsonElement::getAsJsonObject).forEach(entry -> {
        ActionLabel key = parseLabel(requireNonNull(entry.getAsJsonObject("actions"), "Missing progress actions"));
        List<List<String>> groups = stream(requireNonNull(entry.getAsJsonArray("groups"),
            () -> "Missing progress groups of %s".formatted(key)))
            .map(group -> strings(group.getAsJsonArray()))
            .toList();
        progress.put(key, groups);
      });
      augmented.setProgressMap(progress);
    }
    return graph;
  }

  private static ActionLabel parseLabel(JsonObject json) {
    Map<String, String> values = new LinkedHashMap<>();
    json.entrySet().forEach(entry -> values.put(entry.getKey(), entry.getValue().getAsString()));
    return ActionLabel.of(values);
  }

  private static TimeData parseTimeData(JsonObject json) {
    TimeSemantics semantics = json.has("timeSemantics")
        ? TimeSemantics.parse(json.getAsJsonPrimitive("timeSemantics").getAsString())
        : TimeSemantics.UNSET;
    @Nullable
    Double timestep = json.has("timestep") ? json.getAsJsonPrimitive("timestep").getAsDouble() : null;
    return new TimeData(semantics, timestep);
  }

  private static boolean overwriteTime(JsonObject json) {
    JsonPrimitive overwrite = json.getAsJsonPrimitive("overwriteTime");
    return overwrite == null || overwrite.getAsBoolean();
  }

  @Nullable
  private static Region optionalRegion(JsonObject json, String key) {
    JsonObject region = json.getAsJsonObject(key);
    return region == null ? null : parseRegion(region);
  }

  static double[][] parseMatrix(JsonArray rows) {
    return stream(rows).map(row -> parseVector(row.getAsJsonArray())).toArray(double[][]::new);
  }

  static double[] parseVector(JsonArray values) {
    return stream(values).mapToDouble(JsonElement::getAsDouble).toArray();
  }

  private static List<String> strings(JsonArray array) {
    return stream(array).map(JsonElement::getAsString).toList();
  }

  private static Stream<JsonElement> stream(JsonArray array) {
    if (array.isEmpty()) {
      return Stream.of();
    }
    return StreamSupport.stream(Spliterators.spliterator(array.iterator(), array.size(),
        Spliterator.IMMUTABLE | Spliterator.SIZED | Spliterator.ORDERED), false);
  }
}
