package com.hybridgames;

import static picocli.CommandLine.ArgGroup;
import static picocli.CommandLine.Command;
import static picocli.CommandLine.Option;

import com.google.common.base.Stopwatch;
import com.hybridgames.algorithm.EquilibriumFinder;
import com.hybridgames.algorithm.EquilibriumRegion;
import com.hybridgames.dynamics.SwitchedDynamics;
import com.hybridgames.graph.ActionConstraints;
import com.hybridgames.graph.AugmentedTransitionGraph;
import com.hybridgames.graph.TransitionGraph;
import com.hybridgames.output.DotWriter;
import com.hybridgames.output.JsonWriter;
import com.hybridgames.parser.ModelParser;
import com.hybridgames.synthesis.SpecificationBuilder;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.function.BiConsumer;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;
import javax.annotation.Nullable;
import picocli.CommandLine;

@Command(
    name = "hybridgames",
    mixinStandardHelpOptions = true,
    version = "Hybrid Games 0.1",
    description = "Finds equilibrium regions of switched affine systems and prepares transition graphs for "
        + "GR(1) synthesis")
public final class Main implements Callable<Void> {
    private static final Logger log = Logger.getLogger(Main.class.getName());

    private static PrintStream open(String output) throws IOException {
        return "-".equals(output)
            ? new PrintStream(System.out) {
                @Override
                public void close() {
                    flush();
                }
            }
            : new PrintStream(new BufferedOutputStream(Files.newOutputStream(Path.of(output))));
    }

    private static <S> void writeIfPresent(@Nullable String output, S object, BiConsumer<S, PrintStream> formatter)
        throws IOException {
        if (output != null) {
            try (var stream = open(output)) {
                formatter.accept(object, stream);
            }
        }
    }

    @ArgGroup(heading = "input", exclusive = false, multiplicity = "1")
    private Input input;

    static class Input {
        @Nullable
        @Option(names = "--model", description = "Switched system in JSON format")
        private String model;

        @Nullable
        @Option(names = "--graph", description = "Transition graph in JSON format")
        private String graph;
    }

    @Option(
        names = {"--eps"},
        description = "Padding of equilibrium regions, 0 derives it from the dynamics. Default: ${DEFAULT-VALUE}")
    private double eps = EquilibriumFinder.Settings.DEFAULT.padding();

    @Option(
        names = {"--fallback-offset"},
        description = "Size of the marker region placed past the state space. Default: ${DEFAULT-VALUE}")
    private double fallbackOffset = EquilibriumFinder.Settings.DEFAULT.fallbackOffset();

    @Option(
        names = {"--write-equilibria"},
        description = "Write the equilibrium regions as JSON (- for stdout). Default: ${DEFAULT-VALUE}")
    private String writeEquilibria = "-";

    @Option(
        names = {"--check-actions"},
        description = "Fail if an edge of the graph violates the selection mode of an action group")
    private boolean checkActions = false;

    @Nullable
    @Option(
        names = {"--write-dot"},
        description = "Write the graph in dot format")
    private String writeDot;

    @Nullable
    @Option(
        names = {"--write-spec"},
        description = "Write the progress formulas derived from the graph and the equilibria")
    private String writeSpec;

    private Main() {}

    public static void main(String[] args) {
        try (InputStream configuration = Main.class.getResourceAsStream("/logging.properties")) {
            if (configuration != null) {
                LogManager.getLogManager().readConfiguration(configuration);
            }
        } catch (IOException e) {
            log.log(Level.WARNING, "Failed to read logging configuration", e);
        }
        System.exit(new CommandLine(new Main())
            .setCaseInsensitiveEnumValuesAllowed(true)
            .execute(args));
    }

    @Override
    public Void call() throws Exception {
        List<String> formulas = new ArrayList<>();
        if (input.model != null) {
            Stopwatch timer = Stopwatch.createStarted();
            SwitchedDynamics system = ModelParser.parseSwitched(ModelParser.read(Path.of(input.model)));
            var settings = EquilibriumFinder.Settings.DEFAULT.withPadding(eps).withFallbackOffset(fallbackOffset);
            Map<String, EquilibriumRegion> equilibria = new EquilibriumFinder(settings).find(system);
            log.log(Level.INFO, () -> "Found %d equilibrium regions in %s".formatted(equilibria.size(), timer));
            writeIfPresent(writeEquilibria, equilibria, (regions, stream) -> {
                try {
                    JsonWriter.write(JsonWriter.equilibria(regions), stream);
                } catch (IOException e) {
                    throw new IllegalStateException(e);
                }
            });
            formulas.addAll(SpecificationBuilder.equilibriumProgress(equilibria));
        }
        if (input.graph != null) {
            TransitionGraph<String> graph = ModelParser.parseGraph(ModelParser.read(Path.of(input.graph)));
            log.log(Level.INFO, () -> "Read %s".formatted(graph));
            if (checkActions) {
                ActionConstraints.validate(graph);
            } else {
                ActionConstraints.violations(graph).forEach(violation -> log.log(Level.WARNING, violation));
            }
            writeIfPresent(writeDot, graph, DotWriter::writeGraph);
            if (graph instanceof AugmentedTransitionGraph<String> augmented) {
                formulas.addAll(SpecificationBuilder.progressAssumptions(augmented));
            }
        }
        writeIfPresent(writeSpec, formulas, (list, stream) -> list.forEach(stream::println));
        return null;
    }
}
