/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.mepgraph.tools;

import com.powsybl.commons.config.PlatformConfig;
import com.powsybl.commons.io.table.AsciiTableFormatter;
import com.powsybl.commons.io.table.Column;
import com.powsybl.commons.io.table.HorizontalAlignment;
import com.powsybl.commons.report.ReportNode;
import com.powsybl.mepgraph.InvalidParameterException;
import com.powsybl.mepgraph.MepGraphGenerator;
import com.powsybl.mepgraph.MepGraphParameters;
import com.powsybl.mepgraph.building.BuildingProfile;
import com.powsybl.mepgraph.io.MepGraphExporter;
import com.powsybl.mepgraph.network.MepEdge;
import com.powsybl.mepgraph.network.MepGraph;
import com.powsybl.mepgraph.network.MepNode;
import com.powsybl.mepgraph.network.NodeType;
import com.powsybl.mepgraph.util.Profiler;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.concurrent.Callable;

/**
 * Command line wrapper: generates a graph and writes it as a {@value MepGraphExporter#EXTENSION} file.
 *
 * @author MEP graph developers {@literal <mep-graph-dev at example.org>}
 */
@CommandLine.Command(
    name = "mep-graph",
    mixinStandardHelpOptions = true,
    version = "mep-graph 1.0",
    description = "Generates the electrical distribution graph of a building")
public class MepGraphTool implements Callable<Integer> {

    private static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    @CommandLine.Parameters(
        index = "0",
        paramLabel = "node_count",
        description = "Target number of nodes (at least 3)")
    int nodeCount;

    @CommandLine.Option(
        names = {"--seed"},
        description = "Random seed (default: time based)")
    Long seed;

    @CommandLine.Option(
        names = {"--filename"},
        description = "Output file name, the .mepg extension is added when missing")
    String filename;

    @CommandLine.Option(
        names = {"--length"},
        description = "Building length in meters (default: 20)")
    double length = BuildingProfile.DEFAULT_LENGTH;

    @CommandLine.Option(
        names = {"--width"},
        description = "Building width in meters (default: 20)")
    double width = BuildingProfile.DEFAULT_WIDTH;

    @CommandLine.Option(
        names = {"--floors"},
        description = "Number of above ground floors (default: 4)")
    int floorCount = BuildingProfile.DEFAULT_FLOOR_COUNT;

    @CommandLine.Option(
        names = {"--floor-height"},
        description = "Floor height in meters (default: 3.5)")
    double floorHeight = BuildingProfile.DEFAULT_FLOOR_HEIGHT;

    @CommandLine.Option(
        names = {"--basement-depth"},
        description = "Basement depth in meters (default: 4)")
    double basementDepth = BuildingProfile.DEFAULT_BASEMENT_DEPTH;

    @CommandLine.Option(
        names = {"--output-dir"},
        description = "Output directory, created when missing (default: graph_outputs)")
    Path outputDir;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    private final PlatformConfig platformConfig;

    public MepGraphTool() {
        this(null);
    }

    public MepGraphTool(PlatformConfig platformConfig) {
        this.platformConfig = platformConfig;
    }

    public static final int INVALID_PARAMETER_EXIT_CODE = 2;

    public static CommandLine createCommandLine(MepGraphTool tool) {
        return new CommandLine(tool)
                .setExecutionExceptionHandler((e, commandLine, parseResult) -> {
                    if (e instanceof InvalidParameterException) {
                        commandLine.getErr().println("Invalid parameter: " + e.getMessage());
                        return INVALID_PARAMETER_EXIT_CODE;
                    }
                    throw e;
                });
    }

    public static void main(String[] args) {
        System.exit(createCommandLine(new MepGraphTool()).execute(args));
    }

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        MepGraphParameters parameters = platformConfig != null ? MepGraphParameters.load(platformConfig) : MepGraphParameters.load();

        BuildingProfile building = BuildingProfile.builder()
                .setLength(length)
                .setWidth(width)
                .setFloorCount(floorCount)
                .setFloorHeight(floorHeight)
                .setBasementDepth(basementDepth)
                .build();
        MepGraph graph = MepGraphGenerator.generate(building, nodeCount, seed, parameters, ReportNode.NO_OP, Profiler.create());

        Path directory = outputDir != null ? outputDir : Path.of(parameters.getOutputDirectory());
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        Path file = MepGraphExporter.export(graph, directory.resolve(getFileName(graph)));

        printSummary(graph, file, out);
        out.flush();
        return 0;
    }

    private String getFileName(MepGraph graph) {
        String name = filename;
        if (name == null) {
            name = String.format(Locale.US, "mep_graph_%s_seed_%d_nodes_%d", LocalDateTime.now().format(TIMESTAMP_FORMAT),
                    graph.getMetadata().seed(), nodeCount);
        }
        String extension = "." + MepGraphExporter.EXTENSION;
        return name.endsWith(extension) ? name : name + extension;
    }

    static void printSummary(MepGraph graph, Path file, PrintWriter out) {
        Objects.requireNonNull(graph);
        BuildingProfile building = graph.getMetadata().building();
        out.printf(Locale.US, "Graph %s written to %s%n", graph.getMetadata().generationId(), file);
        out.printf(Locale.US, "Building: %.1f m x %.1f m, %d floors of %.1f m, %s with %d core(s)%n",
                building.getLength(), building.getWidth(), building.getFloorCount(), building.getFloorHeight(),
                graph.getMetadata().coreStrategy().getKind(), graph.getMetadata().coreStrategy().getCoreCount());
        out.printf(Locale.US, "Nodes: %d, edges: %d, seed: %d%n", graph.getNodeCount(), graph.getEdgeCount(), graph.getMetadata().seed());

        Map<NodeType, Integer> countByType = new EnumMap<>(NodeType.class);
        SortedMap<Integer, Map<NodeType, Integer>> countByFloor = new TreeMap<>();
        for (MepNode node : graph.getNodes()) {
            countByType.merge(node.getType(), 1, Integer::sum);
            countByFloor.computeIfAbsent(node.getFloor(), f -> new EnumMap<>(NodeType.class))
                    .merge(node.getType(), 1, Integer::sum);
        }

        StringWriter tables = new StringWriter();
        try (AsciiTableFormatter formatter = new AsciiTableFormatter(tables, "Nodes by type",
                new Column("Type"),
                new Column("Count").setHorizontalAlignment(HorizontalAlignment.RIGHT))) {
            for (NodeType type : NodeType.values()) {
                formatter.writeCell(type.getPrefix())
                        .writeCell(countByType.getOrDefault(type, 0));
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }

        try (AsciiTableFormatter formatter = new AsciiTableFormatter(tables, "Nodes by floor",
                new Column("Floor"),
                new Column("Transformers").setHorizontalAlignment(HorizontalAlignment.RIGHT),
                new Column("Switchboards").setHorizontalAlignment(HorizontalAlignment.RIGHT),
                new Column("Panelboards").setHorizontalAlignment(HorizontalAlignment.RIGHT),
                new Column("Loads").setHorizontalAlignment(HorizontalAlignment.RIGHT))) {
            for (Map.Entry<Integer, Map<NodeType, Integer>> e : countByFloor.entrySet()) {
                Map<NodeType, Integer> counts = e.getValue();
                formatter.writeCell(e.getKey() == BuildingProfile.BASEMENT_FLOOR ? "B" : Integer.toString(e.getKey()))
                        .writeCell(counts.getOrDefault(NodeType.TRANSFORMER, 0))
                        .writeCell(counts.getOrDefault(NodeType.SWITCHBOARD, 0))
                        .writeCell(counts.getOrDefault(NodeType.PANELBOARD, 0))
                        .writeCell(counts.getOrDefault(NodeType.LOAD, 0));
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }

        out.print(tables);

        DescriptiveStatistics cableDistances = new DescriptiveStatistics();
        for (MepEdge edge : graph.getEdges()) {
            cableDistances.addValue(edge.getCableDistance());
        }
        if (cableDistances.getN() > 0) {
            out.printf(Locale.US, "Cable distance (m): total %.1f, min %.1f, mean %.1f, max %.1f%n",
                    cableDistances.getSum(), cableDistances.getMin(), cableDistances.getMean(), cableDistances.getMax());
        }
    }
}
