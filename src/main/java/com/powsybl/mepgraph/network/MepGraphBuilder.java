/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.mepgraph.network;

import com.powsybl.mepgraph.building.BuildingProfile;
import com.powsybl.mepgraph.decision.NodeDecision;
import com.powsybl.mepgraph.requirement.ElectricalRequirement;
import com.powsybl.mepgraph.requirement.LoadType;
import org.apache.commons.math3.random.RandomGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Materializes node decisions as graph nodes and connects them following a fixed precedence of rules.
 *
 * @author MEP graph developers {@literal <mep-graph-dev at example.org>}
 */
public class MepGraphBuilder {

    private static final Logger LOGGER = LoggerFactory.getLogger(MepGraphBuilder.class);

    public static final String MAIN_DISTRIBUTION = "Main Distribution";

    public static final String SECONDARY_DISTRIBUTION = "Secondary Distribution";

    public static final String FLOOR_DISTRIBUTION = "Floor Distribution";

    static final int MAX_EQUIPMENT_AGE = 5;

    private static final Map<NodeType, List<String>> MANUFACTURERS = new EnumMap<>(Map.of(
            NodeType.TRANSFORMER, List.of("ABB", "Siemens", "Schneider Electric", "Eaton", "GE"),
            NodeType.SWITCHBOARD, List.of("Eaton", "Siemens", "Schneider Electric", "ABB"),
            NodeType.PANELBOARD, List.of("Square D", "Eaton", "Siemens", "GE", "Leviton"),
            NodeType.LOAD, List.of("Carrier", "Trane", "Lutron", "Hubbell", "Vertiv")));

    /**
     * Width, height and depth bounds in meters.
     */
    private record DimensionBounds(double minWidth, double maxWidth, double minHeight, double maxHeight,
                                   double minDepth, double maxDepth) {
    }

    private static final Map<NodeType, DimensionBounds> DIMENSIONS = new EnumMap<>(Map.of(
            NodeType.TRANSFORMER, new DimensionBounds(1.5, 3.0, 2.0, 3.0, 1.2, 2.5),
            NodeType.SWITCHBOARD, new DimensionBounds(0.8, 2.4, 2.0, 2.4, 0.6, 1.2),
            NodeType.PANELBOARD, new DimensionBounds(0.5, 0.9, 0.9, 1.8, 0.15, 0.3),
            NodeType.LOAD, new DimensionBounds(0.3, 2.0, 0.3, 2.0, 0.3, 1.5)));

    /**
     * Expected lifespan in years, maintenance frequency in months and mean time to failure in hours.
     */
    private record LifecycleBaseline(int expectedLifespan, int maintenanceFrequency, double meanTimeToFailure) {
    }

    private static final LifecycleBaseline MAIN_TRANSFORMER_BASELINE = new LifecycleBaseline(35, 12, 306600);
    private static final LifecycleBaseline SECONDARY_TRANSFORMER_BASELINE = new LifecycleBaseline(30, 12, 262800);
    private static final LifecycleBaseline SWITCHBOARD_BASELINE = new LifecycleBaseline(30, 24, 262800);
    private static final LifecycleBaseline PANELBOARD_BASELINE = new LifecycleBaseline(25, 24, 219000);
    private static final LifecycleBaseline LOAD_BASELINE = new LifecycleBaseline(15, 6, 131400);

    private static final double[] SWITCHBOARD_SHORT_CIRCUIT_RATINGS = {42, 65, 100}; // kA

    private static final int[] PANELBOARD_CIRCUIT_COUNTS = {12, 24, 30, 42};

    private static final double MIN_TRANSFORMER_IMPEDANCE = 4.0; // %

    private static final double MAX_TRANSFORMER_IMPEDANCE = 6.0; // %

    private final RandomGenerator random;

    private final double powerFactor;

    public MepGraphBuilder(RandomGenerator random, double powerFactor) {
        this.random = Objects.requireNonNull(random);
        this.powerFactor = powerFactor;
    }

    public MepGraph build(List<NodeDecision> decisions, MepGraphMetadata metadata) {
        Objects.requireNonNull(decisions);
        MepGraph graph = new MepGraph(metadata);
        Map<NodeType, Integer> numByType = new EnumMap<>(NodeType.class);
        for (NodeDecision decision : decisions) {
            int num = numByType.merge(decision.getType(), 1, Integer::sum);
            graph.addNode(createNode(decision, num, metadata.constructionDate()));
        }
        connect(graph);
        LOGGER.debug("Graph built: {} nodes, {} edges", graph.getNodeCount(), graph.getEdgeCount());
        return graph;
    }

    private MepNode createNode(NodeDecision decision, int num, LocalDate constructionDate) {
        AbstractNodeAttributes attributes = createAttributes(decision);
        drawCosmeticAttributes(attributes, constructionDate);
        LifecycleBaseline baseline = getLifecycleBaseline(decision);
        attributes.setLifecycle(baseline.expectedLifespan(), baseline.maintenanceFrequency(), baseline.meanTimeToFailure());
        attributes.setInstallYear(constructionDate.getYear());
        attributes.setInstallationDate(constructionDate);
        return new MepNode(num, decision.getSubtype(), decision.getLocation(), decision.getFloor(), decision.getRoom(),
                decision.getCapacity(), decision.getReason(), attributes);
    }

    private AbstractNodeAttributes createAttributes(NodeDecision decision) {
        return switch (decision.getType()) {
            case TRANSFORMER -> {
                TransformerAttributes attributes = new TransformerAttributes();
                attributes.setNominalPower(decision.getCapacity() / powerFactor);
                attributes.setImpedance(MIN_TRANSFORMER_IMPEDANCE + random.nextDouble() * (MAX_TRANSFORMER_IMPEDANCE - MIN_TRANSFORMER_IMPEDANCE));
                yield attributes;
            }
            case SWITCHBOARD -> {
                SwitchboardAttributes attributes = new SwitchboardAttributes();
                attributes.setShortCircuitRating(SWITCHBOARD_SHORT_CIRCUIT_RATINGS[random.nextInt(SWITCHBOARD_SHORT_CIRCUIT_RATINGS.length)]);
                yield attributes;
            }
            case PANELBOARD -> {
                PanelboardAttributes attributes = new PanelboardAttributes();
                attributes.setCircuitCount(PANELBOARD_CIRCUIT_COUNTS[random.nextInt(PANELBOARD_CIRCUIT_COUNTS.length)]);
                yield attributes;
            }
            case LOAD -> {
                LoadType loadType = decision.getLoadType()
                        .orElseThrow(() -> new IllegalStateException("Load decision " + decision.getIndex() + " serves no requirement"));
                int priority = decision.getRequirements().stream().mapToInt(ElectricalRequirement::priority).min().orElse(loadType.getPriority());
                yield new LoadAttributes(loadType, decision.getCapacity(), priority);
            }
        };
    }

    private void drawCosmeticAttributes(AbstractNodeAttributes attributes, LocalDate constructionDate) {
        List<String> manufacturers = MANUFACTURERS.get(attributes.getType());
        attributes.setManufacturer(manufacturers.get(random.nextInt(manufacturers.size())));
        DimensionBounds bounds = DIMENSIONS.get(attributes.getType());
        attributes.setDimensions(uniform(bounds.minWidth(), bounds.maxWidth()),
                uniform(bounds.minHeight(), bounds.maxHeight()),
                uniform(bounds.minDepth(), bounds.maxDepth()));
        attributes.setManufactureYear(constructionDate.getYear() - random.nextInt(MAX_EQUIPMENT_AGE + 1));
    }

    private double uniform(double min, double max) {
        return min + random.nextDouble() * (max - min);
    }

    private static LifecycleBaseline getLifecycleBaseline(NodeDecision decision) {
        return switch (decision.getType()) {
            case TRANSFORMER -> decision.getSubtype() == NodeSubtype.MAIN ? MAIN_TRANSFORMER_BASELINE : SECONDARY_TRANSFORMER_BASELINE;
            case SWITCHBOARD -> SWITCHBOARD_BASELINE;
            case PANELBOARD -> PANELBOARD_BASELINE;
            case LOAD -> LOAD_BASELINE;
        };
    }

    private static void connect(MepGraph graph) {
        List<MepNode> mainTransformers = graph.getNodes(NodeType.TRANSFORMER, NodeSubtype.MAIN);
        List<MepNode> mainSwitchboards = graph.getNodes(NodeType.SWITCHBOARD, NodeSubtype.MAIN);
        List<MepNode> secondaryTransformers = graph.getNodes(NodeType.TRANSFORMER, NodeSubtype.SECONDARY);
        List<MepNode> panelboards = graph.getNodes(NodeType.PANELBOARD);
        MepNode mainTransformer = mainTransformers.isEmpty() ? null : mainTransformers.get(0);
        MepNode mainSwitchboard = mainSwitchboards.isEmpty() ? null : mainSwitchboards.get(0);

        if (mainTransformer != null && mainSwitchboard != null) {
            graph.addEdge(mainTransformer, mainSwitchboard, MAIN_DISTRIBUTION);
        }

        if (mainSwitchboard != null) {
            for (MepNode transformer : secondaryTransformers) {
                graph.addEdge(mainSwitchboard, transformer, SECONDARY_DISTRIBUTION);
            }
        }

        for (MepNode transformer : secondaryTransformers) {
            for (MepNode panelboard : panelboards) {
                if (panelboard.getFloor() == transformer.getFloor()) {
                    graph.addEdge(transformer, panelboard, FLOOR_DISTRIBUTION);
                }
            }
        }

        if (mainSwitchboard != null) {
            Set<Integer> floorsWithTransformer = secondaryTransformers.stream()
                    .map(MepNode::getFloor)
                    .collect(Collectors.toSet());
            for (MepNode panelboard : panelboards) {
                int floor = panelboard.getFloor();
                if (floor != BuildingProfile.BASEMENT_FLOOR && !floorsWithTransformer.contains(floor)) {
                    graph.addEdge(mainSwitchboard, panelboard, FLOOR_DISTRIBUTION);
                }
            }
        }

        List<MepNode> unconnected = new ArrayList<>();
        for (MepNode load : graph.getNodes(NodeType.LOAD)) {
            MepGraph.getNearestNode(load, panelboards).ifPresentOrElse(
                panelboard -> graph.addEdge(panelboard, load, load.getAttributes(LoadAttributes.class).getLoadType().getLabel()),
                () -> unconnected.add(load));
        }
        if (!unconnected.isEmpty()) {
            LOGGER.warn("No panelboard to feed {} loads: {}", unconnected.size(), unconnected);
        }
    }
}
