/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.mepgraph;

import com.powsybl.mepgraph.building.BuildingProfile;
import com.powsybl.mepgraph.building.CoreStrategyPlanner;
import com.powsybl.mepgraph.network.AbstractNodeAttributes;
import com.powsybl.mepgraph.network.MepEdge;
import com.powsybl.mepgraph.network.MepGraph;
import com.powsybl.mepgraph.network.MepGraphMetadata;
import com.powsybl.mepgraph.network.MepNode;
import com.powsybl.mepgraph.network.NodeSubtype;
import com.powsybl.mepgraph.network.NodeType;
import com.powsybl.mepgraph.network.TransformerAttributes;
import com.powsybl.mepgraph.voltage.HighVoltageTierMode;
import com.powsybl.mepgraph.voltage.StandardVoltages;
import org.apache.commons.math3.geometry.euclidean.threed.Vector3D;
import org.jgrapht.traverse.BreadthFirstIterator;

import java.time.LocalDate;
import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author MEP graph developers {@literal <mep-graph-dev at example.org>}
 */
public final class MepGraphTestUtil {

    public static final LocalDate CONSTRUCTION_DATE = LocalDate.of(2020, 6, 1);

    private MepGraphTestUtil() {
    }

    /**
     * 3 floors of 20 m x 20 m, 3.5 m high.
     */
    public static BuildingProfile createMinimalBuilding() {
        return BuildingProfile.builder()
                .setLength(20)
                .setWidth(20)
                .setFloorHeight(3.5)
                .setFloorCount(3)
                .build();
    }

    public static MepGraphParameters createParameters() {
        return new MepGraphParameters()
                .setHighVoltageTierMode(HighVoltageTierMode.TIER_13500)
                .setConstructionDate(CONSTRUCTION_DATE);
    }

    public static MepGraph generateMinimalGraph() {
        return MepGraphGenerator.generate(createMinimalBuilding(), 10, 1L, createParameters());
    }

    public static MepGraph createEmptyGraph() {
        BuildingProfile building = createMinimalBuilding();
        return new MepGraph(new MepGraphMetadata("test", building, new CoreStrategyPlanner().plan(building),
                StandardVoltages.HIGH_VOLTAGE_13500, 0, CONSTRUCTION_DATE, MepGraphMetadata.DEFAULT_DESCRIPTION));
    }

    public static MepNode addNode(MepGraph graph, int num, NodeSubtype subtype, AbstractNodeAttributes attributes,
                                  double x, double y, int floor, double capacity) {
        BuildingProfile building = graph.getMetadata().building();
        MepNode node = new MepNode(num, subtype, new Vector3D(x, y, building.getFloorElevation(floor)), floor, "",
                capacity, "test", attributes);
        graph.addNode(node);
        return node;
    }

    /**
     * Checks the rules every generated graph follows.
     */
    public static void assertGraphInvariants(MepGraph graph) {
        for (MepNode node : graph.getNodes()) {
            assertTrue(node.isEnergized(), () -> node.getId() + " is not energized");
        }

        for (MepNode transformer : graph.getNodes(NodeType.TRANSFORMER)) {
            TransformerAttributes attributes = transformer.getAttributes(TransformerAttributes.class);
            assertTrue(attributes.getDownstreamVoltage() < attributes.getUpstreamVoltage(), () -> transformer.getId() + " does not step down");
            for (MepNode neighbor : graph.getPredecessors(transformer)) {
                assertNotEquals(NodeType.TRANSFORMER, neighbor.getType());
            }
            for (MepNode neighbor : graph.getSuccessors(transformer)) {
                assertNotEquals(NodeType.TRANSFORMER, neighbor.getType());
            }
        }

        for (MepNode load : graph.getNodes(NodeType.LOAD)) {
            assertEquals(1, graph.getInDegree(load), () -> load.getId() + " has not a single feeder");
            assertEquals(NodeType.PANELBOARD, graph.getPredecessors(load).get(0).getType());
        }

        for (MepEdge edge : graph.getEdges()) {
            assertTrue(edge.isStamped());
            assertEquals(graph.getEdgeSource(edge).getAttributes().getDownstreamVoltage(), edge.getVoltage(), 0);
        }

        Set<MepNode> reached = new HashSet<>();
        for (MepNode source : graph.getSources()) {
            new BreadthFirstIterator<>(graph.getGraph(), source).forEachRemaining(reached::add);
        }
        assertEquals(graph.getNodes(), reached);
    }
}
