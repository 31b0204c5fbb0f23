/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.mepgraph;

import com.powsybl.commons.report.ReportNode;
import com.powsybl.mepgraph.building.BuildingProfile;
import com.powsybl.mepgraph.building.CoreStrategyKind;
import com.powsybl.mepgraph.io.MepGraphExporter;
import com.powsybl.mepgraph.network.MepGraph;
import com.powsybl.mepgraph.network.NodeType;
import com.powsybl.mepgraph.network.MepNode;
import com.powsybl.mepgraph.util.Profiler;
import com.powsybl.mepgraph.voltage.HighVoltageTierMode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.io.StringWriter;
import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author MEP graph developers {@literal <mep-graph-dev at example.org>}
 */
class MepGraphGeneratorTest {

    private static String export(MepGraph graph) {
        StringWriter writer = new StringWriter();
        MepGraphExporter.export(graph, writer);
        return writer.toString();
    }

    private static BuildingProfile building(double length, double width, int floorCount) {
        return BuildingProfile.builder()
                .setLength(length)
                .setWidth(width)
                .setFloorCount(floorCount)
                .build();
    }

    static Stream<Arguments> buildings() {
        return Stream.of(
                Arguments.of(building(20, 20, 3), 10, 1L),
                Arguments.of(building(20, 20, 3), 25, 2L),
                Arguments.of(building(10, 10, 1), 5, 3L),
                Arguments.of(building(50, 40, 12), 60, 4L),
                Arguments.of(building(120, 30, 3), 40, 5L),
                Arguments.of(building(60, 30, 2), 3, 6L),
                Arguments.of(building(80, 80, 6), 100, 7L));
    }

    @ParameterizedTest
    @MethodSource("buildings")
    void testInvariants(BuildingProfile building, int nodeCount, long seed) {
        MepGraph graph = MepGraphGenerator.generate(building, nodeCount, seed, new MepGraphParameters());
        MepGraphTestUtil.assertGraphInvariants(graph);
        if (graph.getNodes(NodeType.LOAD).isEmpty()) {
            assertTrue(graph.getNodeCount() >= nodeCount);
        } else {
            assertEquals(nodeCount, graph.getNodeCount());
        }
        assertEquals(seed, graph.getMetadata().seed());
        double highVoltage = graph.getMetadata().highVoltageTier();
        assertTrue(highVoltage == 13500 || highVoltage == 4160);
        graph.getNodes(NodeType.TRANSFORMER).stream()
                .filter(t -> graph.getInDegree(t) == 0)
                .forEach(t -> assertEquals(highVoltage, t.getAttributes().getUpstreamVoltage()));
    }

    @Test
    void testMinimalBuilding() {
        MepGraph graph = MepGraphTestUtil.generateMinimalGraph();
        assertEquals(10, graph.getNodeCount());
        assertEquals(8, graph.getEdgeCount());
        assertEquals(CoreStrategyKind.MULTI_CORE, graph.getMetadata().coreStrategy().getKind());
        assertEquals(13500, graph.getMetadata().highVoltageTier());
        assertEquals(List.of("transformer_001", "panelboard_001"),
                graph.getSources().stream().map(MepNode::getId).toList());
        assertEquals(2, graph.getNodes(NodeType.TRANSFORMER).size());
        assertEquals(1, graph.getNodes(NodeType.SWITCHBOARD).size());
        assertEquals(5, graph.getNodes(NodeType.PANELBOARD).size());
        assertEquals(2, graph.getNodes(NodeType.LOAD).size());
    }

    @Test
    void testDeterminism() {
        MepGraphParameters parameters = MepGraphTestUtil.createParameters().setHighVoltageTierMode(HighVoltageTierMode.RANDOM);
        BuildingProfile building = building(45, 30, 5);
        MepGraph graph1 = MepGraphGenerator.generate(building, 30, 12345L, parameters);
        MepGraph graph2 = MepGraphGenerator.generate(building, 30, 12345L, parameters, ReportNode.NO_OP, Profiler.create());
        assertEquals(graph1.getMetadata().generationId(), graph2.getMetadata().generationId());
        assertEquals(export(graph1), export(graph2));

        MepGraph graph3 = MepGraphGenerator.generate(building, 30, 54321L, parameters);
        assertNotEquals(graph1.getMetadata().generationId(), graph3.getMetadata().generationId());
    }

    @Test
    void testWithoutSeed() {
        MepGraph graph = MepGraphGenerator.generate(MepGraphTestUtil.createMinimalBuilding(), 10, null, MepGraphTestUtil.createParameters());
        MepGraphTestUtil.assertGraphInvariants(graph);
    }

    @Test
    void testInvalidArguments() {
        InvalidParameterException e = assertThrows(InvalidParameterException.class,
            () -> MepGraphGenerator.generate(MepGraphTestUtil.createMinimalBuilding(), 2, 1L));
        assertEquals("Node count must be at least 3: 2", e.getMessage());
        assertThrows(InvalidParameterException.class, () -> MepGraphGenerator.generate(null, 10, 1L));
    }
}
