/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.mepgraph.decision;

import com.powsybl.mepgraph.InvalidParameterException;
import com.powsybl.mepgraph.MepGraphParameters;
import com.powsybl.mepgraph.MepGraphTestUtil;
import com.powsybl.mepgraph.building.BuildingProfile;
import com.powsybl.mepgraph.building.CoreStrategy;
import com.powsybl.mepgraph.building.CoreStrategyPlanner;
import com.powsybl.mepgraph.network.NodeSubtype;
import com.powsybl.mepgraph.network.NodeType;
import com.powsybl.mepgraph.requirement.ElectricalRequirement;
import com.powsybl.mepgraph.requirement.LoadType;
import com.powsybl.mepgraph.requirement.RequirementAnalyzer;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author MEP graph developers {@literal <mep-graph-dev at example.org>}
 */
class NodeDecisionPlannerTest {

    private static List<NodeDecision> plan(BuildingProfile building, int targetNodeCount) {
        MepGraphParameters parameters = new MepGraphParameters();
        RandomGenerator random = new Well19937c(1);
        CoreStrategy coreStrategy = new CoreStrategyPlanner().plan(building);
        List<ElectricalRequirement> requirements = new RequirementAnalyzer(parameters, random).analyze(building, coreStrategy);
        return new NodeDecisionPlanner(parameters, random).plan(building, coreStrategy, requirements, targetNodeCount);
    }

    private static String describe(NodeDecision decision) {
        return decision.getType() + "/" + decision.getSubtype() + "@" + decision.getFloor();
    }

    @Test
    void testMinimalBuildingWithoutReconciliation() {
        // 8 equipment decisions and 9 loads
        List<NodeDecision> decisions = plan(MepGraphTestUtil.createMinimalBuilding(), 17);
        assertEquals(List.of("TRANSFORMER/MAIN@0", "SWITCHBOARD/MAIN@0",
                        "PANELBOARD/DISTRIBUTION@0",
                        "PANELBOARD/LIGHTING@1",
                        "PANELBOARD/LIGHTING@2",
                        "TRANSFORMER/SECONDARY@3", "PANELBOARD/DISTRIBUTION@3", "PANELBOARD/LIGHTING@3"),
                decisions.stream().filter(d -> !d.isLoad()).map(NodeDecisionPlannerTest::describe).toList());
        assertEquals(9, decisions.stream().filter(NodeDecision::isLoad).count());
        assertEquals(IntStream.range(0, 17).boxed().toList(), decisions.stream().map(NodeDecision::getIndex).toList());

        // 3 floors of 400 m2: 25.8 kW of HVAC, 19.4 kW per floor, 30 kW kitchen, 50 kW data center
        double floorAreaSqft = 400 * BuildingProfile.SQFT_PER_SQUARE_METER;
        double totalLoad = 2 * floorAreaSqft * 3 / 1000 + 3 * 4.5 * floorAreaSqft / 1000 + 80;
        NodeDecision mainTransformer = decisions.get(0);
        assertEquals(totalLoad * NodeDecisionPlanner.MAIN_TRANSFORMER_FACTOR, mainTransformer.getCapacity(), 1e-9);
        assertEquals(totalLoad * NodeDecisionPlanner.MAIN_SWITCHBOARD_FACTOR, decisions.get(1).getCapacity(), 1e-9);
        assertEquals(80 * NodeDecisionPlanner.SECONDARY_TRANSFORMER_FACTOR, decisions.get(5).getCapacity(), 1e-9);
        assertEquals(2, decisions.get(6).getRequirements().size());

        // equipment of a floor shares the riser without overlapping
        assertEquals(7, decisions.get(5).getLocation().getZ());
        assertNotEquals(decisions.get(5).getLocation(), decisions.get(6).getLocation());
        assertNotEquals(decisions.get(6).getLocation(), decisions.get(7).getLocation());
    }

    @Test
    void testMinimalBuildingTrimsLoads() {
        List<NodeDecision> decisions = plan(MepGraphTestUtil.createMinimalBuilding(), 10);
        assertEquals(10, decisions.size());
        List<NodeDecision> loads = decisions.stream().filter(NodeDecision::isLoad).toList();
        assertEquals(List.of(Optional.of(LoadType.KITCHEN), Optional.of(LoadType.DATA_CENTER)),
                loads.stream().map(NodeDecision::getLoadType).toList());
        assertEquals("F3-DATA", loads.get(1).getRoom());
        assertEquals(IntStream.range(0, 10).boxed().toList(), decisions.stream().map(NodeDecision::getIndex).toList());
    }

    @Test
    void testTargetBelowEquipmentCount() {
        List<NodeDecision> decisions = plan(MepGraphTestUtil.createMinimalBuilding(), 5);
        assertEquals(8, decisions.size());
        assertTrue(decisions.stream().noneMatch(NodeDecision::isLoad));
        assertEquals(IntStream.range(0, 8).boxed().toList(), decisions.stream().map(NodeDecision::getIndex).toList());
    }

    @Test
    void testFillerPanelboards() {
        BuildingProfile building = MepGraphTestUtil.createMinimalBuilding();
        List<NodeDecision> decisions = plan(building, 25);
        assertEquals(25, decisions.size());
        List<NodeDecision> fillers = decisions.stream().filter(d -> d.is(NodeType.PANELBOARD, NodeSubtype.GENERIC)).toList();
        assertEquals(8, fillers.size());
        for (NodeDecision filler : fillers) {
            assertTrue(filler.getFloor() >= 1 && filler.getFloor() <= 3);
            assertTrue(filler.getCapacity() >= NodeDecisionPlanner.FILLER_PANEL_MIN_CAPACITY
                    && filler.getCapacity() < NodeDecisionPlanner.FILLER_PANEL_MAX_CAPACITY);
            assertEquals(building.getFloorElevation(filler.getFloor()), filler.getLocation().getZ());
            assertTrue(filler.getRequirements().isEmpty());
        }
        // fillers are appended after the loads
        assertTrue(decisions.get(16).isLoad());
        assertEquals(NodeSubtype.GENERIC, decisions.get(17).getSubtype());
    }

    @Test
    void testSmallBuildingHasNoMainService() {
        // 57 kW of building load
        BuildingProfile building = BuildingProfile.builder().setLength(10).setWidth(10).setFloorCount(1).build();
        List<NodeDecision> decisions = plan(building, 3);
        assertTrue(decisions.stream().noneMatch(d -> d.getSubtype() == NodeSubtype.MAIN));
        assertTrue(decisions.stream().noneMatch(d -> d.getType() == NodeType.TRANSFORMER));
    }

    @Test
    void testLowVoltagePanelSplit() {
        // 1800 m2 per floor: 87 kW of low voltage load per floor, 2 panels
        BuildingProfile building = BuildingProfile.builder().setLength(60).setWidth(30).setFloorCount(2).build();
        List<NodeDecision> floorPanels = plan(building, 3).stream()
                .filter(d -> d.getFloor() == 1 && d.getType() == NodeType.PANELBOARD)
                .toList();
        assertEquals(2, floorPanels.size());
        assertEquals(NodeSubtype.LIGHTING, floorPanels.get(0).getSubtype());
        assertEquals(NodeSubtype.POWER, floorPanels.get(1).getSubtype());
    }

    @Test
    void testInvalidTarget() {
        BuildingProfile building = MepGraphTestUtil.createMinimalBuilding();
        assertThrows(InvalidParameterException.class, () -> plan(building, 2));
    }
}
