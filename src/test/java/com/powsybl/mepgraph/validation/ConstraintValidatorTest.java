/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.mepgraph.validation;

import com.powsybl.commons.report.ReportNode;
import com.powsybl.mepgraph.MepGraphParameters;
import com.powsybl.mepgraph.MepGraphTestUtil;
import com.powsybl.mepgraph.io.MepGraphExporter;
import com.powsybl.mepgraph.network.*;
import com.powsybl.mepgraph.requirement.LoadType;
import com.powsybl.mepgraph.util.report.MepGraphReportResourceBundle;
import com.powsybl.mepgraph.voltage.StandardVoltages;
import com.powsybl.mepgraph.voltage.VoltagePropagator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.StringWriter;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author MEP graph developers {@literal <mep-graph-dev at example.org>}
 */
class ConstraintValidatorTest {

    private VoltagePropagator propagator;

    private ConstraintValidator validator;

    private MepGraph graph;

    @BeforeEach
    void setUp() {
        propagator = new VoltagePropagator(new StandardVoltages(StandardVoltages.HIGH_VOLTAGE_13500), new MepGraphParameters());
        validator = new ConstraintValidator(propagator);
        graph = MepGraphTestUtil.createEmptyGraph();
    }

    private static String export(MepGraph graph) {
        StringWriter writer = new StringWriter();
        MepGraphExporter.export(graph, writer);
        return writer.toString();
    }

    private MepNode addTransformer(int num, NodeSubtype subtype, double x) {
        return MepGraphTestUtil.addNode(graph, num, subtype, new TransformerAttributes(), x, 0, 1, 50);
    }

    private MepNode addPanelboard(int num, double x, double y) {
        return MepGraphTestUtil.addNode(graph, num, NodeSubtype.POWER, new PanelboardAttributes(), x, y, 1, 20);
    }

    private MepNode addLoad(int num, double x, double y) {
        return MepGraphTestUtil.addNode(graph, num, NodeSubtype.END_LOAD, new LoadAttributes(LoadType.GENERAL_POWER, 10, 3), x, y, 1, 10);
    }

    @Test
    void testGeneratedGraphIsClean() {
        MepGraph minimal = MepGraphTestUtil.generateMinimalGraph();
        String before = export(minimal);
        ValidationResult result = validator.validate(minimal);
        assertTrue(result.isClean());
        assertEquals(before, export(minimal));
    }

    @Test
    void testTransformerStepDownRepaired() {
        MepNode transformer = addTransformer(1, NodeSubtype.MAIN, 0);
        MepNode panelboard = addPanelboard(1, 4, 0);
        MepEdge edge = graph.addEdge(transformer, panelboard, "Floor Distribution");
        propagator.propagate(graph);

        transformer.getAttributes(TransformerAttributes.class).setDownstreamVoltage(13500);
        propagator.stampEdge(graph, edge);
        assertEquals(13500, edge.getVoltage());

        ValidationResult result = validator.validate(graph);
        assertEquals(1, result.getRepairedCount());
        assertEquals(0, result.getSoftCount());
        assertEquals(List.of(ConstraintViolation.repaired(ViolationType.TRANSFORMER_NO_STEP_DOWN, "transformer_001", "13500.0", "480.0")),
                result.getViolations());
        assertEquals(480, transformer.getAttributes().getDownstreamVoltage());
        assertEquals(480, edge.getVoltage());
        assertEquals(3, edge.getPhaseCount());

        assertTrue(validator.validate(graph).isClean());
    }

    @Test
    void testTransformerCannotStepDown() {
        MepNode transformer = addTransformer(1, NodeSubtype.SECONDARY, 0);
        propagator.assignVoltages(transformer, 208);
        assertEquals(208, transformer.getAttributes().getDownstreamVoltage());

        ReportNode reportNode = ReportNode.newRootReportNode()
                .withResourceBundles(MepGraphReportResourceBundle.BASE_NAME)
                .withMessageTemplate("mepgraph.validation")
                .build();
        ValidationResult result = validator.validate(graph, reportNode);
        assertEquals(1, result.getSoftCount());
        assertEquals(ViolationSeverity.SOFT, result.getViolations(ViolationType.TRANSFORMER_NO_STEP_DOWN).get(0).severity());
        assertEquals(208, transformer.getAttributes().getDownstreamVoltage());
        assertEquals(2, reportNode.getChildren().size());
        assertEquals("1 soft violation(s), 0 repair(s)", reportNode.getChildren().get(1).getMessage());
    }

    @Test
    void testTransformerAdjacency() {
        MepNode mainTransformer = addTransformer(1, NodeSubtype.MAIN, 0);
        MepNode secondaryTransformer = addTransformer(2, NodeSubtype.SECONDARY, 2);
        graph.addEdge(mainTransformer, secondaryTransformer, "Secondary Distribution");
        propagator.propagate(graph);

        ValidationResult result = validator.validate(graph);
        List<ConstraintViolation> violations = result.getViolations(ViolationType.TRANSFORMER_ADJACENCY);
        assertEquals(2, violations.size());
        assertEquals(ConstraintViolation.soft(ViolationType.TRANSFORMER_ADJACENCY, "transformer_001", "transformer_002"),
                violations.get(0));
        assertEquals(0, result.getRepairedCount());
        // reported, not repaired
        assertTrue(graph.getEdge(mainTransformer, secondaryTransformer).isPresent());
    }

    @Test
    void testUnfedLoad() {
        MepNode transformer = addTransformer(1, NodeSubtype.MAIN, 0);
        MepNode near = addPanelboard(1, 10, 10);
        MepNode far = addPanelboard(2, 1, 1);
        graph.addEdge(transformer, near, "Floor Distribution");
        graph.addEdge(transformer, far, "Floor Distribution");
        MepNode load = addLoad(1, 12, 10);
        propagator.propagate(graph);

        ValidationResult result = validator.validate(graph);
        assertEquals(List.of(ConstraintViolation.repaired(ViolationType.LOAD_UNFED, "load_001", "", "panelboard_001")), result.getViolations());
        assertEquals(List.of(near), graph.getPredecessors(load));
        MepEdge edge = graph.getEdge(near, load).orElseThrow();
        assertEquals("General Power", edge.getLoadClassification());
        assertTrue(edge.isStamped());
        assertTrue(load.isEnergized());
        assertTrue(validator.validate(graph).isClean());
    }

    @Test
    void testLoadWithMultipleFeeders() {
        MepNode transformer = addTransformer(1, NodeSubtype.MAIN, 0);
        MepNode switchboard = MepGraphTestUtil.addNode(graph, 1, NodeSubtype.MAIN, new SwitchboardAttributes(), 12, 11, 1, 50);
        MepNode far = addPanelboard(1, 2, 2);
        MepNode near = addPanelboard(2, 10, 10);
        MepNode load = addLoad(1, 12, 10);
        graph.addEdge(transformer, switchboard, "Main Distribution");
        graph.addEdge(switchboard, far, "Floor Distribution");
        graph.addEdge(switchboard, near, "Floor Distribution");
        graph.addEdge(switchboard, load, "General Power");
        graph.addEdge(far, load, "General Power");
        graph.addEdge(near, load, "General Power");
        propagator.propagate(graph);

        ValidationResult result = validator.validate(graph);
        ConstraintViolation violation = result.getViolations().get(0);
        assertEquals(ViolationType.LOAD_MULTIPLE_FEEDERS, violation.type());
        assertEquals("switchboard_001,panelboard_001,panelboard_002", violation.before());
        assertEquals("panelboard_002", violation.after());
        assertEquals(List.of(near), graph.getPredecessors(load));
    }

    @Test
    void testLoadFedByNonPanelboard() {
        MepNode transformer = addTransformer(1, NodeSubtype.MAIN, 0);
        MepNode switchboard = MepGraphTestUtil.addNode(graph, 1, NodeSubtype.MAIN, new SwitchboardAttributes(), 1, 0, 1, 50);
        MepNode panelboard = addPanelboard(1, 8, 8);
        MepNode load = addLoad(1, 12, 10);
        graph.addEdge(transformer, switchboard, "Main Distribution");
        graph.addEdge(switchboard, panelboard, "Floor Distribution");
        graph.addEdge(switchboard, load, "General Power");
        propagator.propagate(graph);

        ValidationResult result = validator.validate(graph);
        assertEquals(ViolationType.LOAD_FED_BY_NON_PANELBOARD, result.getViolations().get(0).type());
        assertEquals(List.of(panelboard), graph.getPredecessors(load));
        MepGraphTestUtil.assertGraphInvariants(graph);
    }

    @Test
    void testLoadWithoutPanelboard() {
        MepNode load = addLoad(1, 12, 10);
        propagator.propagate(graph);

        ValidationResult result = validator.validate(graph);
        assertEquals(List.of(ConstraintViolation.soft(ViolationType.LOAD_NO_PANELBOARD, "load_001", "")), result.getViolations());
        assertEquals(0, graph.getInDegree(load));
    }
}
