/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.mepgraph.validation;

import com.powsybl.commons.report.ReportNode;
import com.powsybl.mepgraph.network.LoadAttributes;
import com.powsybl.mepgraph.network.MepEdge;
import com.powsybl.mepgraph.network.MepGraph;
import com.powsybl.mepgraph.network.MepNode;
import com.powsybl.mepgraph.network.NodeType;
import com.powsybl.mepgraph.network.TransformerAttributes;
import com.powsybl.mepgraph.util.Reports;
import com.powsybl.mepgraph.voltage.VoltagePropagator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Checks the electrical rules of a propagated graph and repairs what can be repaired in place.
 * <p>
 * First pass: every transformer must step down; a transformer next to another transformer is only reported.
 * Second pass: every load must be fed by exactly one panelboard. Running the validator on its own output
 * changes nothing.
 *
 * @author MEP graph developers {@literal <mep-graph-dev at example.org>}
 */
public class ConstraintValidator {

    private static final Logger LOGGER = LoggerFactory.getLogger(ConstraintValidator.class);

    private final VoltagePropagator voltagePropagator;

    public ConstraintValidator(VoltagePropagator voltagePropagator) {
        this.voltagePropagator = Objects.requireNonNull(voltagePropagator);
    }

    public ValidationResult validate(MepGraph graph) {
        return validate(graph, ReportNode.NO_OP);
    }

    public ValidationResult validate(MepGraph graph, ReportNode reportNode) {
        Objects.requireNonNull(graph);
        Objects.requireNonNull(reportNode);
        ValidationResult result = new ValidationResult();
        checkTransformers(graph, result, reportNode);
        checkLoadFeeders(graph, result, reportNode);
        LOGGER.debug("Graph validated: {}", result);
        Reports.reportValidation(reportNode, result.getSoftCount(), result.getRepairedCount());
        return result;
    }

    private void checkTransformers(MepGraph graph, ValidationResult result, ReportNode reportNode) {
        for (MepNode transformer : graph.getNodes(NodeType.TRANSFORMER)) {
            checkStepDown(graph, transformer, result, reportNode);
            checkAdjacency(graph, transformer, result, reportNode);
        }
    }

    private void checkStepDown(MepGraph graph, MepNode transformer, ValidationResult result, ReportNode reportNode) {
        TransformerAttributes attributes = transformer.getAttributes(TransformerAttributes.class);
        double upstreamVoltage = attributes.getUpstreamVoltage();
        double downstreamVoltage = attributes.getDownstreamVoltage();
        if (Double.isNaN(upstreamVoltage) || Double.isNaN(downstreamVoltage) || downstreamVoltage < upstreamVoltage) {
            return;
        }
        double repairedVoltage = voltagePropagator.getStandardVoltages().stepDown(upstreamVoltage);
        if (repairedVoltage >= upstreamVoltage) {
            // already at the lowest tier, nothing to step down to
            LOGGER.warn("Transformer '{}' cannot step down from {} V", transformer.getId(), upstreamVoltage);
            result.add(ConstraintViolation.soft(ViolationType.TRANSFORMER_NO_STEP_DOWN, transformer.getId(), Double.toString(downstreamVoltage)));
            Reports.reportTransformerCannotStepDown(reportNode, transformer.getId(), upstreamVoltage);
            return;
        }
        voltagePropagator.assignTransformerDownstreamVoltage(transformer, repairedVoltage);
        for (MepEdge edge : graph.getOutgoingEdges(transformer)) {
            voltagePropagator.stampEdge(graph, edge);
        }
        LOGGER.info("Transformer '{}' downstream voltage repaired: {} V -> {} V", transformer.getId(), downstreamVoltage, repairedVoltage);
        result.add(ConstraintViolation.repaired(ViolationType.TRANSFORMER_NO_STEP_DOWN, transformer.getId(),
                Double.toString(downstreamVoltage), Double.toString(repairedVoltage)));
        Reports.reportTransformerStepDownRepaired(reportNode, transformer.getId(), downstreamVoltage, repairedVoltage);
    }

    private static void checkAdjacency(MepGraph graph, MepNode transformer, ValidationResult result, ReportNode reportNode) {
        List<MepNode> neighbors = new ArrayList<>(graph.getPredecessors(transformer));
        neighbors.addAll(graph.getSuccessors(transformer));
        for (MepNode neighbor : neighbors) {
            if (neighbor.getType() == NodeType.TRANSFORMER) {
                LOGGER.warn("Transformer '{}' is directly connected to transformer '{}'", transformer.getId(), neighbor.getId());
                result.add(ConstraintViolation.soft(ViolationType.TRANSFORMER_ADJACENCY, transformer.getId(), neighbor.getId()));
                Reports.reportTransformerAdjacency(reportNode, transformer.getId(), neighbor.getId());
            }
        }
    }

    private void checkLoadFeeders(MepGraph graph, ValidationResult result, ReportNode reportNode) {
        List<MepNode> panelboards = graph.getNodes(NodeType.PANELBOARD);
        for (MepNode load : graph.getNodes(NodeType.LOAD)) {
            List<MepNode> feeders = graph.getPredecessors(load);
            if (feeders.size() == 1 && feeders.get(0).getType() == NodeType.PANELBOARD) {
                continue;
            }
            ViolationType type;
            Optional<MepNode> panelboard;
            if (feeders.isEmpty()) {
                type = ViolationType.LOAD_UNFED;
                panelboard = MepGraph.getNearestNode(load, panelboards);
            } else if (feeders.size() > 1) {
                type = ViolationType.LOAD_MULTIPLE_FEEDERS;
                List<MepNode> panelboardFeeders = feeders.stream().filter(f -> f.getType() == NodeType.PANELBOARD).toList();
                panelboard = MepGraph.getNearestNode(load, panelboardFeeders.isEmpty() ? panelboards : panelboardFeeders);
            } else {
                type = ViolationType.LOAD_FED_BY_NON_PANELBOARD;
                panelboard = MepGraph.getNearestNode(load, panelboards);
            }
            String before = String.join(",", feeders.stream().map(MepNode::getId).toList());
            if (panelboard.isEmpty()) {
                LOGGER.warn("Load '{}' cannot be fed, graph has no panelboard", load.getId());
                result.add(ConstraintViolation.soft(ViolationType.LOAD_NO_PANELBOARD, load.getId(), before));
                Reports.reportLoadWithoutPanelboard(reportNode, load.getId());
                continue;
            }
            MepNode feeder = panelboard.get();
            for (MepEdge edge : new ArrayList<>(graph.getIncomingEdges(load))) {
                if (graph.getEdgeSource(edge) != feeder) {
                    graph.removeEdge(edge);
                }
            }
            if (graph.getEdge(feeder, load).isEmpty()) {
                MepEdge edge = graph.addEdge(feeder, load, load.getAttributes(LoadAttributes.class).getLoadType().getLabel());
                if (feeder.isEnergized()) {
                    if (!load.isEnergized()) {
                        voltagePropagator.assignVoltages(load, feeder.getAttributes().getDownstreamVoltage());
                    }
                    voltagePropagator.stampEdge(graph, edge);
                }
            }
            LOGGER.info("Load '{}' feeder repaired ({}): [{}] -> [{}]", load.getId(), type, before, feeder.getId());
            result.add(ConstraintViolation.repaired(type, load.getId(), before, feeder.getId()));
            Reports.reportLoadFeederRepaired(reportNode, load.getId(), type.name(), before, feeder.getId());
        }
    }
}
