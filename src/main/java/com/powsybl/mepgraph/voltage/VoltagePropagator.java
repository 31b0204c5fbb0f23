/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.mepgraph.voltage;

import com.powsybl.commons.report.ReportNode;
import com.powsybl.mepgraph.MepGraphParameters;
import com.powsybl.mepgraph.network.AbstractNodeAttributes;
import com.powsybl.mepgraph.network.LoadAttributes;
import com.powsybl.mepgraph.network.MepEdge;
import com.powsybl.mepgraph.network.MepGraph;
import com.powsybl.mepgraph.network.MepNode;
import com.powsybl.mepgraph.network.NodeSubtype;
import com.powsybl.mepgraph.network.NodeType;
import com.powsybl.mepgraph.network.PanelboardAttributes;
import com.powsybl.mepgraph.network.SwitchboardAttributes;
import com.powsybl.mepgraph.network.TransformerAttributes;
import com.powsybl.mepgraph.util.ElectricalRatings;
import com.powsybl.mepgraph.util.Reports;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Assigns voltages, phases and currents from the source nodes down to the loads, and stamps every edge with
 * the values it transmits.
 * <p>
 * The traversal is a FIFO worklist with a visited state per node so that an accidental cycle or two feeders
 * reaching the same node cannot loop: a node keeps the voltages of its first feeder.
 *
 * @author MEP graph developers {@literal <mep-graph-dev at example.org>}
 */
public class VoltagePropagator {

    private static final Logger LOGGER = LoggerFactory.getLogger(VoltagePropagator.class);

    /**
     * Above this voltage equipment is fed three phase.
     */
    public static final double SINGLE_PHASE_MAX_VOLTAGE = 240;

    enum PropagationState {
        UNVISITED,
        VOLTAGE_ASSIGNED,
        PROPAGATED
    }

    private final StandardVoltages standardVoltages;

    private final double powerFactor;

    private final double frequency;

    public VoltagePropagator(StandardVoltages standardVoltages, MepGraphParameters parameters) {
        this.standardVoltages = Objects.requireNonNull(standardVoltages);
        this.powerFactor = parameters.getPowerFactor();
        this.frequency = parameters.getFrequency();
    }

    public StandardVoltages getStandardVoltages() {
        return standardVoltages;
    }

    public void propagate(MepGraph graph) {
        propagate(graph, ReportNode.NO_OP);
    }

    public void propagate(MepGraph graph, ReportNode reportNode) {
        Objects.requireNonNull(graph);
        Objects.requireNonNull(reportNode);

        List<MepNode> sources = graph.getSources();
        if (sources.isEmpty()) {
            sources = graph.getNodes(NodeType.TRANSFORMER, NodeSubtype.MAIN);
            LOGGER.warn("Graph has no node without feeder, starting from {} main transformers", sources.size());
        }

        Map<MepNode, PropagationState> states = new HashMap<>();
        Deque<MepNode> worklist = new ArrayDeque<>();
        for (MepNode source : sources) {
            assignVoltages(source, getSourceSupplyVoltage(source));
            states.put(source, PropagationState.VOLTAGE_ASSIGNED);
            worklist.add(source);
        }

        int stampedEdgeCount = 0;
        while (!worklist.isEmpty()) {
            MepNode node = worklist.poll();
            for (MepEdge edge : graph.getOutgoingEdges(node)) {
                MepNode target = graph.getEdgeTarget(edge);
                if (states.getOrDefault(target, PropagationState.UNVISITED) == PropagationState.UNVISITED) {
                    assignVoltages(target, node.getAttributes().getDownstreamVoltage());
                    states.put(target, PropagationState.VOLTAGE_ASSIGNED);
                    worklist.add(target);
                } else {
                    LOGGER.debug("Node '{}' already has voltages, edge from '{}' only stamped", target.getId(), node.getId());
                }
                stampEdge(graph, edge);
                stampedEdgeCount++;
            }
            states.put(node, PropagationState.PROPAGATED);
        }

        List<MepNode> unreachable = graph.getNodes().stream()
                .filter(n -> states.getOrDefault(n, PropagationState.UNVISITED) == PropagationState.UNVISITED)
                .toList();
        if (!unreachable.isEmpty()) {
            LOGGER.warn("{} nodes not reachable from any source: {}", unreachable.size(), unreachable);
            Reports.reportUnreachableNodes(reportNode, unreachable.size());
        }
        LOGGER.debug("Voltages propagated from {} sources, {} edges stamped", sources.size(), stampedEdgeCount);
        Reports.reportVoltagePropagation(reportNode, sources.size(), stampedEdgeCount, standardVoltages.getHighVoltage());
    }

    /**
     * Voltage feeding a node without feeder: the utility tier for a transformer, the distribution tier otherwise.
     */
    public double getSourceSupplyVoltage(MepNode source) {
        return source.getType() == NodeType.TRANSFORMER ? standardVoltages.getHighVoltage() : StandardVoltages.DISTRIBUTION_VOLTAGE;
    }

    public static int getPhaseCount(double voltage) {
        return voltage > SINGLE_PHASE_MAX_VOLTAGE ? 3 : 1;
    }

    /**
     * Sets the voltages, phases, frequency and currents of a node supplied at the given voltage, then
     * energizes it.
     */
    public void assignVoltages(MepNode node, double supplyVoltage) {
        double capacity = node.getCapacity();
        switch (node.getType()) {
            case TRANSFORMER -> {
                TransformerAttributes attributes = node.getAttributes(TransformerAttributes.class);
                assignTransformerVoltages(attributes, capacity, supplyVoltage, standardVoltages.stepDown(supplyVoltage));
            }
            case SWITCHBOARD -> {
                SwitchboardAttributes attributes = node.getAttributes(SwitchboardAttributes.class);
                double voltage = standardVoltages.nearest(supplyVoltage);
                setCommonAttributes(attributes, voltage, getPhaseCount(voltage));
                attributes.setDownstreamVoltage(voltage);
                attributes.setBusRating(ElectricalRatings.standardAmpereRating(
                        ElectricalRatings.current(capacity, powerFactor, voltage, attributes.getPhaseCount())));
            }
            case PANELBOARD -> {
                PanelboardAttributes attributes = node.getAttributes(PanelboardAttributes.class);
                double voltage = standardVoltages.nearest(supplyVoltage);
                setCommonAttributes(attributes, voltage, getPhaseCount(voltage));
                attributes.setDownstreamVoltage(voltage);
                attributes.setMainBreakerRating(ElectricalRatings.standardAmpereRating(
                        ElectricalRatings.current(capacity, powerFactor, voltage, attributes.getPhaseCount())));
            }
            case LOAD -> {
                LoadAttributes attributes = node.getAttributes(LoadAttributes.class);
                setCommonAttributes(attributes, StandardVoltages.UTILIZATION_VOLTAGE, 1);
                attributes.setCurrentRating(ElectricalRatings.standardAmpereRating(
                        ElectricalRatings.current(attributes.getDemand(), powerFactor, StandardVoltages.UTILIZATION_VOLTAGE, 1)));
            }
            default -> throw new IllegalStateException("Unknown node type: " + node.getType());
        }
        node.energize();
    }

    /**
     * Sets the downstream side of a transformer, keeping its upstream side.
     */
    public void assignTransformerDownstreamVoltage(MepNode transformer, double downstreamVoltage) {
        TransformerAttributes attributes = transformer.getAttributes(TransformerAttributes.class);
        assignTransformerVoltages(attributes, transformer.getCapacity(), attributes.getUpstreamVoltage(), downstreamVoltage);
    }

    private void assignTransformerVoltages(TransformerAttributes attributes, double capacity, double upstreamVoltage,
                                           double downstreamVoltage) {
        setCommonAttributes(attributes, upstreamVoltage, getPhaseCount(upstreamVoltage));
        attributes.setDownstreamVoltage(downstreamVoltage);
        attributes.setUpstreamCurrent(ElectricalRatings.current(capacity, powerFactor, upstreamVoltage, getPhaseCount(upstreamVoltage)));
        attributes.setDownstreamCurrent(ElectricalRatings.current(capacity, powerFactor, downstreamVoltage, getPhaseCount(downstreamVoltage)));
        double impedance = attributes.getImpedance();
        if (impedance > 0) {
            // bolted fault current at the secondary terminals, in kA
            double ratedCurrent = attributes.getNominalPower() * 1000 / (ElectricalRatings.SQRT_3 * downstreamVoltage);
            attributes.setShortCircuitRating(ratedCurrent / (impedance / 100) / 1000);
        }
    }

    private void setCommonAttributes(AbstractNodeAttributes attributes, double upstreamVoltage, int phaseCount) {
        attributes.setUpstreamVoltage(upstreamVoltage);
        attributes.setPhaseCount(phaseCount);
        attributes.setFrequency(frequency);
    }

    /**
     * Stamps an edge with the voltage of its source and the current drawn by its target.
     */
    public void stampEdge(MepGraph graph, MepEdge edge) {
        MepNode source = graph.getEdgeSource(edge);
        MepNode target = graph.getEdgeTarget(edge);
        double voltage = source.getAttributes().getDownstreamVoltage();
        int phaseCount = target.getType() == NodeType.LOAD ? 1 : getPhaseCount(voltage);
        double apparentCurrent = ElectricalRatings.current(target.getCapacity(), powerFactor, voltage, phaseCount);
        edge.setVoltage(voltage);
        edge.setPhaseCount(phaseCount);
        edge.setFrequency(frequency);
        edge.setApparentCurrent(apparentCurrent);
        edge.setCurrentRating(ElectricalRatings.standardAmpereRating(apparentCurrent));
        edge.setVoltageDrop(ElectricalRatings.voltageDrop(apparentCurrent, phaseCount, edge.getCableDistance()));
    }
}
