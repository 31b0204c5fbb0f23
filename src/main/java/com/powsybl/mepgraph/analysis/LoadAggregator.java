/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.mepgraph.analysis;

import com.powsybl.mepgraph.network.AbstractNodeAttributes;
import com.powsybl.mepgraph.network.LoadAttributes;
import com.powsybl.mepgraph.network.MepEdge;
import com.powsybl.mepgraph.network.MepGraph;
import com.powsybl.mepgraph.network.MepNode;
import com.powsybl.mepgraph.network.NodeType;
import com.powsybl.mepgraph.network.TransformerAttributes;
import com.powsybl.mepgraph.util.ElectricalRatings;
import com.powsybl.mepgraph.voltage.VoltagePropagator;
import org.jgrapht.Graph;
import org.jgrapht.alg.cycle.CycleDetector;
import org.jgrapht.traverse.TopologicalOrderIterator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Sums the demand of the loads up the hierarchy and derives the current each node carries.
 *
 * @author MEP graph developers {@literal <mep-graph-dev at example.org>}
 */
public class LoadAggregator {

    private static final Logger LOGGER = LoggerFactory.getLogger(LoadAggregator.class);

    private final double powerFactor;

    public LoadAggregator(double powerFactor) {
        this.powerFactor = powerFactor;
    }

    /**
     * @return false if the graph has a cycle, in which case nothing is computed
     */
    public boolean aggregate(MepGraph mepGraph) {
        Graph<MepNode, MepEdge> graph = mepGraph.getGraph();
        if (new CycleDetector<>(graph).detectCycles()) {
            LOGGER.warn("Graph has a cycle, load aggregation skipped");
            return false;
        }

        List<MepNode> order = new ArrayList<>(mepGraph.getNodeCount());
        new TopologicalOrderIterator<>(graph).forEachRemaining(order::add);
        Collections.reverse(order);

        for (MepNode node : order) {
            AbstractNodeAttributes attributes = node.getAttributes();
            double power;
            if (node.getType() == NodeType.LOAD) {
                power = node.getAttributes(LoadAttributes.class).getDemand();
            } else {
                power = mepGraph.getSuccessors(node).stream()
                        .mapToDouble(s -> s.getAttributes().getPropagatedPower())
                        .sum();
            }
            attributes.setPropagatedPower(power);
            attributes.setAmperage(computeAmperage(node, power));
        }
        return true;
    }

    private double computeAmperage(MepNode node, double power) {
        AbstractNodeAttributes attributes = node.getAttributes();
        // a transformer is loaded on its secondary side
        double voltage = node.getType() == NodeType.TRANSFORMER
                ? node.getAttributes(TransformerAttributes.class).getDownstreamVoltage()
                : attributes.getUpstreamVoltage();
        if (Double.isNaN(voltage)) {
            return Double.NaN;
        }
        int phaseCount = node.getType() == NodeType.LOAD ? 1 : VoltagePropagator.getPhaseCount(voltage);
        return ElectricalRatings.current(power, powerFactor, voltage, phaseCount);
    }
}
