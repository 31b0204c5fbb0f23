/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.mepgraph.analysis;

import com.powsybl.mepgraph.network.MepEdge;
import com.powsybl.mepgraph.network.MepGraph;
import com.powsybl.mepgraph.network.MepNode;
import com.powsybl.mepgraph.network.NodeType;
import org.jgrapht.Graph;
import org.jgrapht.traverse.BreadthFirstIterator;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Scores how critical each node is, as the mean of its share of the propagated power and of its normalized
 * count of non load descendants. Scores are rescaled so that the most critical node scores 1.
 *
 * @author MEP graph developers {@literal <mep-graph-dev at example.org>}
 */
public class RiskScoreCalculator {

    public Map<MepNode, Double> calculate(MepGraph mepGraph) {
        Objects.requireNonNull(mepGraph);
        Graph<MepNode, MepEdge> graph = mepGraph.getGraph();

        double totalPower = mepGraph.getNodes().stream()
                .mapToDouble(n -> n.getAttributes().getPropagatedPower())
                .filter(p -> !Double.isNaN(p))
                .sum();
        if (totalPower == 0) {
            totalPower = 1;
        }

        Map<MepNode, Integer> descendantCounts = new HashMap<>();
        int maxDescendantCount = 0;
        for (MepNode node : mepGraph.getNodes()) {
            int count = countNonLoadDescendants(graph, node);
            descendantCounts.put(node, count);
            maxDescendantCount = Math.max(maxDescendantCount, count);
        }
        if (maxDescendantCount == 0) {
            maxDescendantCount = 1;
        }

        Map<MepNode, Double> scores = new HashMap<>();
        double maxScore = 0;
        for (MepNode node : mepGraph.getNodes()) {
            double power = node.getAttributes().getPropagatedPower();
            double powerShare = Double.isNaN(power) ? 0 : power / totalPower;
            double score = (powerShare + (double) descendantCounts.get(node) / maxDescendantCount) / 2;
            scores.put(node, score);
            maxScore = Math.max(maxScore, score);
        }
        if (maxScore == 0) {
            maxScore = 1;
        }
        for (Map.Entry<MepNode, Double> e : scores.entrySet()) {
            e.setValue(e.getValue() / maxScore);
        }
        return scores;
    }

    public void apply(MepGraph mepGraph) {
        calculate(mepGraph).forEach((node, score) -> node.getAttributes().setRiskScore(score));
    }

    private static int countNonLoadDescendants(Graph<MepNode, MepEdge> graph, MepNode node) {
        int count = 0;
        BreadthFirstIterator<MepNode, MepEdge> it = new BreadthFirstIterator<>(graph, node);
        while (it.hasNext()) {
            MepNode descendant = it.next();
            if (descendant != node && descendant.getType() != NodeType.LOAD) {
                count++;
            }
        }
        return count;
    }
}
