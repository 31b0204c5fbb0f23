/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.mepgraph.analysis;

import com.powsybl.mepgraph.MepGraphTestUtil;
import com.powsybl.mepgraph.network.MepGraph;
import com.powsybl.mepgraph.network.MepNode;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author MEP graph developers {@literal <mep-graph-dev at example.org>}
 */
class RiskScoreCalculatorTest {

    private static final double DELTA = 1e-9;

    @Test
    void testMinimalGraph() {
        MepGraph graph = MepGraphTestUtil.generateMinimalGraph();
        Map<MepNode, Double> scores = new RiskScoreCalculator().calculate(graph);

        assertEquals(graph.getNodeCount(), scores.size());
        MepNode mainTransformer = graph.getNode("transformer_001");
        assertEquals(1.0, scores.get(mainTransformer), DELTA);
        assertTrue(scores.values().stream().allMatch(s -> s >= 0 && s <= 1));

        // 80 of the 400 kW summed over all nodes and 5 of the 6 descendants of the main transformer
        MepNode switchboard = graph.getNode("switchboard_001");
        assertEquals((0.2 + 5.0 / 6) / 2 / 0.6, scores.get(switchboard), DELTA);
        assertEquals(0, scores.get(graph.getNode("panelboard_001")), DELTA);
        assertEquals(1.0, mainTransformer.getAttributes().getRiskScore(), DELTA);
    }
}
