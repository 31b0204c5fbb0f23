/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.mepgraph.analysis;

import com.powsybl.mepgraph.network.AbstractNodeAttributes;
import com.powsybl.mepgraph.network.MepGraph;
import com.powsybl.mepgraph.network.MepNode;
import com.powsybl.mepgraph.util.ElectricalRatings;

import java.util.Objects;

/**
 * Picks a standard frame size and its replacement cost for every distribution equipment, from the aggregated
 * load. Transformers are sized in kVA, switchboards and panelboards in amperes. Loads are not sized.
 *
 * @author MEP graph developers {@literal <mep-graph-dev at example.org>}
 */
public class EquipmentSizer {

    private final double powerFactor;

    public EquipmentSizer(double powerFactor) {
        this.powerFactor = powerFactor;
    }

    public void size(MepGraph graph) {
        Objects.requireNonNull(graph);
        for (MepNode node : graph.getNodes()) {
            AbstractNodeAttributes attributes = node.getAttributes();
            ElectricalRatings.StandardSize size = switch (node.getType()) {
                case TRANSFORMER -> Double.isNaN(attributes.getPropagatedPower()) ? null
                        : ElectricalRatings.selectSize(ElectricalRatings.TRANSFORMER_SIZES, attributes.getPropagatedPower() / powerFactor);
                case SWITCHBOARD, PANELBOARD -> Double.isNaN(attributes.getAmperage()) || attributes.getAmperage() <= 0 ? null
                        : ElectricalRatings.selectSize(ElectricalRatings.DISTRIBUTION_SIZES, attributes.getAmperage());
                case LOAD -> null;
            };
            if (size == null) {
                continue;
            }
            attributes.setSizing(size.rating(), size.cost());
        }
    }
}
