/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.mepgraph.network;

import com.powsybl.mepgraph.requirement.LoadType;

import java.util.Map;
import java.util.Objects;

/**
 * @author MEP graph developers {@literal <mep-graph-dev at example.org>}
 */
public class LoadAttributes extends AbstractNodeAttributes {

    private final LoadType loadType;

    private final double demand;

    private final int priority;

    private double currentRating = Double.NaN;

    public LoadAttributes(LoadType loadType, double demand, int priority) {
        this.loadType = Objects.requireNonNull(loadType);
        this.demand = demand;
        this.priority = priority;
    }

    @Override
    public NodeType getType() {
        return NodeType.LOAD;
    }

    public LoadType getLoadType() {
        return loadType;
    }

    /**
     * Demand in kW.
     */
    public double getDemand() {
        return demand;
    }

    public int getPriority() {
        return priority;
    }

    @Override
    public double getCurrentRating() {
        return currentRating;
    }

    public void setCurrentRating(double currentRating) {
        this.currentRating = currentRating;
    }

    @Override
    protected void addElectricalAttributes(Map<String, Object> map) {
        map.put("load_type", loadType.getLabel());
        map.put("demand", demand);
        map.put("priority", priority);
    }
}
