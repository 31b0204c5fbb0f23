/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.mepgraph.network;

import java.util.List;
import java.util.Map;

/**
 * @author MEP graph developers {@literal <mep-graph-dev at example.org>}
 */
public class SwitchboardAttributes extends AbstractNodeAttributes {

    private double downstreamVoltage = Double.NaN;

    private double busRating = Double.NaN;

    private double shortCircuitRating;

    @Override
    public NodeType getType() {
        return NodeType.SWITCHBOARD;
    }

    @Override
    public double getDownstreamVoltage() {
        return downstreamVoltage;
    }

    public void setDownstreamVoltage(double downstreamVoltage) {
        this.downstreamVoltage = downstreamVoltage;
    }

    @Override
    public double getCurrentRating() {
        return busRating;
    }

    public void setBusRating(double busRating) {
        this.busRating = busRating;
    }

    public double getShortCircuitRating() {
        return shortCircuitRating;
    }

    public void setShortCircuitRating(double shortCircuitRating) {
        this.shortCircuitRating = shortCircuitRating;
    }

    @Override
    public List<String> getMissingElectricalFields() {
        List<String> missing = super.getMissingElectricalFields();
        if (Double.isNaN(downstreamVoltage)) {
            missing.add("downstreamVoltage");
        }
        return missing;
    }

    @Override
    protected void addElectricalAttributes(Map<String, Object> map) {
        map.put("downstream_voltage", downstreamVoltage);
        map.put("short_circuit_rating", shortCircuitRating);
    }
}
