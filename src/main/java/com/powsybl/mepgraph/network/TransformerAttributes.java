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
public class TransformerAttributes extends AbstractNodeAttributes {

    private double downstreamVoltage = Double.NaN;

    private double upstreamCurrent = Double.NaN;

    private double downstreamCurrent = Double.NaN;

    private double shortCircuitRating;

    private double nominalPower;

    private double impedance;

    @Override
    public NodeType getType() {
        return NodeType.TRANSFORMER;
    }

    @Override
    public double getDownstreamVoltage() {
        return downstreamVoltage;
    }

    public void setDownstreamVoltage(double downstreamVoltage) {
        this.downstreamVoltage = downstreamVoltage;
    }

    /**
     * A transformer is rated on its secondary side.
     */
    @Override
    public double getCurrentRating() {
        return downstreamCurrent;
    }

    public double getUpstreamCurrent() {
        return upstreamCurrent;
    }

    public void setUpstreamCurrent(double upstreamCurrent) {
        this.upstreamCurrent = upstreamCurrent;
    }

    public double getDownstreamCurrent() {
        return downstreamCurrent;
    }

    public void setDownstreamCurrent(double downstreamCurrent) {
        this.downstreamCurrent = downstreamCurrent;
    }

    /**
     * Short circuit withstand rating in kA.
     */
    public double getShortCircuitRating() {
        return shortCircuitRating;
    }

    public void setShortCircuitRating(double shortCircuitRating) {
        this.shortCircuitRating = shortCircuitRating;
    }

    /**
     * Nominal apparent power in kVA.
     */
    public double getNominalPower() {
        return nominalPower;
    }

    public void setNominalPower(double nominalPower) {
        this.nominalPower = nominalPower;
    }

    /**
     * Percent impedance.
     */
    public double getImpedance() {
        return impedance;
    }

    public void setImpedance(double impedance) {
        this.impedance = impedance;
    }

    @Override
    public List<String> getMissingElectricalFields() {
        List<String> missing = super.getMissingElectricalFields();
        if (Double.isNaN(downstreamVoltage)) {
            missing.add("downstreamVoltage");
        }
        if (Double.isNaN(upstreamCurrent)) {
            missing.add("upstreamCurrent");
        }
        return missing;
    }

    @Override
    protected void addElectricalAttributes(Map<String, Object> map) {
        map.put("downstream_voltage", downstreamVoltage);
        map.put("upstream_current", upstreamCurrent);
        map.put("downstream_current", downstreamCurrent);
        map.put("short_circuit_rating", shortCircuitRating);
        map.put("nominal_power", nominalPower);
        map.put("impedance", impedance);
    }
}
