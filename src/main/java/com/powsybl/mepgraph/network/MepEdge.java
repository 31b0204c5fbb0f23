/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.mepgraph.network;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A power feeder between two pieces of equipment. Electrical values are {@link Double#NaN} until
 * the edge is stamped by voltage propagation.
 *
 * @author MEP graph developers {@literal <mep-graph-dev at example.org>}
 */
public class MepEdge {

    public static final String POWER_CONNECTION = "power";

    private final String loadClassification;

    private final double cableDistance;

    private double voltage = Double.NaN;

    private double currentRating = Double.NaN;

    private int phaseCount = 0;

    private double frequency = Double.NaN;

    private double apparentCurrent = Double.NaN;

    private double voltageDrop = Double.NaN;

    public MepEdge(String loadClassification, double cableDistance) {
        this.loadClassification = Objects.requireNonNull(loadClassification);
        this.cableDistance = cableDistance;
    }

    public String getConnectionType() {
        return POWER_CONNECTION;
    }

    public String getLoadClassification() {
        return loadClassification;
    }

    /**
     * Cable routing length in meters.
     */
    public double getCableDistance() {
        return cableDistance;
    }

    public double getVoltage() {
        return voltage;
    }

    public void setVoltage(double voltage) {
        this.voltage = voltage;
    }

    public double getCurrentRating() {
        return currentRating;
    }

    public void setCurrentRating(double currentRating) {
        this.currentRating = currentRating;
    }

    public int getPhaseCount() {
        return phaseCount;
    }

    public void setPhaseCount(int phaseCount) {
        this.phaseCount = phaseCount;
    }

    public double getFrequency() {
        return frequency;
    }

    public void setFrequency(double frequency) {
        this.frequency = frequency;
    }

    public double getApparentCurrent() {
        return apparentCurrent;
    }

    public void setApparentCurrent(double apparentCurrent) {
        this.apparentCurrent = apparentCurrent;
    }

    /**
     * Voltage drop in volts along the cable.
     */
    public double getVoltageDrop() {
        return voltageDrop;
    }

    public void setVoltageDrop(double voltageDrop) {
        this.voltageDrop = voltageDrop;
    }

    public boolean isStamped() {
        return !Double.isNaN(voltage) && phaseCount > 0;
    }

    public Map<String, Object> toAttributeMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("connection_type", POWER_CONNECTION);
        map.put("voltage", voltage);
        map.put("current_rating", currentRating);
        map.put("phase_count", phaseCount);
        map.put("frequency", frequency);
        map.put("apparent_current", apparentCurrent);
        map.put("voltage_drop", voltageDrop);
        map.put("cable_distance", cableDistance);
        map.put("load_classification", loadClassification);
        return map;
    }
}
