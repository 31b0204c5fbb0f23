/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.mepgraph.network;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Attributes shared by every equipment kind. Electrical values are {@link Double#NaN} until set by
 * voltage propagation.
 *
 * @author MEP graph developers {@literal <mep-graph-dev at example.org>}
 */
public abstract class AbstractNodeAttributes {

    private String manufacturer = "";

    private double width;

    private double height;

    private double depth;

    private int manufactureYear;

    private int installYear;

    private LocalDate installationDate;

    private int expectedLifespan;

    private int maintenanceFrequency;

    private double meanTimeToFailure;

    protected double upstreamVoltage = Double.NaN;

    protected int phaseCount = 0;

    protected double frequency = Double.NaN;

    private double propagatedPower = Double.NaN;

    private double amperage = Double.NaN;

    private double ratedSize = Double.NaN;

    private double replacementCost = Double.NaN;

    private double riskScore = Double.NaN;

    public abstract NodeType getType();

    /**
     * Voltage available on the output side. Equipment that does not transform passes its input voltage.
     */
    public double getDownstreamVoltage() {
        return upstreamVoltage;
    }

    /**
     * Current rating in amperes of the equipment, as seen by its feeder.
     */
    public abstract double getCurrentRating();

    /**
     * Names of the electrical fields voltage propagation has not set yet.
     */
    public List<String> getMissingElectricalFields() {
        List<String> missing = new ArrayList<>();
        if (Double.isNaN(upstreamVoltage)) {
            missing.add("upstreamVoltage");
        }
        if (phaseCount <= 0) {
            missing.add("phaseCount");
        }
        if (Double.isNaN(frequency)) {
            missing.add("frequency");
        }
        if (Double.isNaN(getCurrentRating())) {
            missing.add("currentRating");
        }
        return missing;
    }

    /**
     * Fixed schema flat view of the attributes, in persisted naming. Unset values are kept as
     * {@link Double#NaN} or null, the exporter replaces them.
     */
    public Map<String, Object> toAttributeMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("manufacturer", manufacturer);
        map.put("width", width);
        map.put("height", height);
        map.put("depth", depth);
        map.put("manufacture_year", manufactureYear);
        map.put("install_year", installYear);
        map.put("installation_date", installationDate != null ? installationDate.toString() : null);
        map.put("expected_lifespan", expectedLifespan);
        map.put("maintenance_frequency", maintenanceFrequency);
        map.put("mean_time_to_failure", meanTimeToFailure);
        map.put("upstream_voltage", upstreamVoltage);
        map.put("phase_count", phaseCount);
        map.put("frequency", frequency);
        map.put("current_rating", getCurrentRating());
        addElectricalAttributes(map);
        map.put("propagated_power", propagatedPower);
        map.put("amperage", amperage);
        map.put("rated_size", ratedSize);
        map.put("replacement_cost", replacementCost);
        map.put("risk_score", riskScore);
        return map;
    }

    protected abstract void addElectricalAttributes(Map<String, Object> map);

    public String getManufacturer() {
        return manufacturer;
    }

    public void setManufacturer(String manufacturer) {
        this.manufacturer = Objects.requireNonNull(manufacturer);
    }

    public double getWidth() {
        return width;
    }

    public double getHeight() {
        return height;
    }

    public double getDepth() {
        return depth;
    }

    public void setDimensions(double width, double height, double depth) {
        this.width = width;
        this.height = height;
        this.depth = depth;
    }

    public int getManufactureYear() {
        return manufactureYear;
    }

    public void setManufactureYear(int manufactureYear) {
        this.manufactureYear = manufactureYear;
    }

    public int getInstallYear() {
        return installYear;
    }

    public void setInstallYear(int installYear) {
        this.installYear = installYear;
    }

    public LocalDate getInstallationDate() {
        return installationDate;
    }

    public void setInstallationDate(LocalDate installationDate) {
        this.installationDate = Objects.requireNonNull(installationDate);
    }

    public int getExpectedLifespan() {
        return expectedLifespan;
    }

    public int getMaintenanceFrequency() {
        return maintenanceFrequency;
    }

    public double getMeanTimeToFailure() {
        return meanTimeToFailure;
    }

    public void setLifecycle(int expectedLifespan, int maintenanceFrequency, double meanTimeToFailure) {
        this.expectedLifespan = expectedLifespan;
        this.maintenanceFrequency = maintenanceFrequency;
        this.meanTimeToFailure = meanTimeToFailure;
    }

    public double getUpstreamVoltage() {
        return upstreamVoltage;
    }

    public void setUpstreamVoltage(double upstreamVoltage) {
        this.upstreamVoltage = upstreamVoltage;
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

    public double getPropagatedPower() {
        return propagatedPower;
    }

    public void setPropagatedPower(double propagatedPower) {
        this.propagatedPower = propagatedPower;
    }

    public double getAmperage() {
        return amperage;
    }

    public void setAmperage(double amperage) {
        this.amperage = amperage;
    }

    public double getRatedSize() {
        return ratedSize;
    }

    public double getReplacementCost() {
        return replacementCost;
    }

    public void setSizing(double ratedSize, double replacementCost) {
        this.ratedSize = ratedSize;
        this.replacementCost = replacementCost;
    }

    public double getRiskScore() {
        return riskScore;
    }

    public void setRiskScore(double riskScore) {
        this.riskScore = riskScore;
    }
}
