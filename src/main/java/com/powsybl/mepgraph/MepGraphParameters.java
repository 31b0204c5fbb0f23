/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.mepgraph;

import com.powsybl.commons.config.PlatformConfig;
import com.powsybl.mepgraph.voltage.HighVoltageTierMode;

import java.time.LocalDate;
import java.util.Objects;

/**
 * Tuning constants of the topology synthesizer. Defaults can be overridden in the
 * {@value #MODULE_NAME} module of the platform configuration.
 *
 * @author MEP graph developers {@literal <mep-graph-dev at example.org>}
 */
public class MepGraphParameters {

    public static final String MODULE_NAME = "mep-graph-default-parameters";

    public static final double MAIN_SERVICE_DENSITY_DEFAULT_VALUE = 5.0; // W/sqft

    public static final double LIGHTING_DENSITY_DEFAULT_VALUE = 1.5; // W/sqft

    public static final double GENERAL_POWER_DENSITY_DEFAULT_VALUE = 3.0; // W/sqft

    public static final double HVAC_DENSITY_DEFAULT_VALUE = 2.0; // W/sqft

    public static final double KITCHEN_LOAD_DEFAULT_VALUE = 30; // kW

    public static final double DATA_CENTER_LOAD_DEFAULT_VALUE = 50; // kW

    public static final int KITCHEN_FLOOR_INTERVAL_DEFAULT_VALUE = 3;

    public static final double MAIN_SERVICE_THRESHOLD_DEFAULT_VALUE = 100; // kW

    public static final double SECONDARY_TRANSFORMER_THRESHOLD_DEFAULT_VALUE = 75; // kW

    public static final double PANEL_SPLIT_LOAD_DEFAULT_VALUE = 40; // kW

    public static final int MAX_PANELS_PER_GROUP_DEFAULT_VALUE = 3;

    public static final double POWER_FACTOR_DEFAULT_VALUE = 0.9;

    public static final double FREQUENCY_DEFAULT_VALUE = 60; // Hz

    public static final HighVoltageTierMode HIGH_VOLTAGE_TIER_MODE_DEFAULT_VALUE = HighVoltageTierMode.RANDOM;

    public static final String OUTPUT_DIRECTORY_DEFAULT_VALUE = "graph_outputs";

    private double mainServiceDensity = MAIN_SERVICE_DENSITY_DEFAULT_VALUE;

    private double lightingDensity = LIGHTING_DENSITY_DEFAULT_VALUE;

    private double generalPowerDensity = GENERAL_POWER_DENSITY_DEFAULT_VALUE;

    private double hvacDensity = HVAC_DENSITY_DEFAULT_VALUE;

    private double kitchenLoad = KITCHEN_LOAD_DEFAULT_VALUE;

    private double dataCenterLoad = DATA_CENTER_LOAD_DEFAULT_VALUE;

    private int kitchenFloorInterval = KITCHEN_FLOOR_INTERVAL_DEFAULT_VALUE;

    private double mainServiceThreshold = MAIN_SERVICE_THRESHOLD_DEFAULT_VALUE;

    private double secondaryTransformerThreshold = SECONDARY_TRANSFORMER_THRESHOLD_DEFAULT_VALUE;

    private double panelSplitLoad = PANEL_SPLIT_LOAD_DEFAULT_VALUE;

    private int maxPanelsPerGroup = MAX_PANELS_PER_GROUP_DEFAULT_VALUE;

    private double powerFactor = POWER_FACTOR_DEFAULT_VALUE;

    private double frequency = FREQUENCY_DEFAULT_VALUE;

    private HighVoltageTierMode highVoltageTierMode = HIGH_VOLTAGE_TIER_MODE_DEFAULT_VALUE;

    private LocalDate constructionDate = LocalDate.now();

    private String outputDirectory = OUTPUT_DIRECTORY_DEFAULT_VALUE;

    public static MepGraphParameters load() {
        return load(PlatformConfig.defaultConfig());
    }

    public static MepGraphParameters load(PlatformConfig platformConfig) {
        MepGraphParameters parameters = new MepGraphParameters();
        platformConfig.getOptionalModuleConfig(MODULE_NAME)
            .ifPresent(config -> {
                parameters
                    .setMainServiceDensity(config.getDoubleProperty("mainServiceDensity", MAIN_SERVICE_DENSITY_DEFAULT_VALUE))
                    .setLightingDensity(config.getDoubleProperty("lightingDensity", LIGHTING_DENSITY_DEFAULT_VALUE))
                    .setGeneralPowerDensity(config.getDoubleProperty("generalPowerDensity", GENERAL_POWER_DENSITY_DEFAULT_VALUE))
                    .setHvacDensity(config.getDoubleProperty("hvacDensity", HVAC_DENSITY_DEFAULT_VALUE))
                    .setKitchenLoad(config.getDoubleProperty("kitchenLoad", KITCHEN_LOAD_DEFAULT_VALUE))
                    .setDataCenterLoad(config.getDoubleProperty("dataCenterLoad", DATA_CENTER_LOAD_DEFAULT_VALUE))
                    .setKitchenFloorInterval(config.getIntProperty("kitchenFloorInterval", KITCHEN_FLOOR_INTERVAL_DEFAULT_VALUE))
                    .setMainServiceThreshold(config.getDoubleProperty("mainServiceThreshold", MAIN_SERVICE_THRESHOLD_DEFAULT_VALUE))
                    .setSecondaryTransformerThreshold(config.getDoubleProperty("secondaryTransformerThreshold", SECONDARY_TRANSFORMER_THRESHOLD_DEFAULT_VALUE))
                    .setPanelSplitLoad(config.getDoubleProperty("panelSplitLoad", PANEL_SPLIT_LOAD_DEFAULT_VALUE))
                    .setMaxPanelsPerGroup(config.getIntProperty("maxPanelsPerGroup", MAX_PANELS_PER_GROUP_DEFAULT_VALUE))
                    .setPowerFactor(config.getDoubleProperty("powerFactor", POWER_FACTOR_DEFAULT_VALUE))
                    .setFrequency(config.getDoubleProperty("frequency", FREQUENCY_DEFAULT_VALUE))
                    .setHighVoltageTierMode(config.getEnumProperty("highVoltageTierMode", HighVoltageTierMode.class, HIGH_VOLTAGE_TIER_MODE_DEFAULT_VALUE))
                    .setOutputDirectory(config.getStringProperty("outputDirectory", OUTPUT_DIRECTORY_DEFAULT_VALUE));
                config.getOptionalStringProperty("constructionDate")
                    .ifPresent(date -> parameters.setConstructionDate(LocalDate.parse(date)));
            });
        return parameters;
    }

    private static double checkPositive(double value, String name) {
        if (Double.isNaN(value) || value <= 0) {
            throw new InvalidParameterException("Parameter " + name + " must be strictly positive: " + value);
        }
        return value;
    }

    private static int checkPositive(int value, String name) {
        if (value <= 0) {
            throw new InvalidParameterException("Parameter " + name + " must be strictly positive: " + value);
        }
        return value;
    }

    public double getMainServiceDensity() {
        return mainServiceDensity;
    }

    public MepGraphParameters setMainServiceDensity(double mainServiceDensity) {
        this.mainServiceDensity = checkPositive(mainServiceDensity, "mainServiceDensity");
        return this;
    }

    public double getLightingDensity() {
        return lightingDensity;
    }

    public MepGraphParameters setLightingDensity(double lightingDensity) {
        this.lightingDensity = checkPositive(lightingDensity, "lightingDensity");
        return this;
    }

    public double getGeneralPowerDensity() {
        return generalPowerDensity;
    }

    public MepGraphParameters setGeneralPowerDensity(double generalPowerDensity) {
        this.generalPowerDensity = checkPositive(generalPowerDensity, "generalPowerDensity");
        return this;
    }

    public double getHvacDensity() {
        return hvacDensity;
    }

    public MepGraphParameters setHvacDensity(double hvacDensity) {
        this.hvacDensity = checkPositive(hvacDensity, "hvacDensity");
        return this;
    }

    public double getKitchenLoad() {
        return kitchenLoad;
    }

    public MepGraphParameters setKitchenLoad(double kitchenLoad) {
        this.kitchenLoad = checkPositive(kitchenLoad, "kitchenLoad");
        return this;
    }

    public double getDataCenterLoad() {
        return dataCenterLoad;
    }

    public MepGraphParameters setDataCenterLoad(double dataCenterLoad) {
        this.dataCenterLoad = checkPositive(dataCenterLoad, "dataCenterLoad");
        return this;
    }

    public int getKitchenFloorInterval() {
        return kitchenFloorInterval;
    }

    public MepGraphParameters setKitchenFloorInterval(int kitchenFloorInterval) {
        this.kitchenFloorInterval = checkPositive(kitchenFloorInterval, "kitchenFloorInterval");
        return this;
    }

    public double getMainServiceThreshold() {
        return mainServiceThreshold;
    }

    public MepGraphParameters setMainServiceThreshold(double mainServiceThreshold) {
        this.mainServiceThreshold = checkPositive(mainServiceThreshold, "mainServiceThreshold");
        return this;
    }

    public double getSecondaryTransformerThreshold() {
        return secondaryTransformerThreshold;
    }

    public MepGraphParameters setSecondaryTransformerThreshold(double secondaryTransformerThreshold) {
        this.secondaryTransformerThreshold = checkPositive(secondaryTransformerThreshold, "secondaryTransformerThreshold");
        return this;
    }

    public double getPanelSplitLoad() {
        return panelSplitLoad;
    }

    public MepGraphParameters setPanelSplitLoad(double panelSplitLoad) {
        this.panelSplitLoad = checkPositive(panelSplitLoad, "panelSplitLoad");
        return this;
    }

    public int getMaxPanelsPerGroup() {
        return maxPanelsPerGroup;
    }

    public MepGraphParameters setMaxPanelsPerGroup(int maxPanelsPerGroup) {
        this.maxPanelsPerGroup = checkPositive(maxPanelsPerGroup, "maxPanelsPerGroup");
        return this;
    }

    public double getPowerFactor() {
        return powerFactor;
    }

    public MepGraphParameters setPowerFactor(double powerFactor) {
        if (Double.isNaN(powerFactor) || powerFactor <= 0 || powerFactor > 1) {
            throw new InvalidParameterException("Power factor must be in ]0, 1]: " + powerFactor);
        }
        this.powerFactor = powerFactor;
        return this;
    }

    public double getFrequency() {
        return frequency;
    }

    public MepGraphParameters setFrequency(double frequency) {
        this.frequency = checkPositive(frequency, "frequency");
        return this;
    }

    public HighVoltageTierMode getHighVoltageTierMode() {
        return highVoltageTierMode;
    }

    public MepGraphParameters setHighVoltageTierMode(HighVoltageTierMode highVoltageTierMode) {
        this.highVoltageTierMode = Objects.requireNonNull(highVoltageTierMode);
        return this;
    }

    public LocalDate getConstructionDate() {
        return constructionDate;
    }

    public MepGraphParameters setConstructionDate(LocalDate constructionDate) {
        this.constructionDate = Objects.requireNonNull(constructionDate);
        return this;
    }

    public String getOutputDirectory() {
        return outputDirectory;
    }

    public MepGraphParameters setOutputDirectory(String outputDirectory) {
        this.outputDirectory = Objects.requireNonNull(outputDirectory);
        return this;
    }

    @Override
    public String toString() {
        return "MepGraphParameters(" +
                "mainServiceDensity=" + mainServiceDensity +
                ", lightingDensity=" + lightingDensity +
                ", generalPowerDensity=" + generalPowerDensity +
                ", hvacDensity=" + hvacDensity +
                ", kitchenLoad=" + kitchenLoad +
                ", dataCenterLoad=" + dataCenterLoad +
                ", kitchenFloorInterval=" + kitchenFloorInterval +
                ", mainServiceThreshold=" + mainServiceThreshold +
                ", secondaryTransformerThreshold=" + secondaryTransformerThreshold +
                ", panelSplitLoad=" + panelSplitLoad +
                ", maxPanelsPerGroup=" + maxPanelsPerGroup +
                ", powerFactor=" + powerFactor +
                ", frequency=" + frequency +
                ", highVoltageTierMode=" + highVoltageTierMode +
                ", constructionDate=" + constructionDate +
                ", outputDirectory=" + outputDirectory +
                ')';
    }
}
