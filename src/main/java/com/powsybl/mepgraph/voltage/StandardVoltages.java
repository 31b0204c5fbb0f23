/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.mepgraph.voltage;

import org.apache.commons.math3.random.RandomGenerator;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * The permissible voltage levels of one building: a utility tier, a 480 V distribution tier and a 208 V
 * utilization tier.
 *
 * @author MEP graph developers {@literal <mep-graph-dev at example.org>}
 */
public final class StandardVoltages {

    public static final double HIGH_VOLTAGE_13500 = 13500;

    public static final double HIGH_VOLTAGE_4160 = 4160;

    public static final double DISTRIBUTION_VOLTAGE = 480;

    public static final double UTILIZATION_VOLTAGE = 208;

    /**
     * A transformer output is at most this ratio of its input.
     */
    public static final double STEP_DOWN_RATIO = 0.8;

    private final double highVoltage;

    private final List<Double> tiers;

    public StandardVoltages(double highVoltage) {
        if (highVoltage != HIGH_VOLTAGE_13500 && highVoltage != HIGH_VOLTAGE_4160) {
            throw new IllegalArgumentException("Not a standard high voltage tier: " + highVoltage);
        }
        this.highVoltage = highVoltage;
        this.tiers = List.of(highVoltage, DISTRIBUTION_VOLTAGE, UTILIZATION_VOLTAGE);
    }

    public static StandardVoltages select(HighVoltageTierMode mode, RandomGenerator random) {
        Objects.requireNonNull(mode);
        return switch (mode) {
            case TIER_13500 -> new StandardVoltages(HIGH_VOLTAGE_13500);
            case TIER_4160 -> new StandardVoltages(HIGH_VOLTAGE_4160);
            case RANDOM -> new StandardVoltages(random.nextBoolean() ? HIGH_VOLTAGE_13500 : HIGH_VOLTAGE_4160);
        };
    }

    public double getHighVoltage() {
        return highVoltage;
    }

    /**
     * Tiers in decreasing order.
     */
    public List<Double> getTiers() {
        return tiers;
    }

    public boolean isStandard(double voltage) {
        return tiers.contains(voltage);
    }

    /**
     * Highest tier not above {@link #STEP_DOWN_RATIO} of the given upstream voltage, or the utilization tier
     * when none qualifies.
     */
    public double stepDown(double upstreamVoltage) {
        double limit = STEP_DOWN_RATIO * upstreamVoltage;
        return tiers.stream()
                .filter(v -> v <= limit)
                .findFirst()
                .orElse(UTILIZATION_VOLTAGE);
    }

    /**
     * Nearest tier, the lower one on a tie.
     */
    public double nearest(double voltage) {
        return tiers.stream()
                .min(Comparator.<Double>comparingDouble(v -> Math.abs(v - voltage)).thenComparingDouble(v -> v))
                .orElseThrow();
    }

    @Override
    public String toString() {
        return "StandardVoltages" + tiers;
    }
}
