/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.mepgraph.util;

import org.apache.commons.math3.util.FastMath;

import java.util.List;

/**
 * Standard equipment ratings and current computations.
 *
 * @author MEP graph developers {@literal <mep-graph-dev at example.org>}
 */
public final class ElectricalRatings {

    /**
     * Continuous loading allowed on a protective device or an equipment frame.
     */
    public static final double CONTINUOUS_LOAD_FACTOR = 0.8;

    public static final double SQRT_3 = FastMath.sqrt(3);

    public static final double CABLE_RESISTANCE = 0.0008; // ohm/m

    /**
     * Standard breaker and bus ratings in amperes.
     */
    private static final double[] STANDARD_AMPERE_RATINGS = {
        15, 20, 25, 30, 35, 40, 45, 50, 60, 70, 80, 90, 100, 110, 125, 150, 175, 200, 225, 250, 300, 350, 400,
        450, 500, 600, 700, 800, 1000, 1200, 1600, 2000, 2500, 3000, 4000, 5000, 6000
    };

    public record StandardSize(double rating, double cost) {
    }

    /**
     * Switchboard and panelboard frame sizes in amperes with their replacement cost.
     */
    public static final List<StandardSize> DISTRIBUTION_SIZES = List.of(
            new StandardSize(60, 1000), new StandardSize(100, 1500), new StandardSize(150, 2000),
            new StandardSize(200, 2250), new StandardSize(225, 3000), new StandardSize(300, 4000),
            new StandardSize(400, 5000), new StandardSize(500, 6000), new StandardSize(600, 8000),
            new StandardSize(800, 10000), new StandardSize(1000, 12000), new StandardSize(1200, 16000),
            new StandardSize(1600, 20000), new StandardSize(2000, 25000), new StandardSize(2500, 30000),
            new StandardSize(3000, 40000), new StandardSize(4000, 50000), new StandardSize(5000, 60000),
            new StandardSize(6000, 80000), new StandardSize(8000, 100000), new StandardSize(10000, 120000));

    /**
     * Transformer sizes in kVA with their replacement cost.
     */
    public static final List<StandardSize> TRANSFORMER_SIZES = List.of(
            new StandardSize(15, 1500), new StandardSize(25, 2500), new StandardSize(37.5, 3750),
            new StandardSize(50, 5000), new StandardSize(75, 7500), new StandardSize(100, 10000),
            new StandardSize(112.5, 11250), new StandardSize(150, 15000), new StandardSize(167, 16700),
            new StandardSize(200, 20000), new StandardSize(225, 22500), new StandardSize(250, 25000),
            new StandardSize(300, 30000), new StandardSize(400, 40000), new StandardSize(500, 50000),
            new StandardSize(750, 75000), new StandardSize(1000, 100000), new StandardSize(1500, 150000),
            new StandardSize(2000, 200000), new StandardSize(2500, 250000));

    private ElectricalRatings() {
    }

    /**
     * Line current in amperes drawn by a load of the given active power in kW.
     */
    public static double current(double powerKw, double powerFactor, double voltage, int phaseCount) {
        if (voltage <= 0 || powerFactor <= 0) {
            return 0;
        }
        double apparentPower = powerKw * 1000 / powerFactor;
        return phaseCount == 3 ? apparentPower / (SQRT_3 * voltage) : apparentPower / voltage;
    }

    /**
     * Smallest standard ampere rating carrying the given current at continuous loading, the largest rating
     * when none does.
     */
    public static double standardAmpereRating(double current) {
        double required = current / CONTINUOUS_LOAD_FACTOR;
        for (double rating : STANDARD_AMPERE_RATINGS) {
            if (rating >= required) {
                return rating;
            }
        }
        return STANDARD_AMPERE_RATINGS[STANDARD_AMPERE_RATINGS.length - 1];
    }

    /**
     * Voltage drop in volts of a cable run.
     */
    public static double voltageDrop(double current, int phaseCount, double distance) {
        double phaseFactor = phaseCount == 3 ? SQRT_3 : 2;
        return phaseFactor * current * CABLE_RESISTANCE * distance;
    }

    /**
     * Smallest standard size whose continuous rating covers the demand, the largest size when none does.
     */
    public static StandardSize selectSize(List<StandardSize> sizes, double demand) {
        double required = demand / CONTINUOUS_LOAD_FACTOR;
        return sizes.stream()
                .filter(s -> s.rating() >= required)
                .findFirst()
                .orElse(sizes.get(sizes.size() - 1));
    }
}
