/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.mepgraph.voltage;

import org.apache.commons.math3.random.Well19937c;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author MEP graph developers {@literal <mep-graph-dev at example.org>}
 */
class StandardVoltagesTest {

    @Test
    void testTiers() {
        assertEquals(List.of(13500.0, 480.0, 208.0), new StandardVoltages(StandardVoltages.HIGH_VOLTAGE_13500).getTiers());
        assertEquals(List.of(4160.0, 480.0, 208.0), new StandardVoltages(StandardVoltages.HIGH_VOLTAGE_4160).getTiers());
        assertThrows(IllegalArgumentException.class, () -> new StandardVoltages(11000));
    }

    @Test
    void testStepDown() {
        StandardVoltages voltages = new StandardVoltages(StandardVoltages.HIGH_VOLTAGE_13500);
        assertEquals(480, voltages.stepDown(13500));
        assertEquals(208, voltages.stepDown(480));
        // nothing below the utilization tier
        assertEquals(208, voltages.stepDown(208));
        assertEquals(480, new StandardVoltages(StandardVoltages.HIGH_VOLTAGE_4160).stepDown(4160));
    }

    @Test
    void testNearest() {
        StandardVoltages voltages = new StandardVoltages(StandardVoltages.HIGH_VOLTAGE_4160);
        assertEquals(480, voltages.nearest(500));
        assertEquals(208, voltages.nearest(120));
        assertEquals(4160, voltages.nearest(13500));
        assertEquals(208, voltages.nearest(344));
        assertTrue(voltages.isStandard(480));
        assertFalse(voltages.isStandard(13500));
    }

    @Test
    void testSelect() {
        assertEquals(13500, StandardVoltages.select(HighVoltageTierMode.TIER_13500, new Well19937c(1)).getHighVoltage());
        assertEquals(4160, StandardVoltages.select(HighVoltageTierMode.TIER_4160, new Well19937c(1)).getHighVoltage());
        boolean expected13500 = new Well19937c(42).nextBoolean();
        assertEquals(expected13500 ? 13500 : 4160,
                StandardVoltages.select(HighVoltageTierMode.RANDOM, new Well19937c(42)).getHighVoltage());
    }
}
