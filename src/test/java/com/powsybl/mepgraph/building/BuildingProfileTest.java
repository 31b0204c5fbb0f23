/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.mepgraph.building;

import com.powsybl.mepgraph.InvalidParameterException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author MEP graph developers {@literal <mep-graph-dev at example.org>}
 */
class BuildingProfileTest {

    @Test
    void testDefaults() {
        BuildingProfile building = BuildingProfile.builder().build();
        assertEquals(BuildingProfile.DEFAULT_LENGTH, building.getLength());
        assertEquals(BuildingProfile.DEFAULT_WIDTH, building.getWidth());
        assertEquals(BuildingProfile.DEFAULT_FLOOR_COUNT, building.getFloorCount());
        assertEquals(BuildingProfile.DEFAULT_FLOOR_HEIGHT, building.getFloorHeight());
        assertEquals(BuildingProfile.DEFAULT_BASEMENT_DEPTH, building.getBasementDepth());
        assertEquals(new CoreFootprint(10, 10, CoreFootprint.DEFAULT_SIZE), building.getCoreFootprint());
    }

    @Test
    void testDerivedGeometry() {
        BuildingProfile building = BuildingProfile.builder()
                .setLength(40)
                .setWidth(20)
                .setFloorCount(3)
                .setFloorHeight(4)
                .setBasementDepth(5)
                .build();
        assertEquals(800, building.getFloorArea());
        assertEquals(800 * BuildingProfile.SQFT_PER_SQUARE_METER, building.getFloorAreaSqft(), 1e-9);
        assertEquals(2400, building.getTotalFloorArea());
        assertEquals(12, building.getHeight());
        assertEquals(2, building.getAspectRatio());
        assertEquals(-5, building.getFloorElevation(BuildingProfile.BASEMENT_FLOOR));
        assertEquals(0, building.getFloorElevation(1));
        assertEquals(8, building.getFloorElevation(3));
        assertTrue(building.isTopFloor(3));
        assertFalse(building.isTopFloor(2));
        assertThrows(IllegalArgumentException.class, () -> building.getFloorElevation(4));
    }

    @Test
    void testInvalidDimensions() {
        BuildingProfile.Builder zeroLength = BuildingProfile.builder().setLength(0);
        InvalidParameterException e = assertThrows(InvalidParameterException.class, zeroLength::build);
        assertEquals("Building length must be strictly positive: 0.0", e.getMessage());
        assertThrows(InvalidParameterException.class, () -> BuildingProfile.builder().setWidth(-1).build());
        assertThrows(InvalidParameterException.class, () -> BuildingProfile.builder().setFloorHeight(Double.NaN).build());
        assertThrows(InvalidParameterException.class, () -> BuildingProfile.builder().setBasementDepth(0).build());
        assertThrows(InvalidParameterException.class, () -> BuildingProfile.builder().setFloorCount(0).build());
    }

    @Test
    void testCoreFootprintOutsideBuilding() {
        BuildingProfile.Builder builder = BuildingProfile.builder()
                .setLength(20)
                .setWidth(20)
                .setCoreFootprint(new CoreFootprint(25, 10, 3));
        assertThrows(InvalidParameterException.class, builder::build);

        BuildingProfile building = BuildingProfile.builder()
                .setCoreFootprint(new CoreFootprint(2, 3, 4))
                .build();
        assertEquals(2, building.getCoreFootprint().centerX());
    }
}
