/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.mepgraph.building;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Decides the riser layout of a building from its geometry only, so the result does not depend on
 * any random seed.
 *
 * @author MEP graph developers {@literal <mep-graph-dev at example.org>}
 */
public class CoreStrategyPlanner {

    private static final Logger LOGGER = LoggerFactory.getLogger(CoreStrategyPlanner.class);

    public static final double SINGLE_CORE_MIN_HEIGHT = 30;

    public static final double COMPACT_ASPECT_RATIO = 2.0;

    public static final int COMPACT_MIN_FLOOR_COUNT = 6;

    public static final double DUAL_CORE_MIN_HEIGHT = 15;

    public static final double DUAL_CORE_MAX_ASPECT_RATIO = 3.5;

    public static final double FLOOR_AREA_PER_CORE = 1200;

    public static final int MIN_MULTI_CORE_COUNT = 2;

    public static final int MAX_CORE_COUNT = 4;

    public CoreStrategy plan(BuildingProfile building) {
        Objects.requireNonNull(building);
        double height = building.getHeight();
        double aspectRatio = building.getAspectRatio();

        CoreStrategyKind kind;
        int coreCount;
        if (height > SINGLE_CORE_MIN_HEIGHT
                || aspectRatio < COMPACT_ASPECT_RATIO && building.getFloorCount() > COMPACT_MIN_FLOOR_COUNT) {
            kind = CoreStrategyKind.SINGLE_CORE;
            coreCount = 1;
        } else if (height >= DUAL_CORE_MIN_HEIGHT && height <= SINGLE_CORE_MIN_HEIGHT
                && aspectRatio <= DUAL_CORE_MAX_ASPECT_RATIO) {
            kind = CoreStrategyKind.DUAL_CORE;
            coreCount = 2;
        } else {
            kind = CoreStrategyKind.MULTI_CORE;
            int byArea = (int) Math.ceil(building.getFloorArea() / FLOOR_AREA_PER_CORE);
            coreCount = Math.max(MIN_MULTI_CORE_COUNT, Math.min(MAX_CORE_COUNT, byArea));
        }

        CoreStrategy strategy = new CoreStrategy(kind, placeCores(building, coreCount));
        LOGGER.debug("Building {} (height={}m, aspect ratio={}) gets {}", building, height, aspectRatio, strategy);
        return strategy;
    }

    static List<CorePosition> placeCores(BuildingProfile building, int coreCount) {
        double length = building.getLength();
        double width = building.getWidth();
        List<CorePosition> positions = new ArrayList<>(coreCount);
        switch (coreCount) {
            case 1 -> {
                CoreFootprint footprint = building.getCoreFootprint();
                positions.add(new CorePosition(footprint.centerX(), footprint.centerY(), 0));
            }
            case 2 -> {
                // split along the longer axis
                if (length >= width) {
                    positions.add(new CorePosition(0.3 * length, 0.5 * width, 0));
                    positions.add(new CorePosition(0.7 * length, 0.5 * width, 1));
                } else {
                    positions.add(new CorePosition(0.5 * length, 0.3 * width, 0));
                    positions.add(new CorePosition(0.5 * length, 0.7 * width, 1));
                }
            }
            case 3 -> {
                positions.add(new CorePosition(0.25 * length, 0.25 * width, 0));
                positions.add(new CorePosition(0.75 * length, 0.25 * width, 1));
                positions.add(new CorePosition(0.5 * length, 0.75 * width, 2));
            }
            case 4 -> {
                positions.add(new CorePosition(0.25 * length, 0.25 * width, 0));
                positions.add(new CorePosition(0.75 * length, 0.25 * width, 1));
                positions.add(new CorePosition(0.25 * length, 0.75 * width, 2));
                positions.add(new CorePosition(0.75 * length, 0.75 * width, 3));
            }
            default -> throw new IllegalArgumentException("Unsupported core count: " + coreCount);
        }
        return positions;
    }
}
