/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.mepgraph.building;

import com.powsybl.mepgraph.InvalidParameterException;

import java.util.Locale;
import java.util.Objects;

/**
 * Validated building geometry. Floor 0 is the basement, above ground floors are numbered from 1 to
 * {@link #getFloorCount()}.
 *
 * @author MEP graph developers {@literal <mep-graph-dev at example.org>}
 */
public final class BuildingProfile {

    public static final double SQFT_PER_SQUARE_METER = 10.7639;

    public static final double DEFAULT_LENGTH = 20.0;

    public static final double DEFAULT_WIDTH = 20.0;

    public static final double DEFAULT_FLOOR_HEIGHT = 3.5;

    public static final int DEFAULT_FLOOR_COUNT = 4;

    public static final double DEFAULT_BASEMENT_DEPTH = 4.0;

    public static final int BASEMENT_FLOOR = 0;

    private final double length;

    private final double width;

    private final double floorHeight;

    private final int floorCount;

    private final double basementDepth;

    private final CoreFootprint coreFootprint;

    private BuildingProfile(double length, double width, double floorHeight, int floorCount, double basementDepth,
                            CoreFootprint coreFootprint) {
        this.length = length;
        this.width = width;
        this.floorHeight = floorHeight;
        this.floorCount = floorCount;
        this.basementDepth = basementDepth;
        this.coreFootprint = coreFootprint;
    }

    public static Builder builder() {
        return new Builder();
    }

    public double getLength() {
        return length;
    }

    public double getWidth() {
        return width;
    }

    public double getFloorHeight() {
        return floorHeight;
    }

    public int getFloorCount() {
        return floorCount;
    }

    public double getBasementDepth() {
        return basementDepth;
    }

    public CoreFootprint getCoreFootprint() {
        return coreFootprint;
    }

    /**
     * Plan area of one floor in square meters.
     */
    public double getFloorArea() {
        return length * width;
    }

    public double getFloorAreaSqft() {
        return getFloorArea() * SQFT_PER_SQUARE_METER;
    }

    public double getTotalFloorArea() {
        return getFloorArea() * floorCount;
    }

    /**
     * Above ground height, basement excluded.
     */
    public double getHeight() {
        return floorCount * floorHeight;
    }

    public double getAspectRatio() {
        return Math.max(length, width) / Math.min(length, width);
    }

    public boolean isTopFloor(int floor) {
        return floor == floorCount;
    }

    /**
     * Elevation of the slab of the given floor.
     */
    public double getFloorElevation(int floor) {
        checkFloor(floor);
        return floor == BASEMENT_FLOOR ? -basementDepth : (floor - 1) * floorHeight;
    }

    private void checkFloor(int floor) {
        if (floor < BASEMENT_FLOOR || floor > floorCount) {
            throw new IllegalArgumentException("Floor " + floor + " is outside of [0, " + floorCount + "]");
        }
    }

    @Override
    public String toString() {
        return String.format(Locale.US, "BuildingProfile(%.1fm x %.1fm, %d floors of %.2fm, basement %.2fm)",
                length, width, floorCount, floorHeight, basementDepth);
    }

    public static final class Builder {

        private double length = DEFAULT_LENGTH;

        private double width = DEFAULT_WIDTH;

        private double floorHeight = DEFAULT_FLOOR_HEIGHT;

        private int floorCount = DEFAULT_FLOOR_COUNT;

        private double basementDepth = DEFAULT_BASEMENT_DEPTH;

        private CoreFootprint coreFootprint;

        private Builder() {
        }

        public Builder setLength(double length) {
            this.length = length;
            return this;
        }

        public Builder setWidth(double width) {
            this.width = width;
            return this;
        }

        public Builder setFloorHeight(double floorHeight) {
            this.floorHeight = floorHeight;
            return this;
        }

        public Builder setFloorCount(int floorCount) {
            this.floorCount = floorCount;
            return this;
        }

        public Builder setBasementDepth(double basementDepth) {
            this.basementDepth = basementDepth;
            return this;
        }

        public Builder setCoreFootprint(CoreFootprint coreFootprint) {
            this.coreFootprint = Objects.requireNonNull(coreFootprint);
            return this;
        }

        private static void checkPositive(double value, String name) {
            if (Double.isNaN(value) || value <= 0) {
                throw new InvalidParameterException("Building " + name + " must be strictly positive: " + value);
            }
        }

        public BuildingProfile build() {
            checkPositive(length, "length");
            checkPositive(width, "width");
            checkPositive(floorHeight, "floor height");
            checkPositive(basementDepth, "basement depth");
            if (floorCount < 1) {
                throw new InvalidParameterException("Building must have at least one floor: " + floorCount);
            }
            CoreFootprint footprint = coreFootprint != null ? coreFootprint : CoreFootprint.centeredIn(length, width);
            checkPositive(footprint.size(), "core footprint size");
            if (footprint.centerX() < 0 || footprint.centerX() > length
                    || footprint.centerY() < 0 || footprint.centerY() > width) {
                throw new InvalidParameterException("Electrical core footprint center (" + footprint.centerX() + ", "
                        + footprint.centerY() + ") is outside of the building");
            }
            return new BuildingProfile(length, width, floorHeight, floorCount, basementDepth, footprint);
        }
    }
}
