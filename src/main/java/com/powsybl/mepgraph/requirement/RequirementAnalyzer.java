/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.mepgraph.requirement;

import com.powsybl.mepgraph.MepGraphParameters;
import com.powsybl.mepgraph.building.BuildingProfile;
import com.powsybl.mepgraph.building.CorePosition;
import com.powsybl.mepgraph.building.CoreStrategy;
import org.apache.commons.math3.geometry.euclidean.threed.Vector3D;
import org.apache.commons.math3.random.RandomGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Turns a building profile into discrete electrical requirements. Service loads are placed on the
 * closest riser, general floor loads at a random point of their floor.
 *
 * @author MEP graph developers {@literal <mep-graph-dev at example.org>}
 */
public class RequirementAnalyzer {

    private static final Logger LOGGER = LoggerFactory.getLogger(RequirementAnalyzer.class);

    private final MepGraphParameters parameters;

    private final RandomGenerator random;

    public RequirementAnalyzer(MepGraphParameters parameters, RandomGenerator random) {
        this.parameters = Objects.requireNonNull(parameters);
        this.random = Objects.requireNonNull(random);
    }

    private static double densityLoad(double wattsPerSqft, double areaSqft) {
        return wattsPerSqft * areaSqft / 1000;
    }

    public List<ElectricalRequirement> analyze(BuildingProfile building, CoreStrategy coreStrategy) {
        Objects.requireNonNull(building);
        Objects.requireNonNull(coreStrategy);

        List<ElectricalRequirement> requirements = new ArrayList<>();
        double floorAreaSqft = building.getFloorAreaSqft();
        int floorCount = building.getFloorCount();

        // basement: building service and central plant
        double basementZ = building.getFloorElevation(BuildingProfile.BASEMENT_FLOOR);
        Vector3D serviceLocation = coreLocation(building, coreStrategy, basementZ);
        requirements.add(new ElectricalRequirement(densityLoad(parameters.getMainServiceDensity(), floorAreaSqft) * floorCount,
                serviceLocation, LoadType.MAIN_SERVICE, BuildingProfile.BASEMENT_FLOOR, "B-ELEC"));
        requirements.add(new ElectricalRequirement(densityLoad(parameters.getHvacDensity(), floorAreaSqft) * floorCount,
                serviceLocation, LoadType.HVAC, BuildingProfile.BASEMENT_FLOOR, "B-MECH"));

        for (int floor = 1; floor <= floorCount; floor++) {
            double z = building.getFloorElevation(floor);
            String openSpace = "F" + floor + "-OPEN";
            requirements.add(new ElectricalRequirement(densityLoad(parameters.getLightingDensity(), floorAreaSqft),
                    randomFloorLocation(building, z), LoadType.LIGHTING, floor, openSpace));
            requirements.add(new ElectricalRequirement(densityLoad(parameters.getGeneralPowerDensity(), floorAreaSqft),
                    randomFloorLocation(building, z), LoadType.GENERAL_POWER, floor, openSpace));
            if (floor % parameters.getKitchenFloorInterval() == 0) {
                requirements.add(new ElectricalRequirement(parameters.getKitchenLoad(),
                        randomFloorLocation(building, z), LoadType.KITCHEN, floor, "F" + floor + "-KITCHEN"));
            }
            if (building.isTopFloor(floor)) {
                requirements.add(new ElectricalRequirement(parameters.getDataCenterLoad(),
                        coreLocation(building, coreStrategy, z), LoadType.DATA_CENTER, floor, "F" + floor + "-DATA"));
            }
        }

        LOGGER.debug("{} electrical requirements for {} floors, total demand {} kW", requirements.size(), floorCount,
                requirements.stream().filter(r -> !r.isMainService()).mapToDouble(ElectricalRequirement::load).sum());
        return requirements;
    }

    private static Vector3D coreLocation(BuildingProfile building, CoreStrategy coreStrategy, double z) {
        CorePosition core = coreStrategy.getNearestCore(building.getCoreFootprint().centerX(), building.getCoreFootprint().centerY());
        return new Vector3D(core.x(), core.y(), z);
    }

    private Vector3D randomFloorLocation(BuildingProfile building, double z) {
        double x = random.nextDouble() * building.getLength();
        double y = random.nextDouble() * building.getWidth();
        return new Vector3D(x, y, z);
    }
}
