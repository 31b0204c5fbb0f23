/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.mepgraph.requirement;

import org.apache.commons.math3.geometry.euclidean.threed.Vector3D;

import java.util.Objects;

/**
 * A discrete demand to be served by the distribution system.
 *
 * @param load demand in kW
 * @param priority 1 is critical
 *
 * @author MEP graph developers {@literal <mep-graph-dev at example.org>}
 */
public record ElectricalRequirement(double load, VoltageClass voltageClass, Vector3D location, LoadType loadType,
                                    int floor, String room, int priority) {

    public ElectricalRequirement {
        Objects.requireNonNull(voltageClass);
        Objects.requireNonNull(location);
        Objects.requireNonNull(loadType);
        Objects.requireNonNull(room);
        if (load < 0) {
            throw new IllegalArgumentException("Negative load: " + load);
        }
    }

    public ElectricalRequirement(double load, Vector3D location, LoadType loadType, int floor, String room) {
        this(load, loadType.getVoltageClass(), location, loadType, floor, room, loadType.getPriority());
    }

    public boolean isMainService() {
        return loadType == LoadType.MAIN_SERVICE;
    }
}
