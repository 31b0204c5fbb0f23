/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.mepgraph.building;

/**
 * Plan footprint of the main electrical core (riser shaft), in meters.
 *
 * @param centerX center along the building length
 * @param centerY center along the building width
 * @param size side of the square footprint
 *
 * @author MEP graph developers {@literal <mep-graph-dev at example.org>}
 */
public record CoreFootprint(double centerX, double centerY, double size) {

    public static final double DEFAULT_SIZE = 3.0;

    public static CoreFootprint centeredIn(double length, double width) {
        return new CoreFootprint(length / 2, width / 2, DEFAULT_SIZE);
    }
}
