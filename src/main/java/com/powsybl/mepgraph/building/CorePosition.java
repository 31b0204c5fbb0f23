/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.mepgraph.building;

import org.apache.commons.math3.geometry.euclidean.twod.Vector2D;

/**
 * Plan position of a vertical electrical riser.
 *
 * @author MEP graph developers {@literal <mep-graph-dev at example.org>}
 */
public record CorePosition(double x, double y, int coreId) {

    public Vector2D toVector() {
        return new Vector2D(x, y);
    }

    public double distance(double px, double py) {
        return toVector().distance(new Vector2D(px, py));
    }
}
