/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.mepgraph.building;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * How many vertical risers a building gets and where they sit.
 *
 * @author MEP graph developers {@literal <mep-graph-dev at example.org>}
 */
public final class CoreStrategy {

    private final CoreStrategyKind kind;

    private final List<CorePosition> positions;

    public CoreStrategy(CoreStrategyKind kind, List<CorePosition> positions) {
        this.kind = Objects.requireNonNull(kind);
        this.positions = List.copyOf(positions);
        if (this.positions.isEmpty() || this.positions.size() > CoreStrategyPlanner.MAX_CORE_COUNT) {
            throw new IllegalArgumentException("Invalid core count: " + this.positions.size());
        }
    }

    public CoreStrategyKind getKind() {
        return kind;
    }

    public int getCoreCount() {
        return positions.size();
    }

    public List<CorePosition> getPositions() {
        return positions;
    }

    public CorePosition getCore(int index) {
        return positions.get(Math.floorMod(index, positions.size()));
    }

    /**
     * Closest core to a plan point, the lowest core id wins a tie.
     */
    public CorePosition getNearestCore(double x, double y) {
        return positions.stream()
                .min(Comparator.<CorePosition>comparingDouble(p -> p.distance(x, y))
                        .thenComparingInt(CorePosition::coreId))
                .orElseThrow();
    }

    @Override
    public String toString() {
        return "CoreStrategy(kind=" + kind + ", cores=" + positions + ")";
    }
}
