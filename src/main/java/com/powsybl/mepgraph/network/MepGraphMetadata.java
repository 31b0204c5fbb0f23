/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.mepgraph.network;

import com.powsybl.mepgraph.building.BuildingProfile;
import com.powsybl.mepgraph.building.CoreStrategy;

import java.time.LocalDate;
import java.util.Objects;

/**
 * Graph level data needed by consumers, for instance to render the building bounding box.
 *
 * @param highVoltageTier utility voltage in volts chosen for the whole graph
 * @param seed seed of the random stream the graph has been generated with
 *
 * @author MEP graph developers {@literal <mep-graph-dev at example.org>}
 */
public record MepGraphMetadata(String generationId, BuildingProfile building, CoreStrategy coreStrategy,
                               double highVoltageTier, long seed, LocalDate constructionDate, String description) {

    public static final String DEFAULT_DESCRIPTION = "Procedurally generated building electrical distribution graph";

    public MepGraphMetadata {
        Objects.requireNonNull(generationId);
        Objects.requireNonNull(building);
        Objects.requireNonNull(coreStrategy);
        Objects.requireNonNull(constructionDate);
        Objects.requireNonNull(description);
    }
}
