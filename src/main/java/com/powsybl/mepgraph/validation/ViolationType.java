/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.mepgraph.validation;

/**
 * @author MEP graph developers {@literal <mep-graph-dev at example.org>}
 */
public enum ViolationType {
    TRANSFORMER_NO_STEP_DOWN,
    TRANSFORMER_ADJACENCY,
    LOAD_UNFED,
    LOAD_MULTIPLE_FEEDERS,
    LOAD_FED_BY_NON_PANELBOARD,
    LOAD_NO_PANELBOARD
}
