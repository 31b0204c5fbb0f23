/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.mepgraph.network;

/**
 * Lifecycle of a node: structural attributes only, then electrical attributes populated by voltage
 * propagation. Only energized nodes can be exported.
 *
 * @author MEP graph developers {@literal <mep-graph-dev at example.org>}
 */
public enum NodeState {
    PROVISIONAL,
    ENERGIZED
}
