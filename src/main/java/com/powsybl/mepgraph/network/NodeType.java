/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.mepgraph.network;

import java.util.Locale;

/**
 * Equipment kinds, from the most upstream to the end loads.
 *
 * @author MEP graph developers {@literal <mep-graph-dev at example.org>}
 */
public enum NodeType {
    TRANSFORMER,
    SWITCHBOARD,
    PANELBOARD,
    LOAD;

    /**
     * Lower case name, used as node id prefix and as persisted type.
     */
    public String getPrefix() {
        return name().toLowerCase(Locale.ROOT);
    }
}
