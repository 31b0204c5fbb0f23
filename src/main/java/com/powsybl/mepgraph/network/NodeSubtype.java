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
 * @author MEP graph developers {@literal <mep-graph-dev at example.org>}
 */
public enum NodeSubtype {
    MAIN,
    SECONDARY,
    DISTRIBUTION,
    LIGHTING,
    POWER,
    GENERIC,
    END_LOAD;

    public String getLabel() {
        return name().toLowerCase(Locale.ROOT);
    }
}
