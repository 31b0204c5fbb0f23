/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.mepgraph.requirement;

/**
 * Kind of electrical demand found in a building.
 *
 * @author MEP graph developers {@literal <mep-graph-dev at example.org>}
 */
public enum LoadType {
    MAIN_SERVICE("Main Service", VoltageClass.HIGH, 1),
    HVAC("HVAC", VoltageClass.MEDIUM, 2),
    LIGHTING("Lighting", VoltageClass.LOW, 3),
    GENERAL_POWER("General Power", VoltageClass.LOW, 3),
    KITCHEN("Kitchen", VoltageClass.MEDIUM, 2),
    DATA_CENTER("Data Center", VoltageClass.MEDIUM, 1);

    private final String label;

    private final VoltageClass voltageClass;

    private final int priority;

    LoadType(String label, VoltageClass voltageClass, int priority) {
        this.label = label;
        this.voltageClass = voltageClass;
        this.priority = priority;
    }

    /**
     * Title cased name used as a load classification.
     */
    public String getLabel() {
        return label;
    }

    public VoltageClass getVoltageClass() {
        return voltageClass;
    }

    public int getPriority() {
        return priority;
    }
}
