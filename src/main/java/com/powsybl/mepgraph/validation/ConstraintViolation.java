/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.mepgraph.validation;

import java.util.Objects;

/**
 * @param before offending value, empty when not applicable
 * @param after value after repair, empty for a soft violation
 *
 * @author MEP graph developers {@literal <mep-graph-dev at example.org>}
 */
public record ConstraintViolation(ViolationType type, String nodeId, ViolationSeverity severity, String before, String after) {

    public ConstraintViolation {
        Objects.requireNonNull(type);
        Objects.requireNonNull(nodeId);
        Objects.requireNonNull(severity);
        Objects.requireNonNull(before);
        Objects.requireNonNull(after);
    }

    public static ConstraintViolation soft(ViolationType type, String nodeId, String before) {
        return new ConstraintViolation(type, nodeId, ViolationSeverity.SOFT, before, "");
    }

    public static ConstraintViolation repaired(ViolationType type, String nodeId, String before, String after) {
        return new ConstraintViolation(type, nodeId, ViolationSeverity.REPAIRED, before, after);
    }
}
