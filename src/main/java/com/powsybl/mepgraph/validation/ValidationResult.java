/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.mepgraph.validation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * @author MEP graph developers {@literal <mep-graph-dev at example.org>}
 */
public class ValidationResult {

    private final List<ConstraintViolation> violations = new ArrayList<>();

    void add(ConstraintViolation violation) {
        violations.add(Objects.requireNonNull(violation));
    }

    public List<ConstraintViolation> getViolations() {
        return Collections.unmodifiableList(violations);
    }

    public List<ConstraintViolation> getViolations(ViolationSeverity severity) {
        return violations.stream().filter(v -> v.severity() == severity).toList();
    }

    public List<ConstraintViolation> getViolations(ViolationType type) {
        return violations.stream().filter(v -> v.type() == type).toList();
    }

    public int getSoftCount() {
        return getViolations(ViolationSeverity.SOFT).size();
    }

    public int getRepairedCount() {
        return getViolations(ViolationSeverity.REPAIRED).size();
    }

    public boolean isClean() {
        return violations.isEmpty();
    }

    @Override
    public String toString() {
        return "ValidationResult(soft=" + getSoftCount() + ", repaired=" + getRepairedCount() + ")";
    }
}
