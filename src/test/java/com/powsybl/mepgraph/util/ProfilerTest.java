/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.mepgraph.util;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author MEP graph developers {@literal <mep-graph-dev at example.org>}
 */
class ProfilerTest {

    @Test
    void test() {
        Profiler.ProfilerImpl profiler = (Profiler.ProfilerImpl) Profiler.create();
        assertEquals(42, profiler.profile("a", () -> 42));
        profiler.profile("b", () -> {
        });
        profiler.profile("a", () -> 1);
        assertEquals(List.of("a", "b"), List.copyOf(profiler.getElapsedByTask().keySet()));
        profiler.printSummary();
    }

    @Test
    void testNesting() {
        Profiler profiler = Profiler.create();
        profiler.beforeTask("a");
        assertThrows(IllegalStateException.class, () -> profiler.beforeTask("b"));
        assertThrows(IllegalStateException.class, () -> profiler.afterTask("b"));
        profiler.afterTask("a");
    }

    @Test
    void testReleasedOnFailure() {
        Profiler profiler = Profiler.create();
        assertThrows(IllegalArgumentException.class, () -> profiler.profile("a", () -> {
            throw new IllegalArgumentException();
        }));
        assertEquals(1, profiler.profile("b", () -> 1));
    }

    @Test
    void testNoOp() {
        assertEquals("x", Profiler.NO_OP.profile("a", () -> "x"));
        Profiler.NO_OP.printSummary();
    }
}
