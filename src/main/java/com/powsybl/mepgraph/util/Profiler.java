/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.mepgraph.util;

import com.google.common.base.Stopwatch;
import com.powsybl.commons.io.table.AsciiTableFormatter;
import com.powsybl.commons.io.table.Column;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Times the generation stages. Stages are flat: a stage must be finished before the next one starts.
 *
 * @author MEP graph developers {@literal <mep-graph-dev at example.org>}
 */
public interface Profiler {

    Profiler NO_OP = new NoOpProfilerImpl();

    void beforeTask(String taskName);

    void afterTask(String taskName);

    void printSummary();

    default <T> T profile(String taskName, Supplier<T> task) {
        beforeTask(taskName);
        try {
            return task.get();
        } finally {
            afterTask(taskName);
        }
    }

    default void profile(String taskName, Runnable task) {
        beforeTask(taskName);
        try {
            task.run();
        } finally {
            afterTask(taskName);
        }
    }

    static Profiler create() {
        return new ProfilerImpl();
    }

    class NoOpProfilerImpl implements Profiler {

        @Override
        public void beforeTask(String taskName) {
            // no-op
        }

        @Override
        public void afterTask(String taskName) {
            // no-op
        }

        @Override
        public void printSummary() {
            // no-op
        }
    }

    class ProfilerImpl implements Profiler {

        private static final Logger LOGGER = LoggerFactory.getLogger(Profiler.class);

        private String currentTaskName;

        private Stopwatch stopwatch;

        private final Map<String, Long> elapsedByTask = new LinkedHashMap<>();

        @Override
        public void beforeTask(String taskName) {
            Objects.requireNonNull(taskName);
            if (currentTaskName != null) {
                throw new IllegalStateException("Task '" + currentTaskName + "' is still running");
            }
            currentTaskName = taskName;
            stopwatch = Stopwatch.createStarted();
        }

        @Override
        public void afterTask(String taskName) {
            Objects.requireNonNull(taskName);
            if (!taskName.equals(currentTaskName)) {
                throw new IllegalStateException("Task nesting issue, running task is: " + currentTaskName);
            }
            stopwatch.stop();
            long elapsed = stopwatch.elapsed(TimeUnit.MICROSECONDS);
            elapsedByTask.merge(taskName, elapsed, Long::sum);
            currentTaskName = null;
            LOGGER.trace(Markers.PERFORMANCE_MARKER, "Task '{}' done in {} us", taskName, elapsed);
        }

        Map<String, Long> getElapsedByTask() {
            return elapsedByTask;
        }

        @Override
        public void printSummary() {
            if (LOGGER.isDebugEnabled()) {
                StringWriter writer = new StringWriter();
                try (AsciiTableFormatter formatter = new AsciiTableFormatter(writer,
                        "Generation profiling summary",
                        new Column("Stage"),
                        new Column("Time (us)"))) {
                    for (Map.Entry<String, Long> e : elapsedByTask.entrySet()) {
                        formatter.writeCell(e.getKey())
                                .writeCell(e.getValue().intValue());
                    }
                } catch (IOException e) {
                    throw new UncheckedIOException(e);
                }
                String tableStr = writer.toString();
                LOGGER.debug(Markers.PERFORMANCE_MARKER, "{}", tableStr.substring(0, tableStr.length() - System.lineSeparator().length()));
            }
        }
    }
}
