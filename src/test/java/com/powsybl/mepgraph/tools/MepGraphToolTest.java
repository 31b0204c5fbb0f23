/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.mepgraph.tools;

import com.google.common.jimfs.Configuration;
import com.google.common.jimfs.Jimfs;
import com.powsybl.commons.config.InMemoryPlatformConfig;
import com.powsybl.commons.config.MapModuleConfig;
import com.powsybl.mepgraph.MepGraphParameters;
import com.powsybl.mepgraph.MepGraphTestUtil;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.FileSystem;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author MEP graph developers {@literal <mep-graph-dev at example.org>}
 */
class MepGraphToolTest {

    @TempDir
    Path tempDir;

    private FileSystem fileSystem;

    private InMemoryPlatformConfig platformConfig;

    private StringWriter out;

    private StringWriter err;

    @BeforeEach
    void setUp() {
        fileSystem = Jimfs.newFileSystem(Configuration.unix());
        platformConfig = new InMemoryPlatformConfig(fileSystem);
        MapModuleConfig moduleConfig = platformConfig.createModuleConfig(MepGraphParameters.MODULE_NAME);
        moduleConfig.setStringProperty("highVoltageTierMode", "TIER_13500");
        moduleConfig.setStringProperty("constructionDate", MepGraphTestUtil.CONSTRUCTION_DATE.toString());
        moduleConfig.setStringProperty("outputDirectory", tempDir.resolve("graph_outputs").toString());
        out = new StringWriter();
        err = new StringWriter();
    }

    @AfterEach
    void tearDown() throws IOException {
        fileSystem.close();
    }

    private int run(String... args) {
        CommandLine commandLine = MepGraphTool.createCommandLine(new MepGraphTool(platformConfig));
        commandLine.setOut(new PrintWriter(out));
        commandLine.setErr(new PrintWriter(err));
        return commandLine.execute(args);
    }

    @Test
    void testRun() {
        assertEquals(0, run("10", "--seed", "1", "--floors", "3", "--filename", "minimal"));
        Path file = tempDir.resolve("graph_outputs").resolve("minimal.mepg");
        assertTrue(Files.exists(file));
        String output = out.toString();
        assertTrue(output.contains("written to " + file));
        assertTrue(output.contains("Building: 20.0 m x 20.0 m, 3 floors of 3.5 m, MULTI_CORE with 2 core(s)"));
        assertTrue(output.contains("Nodes: 10, edges: 8, seed: 1"));
        assertTrue(output.contains("Nodes by type"));
        assertTrue(output.contains("Nodes by floor"));
        assertTrue(output.contains("Cable distance (m)"));
    }

    @Test
    void testPrintSummary() {
        StringWriter summary = new StringWriter();
        try (PrintWriter writer = new PrintWriter(summary)) {
            MepGraphTool.printSummary(MepGraphTestUtil.generateMinimalGraph(), tempDir.resolve("minimal.mepg"), writer);
        }
        String output = summary.toString();
        assertTrue(output.contains("Nodes by type"));
        assertTrue(output.contains("transformer"));
        assertTrue(output.contains("Nodes by floor"));
    }

    @Test
    void testDefaultFileName() throws IOException {
        Path outputDir = tempDir.resolve("custom");
        assertEquals(0, run("12", "--seed", "7", "--output-dir", outputDir.toString(), "--length", "40", "--width", "25"));
        try (Stream<Path> files = Files.list(outputDir)) {
            Path file = files.findFirst().orElseThrow();
            String name = file.getFileName().toString();
            assertTrue(name.matches("mep_graph_\\d{8}_\\d{6}_seed_7_nodes_12\\.mepg"), name);
        }
    }

    @Test
    void testInvalidNodeCount() {
        assertEquals(MepGraphTool.INVALID_PARAMETER_EXIT_CODE, run("2", "--seed", "1"));
        assertTrue(err.toString().contains("Invalid parameter: Node count must be at least 3: 2"));
    }

    @Test
    void testInvalidBuilding() {
        assertEquals(MepGraphTool.INVALID_PARAMETER_EXIT_CODE, run("10", "--length=-5"));
        assertTrue(err.toString().contains("Invalid parameter: Building length must be strictly positive: -5.0"));
    }

    @Test
    void testUsageError() {
        assertEquals(CommandLine.ExitCode.USAGE, run("ten"));
        assertTrue(out.toString().isEmpty());
    }
}
