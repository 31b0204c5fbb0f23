/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.mepgraph;

import com.powsybl.commons.report.ReportNode;
import com.powsybl.mepgraph.analysis.EquipmentSizer;
import com.powsybl.mepgraph.analysis.LoadAggregator;
import com.powsybl.mepgraph.analysis.RiskScoreCalculator;
import com.powsybl.mepgraph.building.BuildingProfile;
import com.powsybl.mepgraph.building.CoreStrategy;
import com.powsybl.mepgraph.building.CoreStrategyPlanner;
import com.powsybl.mepgraph.decision.NodeDecision;
import com.powsybl.mepgraph.decision.NodeDecisionPlanner;
import com.powsybl.mepgraph.network.MepGraph;
import com.powsybl.mepgraph.network.MepGraphBuilder;
import com.powsybl.mepgraph.network.MepGraphMetadata;
import com.powsybl.mepgraph.requirement.ElectricalRequirement;
import com.powsybl.mepgraph.requirement.RequirementAnalyzer;
import com.powsybl.mepgraph.util.Profiler;
import com.powsybl.mepgraph.util.Reports;
import com.powsybl.mepgraph.validation.ConstraintValidator;
import com.powsybl.mepgraph.validation.ValidationResult;
import com.powsybl.mepgraph.voltage.StandardVoltages;
import com.powsybl.mepgraph.voltage.VoltagePropagator;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Entry point of the topology synthesizer: from a building profile and a target node count, plans and builds an
 * energized and validated electrical distribution graph.
 * <p>
 * All random draws come from a single stream seeded once per call, in this order: generation id, requirement
 * locations, filler panelboards, utility voltage tier, cosmetic node attributes. The same seed, profile,
 * node count and parameters always give the same graph.
 *
 * @author MEP graph developers {@literal <mep-graph-dev at example.org>}
 */
public final class MepGraphGenerator {

    private static final Logger LOGGER = LoggerFactory.getLogger(MepGraphGenerator.class);

    private MepGraphGenerator() {
    }

    public static MepGraph generate(BuildingProfile building, int nodeCount, Long seed) {
        return generate(building, nodeCount, seed, new MepGraphParameters());
    }

    public static MepGraph generate(BuildingProfile building, int nodeCount, Long seed, MepGraphParameters parameters) {
        return generate(building, nodeCount, seed, parameters, ReportNode.NO_OP);
    }

    public static MepGraph generate(BuildingProfile building, int nodeCount, Long seed, MepGraphParameters parameters,
                                    ReportNode reportNode) {
        return generate(building, nodeCount, seed, parameters, reportNode, Profiler.NO_OP);
    }

    public static MepGraph generate(BuildingProfile building, int nodeCount, Long seed, MepGraphParameters parameters,
                                    ReportNode reportNode, Profiler profiler) {
        if (building == null) {
            throw new InvalidParameterException("Building profile is missing");
        }
        if (nodeCount < NodeDecisionPlanner.MIN_NODE_COUNT) {
            throw new InvalidParameterException("Node count must be at least " + NodeDecisionPlanner.MIN_NODE_COUNT + ": " + nodeCount);
        }
        Objects.requireNonNull(parameters);
        Objects.requireNonNull(reportNode);
        Objects.requireNonNull(profiler);

        long effectiveSeed = seed != null ? seed : System.nanoTime();
        RandomGenerator random = new Well19937c(effectiveSeed);
        String generationId = new UUID(random.nextLong(), random.nextLong()).toString();
        ReportNode generationReportNode = Reports.createGenerationReportNode(reportNode, generationId);
        LOGGER.info("Generating graph {} for {} with {} nodes, seed {}", generationId, building, nodeCount, effectiveSeed);

        CoreStrategy coreStrategy = profiler.profile("CoreStrategyPlanner", () -> new CoreStrategyPlanner().plan(building));
        Reports.reportCoreStrategy(generationReportNode, coreStrategy.getKind().name(), coreStrategy.getCoreCount());

        List<ElectricalRequirement> requirements = profiler.profile("RequirementAnalyzer",
            () -> new RequirementAnalyzer(parameters, random).analyze(building, coreStrategy));
        Reports.reportRequirements(generationReportNode, requirements.size(),
                requirements.stream().filter(r -> !r.isMainService()).mapToDouble(ElectricalRequirement::load).sum());

        List<NodeDecision> decisions = profiler.profile("NodeDecisionPlanner",
            () -> new NodeDecisionPlanner(parameters, random).plan(building, coreStrategy, requirements, nodeCount));
        Reports.reportNodeDecisions(generationReportNode, decisions.size(), nodeCount);

        StandardVoltages standardVoltages = StandardVoltages.select(parameters.getHighVoltageTierMode(), random);
        MepGraphMetadata metadata = new MepGraphMetadata(generationId, building, coreStrategy, standardVoltages.getHighVoltage(),
                effectiveSeed, parameters.getConstructionDate(), MepGraphMetadata.DEFAULT_DESCRIPTION);

        MepGraph graph = profiler.profile("MepGraphBuilder",
            () -> new MepGraphBuilder(random, parameters.getPowerFactor()).build(decisions, metadata));
        Reports.reportGraphSize(generationReportNode, graph.getNodeCount(), graph.getEdgeCount());

        VoltagePropagator voltagePropagator = new VoltagePropagator(standardVoltages, parameters);
        profiler.profile("VoltagePropagator", () -> voltagePropagator.propagate(graph, generationReportNode));

        ValidationResult validationResult = profiler.profile("ConstraintValidator",
            () -> new ConstraintValidator(voltagePropagator).validate(graph, Reports.createValidationReportNode(generationReportNode)));
        if (!validationResult.isClean()) {
            LOGGER.warn("Graph {} validated with {} soft violations and {} repairs", generationId,
                    validationResult.getSoftCount(), validationResult.getRepairedCount());
        }

        profiler.profile("Analysis", () -> {
            if (new LoadAggregator(parameters.getPowerFactor()).aggregate(graph)) {
                new EquipmentSizer(parameters.getPowerFactor()).size(graph);
                new RiskScoreCalculator().apply(graph);
            } else {
                Reports.reportLoadAggregationSkipped(generationReportNode);
            }
        });
        profiler.printSummary();

        LOGGER.info("Graph {} generated: {} nodes, {} edges", generationId, graph.getNodeCount(), graph.getEdgeCount());
        return graph;
    }
}
