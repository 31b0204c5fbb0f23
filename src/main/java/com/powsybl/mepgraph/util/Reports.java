/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.mepgraph.util;

import com.powsybl.commons.report.ReportNode;
import com.powsybl.commons.report.TypedValue;

/**
 * @author MEP graph developers {@literal <mep-graph-dev at example.org>}
 */
public final class Reports {

    private static final String NODE_ID = "nodeId";
    private static final String COUNT = "count";

    private Reports() {
    }

    public static ReportNode createGenerationReportNode(ReportNode reportNode, String generationId) {
        return reportNode.newReportNode()
                .withMessageTemplate("mepgraph.generation")
                .withUntypedValue("generationId", generationId)
                .add();
    }

    public static ReportNode createValidationReportNode(ReportNode reportNode) {
        return reportNode.newReportNode()
                .withMessageTemplate("mepgraph.validation")
                .add();
    }

    public static void reportCoreStrategy(ReportNode reportNode, String kind, int coreCount) {
        reportNode.newReportNode()
                .withMessageTemplate("mepgraph.coreStrategy")
                .withUntypedValue("kind", kind)
                .withUntypedValue("coreCount", coreCount)
                .withSeverity(TypedValue.INFO_SEVERITY)
                .add();
    }

    public static void reportRequirements(ReportNode reportNode, int requirementCount, double totalLoad) {
        reportNode.newReportNode()
                .withMessageTemplate("mepgraph.requirements")
                .withUntypedValue(COUNT, requirementCount)
                .withUntypedValue("totalLoad", totalLoad)
                .withSeverity(TypedValue.INFO_SEVERITY)
                .add();
    }

    public static void reportNodeDecisions(ReportNode reportNode, int decisionCount, int targetNodeCount) {
        reportNode.newReportNode()
                .withMessageTemplate("mepgraph.nodeDecisions")
                .withUntypedValue(COUNT, decisionCount)
                .withUntypedValue("targetNodeCount", targetNodeCount)
                .withSeverity(TypedValue.INFO_SEVERITY)
                .add();
    }

    public static void reportGraphSize(ReportNode reportNode, int nodeCount, int edgeCount) {
        reportNode.newReportNode()
                .withMessageTemplate("mepgraph.graphSize")
                .withUntypedValue("nodeCount", nodeCount)
                .withUntypedValue("edgeCount", edgeCount)
                .withSeverity(TypedValue.INFO_SEVERITY)
                .add();
    }

    public static void reportVoltagePropagation(ReportNode reportNode, int sourceCount, int edgeCount, double highVoltage) {
        reportNode.newReportNode()
                .withMessageTemplate("mepgraph.voltagePropagation")
                .withUntypedValue("sourceCount", sourceCount)
                .withUntypedValue("edgeCount", edgeCount)
                .withUntypedValue("highVoltage", highVoltage)
                .withSeverity(TypedValue.INFO_SEVERITY)
                .add();
    }

    public static void reportUnreachableNodes(ReportNode reportNode, int count) {
        reportNode.newReportNode()
                .withMessageTemplate("mepgraph.unreachableNodes")
                .withUntypedValue(COUNT, count)
                .withSeverity(TypedValue.WARN_SEVERITY)
                .add();
    }

    public static void reportTransformerStepDownRepaired(ReportNode reportNode, String nodeId, double before, double after) {
        reportNode.newReportNode()
                .withMessageTemplate("mepgraph.transformerStepDownRepaired")
                .withUntypedValue(NODE_ID, nodeId)
                .withUntypedValue("before", before)
                .withUntypedValue("after", after)
                .withSeverity(TypedValue.INFO_SEVERITY)
                .add();
    }

    public static void reportTransformerCannotStepDown(ReportNode reportNode, String nodeId, double upstreamVoltage) {
        reportNode.newReportNode()
                .withMessageTemplate("mepgraph.transformerCannotStepDown")
                .withUntypedValue(NODE_ID, nodeId)
                .withUntypedValue("upstreamVoltage", upstreamVoltage)
                .withSeverity(TypedValue.WARN_SEVERITY)
                .add();
    }

    public static void reportTransformerAdjacency(ReportNode reportNode, String nodeId, String neighborId) {
        reportNode.newReportNode()
                .withMessageTemplate("mepgraph.transformerAdjacency")
                .withUntypedValue(NODE_ID, nodeId)
                .withUntypedValue("neighborId", neighborId)
                .withSeverity(TypedValue.WARN_SEVERITY)
                .add();
    }

    public static void reportLoadFeederRepaired(ReportNode reportNode, String nodeId, String violationType, String before, String after) {
        reportNode.newReportNode()
                .withMessageTemplate("mepgraph.loadFeederRepaired")
                .withUntypedValue(NODE_ID, nodeId)
                .withUntypedValue("violationType", violationType)
                .withUntypedValue("before", before)
                .withUntypedValue("after", after)
                .withSeverity(TypedValue.INFO_SEVERITY)
                .add();
    }

    public static void reportLoadWithoutPanelboard(ReportNode reportNode, String nodeId) {
        reportNode.newReportNode()
                .withMessageTemplate("mepgraph.loadWithoutPanelboard")
                .withUntypedValue(NODE_ID, nodeId)
                .withSeverity(TypedValue.WARN_SEVERITY)
                .add();
    }

    public static void reportValidation(ReportNode reportNode, int softCount, int repairedCount) {
        reportNode.newReportNode()
                .withMessageTemplate("mepgraph.validationSummary")
                .withUntypedValue("softCount", softCount)
                .withUntypedValue("repairedCount", repairedCount)
                .withSeverity(softCount > 0 ? TypedValue.WARN_SEVERITY : TypedValue.INFO_SEVERITY)
                .add();
    }

    public static void reportLoadAggregationSkipped(ReportNode reportNode) {
        reportNode.newReportNode()
                .withMessageTemplate("mepgraph.loadAggregationSkipped")
                .withSeverity(TypedValue.WARN_SEVERITY)
                .add();
    }
}
