/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.mepgraph.decision;

import com.powsybl.mepgraph.InvalidParameterException;
import com.powsybl.mepgraph.MepGraphParameters;
import com.powsybl.mepgraph.building.BuildingProfile;
import com.powsybl.mepgraph.building.CorePosition;
import com.powsybl.mepgraph.building.CoreStrategy;
import com.powsybl.mepgraph.network.NodeSubtype;
import com.powsybl.mepgraph.network.NodeType;
import com.powsybl.mepgraph.requirement.ElectricalRequirement;
import com.powsybl.mepgraph.requirement.LoadType;
import com.powsybl.mepgraph.requirement.VoltageClass;
import org.apache.commons.math3.geometry.euclidean.threed.Vector3D;
import org.apache.commons.math3.random.RandomGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Groups requirements into typed equipment decisions and reconciles their count with a target
 * node count.
 *
 * @author MEP graph developers {@literal <mep-graph-dev at example.org>}
 */
public class NodeDecisionPlanner {

    private static final Logger LOGGER = LoggerFactory.getLogger(NodeDecisionPlanner.class);

    public static final int MIN_NODE_COUNT = 3;

    public static final double MAIN_TRANSFORMER_FACTOR = 1.25;

    public static final double MAIN_SWITCHBOARD_FACTOR = 1.2;

    public static final double SECONDARY_TRANSFORMER_FACTOR = 1.3;

    public static final double DISTRIBUTION_PANEL_FACTOR = 1.2;

    public static final double BRANCH_PANEL_FACTOR = 1.25;

    public static final double FILLER_PANEL_MIN_CAPACITY = 20;

    public static final double FILLER_PANEL_MAX_CAPACITY = 50;

    /**
     * Plan offset between two pieces of equipment sharing the same riser on the same floor.
     */
    static final double EQUIPMENT_SPACING = 0.6;

    private final MepGraphParameters parameters;

    private final RandomGenerator random;

    public NodeDecisionPlanner(MepGraphParameters parameters, RandomGenerator random) {
        this.parameters = Objects.requireNonNull(parameters);
        this.random = Objects.requireNonNull(random);
    }

    /**
     * Sequence generator and riser slot allocator, local to one planning call.
     */
    private static final class PlanningContext {

        private final BuildingProfile building;

        private final CoreStrategy coreStrategy;

        private final List<NodeDecision> decisions = new ArrayList<>();

        private final Map<Integer, Integer> nextCoreByFloor = new HashMap<>();

        private final Map<String, Integer> usedSlots = new HashMap<>();

        private int nextIndex = 0;

        private PlanningContext(BuildingProfile building, CoreStrategy coreStrategy) {
            this.building = building;
            this.coreStrategy = coreStrategy;
        }

        private NodeDecision add(NodeType type, NodeSubtype subtype, String reason, double capacity, int floor,
                                 Vector3D location, List<ElectricalRequirement> requirements) {
            NodeDecision decision = new NodeDecision(nextIndex++, type, subtype, reason, capacity, floor, location, requirements);
            decisions.add(decision);
            return decision;
        }

        private Vector3D nextRiserLocation(int floor) {
            int coreIndex = nextCoreByFloor.merge(floor, 1, Integer::sum) - 1;
            return riserLocation(floor, coreStrategy.getCore(coreIndex));
        }

        private Vector3D riserLocation(int floor, CorePosition core) {
            int slot = usedSlots.merge(floor + "/" + core.coreId(), 1, Integer::sum) - 1;
            return new Vector3D(Math.min(core.x() + slot * EQUIPMENT_SPACING, building.getLength()), core.y(),
                    building.getFloorElevation(floor));
        }
    }

    public List<NodeDecision> plan(BuildingProfile building, CoreStrategy coreStrategy,
                                   List<ElectricalRequirement> requirements, int targetNodeCount) {
        Objects.requireNonNull(building);
        Objects.requireNonNull(coreStrategy);
        Objects.requireNonNull(requirements);
        if (targetNodeCount < MIN_NODE_COUNT) {
            throw new InvalidParameterException("Target node count must be at least " + MIN_NODE_COUNT + ": " + targetNodeCount);
        }

        PlanningContext context = new PlanningContext(building, coreStrategy);
        planMainService(context, requirements);
        planFloorDistribution(context, requirements);
        planLoads(context, requirements);
        List<NodeDecision> decisions = reconcile(context, targetNodeCount);

        if (LOGGER.isDebugEnabled()) {
            Map<NodeType, Long> countByType = decisions.stream()
                    .collect(Collectors.groupingBy(NodeDecision::getType, () -> new EnumMap<>(NodeType.class), Collectors.counting()));
            LOGGER.debug("{} node decisions planned for a target of {} nodes: {}", decisions.size(), targetNodeCount, countByType);
        }
        return decisions;
    }

    private static double totalEstimatedLoad(List<ElectricalRequirement> requirements) {
        return requirements.stream()
                .filter(r -> !r.isMainService())
                .mapToDouble(ElectricalRequirement::load)
                .sum();
    }

    private void planMainService(PlanningContext context, List<ElectricalRequirement> requirements) {
        Optional<ElectricalRequirement> mainService = requirements.stream()
                .filter(ElectricalRequirement::isMainService)
                .findFirst();
        double totalLoad = totalEstimatedLoad(requirements);
        if (mainService.isEmpty() || totalLoad <= parameters.getMainServiceThreshold()) {
            LOGGER.debug("No main service equipment, total load {} kW", totalLoad);
            return;
        }
        ElectricalRequirement main = mainService.get();
        context.add(NodeType.TRANSFORMER, NodeSubtype.MAIN,
                String.format(Locale.US, "Utility service transformer for %.1f kW of building load", totalLoad),
                totalLoad * MAIN_TRANSFORMER_FACTOR, main.floor(), main.location(), List.of(main));
        context.add(NodeType.SWITCHBOARD, NodeSubtype.MAIN,
                String.format(Locale.US, "Main switchboard distributing %.1f kW", totalLoad),
                totalLoad * MAIN_SWITCHBOARD_FACTOR, main.floor(), main.location(), List.of(main));
    }

    private static VoltageClass coarseVoltageClass(ElectricalRequirement requirement) {
        return requirement.voltageClass() == VoltageClass.LOW ? VoltageClass.LOW : VoltageClass.MEDIUM;
    }

    private void planFloorDistribution(PlanningContext context, List<ElectricalRequirement> requirements) {
        // floors ascending, medium voltage group before low voltage group
        SortedMap<Integer, Map<VoltageClass, List<ElectricalRequirement>>> groups = new TreeMap<>();
        for (ElectricalRequirement requirement : requirements) {
            if (requirement.isMainService()) {
                continue;
            }
            groups.computeIfAbsent(requirement.floor(), f -> new EnumMap<>(VoltageClass.class))
                    .computeIfAbsent(coarseVoltageClass(requirement), c -> new ArrayList<>())
                    .add(requirement);
        }
        for (Map.Entry<Integer, Map<VoltageClass, List<ElectricalRequirement>>> e : groups.entrySet()) {
            int floor = e.getKey();
            List<ElectricalRequirement> medium = e.getValue().get(VoltageClass.MEDIUM);
            if (medium != null) {
                planMediumVoltageGroup(context, floor, medium);
            }
            List<ElectricalRequirement> low = e.getValue().get(VoltageClass.LOW);
            if (low != null) {
                planLowVoltageGroup(context, floor, low);
            }
        }
    }

    private void planMediumVoltageGroup(PlanningContext context, int floor, List<ElectricalRequirement> group) {
        double total = group.stream().mapToDouble(ElectricalRequirement::load).sum();
        Vector3D location = context.nextRiserLocation(floor);
        if (total > parameters.getSecondaryTransformerThreshold()) {
            context.add(NodeType.TRANSFORMER, NodeSubtype.SECONDARY,
                    String.format(Locale.US, "Floor %d medium voltage demand of %.1f kW exceeds %.1f kW", floor, total,
                            parameters.getSecondaryTransformerThreshold()),
                    total * SECONDARY_TRANSFORMER_FACTOR, floor, location, group);
        }
        context.add(NodeType.PANELBOARD, NodeSubtype.DISTRIBUTION,
                String.format(Locale.US, "Floor %d medium voltage distribution for %.1f kW", floor, total),
                total * DISTRIBUTION_PANEL_FACTOR, floor, context.riserLocation(floor, context.coreStrategy.getNearestCore(location.getX(), location.getY())),
                group);
    }

    private void planLowVoltageGroup(PlanningContext context, int floor, List<ElectricalRequirement> group) {
        double total = group.stream().mapToDouble(ElectricalRequirement::load).sum();
        int panelCount = Math.max(1, Math.min(parameters.getMaxPanelsPerGroup(), (int) Math.floor(total / parameters.getPanelSplitLoad())));
        List<List<ElectricalRequirement>> shares = new ArrayList<>(panelCount);
        for (int i = 0; i < panelCount; i++) {
            shares.add(new ArrayList<>());
        }
        for (int i = 0; i < group.size(); i++) {
            shares.get(i % panelCount).add(group.get(i));
        }
        for (int i = 0; i < panelCount; i++) {
            List<ElectricalRequirement> share = shares.get(i);
            double shareLoad = share.stream().mapToDouble(ElectricalRequirement::load).sum();
            boolean lighting = share.stream().anyMatch(r -> r.loadType() == LoadType.LIGHTING);
            context.add(NodeType.PANELBOARD, lighting ? NodeSubtype.LIGHTING : NodeSubtype.POWER,
                    String.format(Locale.US, "Floor %d low voltage panel %d/%d for %.1f kW", floor, i + 1, panelCount, shareLoad),
                    shareLoad * BRANCH_PANEL_FACTOR, floor, context.nextRiserLocation(floor), share);
        }
    }

    private static void planLoads(PlanningContext context, List<ElectricalRequirement> requirements) {
        for (ElectricalRequirement requirement : requirements) {
            if (requirement.isMainService()) {
                continue;
            }
            context.add(NodeType.LOAD, NodeSubtype.END_LOAD,
                    requirement.loadType().getLabel() + " load in " + requirement.room(),
                    requirement.load(), requirement.floor(), requirement.location(), List.of(requirement));
        }
    }

    private List<NodeDecision> reconcile(PlanningContext context, int targetNodeCount) {
        List<NodeDecision> decisions = context.decisions;
        if (decisions.size() < targetNodeCount) {
            int floorCount = context.building.getFloorCount();
            while (decisions.size() < targetNodeCount) {
                int floor = 1 + random.nextInt(floorCount);
                double capacity = FILLER_PANEL_MIN_CAPACITY + random.nextDouble() * (FILLER_PANEL_MAX_CAPACITY - FILLER_PANEL_MIN_CAPACITY);
                CorePosition core = context.coreStrategy.getCore(random.nextInt(context.coreStrategy.getCoreCount()));
                context.add(NodeType.PANELBOARD, NodeSubtype.GENERIC,
                        String.format(Locale.US, "Additional floor %d panelboard to reach %d nodes", floor, targetNodeCount),
                        capacity, floor, context.riserLocation(floor, core), List.of());
            }
            return List.copyOf(decisions);
        }
        if (decisions.size() > targetNodeCount) {
            long nonLoadCount = decisions.stream().filter(d -> !d.isLoad()).count();
            long loadSlots = Math.max(0, targetNodeCount - nonLoadCount);
            Set<NodeDecision> keptLoads = decisions.stream()
                    .filter(NodeDecision::isLoad)
                    .sorted(Comparator.comparingDouble(NodeDecision::getCapacity).reversed()
                            .thenComparingInt(NodeDecision::getIndex))
                    .limit(loadSlots)
                    .collect(Collectors.toSet());
            if (nonLoadCount > targetNodeCount) {
                LOGGER.warn("{} equipment decisions already exceed the target of {} nodes, all loads dropped", nonLoadCount, targetNodeCount);
            }
            List<NodeDecision> kept = decisions.stream()
                    .filter(d -> !d.isLoad() || keptLoads.contains(d))
                    .toList();
            // indexes stay contiguous after trimming
            return IntStream.range(0, kept.size())
                    .mapToObj(i -> kept.get(i).withIndex(i))
                    .toList();
        }
        return List.copyOf(decisions);
    }
}
