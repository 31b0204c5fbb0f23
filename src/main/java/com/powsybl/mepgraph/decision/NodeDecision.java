/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.mepgraph.decision;

import com.powsybl.mepgraph.network.NodeSubtype;
import com.powsybl.mepgraph.network.NodeType;
import com.powsybl.mepgraph.requirement.ElectricalRequirement;
import com.powsybl.mepgraph.requirement.LoadType;
import org.apache.commons.math3.geometry.euclidean.threed.Vector3D;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A piece of equipment to be created. Equality is based on the planner sequence index only.
 *
 * @author MEP graph developers {@literal <mep-graph-dev at example.org>}
 */
public final class NodeDecision {

    private final int index;

    private final NodeType type;

    private final NodeSubtype subtype;

    private final String reason;

    private final double capacity;

    private final int floor;

    private final Vector3D location;

    private final List<ElectricalRequirement> requirements;

    NodeDecision(int index, NodeType type, NodeSubtype subtype, String reason, double capacity, int floor,
                 Vector3D location, List<ElectricalRequirement> requirements) {
        this.index = index;
        this.type = Objects.requireNonNull(type);
        this.subtype = Objects.requireNonNull(subtype);
        this.reason = Objects.requireNonNull(reason);
        this.capacity = capacity;
        this.floor = floor;
        this.location = Objects.requireNonNull(location);
        this.requirements = List.copyOf(requirements);
    }

    NodeDecision withIndex(int newIndex) {
        return newIndex == index ? this : new NodeDecision(newIndex, type, subtype, reason, capacity, floor, location, requirements);
    }

    public int getIndex() {
        return index;
    }

    public NodeType getType() {
        return type;
    }

    public NodeSubtype getSubtype() {
        return subtype;
    }

    public String getReason() {
        return reason;
    }

    /**
     * Capacity in kW.
     */
    public double getCapacity() {
        return capacity;
    }

    public int getFloor() {
        return floor;
    }

    public Vector3D getLocation() {
        return location;
    }

    public List<ElectricalRequirement> getRequirements() {
        return requirements;
    }

    public boolean isLoad() {
        return type == NodeType.LOAD;
    }

    public boolean is(NodeType type, NodeSubtype subtype) {
        return this.type == type && this.subtype == subtype;
    }

    /**
     * Load type of the single requirement served by a load decision.
     */
    public Optional<LoadType> getLoadType() {
        return isLoad() && !requirements.isEmpty() ? Optional.of(requirements.get(0).loadType()) : Optional.empty();
    }

    public String getRoom() {
        return requirements.isEmpty() ? "" : requirements.get(0).room();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return index == ((NodeDecision) o).index;
    }

    @Override
    public int hashCode() {
        return Integer.hashCode(index);
    }

    @Override
    public String toString() {
        return "NodeDecision(" + index + ", " + type + "/" + subtype + ", floor=" + floor + ", capacity=" + capacity + ")";
    }
}
