/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.mepgraph.network;

import com.powsybl.commons.PowsyblException;
import org.apache.commons.math3.geometry.euclidean.threed.Vector3D;

import java.util.List;
import java.util.Objects;

/**
 * A piece of equipment of the distribution graph.
 *
 * @author MEP graph developers {@literal <mep-graph-dev at example.org>}
 */
public class MepNode {

    private final String id;

    private final int num;

    private final NodeSubtype subtype;

    private final Vector3D location;

    private final int floor;

    private final String room;

    private final double capacity;

    private final String reason;

    private final AbstractNodeAttributes attributes;

    private NodeState state = NodeState.PROVISIONAL;

    public MepNode(int num, NodeSubtype subtype, Vector3D location, int floor, String room, double capacity,
                   String reason, AbstractNodeAttributes attributes) {
        this.attributes = Objects.requireNonNull(attributes);
        this.num = num;
        this.id = createId(attributes.getType(), num);
        this.subtype = Objects.requireNonNull(subtype);
        this.location = Objects.requireNonNull(location);
        this.floor = floor;
        this.room = Objects.requireNonNull(room);
        this.capacity = capacity;
        this.reason = Objects.requireNonNull(reason);
    }

    public static String createId(NodeType type, int num) {
        return String.format("%s_%03d", type.getPrefix(), num);
    }

    public String getId() {
        return id;
    }

    /**
     * Sequence number of the node among the nodes of the same type, starting at 1.
     */
    public int getNum() {
        return num;
    }

    public NodeType getType() {
        return attributes.getType();
    }

    public NodeSubtype getSubtype() {
        return subtype;
    }

    public boolean is(NodeType type, NodeSubtype subtype) {
        return getType() == type && this.subtype == subtype;
    }

    public Vector3D getLocation() {
        return location;
    }

    public double getX() {
        return location.getX();
    }

    public double getY() {
        return location.getY();
    }

    public double getZ() {
        return location.getZ();
    }

    public int getFloor() {
        return floor;
    }

    public String getRoom() {
        return room;
    }

    /**
     * Design capacity in kW.
     */
    public double getCapacity() {
        return capacity;
    }

    public String getReason() {
        return reason;
    }

    public AbstractNodeAttributes getAttributes() {
        return attributes;
    }

    public <A extends AbstractNodeAttributes> A getAttributes(Class<A> attributesClass) {
        Objects.requireNonNull(attributesClass);
        if (!attributesClass.isInstance(attributes)) {
            throw new PowsyblException("Node '" + id + "' of type " + getType() + " has no " + attributesClass.getSimpleName());
        }
        return attributesClass.cast(attributes);
    }

    public NodeState getState() {
        return state;
    }

    public boolean isEnergized() {
        return state == NodeState.ENERGIZED;
    }

    /**
     * Moves the node to the energized state, all electrical attributes must have been set.
     */
    public void energize() {
        List<String> missing = attributes.getMissingElectricalFields();
        if (!missing.isEmpty()) {
            throw new PowsyblException("Node '" + id + "' cannot be energized, missing " + missing);
        }
        state = NodeState.ENERGIZED;
    }

    public double distance(MepNode other) {
        return location.distance(other.location);
    }

    @Override
    public String toString() {
        return id;
    }
}
