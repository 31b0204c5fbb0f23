/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.mepgraph.network;

import com.powsybl.commons.PowsyblException;
import org.jgrapht.Graph;
import org.jgrapht.Graphs;
import org.jgrapht.graph.AsUnmodifiableGraph;
import org.jgrapht.graph.SimpleDirectedGraph;

import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Directed power distribution graph of a building. Edges go from the feeding equipment to the fed one.
 *
 * @author MEP graph developers {@literal <mep-graph-dev at example.org>}
 */
public class MepGraph {

    private static final Comparator<MepNode> NODE_ID_COMPARATOR = Comparator.comparing(MepNode::getId);

    private final Graph<MepNode, MepEdge> graph = new SimpleDirectedGraph<>(null, null, false);

    private final Map<String, MepNode> nodesById = new HashMap<>();

    private final MepGraphMetadata metadata;

    public MepGraph(MepGraphMetadata metadata) {
        this.metadata = Objects.requireNonNull(metadata);
    }

    public MepGraphMetadata getMetadata() {
        return metadata;
    }

    /**
     * Read only view of the underlying graph, for jgrapht algorithms.
     */
    public Graph<MepNode, MepEdge> getGraph() {
        return new AsUnmodifiableGraph<>(graph);
    }

    public void addNode(MepNode node) {
        Objects.requireNonNull(node);
        if (nodesById.putIfAbsent(node.getId(), node) != null) {
            throw new PowsyblException("Node '" + node.getId() + "' already exists");
        }
        graph.addVertex(node);
    }

    public MepEdge addEdge(MepNode source, MepNode target, String loadClassification) {
        MepEdge edge = new MepEdge(loadClassification, manhattanDistance(source, target));
        if (!graph.addEdge(source, target, edge)) {
            throw new PowsyblException("Edge " + source.getId() + " -> " + target.getId() + " already exists");
        }
        return edge;
    }

    public void removeEdge(MepEdge edge) {
        graph.removeEdge(edge);
    }

    public static double manhattanDistance(MepNode source, MepNode target) {
        return source.getLocation().distance1(target.getLocation());
    }

    /**
     * Nodes in insertion order.
     */
    public Set<MepNode> getNodes() {
        return graph.vertexSet();
    }

    public List<MepNode> getNodes(NodeType type) {
        return graph.vertexSet().stream().filter(n -> n.getType() == type).toList();
    }

    public List<MepNode> getNodes(NodeType type, NodeSubtype subtype) {
        return graph.vertexSet().stream().filter(n -> n.is(type, subtype)).toList();
    }

    public MepNode getNode(String id) {
        return nodesById.get(id);
    }

    public Set<MepEdge> getEdges() {
        return graph.edgeSet();
    }

    public int getNodeCount() {
        return graph.vertexSet().size();
    }

    public int getEdgeCount() {
        return graph.edgeSet().size();
    }

    public MepNode getEdgeSource(MepEdge edge) {
        return graph.getEdgeSource(edge);
    }

    public MepNode getEdgeTarget(MepEdge edge) {
        return graph.getEdgeTarget(edge);
    }

    public Optional<MepEdge> getEdge(MepNode source, MepNode target) {
        return Optional.ofNullable(graph.getEdge(source, target));
    }

    public Set<MepEdge> getIncomingEdges(MepNode node) {
        return graph.incomingEdgesOf(node);
    }

    public Set<MepEdge> getOutgoingEdges(MepNode node) {
        return graph.outgoingEdgesOf(node);
    }

    public int getInDegree(MepNode node) {
        return graph.inDegreeOf(node);
    }

    public List<MepNode> getPredecessors(MepNode node) {
        return Graphs.predecessorListOf(graph, node);
    }

    public List<MepNode> getSuccessors(MepNode node) {
        return Graphs.successorListOf(graph, node);
    }

    /**
     * Nodes without feeder, in insertion order.
     */
    public List<MepNode> getSources() {
        return graph.vertexSet().stream().filter(n -> graph.inDegreeOf(n) == 0).toList();
    }

    /**
     * Nearest node of the given type by euclidean distance, ties broken by the smaller node id.
     */
    public Optional<MepNode> getNearestNode(MepNode from, NodeType type) {
        return getNearestNode(from, getNodes(type));
    }

    public static Optional<MepNode> getNearestNode(MepNode from, List<MepNode> candidates) {
        return candidates.stream()
                .filter(n -> n != from)
                .min(Comparator.<MepNode>comparingDouble(n -> n.distance(from)).thenComparing(NODE_ID_COMPARATOR));
    }

    @Override
    public String toString() {
        return "MepGraph(" + metadata.generationId() + ", nodes=" + getNodeCount() + ", edges=" + getEdgeCount() + ")";
    }
}
