/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.mepgraph.io;

import com.powsybl.commons.PowsyblException;
import com.powsybl.mepgraph.building.BuildingProfile;
import com.powsybl.mepgraph.network.MepEdge;
import com.powsybl.mepgraph.network.MepGraph;
import com.powsybl.mepgraph.network.MepGraphMetadata;
import com.powsybl.mepgraph.network.MepNode;
import org.jgrapht.nio.Attribute;
import org.jgrapht.nio.AttributeType;
import org.jgrapht.nio.DefaultAttribute;
import org.jgrapht.nio.graphml.GraphMLExporter;
import org.jgrapht.nio.graphml.GraphMLExporter.AttributeCategory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.xml.namespace.QName;
import javax.xml.stream.XMLEventFactory;
import javax.xml.stream.XMLEventReader;
import javax.xml.stream.XMLEventWriter;
import javax.xml.stream.XMLInputFactory;
import javax.xml.stream.XMLOutputFactory;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.events.StartElement;
import javax.xml.stream.events.XMLEvent;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Writes a graph as GraphML with flat typed attributes. Unset numbers are written as 0.0 and unset strings
 * as an empty string, so that every attribute of the file has a value.
 *
 * @author MEP graph developers {@literal <mep-graph-dev at example.org>}
 */
public final class MepGraphExporter {

    private static final Logger LOGGER = LoggerFactory.getLogger(MepGraphExporter.class);

    public static final String EXTENSION = "mepg";

    public static final String PARENT_ATTRIBUTE = "parent";

    private static final String KEY_ELEMENT = "key";
    private static final String GRAPH_ELEMENT = "graph";
    private static final String DATA_ELEMENT = "data";

    private MepGraphExporter() {
    }

    public static Path export(MepGraph graph, Path file) {
        Objects.requireNonNull(file);
        try (BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            export(graph, writer);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        LOGGER.info("Graph {} exported to {}", graph.getMetadata().generationId(), file);
        return file;
    }

    public static void export(MepGraph graph, Writer writer) {
        Objects.requireNonNull(graph);
        Objects.requireNonNull(writer);
        checkEnergized(graph);

        Map<MepNode, Map<String, Object>> nodeValues = new LinkedHashMap<>();
        for (MepNode node : graph.getNodes()) {
            nodeValues.put(node, getNodeValues(graph, node));
        }
        Map<MepEdge, Map<String, Object>> edgeValues = new LinkedHashMap<>();
        Map<MepEdge, String> edgeIds = new HashMap<>();
        for (MepEdge edge : graph.getEdges()) {
            edgeValues.put(edge, edge.toAttributeMap());
            edgeIds.put(edge, "e" + edgeIds.size());
        }
        Map<String, Object> graphValues = getGraphValues(graph.getMetadata());

        GraphMLExporter<MepNode, MepEdge> exporter = new GraphMLExporter<>(MepNode::getId);
        exporter.setEdgeIdProvider(edgeIds::get);
        registerAttributes(exporter, nodeValues.values(), edgeValues.values(), graphValues);
        exporter.setVertexAttributeProvider(node -> toAttributes(nodeValues.get(node)));
        exporter.setEdgeAttributeProvider(edge -> toAttributes(edgeValues.get(edge)));
        StringWriter graphMl = new StringWriter();
        exporter.exportGraph(graph.getGraph(), graphMl);
        writeWithGraphData(graphMl.toString(), toAttributes(graphValues), writer);
    }

    /**
     * GraphMLExporter declares the keys of graph attributes but writes no value for them, so the graph
     * data elements are inserted here, right after the graph start element.
     */
    private static void writeWithGraphData(String graphMl, Map<String, Attribute> graphAttributes, Writer writer) {
        XMLEventFactory eventFactory = XMLEventFactory.newInstance();
        Map<String, String> graphKeyIds = new HashMap<>();
        try {
            XMLEventReader reader = XMLInputFactory.newInstance().createXMLEventReader(new StringReader(graphMl));
            XMLEventWriter eventWriter = XMLOutputFactory.newInstance().createXMLEventWriter(writer);
            try {
                while (reader.hasNext()) {
                    XMLEvent event = reader.nextEvent();
                    eventWriter.add(event);
                    if (!event.isStartElement()) {
                        continue;
                    }
                    StartElement element = event.asStartElement();
                    String name = element.getName().getLocalPart();
                    if (KEY_ELEMENT.equals(name)) {
                        String keyFor = getAttributeValue(element, "for");
                        if ("graph".equals(keyFor) || "all".equals(keyFor)) {
                            graphKeyIds.put(getAttributeValue(element, "attr.name"), getAttributeValue(element, "id"));
                        }
                    } else if (GRAPH_ELEMENT.equals(name)) {
                        QName dataName = new QName(element.getName().getNamespaceURI(), DATA_ELEMENT, element.getName().getPrefix());
                        for (Map.Entry<String, Attribute> e : graphAttributes.entrySet()) {
                            String keyId = graphKeyIds.get(e.getKey());
                            if (keyId == null) {
                                throw new IllegalStateException("No GraphML key declared for graph attribute '" + e.getKey() + "'");
                            }
                            eventWriter.add(eventFactory.createStartElement(dataName,
                                    List.of(eventFactory.createAttribute("key", keyId)).iterator(), Collections.emptyIterator()));
                            eventWriter.add(eventFactory.createCharacters(e.getValue().getValue()));
                            eventWriter.add(eventFactory.createEndElement(dataName, Collections.emptyIterator()));
                        }
                    }
                }
                eventWriter.flush();
            } finally {
                eventWriter.close();
                reader.close();
            }
        } catch (XMLStreamException e) {
            throw new PowsyblException("Cannot write graph metadata: " + e.getMessage(), e);
        }
    }

    private static String getAttributeValue(StartElement element, String name) {
        javax.xml.stream.events.Attribute attribute = element.getAttributeByName(new QName(name));
        return attribute != null ? attribute.getValue() : null;
    }

    private static void checkEnergized(MepGraph graph) {
        List<String> provisional = graph.getNodes().stream()
                .filter(n -> !n.isEnergized())
                .map(MepNode::getId)
                .toList();
        if (!provisional.isEmpty()) {
            throw new PowsyblException("Cannot export a graph with provisional nodes: " + provisional);
        }
    }

    private static Map<String, Object> getNodeValues(MepGraph graph, MepNode node) {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("type", node.getType().getPrefix());
        values.put("subtype", node.getSubtype().getLabel());
        values.put("x", node.getX());
        values.put("y", node.getY());
        values.put("z", node.getZ());
        values.put("floor", node.getFloor());
        values.put("room", node.getRoom());
        values.put("capacity", node.getCapacity());
        values.put("reason", node.getReason());
        values.put("state", node.getState().name());
        values.putAll(node.getAttributes().toAttributeMap());
        List<MepNode> predecessors = graph.getPredecessors(node);
        values.put(PARENT_ATTRIBUTE, predecessors.isEmpty() ? "" : predecessors.get(0).getId());
        return values;
    }

    private static Map<String, Object> getGraphValues(MepGraphMetadata metadata) {
        BuildingProfile building = metadata.building();
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("generation_id", metadata.generationId());
        values.put("building_length", building.getLength());
        values.put("building_width", building.getWidth());
        values.put("num_floors", building.getFloorCount());
        values.put("floor_height", building.getFloorHeight());
        values.put("basement_depth", building.getBasementDepth());
        values.put("core_strategy", metadata.coreStrategy().getKind().name());
        values.put("core_count", metadata.coreStrategy().getCoreCount());
        values.put("high_voltage_tier", metadata.highVoltageTier());
        values.put("seed", metadata.seed());
        values.put("construction_year", metadata.constructionDate().getYear());
        values.put("description", metadata.description());
        return values;
    }

    private static AttributeType getAttributeType(Object value) {
        if (value instanceof Double) {
            return AttributeType.DOUBLE;
        } else if (value instanceof Integer) {
            return AttributeType.INT;
        } else if (value instanceof Long) {
            return AttributeType.LONG;
        } else {
            return AttributeType.STRING;
        }
    }

    private static void registerAttributes(GraphMLExporter<MepNode, MepEdge> exporter,
                                           Iterable<Map<String, Object>> nodeValues,
                                           Iterable<Map<String, Object>> edgeValues,
                                           Map<String, Object> graphValues) {
        // a key name is shared by all categories of the file
        Map<String, AttributeType> types = new LinkedHashMap<>();
        Map<String, AttributeCategory> categories = new HashMap<>();
        collectKeys(nodeValues, AttributeCategory.NODE, types, categories);
        collectKeys(edgeValues, AttributeCategory.EDGE, types, categories);
        collectKeys(List.of(graphValues), AttributeCategory.GRAPH, types, categories);
        types.forEach((name, type) -> exporter.registerAttribute(name, categories.get(name), type));
    }

    private static void collectKeys(Iterable<Map<String, Object>> valuesList, AttributeCategory category,
                                    Map<String, AttributeType> types, Map<String, AttributeCategory> categories) {
        for (Map<String, Object> values : valuesList) {
            for (Map.Entry<String, Object> e : values.entrySet()) {
                AttributeType type = getAttributeType(e.getValue());
                AttributeType previousType = types.putIfAbsent(e.getKey(), type);
                if (previousType != null && previousType != type) {
                    throw new IllegalStateException("Attribute '" + e.getKey() + "' has several types: " + previousType + ", " + type);
                }
                categories.merge(e.getKey(), category, (c1, c2) -> c1 == c2 ? c1 : AttributeCategory.ALL);
            }
        }
    }

    private static Map<String, Attribute> toAttributes(Map<String, Object> values) {
        Map<String, Attribute> attributes = new LinkedHashMap<>();
        values.forEach((name, value) -> attributes.put(name, toAttribute(value)));
        return attributes;
    }

    static Attribute toAttribute(Object value) {
        if (value instanceof Double) {
            double d = (Double) value;
            return DefaultAttribute.createAttribute(Double.isNaN(d) || Double.isInfinite(d) ? 0.0 : d);
        } else if (value instanceof Integer) {
            return DefaultAttribute.createAttribute((Integer) value);
        } else if (value instanceof Long) {
            return DefaultAttribute.createAttribute((Long) value);
        } else {
            return DefaultAttribute.createAttribute(value == null ? "" : value.toString());
        }
    }
}
