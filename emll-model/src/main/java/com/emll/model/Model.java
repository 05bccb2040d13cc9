package com.emll.model;

import com.emll.serialization.Deserializer;
import com.emll.serialization.MalformedStreamException;
import com.emll.serialization.Serializable;
import com.emll.serialization.Serializer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.stream.Collectors;

/**
 * Owning container of a directed acyclic graph of {@link Node}s.
 *
 * <p>Nodes are kept in the order they were added and a node's id is its position. A node may only
 * read coordinates of nodes already in the model, so insertion order is a topological order and
 * the graph can never contain a cycle.
 *
 * <p>Models are not thread-safe; a model must not be modified while it is being serialized or
 * evaluated.
 */
public class Model implements Serializable {
    private final List<Node> nodes = new ArrayList<>();

    public static String getTypeName() {
        return "Model";
    }

    @Override
    public String getRuntimeTypeName() {
        return getTypeName();
    }

    /**
     * Add a node to this model, taking ownership of it.
     *
     * @param node Node to add
     * @param <T> Concrete node type
     * @return The added node, now carrying its id
     * @throws GraphConstructionException If the node is already owned by a model, or one of its
     *         input coordinates does not resolve to a port of a node already in this model
     */
    public <T extends Node> T addNode(T node) {
        if (node == null) {
            throw new IllegalArgumentException("Node cannot be null");
        }
        if (node.getModel() != null) {
            throw new GraphConstructionException(node + " is already part of a model");
        }

        for (Coordinate coordinate : node.getInputs()) {
            checkCoordinate(coordinate, node.getRuntimeTypeName() + " input");
        }

        node.attach(this, nodes.size());
        nodes.add(node);
        return node;
    }

    /**
     * Get a node by id.
     *
     * @param id Node id
     * @return The node
     * @throws NoSuchElementException If no node has the given id
     */
    public Node getNode(int id) {
        if (id < 0 || id >= nodes.size()) {
            throw new NoSuchElementException("No node with id " + id + " in a model of " + nodes.size() + " nodes");
        }
        return nodes.get(id);
    }

    /**
     * Get a node by id, checking its type.
     *
     * @param id Node id
     * @param type Expected node type
     * @param <T> Expected node type
     * @return The node
     * @throws NoSuchElementException If no node has the given id
     * @throws IllegalArgumentException If the node is of another type
     */
    public <T extends Node> T getNode(int id, Class<T> type) {
        Node node = getNode(id);
        if (!type.isInstance(node)) {
            throw new IllegalArgumentException(node + " is not a " + type.getSimpleName());
        }
        return type.cast(node);
    }

    /**
     * Get the node a coordinate refers to.
     *
     * @param coordinate Coordinate to resolve
     * @return The referenced node
     * @throws GraphConstructionException If the coordinate does not resolve in this model
     */
    public Node resolve(Coordinate coordinate) {
        checkCoordinate(coordinate, "Coordinate");
        return nodes.get(coordinate.nodeId());
    }

    /**
     * Get all nodes in insertion order.
     *
     * @return Unmodifiable list of nodes
     */
    public List<Node> getNodes() {
        return Collections.unmodifiableList(nodes);
    }

    /**
     * Get all nodes of a given type in insertion order.
     *
     * @param type Node type
     * @param <T> Node type
     * @return List of matching nodes
     */
    public <T extends Node> List<T> getNodesOfType(Class<T> type) {
        return nodes.stream()
                .filter(type::isInstance)
                .map(type::cast)
                .collect(Collectors.toList());
    }

    public int size() {
        return nodes.size();
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    @Override
    public void serialize(Serializer serializer) {
        serializer.writeObjectList("nodes", nodes);
    }

    @Override
    public void deserialize(Deserializer deserializer) {
        if (!nodes.isEmpty()) {
            throw new IllegalStateException("Cannot deserialize into a model that already has nodes");
        }
        for (Node node : deserializer.readObjectList("nodes", Node.class)) {
            if (node == null) {
                throw new MalformedStreamException("Model contains a null node");
            }
            try {
                addNode(node);
            } catch (GraphConstructionException e) {
                throw new MalformedStreamException("Stored model is not a valid graph", e);
            }
        }
    }

    private void checkCoordinate(Coordinate coordinate, String role) {
        if (coordinate.nodeId() >= nodes.size()) {
            throw new GraphConstructionException(role + " " + coordinate + " refers to node " + coordinate.nodeId()
                    + ", but the model has only " + nodes.size() + " nodes");
        }
        Node source = nodes.get(coordinate.nodeId());
        if (coordinate.portIndex() >= source.getOutputSize()) {
            throw new GraphConstructionException(role + " " + coordinate + " refers to port " + coordinate.portIndex()
                    + " of " + source + ", which has " + source.getOutputSize() + " outputs");
        }
    }

    @Override
    public String toString() {
        return "Model" + nodes;
    }
}
