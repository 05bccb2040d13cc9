package com.emll.model;

import com.emll.serialization.Deserializer;
import com.emll.serialization.PropertyBag;
import com.emll.serialization.Serializable;
import com.emll.serialization.Serializer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A unit of computation in a {@link Model}.
 *
 * <p>A node reads the values at its input coordinates and produces one scalar value per output
 * port. Once added to a model, the node is owned by it and identified by its index there.
 * Concrete kinds extend {@link #serialize(Serializer)} and {@link #deserialize(Deserializer)},
 * calling the superclass implementation first.
 */
public abstract class Node implements Serializable {
    private Model model;
    private int id = -1;
    private PropertyBag metadata = new PropertyBag();

    /**
     * Get the id of this node within its model.
     *
     * @return Node id
     * @throws IllegalStateException If the node has not been added to a model
     */
    public int getId() {
        if (model == null) {
            throw new IllegalStateException(getRuntimeTypeName() + " has not been added to a model");
        }
        return id;
    }

    /**
     * Get the model owning this node.
     *
     * @return Owning model, or null if the node has not been added to one
     */
    public Model getModel() {
        return model;
    }

    void attach(Model model, int id) {
        this.model = model;
        this.id = id;
    }

    /**
     * Get the coordinates this node reads, in the order {@link #compute(double[])} expects them.
     *
     * @return Input coordinates, empty for source nodes
     */
    public abstract CoordinateList getInputs();

    /**
     * Get the number of scalar outputs of this node.
     *
     * @return Output size
     */
    public abstract int getOutputSize();

    /**
     * Compute the outputs of this node.
     *
     * @param inputs Values at the coordinates returned by {@link #getInputs()}, in the same order
     * @return One value per output port
     */
    public abstract double[] compute(double[] inputs);

    /**
     * Get the output ports of this node.
     *
     * @return Ports in index order
     */
    public List<Port> getOutputPorts() {
        int size = getOutputSize();
        List<Port> ports = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            ports.add(new Port("output[" + i + "]", i));
        }
        return Collections.unmodifiableList(ports);
    }

    /**
     * Get the coordinate of one output port.
     *
     * @param portIndex Port index
     * @return Coordinate of the port
     */
    public Coordinate getOutput(int portIndex) {
        if (portIndex < 0 || portIndex >= getOutputSize()) {
            throw new IndexOutOfBoundsException("Port " + portIndex + " out of range for " + this);
        }
        return new Coordinate(getId(), portIndex);
    }

    /**
     * Get the coordinates of all output ports.
     *
     * @return Output coordinates in port order
     */
    public CoordinateList getOutput() {
        CoordinateList output = new CoordinateList();
        for (int i = 0; i < getOutputSize(); i++) {
            output.add(getOutput(i));
        }
        return output;
    }

    /**
     * Get the free-form metadata of this node.
     *
     * @return Mutable metadata
     */
    public PropertyBag getMetadata() {
        return metadata;
    }

    @Override
    public void serialize(Serializer serializer) {
        serializer.writeProperties("metadata", metadata);
    }

    @Override
    public void deserialize(Deserializer deserializer) {
        metadata = deserializer.readProperties("metadata");
    }

    @Override
    public String toString() {
        return getRuntimeTypeName() + (model == null ? "" : "#" + id);
    }
}
