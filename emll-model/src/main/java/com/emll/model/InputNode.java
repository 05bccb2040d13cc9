package com.emll.model;

import com.emll.serialization.Deserializer;
import com.emll.serialization.MalformedStreamException;
import com.emll.serialization.Serializer;

/**
 * Source node whose values are supplied from outside the model when it is evaluated.
 */
public class InputNode extends Node {
    private int size;

    /**
     * Create an input node of size zero, to be populated by deserialization.
     */
    public InputNode() {
    }

    /**
     * Create an input node.
     *
     * @param size Number of values the node provides
     */
    public InputNode(int size) {
        if (size < 0) {
            throw new IllegalArgumentException("Input size cannot be negative: " + size);
        }
        this.size = size;
    }

    public static String getTypeName() {
        return "InputNode";
    }

    @Override
    public String getRuntimeTypeName() {
        return getTypeName();
    }

    @Override
    public CoordinateList getInputs() {
        return new CoordinateList();
    }

    @Override
    public int getOutputSize() {
        return size;
    }

    /**
     * Input nodes have no computation; their values are bound by {@link ModelEvaluator}.
     *
     * @throws IllegalStateException Always
     */
    @Override
    public double[] compute(double[] inputs) {
        throw new IllegalStateException("Values of " + this + " must be bound, not computed");
    }

    @Override
    public void serialize(Serializer serializer) {
        super.serialize(serializer);
        serializer.writeInt("size", size);
    }

    @Override
    public void deserialize(Deserializer deserializer) {
        super.deserialize(deserializer);
        size = deserializer.readInt("size");
        if (size < 0) {
            throw new MalformedStreamException("Input size cannot be negative: " + size);
        }
    }
}
