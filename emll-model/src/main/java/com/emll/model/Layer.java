package com.emll.model;

import com.emll.serialization.Deserializer;
import com.emll.serialization.MalformedStreamException;
import com.emll.serialization.Serializer;

/**
 * A node computed from a single ordered list of input coordinates.
 */
public abstract class Layer extends Node {
    private CoordinateList inputs;

    protected Layer() {
        this.inputs = new CoordinateList();
    }

    protected Layer(CoordinateList inputs) {
        if (inputs == null) {
            throw new IllegalArgumentException("Inputs cannot be null");
        }
        this.inputs = new CoordinateList(inputs);
    }

    @Override
    public CoordinateList getInputs() {
        return new CoordinateList(inputs);
    }

    /**
     * Get the number of input coordinates.
     *
     * @return Input size
     */
    public int getInputSize() {
        return inputs.size();
    }

    @Override
    public void serialize(Serializer serializer) {
        super.serialize(serializer);
        serializer.writeObject("inputs", inputs);
    }

    @Override
    public void deserialize(Deserializer deserializer) {
        super.deserialize(deserializer);
        CoordinateList stored = deserializer.readObject("inputs", CoordinateList.class);
        if (stored == null) {
            throw new MalformedStreamException(getRuntimeTypeName() + " has no inputs");
        }
        inputs = stored;
    }
}
