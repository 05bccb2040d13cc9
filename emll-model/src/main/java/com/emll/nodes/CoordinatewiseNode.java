package com.emll.nodes;

import com.emll.model.Coordinate;
import com.emll.model.CoordinateList;
import com.emll.model.Layer;
import com.emll.serialization.Deserializer;
import com.emll.serialization.MalformedStreamException;
import com.emll.serialization.Serializer;

/**
 * Layer combining each input with its own constant, element by element.
 */
public class CoordinatewiseNode extends Layer {

    /**
     * Elementwise operation applied by the layer.
     */
    public enum OperationType {
        ADD("add") {
            @Override
            public double apply(double input, double value) {
                return input + value;
            }
        },
        MULTIPLY("multiply") {
            @Override
            public double apply(double input, double value) {
                return input * value;
            }
        };

        private final String operationName;

        OperationType(String operationName) {
            this.operationName = operationName;
        }

        public abstract double apply(double input, double value);

        public String getOperationName() {
            return operationName;
        }

        /**
         * Look up an operation by its name.
         *
         * @param name Operation name, as returned by {@link #getOperationName()}
         * @return The operation
         * @throws IllegalArgumentException If no operation has the name
         */
        public static OperationType fromName(String name) {
            for (OperationType type : values()) {
                if (type.operationName.equals(name)) {
                    return type;
                }
            }
            throw new IllegalArgumentException("Unknown coordinatewise operation '" + name + "'");
        }
    }

    private double[] values;
    private OperationType operation;

    /**
     * Create an empty layer, to be populated by deserialization.
     */
    public CoordinatewiseNode() {
        this.values = new double[0];
        this.operation = OperationType.ADD;
    }

    /**
     * Create a layer.
     *
     * @param values One constant per input
     * @param inputs Input coordinates
     * @param operation Operation combining each input with its constant
     */
    public CoordinatewiseNode(double[] values, CoordinateList inputs, OperationType operation) {
        super(inputs);
        if (values.length != inputs.size()) {
            throw new IllegalArgumentException("Coordinatewise layer has " + values.length
                    + " values but " + inputs.size() + " inputs");
        }
        if (operation == null) {
            throw new IllegalArgumentException("Operation cannot be null");
        }
        this.values = values.clone();
        this.operation = operation;
    }

    /**
     * Create a single-element layer.
     *
     * @param value Constant
     * @param input Input coordinate
     * @param operation Operation combining the input with the constant
     */
    public CoordinatewiseNode(double value, Coordinate input, OperationType operation) {
        this(new double[] {value}, CoordinateList.of(input), operation);
    }

    public static String getTypeName() {
        return "CoordinatewiseNode";
    }

    @Override
    public String getRuntimeTypeName() {
        return getTypeName();
    }

    public double[] getValues() {
        return values.clone();
    }

    public OperationType getOperation() {
        return operation;
    }

    @Override
    public int getOutputSize() {
        return values.length;
    }

    @Override
    public double[] compute(double[] inputs) {
        double[] output = new double[values.length];
        for (int i = 0; i < output.length; i++) {
            output[i] = operation.apply(inputs[i], values[i]);
        }
        return output;
    }

    @Override
    public void serialize(Serializer serializer) {
        super.serialize(serializer);
        serializer.writeDoubleArray("values", values);
        serializer.writeString("operation", operation.getOperationName());
    }

    @Override
    public void deserialize(Deserializer deserializer) {
        super.deserialize(deserializer);
        double[] storedValues = deserializer.readDoubleArray("values");
        String operationName = deserializer.readString("operation");
        if (storedValues.length != getInputSize()) {
            throw new MalformedStreamException("Coordinatewise layer has " + storedValues.length
                    + " values but " + getInputSize() + " inputs");
        }
        try {
            operation = OperationType.fromName(operationName);
        } catch (IllegalArgumentException e) {
            throw new MalformedStreamException(e.getMessage(), e);
        }
        values = storedValues;
    }
}
