package com.emll.predictors;

import com.emll.model.CoordinateList;
import com.emll.model.GraphConstructionException;
import com.emll.model.Model;
import com.emll.nodes.CoordinatewiseNode;
import com.emll.nodes.CoordinatewiseNode.OperationType;
import com.emll.nodes.SumNode;
import com.emll.serialization.Deserializer;
import com.emll.serialization.Serializer;
import com.emll.utilities.Copyable;

import java.util.Arrays;

/**
 * Linear predictor {@code f(x) = <w, x> + b}.
 */
public class LinearPredictor implements Predictor, Copyable<LinearPredictor> {
    private double[] weights;
    private double bias;

    /**
     * Create a predictor of dimension zero, to be populated by deserialization.
     */
    public LinearPredictor() {
        this(0);
    }

    /**
     * Create a predictor with all-zero weights and zero bias.
     *
     * @param dimension Number of weights
     */
    public LinearPredictor(int dimension) {
        if (dimension < 0) {
            throw new IllegalArgumentException("Dimension cannot be negative: " + dimension);
        }
        this.weights = new double[dimension];
        this.bias = 0;
    }

    /**
     * Create a predictor.
     *
     * @param weights Weight vector; copied
     * @param bias Bias
     */
    public LinearPredictor(double[] weights, double bias) {
        this.weights = weights.clone();
        this.bias = bias;
    }

    public static String getTypeName() {
        return "LinearPredictor";
    }

    @Override
    public String getRuntimeTypeName() {
        return getTypeName();
    }

    public int getDimension() {
        return weights.length;
    }

    public double[] getWeights() {
        return weights.clone();
    }

    public double getBias() {
        return bias;
    }

    /**
     * Set all weights and the bias to zero.
     */
    public void reset() {
        Arrays.fill(weights, 0);
        bias = 0;
    }

    /**
     * Compute {@code <w, x> + b}. Input elements beyond the predictor's dimension are ignored and
     * missing ones count as zero.
     *
     * @param input Input vector
     * @return Score
     */
    @Override
    public double predict(double[] input) {
        double score = bias;
        int length = Math.min(input.length, weights.length);
        for (int i = 0; i < length; i++) {
            score += input[i] * weights[i];
        }
        return score;
    }

    /**
     * Compute the elementwise products of the weights and the input, the terms of the dot product.
     *
     * @param input Input vector
     * @return One term per weight
     */
    public double[] getWeightedElements(double[] input) {
        double[] elements = new double[weights.length];
        int length = Math.min(input.length, weights.length);
        for (int i = 0; i < length; i++) {
            elements[i] = input[i] * weights[i];
        }
        return elements;
    }

    /**
     * Multiply the weights and the bias by a scalar.
     *
     * @param scalar Scale factor
     */
    public void scale(double scalar) {
        for (int i = 0; i < weights.length; i++) {
            weights[i] *= scalar;
        }
        bias *= scalar;
    }

    /**
     * Append a multiply layer holding the weights, a sum layer and an add layer holding the bias.
     *
     * @param model Model to append to
     * @param inputs One coordinate per weight
     * @return Single coordinate of the bias layer's output
     */
    @Override
    public CoordinateList addToModel(Model model, CoordinateList inputs) {
        if (inputs.size() != weights.length) {
            throw new GraphConstructionException("Linear predictor of dimension " + weights.length
                    + " cannot read " + inputs.size() + " inputs");
        }

        CoordinatewiseNode weightsNode = model.addNode(
                new CoordinatewiseNode(weights, inputs, OperationType.MULTIPLY));
        SumNode sumNode = model.addNode(new SumNode(weightsNode.getOutput()));
        CoordinatewiseNode biasNode = model.addNode(
                new CoordinatewiseNode(bias, sumNode.getOutput(0), OperationType.ADD));
        return biasNode.getOutput();
    }

    @Override
    public LinearPredictor copy() {
        return new LinearPredictor(weights, bias);
    }

    @Override
    public void serialize(Serializer serializer) {
        serializer.writeDoubleArray("weights", weights);
        serializer.writeDouble("bias", bias);
    }

    @Override
    public void deserialize(Deserializer deserializer) {
        weights = deserializer.readDoubleArray("weights");
        bias = deserializer.readDouble("bias");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;

        LinearPredictor that = (LinearPredictor) o;
        return Double.compare(bias, that.bias) == 0 && Arrays.equals(weights, that.weights);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(weights) + Double.hashCode(bias);
    }

    @Override
    public String toString() {
        return "LinearPredictor{weights=" + Arrays.toString(weights) + ", bias=" + bias + "}";
    }
}
