package com.emll.model;

import java.util.HashMap;
import java.util.Map;

/**
 * Reference evaluator for a {@link Model}.
 *
 * <p>Values are bound to {@link InputNode}s, then {@link #compute(CoordinateList)} evaluates every
 * node the requested coordinates depend on, in insertion order.
 */
public class ModelEvaluator {
    private final Model model;
    private final Map<Integer, double[]> boundInputs = new HashMap<>();

    /**
     * Create an evaluator for a model.
     *
     * @param model Model to evaluate
     */
    public ModelEvaluator(Model model) {
        if (model == null) {
            throw new IllegalArgumentException("Model cannot be null");
        }
        this.model = model;
    }

    /**
     * Bind the values of an input node.
     *
     * @param node Input node of the evaluated model
     * @param values One value per output of the node
     * @return This evaluator
     * @throws IllegalArgumentException If the node belongs to another model or the size is wrong
     */
    public ModelEvaluator setInput(InputNode node, double[] values) {
        if (node.getModel() != model) {
            throw new IllegalArgumentException(node + " does not belong to the evaluated model");
        }
        if (values.length != node.getOutputSize()) {
            throw new IllegalArgumentException(node + " expects " + node.getOutputSize()
                    + " values, got " + values.length);
        }
        boundInputs.put(node.getId(), values.clone());
        return this;
    }

    /**
     * Compute the values at the given coordinates.
     *
     * @param outputs Coordinates to compute
     * @return Values in the order of the coordinates
     * @throws GraphConstructionException If a coordinate does not resolve in the model
     * @throws IllegalStateException If a needed input node has no bound values
     */
    public double[] compute(CoordinateList outputs) {
        boolean[] needed = new boolean[model.size()];
        for (Coordinate coordinate : outputs) {
            needed[model.resolve(coordinate).getId()] = true;
        }
        // Inputs always precede their readers, so one backward pass finds every dependency
        for (int id = model.size() - 1; id >= 0; id--) {
            if (needed[id]) {
                for (Coordinate coordinate : model.getNode(id).getInputs()) {
                    needed[coordinate.nodeId()] = true;
                }
            }
        }

        double[][] values = new double[model.size()][];
        for (int id = 0; id < model.size(); id++) {
            if (needed[id]) {
                values[id] = computeNode(model.getNode(id), values);
            }
        }

        double[] result = new double[outputs.size()];
        for (int i = 0; i < result.length; i++) {
            Coordinate coordinate = outputs.get(i);
            result[i] = values[coordinate.nodeId()][coordinate.portIndex()];
        }
        return result;
    }

    /**
     * Compute the value at a single coordinate.
     *
     * @param output Coordinate to compute
     * @return Value at the coordinate
     */
    public double compute(Coordinate output) {
        return compute(CoordinateList.of(output))[0];
    }

    private double[] computeNode(Node node, double[][] values) {
        if (node instanceof InputNode) {
            double[] bound = boundInputs.get(node.getId());
            if (bound == null) {
                throw new IllegalStateException("No values bound to " + node);
            }
            return bound;
        }

        CoordinateList inputs = node.getInputs();
        double[] arguments = new double[inputs.size()];
        for (int i = 0; i < arguments.length; i++) {
            Coordinate coordinate = inputs.get(i);
            arguments[i] = values[coordinate.nodeId()][coordinate.portIndex()];
        }

        double[] result = node.compute(arguments);
        if (result.length != node.getOutputSize()) {
            throw new IllegalStateException(node + " computed " + result.length + " values but has "
                    + node.getOutputSize() + " outputs");
        }
        return result;
    }
}
