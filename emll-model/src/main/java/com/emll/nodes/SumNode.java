package com.emll.nodes;

import com.emll.model.CoordinateList;
import com.emll.model.Layer;

/**
 * Layer reducing all of its inputs to their sum.
 */
public class SumNode extends Layer {

    public SumNode() {
    }

    public SumNode(CoordinateList inputs) {
        super(inputs);
    }

    public static String getTypeName() {
        return "SumNode";
    }

    @Override
    public String getRuntimeTypeName() {
        return getTypeName();
    }

    @Override
    public int getOutputSize() {
        return 1;
    }

    @Override
    public double[] compute(double[] inputs) {
        double sum = 0;
        for (double input : inputs) {
            sum += input;
        }
        return new double[] {sum};
    }
}
