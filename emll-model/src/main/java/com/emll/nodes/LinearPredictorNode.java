package com.emll.nodes;

import com.emll.model.CoordinateList;
import com.emll.model.Layer;
import com.emll.predictors.LinearPredictor;
import com.emll.serialization.Deserializer;
import com.emll.serialization.MalformedStreamException;
import com.emll.serialization.Serializer;

/**
 * Layer evaluating a whole {@link LinearPredictor} as a single node, keeping the predictor itself
 * in the graph rather than lowering it into elementary nodes.
 */
public class LinearPredictorNode extends Layer {
    private LinearPredictor predictor;

    public LinearPredictorNode() {
        this.predictor = new LinearPredictor();
    }

    /**
     * Create a predictor node.
     *
     * @param inputs Input coordinates, one per predictor weight
     * @param predictor Predictor to evaluate; copied
     */
    public LinearPredictorNode(CoordinateList inputs, LinearPredictor predictor) {
        super(inputs);
        if (inputs.size() != predictor.getDimension()) {
            throw new IllegalArgumentException("Predictor of dimension " + predictor.getDimension()
                    + " cannot read " + inputs.size() + " inputs");
        }
        this.predictor = predictor.copy();
    }

    public static String getTypeName() {
        return "LinearPredictorNode";
    }

    @Override
    public String getRuntimeTypeName() {
        return getTypeName();
    }

    public LinearPredictor getPredictor() {
        return predictor.copy();
    }

    @Override
    public int getOutputSize() {
        return 1;
    }

    @Override
    public double[] compute(double[] inputs) {
        return new double[] {predictor.predict(inputs)};
    }

    @Override
    public void serialize(Serializer serializer) {
        super.serialize(serializer);
        serializer.writeObject("predictor", predictor);
    }

    @Override
    public void deserialize(Deserializer deserializer) {
        super.deserialize(deserializer);
        LinearPredictor stored = deserializer.readObject("predictor", LinearPredictor.class);
        if (stored == null || stored.getDimension() != getInputSize()) {
            throw new MalformedStreamException("Predictor node does not hold a predictor for its "
                    + getInputSize() + " inputs");
        }
        predictor = stored;
    }
}
