package com.emll.predictors;

import com.emll.model.CoordinateList;
import com.emll.model.Model;
import com.emll.serialization.Serializable;

/**
 * A trained scoring function that can also express itself as a subgraph of a {@link Model}.
 */
public interface Predictor extends Serializable {
    /**
     * Score an input.
     *
     * @param input Dense input vector
     * @return Score
     */
    double predict(double[] input);

    /**
     * Append nodes computing this predictor to a model.
     *
     * @param model Model to append to
     * @param inputs Coordinates of the predictor's inputs within the model
     * @return Coordinates of the predictor's output
     * @throws com.emll.model.GraphConstructionException If the inputs do not fit the predictor or
     *         do not resolve in the model
     */
    CoordinateList addToModel(Model model, CoordinateList inputs);
}
