package com.emll.model;

import com.emll.nodes.CoordinatewiseNode;
import com.emll.nodes.LinearPredictorNode;
import com.emll.nodes.SumNode;
import com.emll.predictors.LinearPredictor;
import com.emll.serialization.TypeRegistry;

/**
 * Registration of every serializable kind shipped with the model library.
 */
public final class ModelTypes {
    private ModelTypes() {
    }

    /**
     * Register all model, node and predictor kinds.
     *
     * @param registry Registry to populate
     * @return The registry
     * @throws com.emll.serialization.DuplicateTypeException If one of the kinds is already registered
     */
    public static TypeRegistry registerAll(TypeRegistry registry) {
        return registry
                .register(Model.class, Model::new)
                .register(ModelMap.class, ModelMap::new)
                .register(CoordinateList.class, CoordinateList::new)
                .register(InputNode.class, InputNode::new)
                .register(CoordinatewiseNode.class, CoordinatewiseNode::new)
                .register(SumNode.class, SumNode::new)
                .register(LinearPredictorNode.class, LinearPredictorNode::new)
                .register(LinearPredictor.class, LinearPredictor::new);
    }

    /**
     * Create a new registry holding all model, node and predictor kinds.
     *
     * @return New registry
     */
    public static TypeRegistry createRegistry() {
        return registerAll(new TypeRegistry());
    }
}
