package com.emll.model;

import com.emll.nodes.SumNode;
import com.emll.predictors.LinearPredictor;
import com.emll.serialization.MsgPackArchiver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.NoSuchElementException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class ModelMapTest {

    private Model model;
    private InputNode features;

    @BeforeEach
    void setUp() {
        model = new Model();
        features = model.addNode(new InputNode(2));
    }

    @Test
    void testAccessors() {
        SumNode total = model.addNode(new SumNode(features.getOutput()));
        ModelMap map = new ModelMap(model, Map.of("features", features),
                Map.of("total", total.getOutput(), "raw", features.getOutput()));

        assertThat(map.getModel()).isSameAs(model);
        assertThat(map.getNumInputs()).isEqualTo(1);
        assertThat(map.getNumOutputs()).isEqualTo(2);
        assertThat(map.getInput("features")).isSameAs(features);
        assertThat(map.getInputSize(0)).isEqualTo(2);
        assertThat(map.getOutputCoordinates("raw")).isEqualTo(features.getOutput());
        assertThat(map.getOutputSize(map.getOutputNames().indexOf("raw"))).isEqualTo(2);
        assertThatThrownBy(() -> map.getInput("labels")).isInstanceOf(NoSuchElementException.class);
        assertThatThrownBy(() -> map.getOutputCoordinates("labels")).isInstanceOf(NoSuchElementException.class);
    }

    @Test
    void testOutputCoordinatesAreCopies() {
        ModelMap map = new ModelMap(model, Map.of("features", features), Map.of("raw", features.getOutput()));

        map.getOutputCoordinates(0).add(new Coordinate(0, 0));

        assertThat(map.getOutputSize(0)).isEqualTo(2);
    }

    @Test
    void testAttachPredictorAndSave() {
        // Load a map, lower a trained predictor onto its output, store a map exposing the prediction
        ModelMap featureMap = new ModelMap(model, Map.of("features", features), Map.of("features", features.getOutput()));
        MsgPackArchiver archiver = MsgPackArchiver.builder().registry(ModelTypes.createRegistry()).build();
        ModelMap loaded = archiver.load(archiver.save(featureMap), ModelMap.class);

        LinearPredictor predictor = new LinearPredictor(new double[] {2, -1}, 0.5);
        CoordinateList prediction = predictor.addToModel(loaded.getModel(), loaded.getOutputCoordinates(0));
        ModelMap predictorMap = new ModelMap(loaded.getModel(),
                Map.of("features", loaded.getInput("features")), Map.of("prediction", prediction));

        ModelMap reloaded = archiver.load(archiver.save(predictorMap), ModelMap.class);

        assertThat(reloaded.getModel().size()).isEqualTo(4);
        assertThat(reloaded.getOutputNames()).containsExactly("prediction");
        assertThat(reloaded.getOutputSize(0)).isEqualTo(1);
        assertThat(reloaded.compute(new double[] {1, 1})).containsExactly(1.5);
        assertThat(reloaded.compute(new double[] {3, 2})).containsExactly(predictor.predict(new double[] {3, 2}));
    }

    @Test
    void testComputeByName() {
        InputNode other = model.addNode(new InputNode(1));
        SumNode total = model.addNode(new SumNode(CoordinateList.of(features.getOutput(0), other.getOutput(0))));
        ModelMap map = new ModelMap(model, Map.of("a", features, "b", other), Map.of("total", total.getOutput()));

        Map<String, double[]> result = map.compute(Map.of("a", new double[] {1, 2}, "b", new double[] {10}));

        assertThat(result).containsOnlyKeys("total");
        assertThat(result.get("total")).containsExactly(11.0);
        assertThatThrownBy(() -> map.compute(new double[] {1, 2}))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void testInvalidMaps() {
        InputNode foreign = new Model().addNode(new InputNode(2));

        assertThatThrownBy(() -> new ModelMap(model, Map.of("x", foreign), Map.of()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ModelMap(model, Map.of(), Map.of("y", CoordinateList.of(new Coordinate(3, 0)))))
                .isInstanceOf(GraphConstructionException.class);
        assertThatThrownBy(() -> new ModelMap(null, Map.of(), Map.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
