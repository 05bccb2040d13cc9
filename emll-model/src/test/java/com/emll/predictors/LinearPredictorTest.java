package com.emll.predictors;

import com.emll.model.CoordinateList;
import com.emll.model.GraphConstructionException;
import com.emll.model.InputNode;
import com.emll.model.Model;
import com.emll.model.ModelEvaluator;
import com.emll.model.ModelTypes;
import com.emll.nodes.CoordinatewiseNode;
import com.emll.nodes.CoordinatewiseNode.OperationType;
import com.emll.nodes.SumNode;
import com.emll.serialization.Deserializer;
import com.emll.serialization.MsgPackArchiver;
import com.emll.serialization.Serializer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.AdditionalMatchers.aryEq;
import static org.mockito.Mockito.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.verifyNoMoreInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
public class LinearPredictorTest {

    @Mock
    private Serializer serializer;

    @Mock
    private Deserializer deserializer;

    private LinearPredictor predictor;

    @BeforeEach
    void setUp() {
        predictor = new LinearPredictor(new double[] {2, -1}, 0.5);
    }

    @Test
    void testPredict() {
        assertThat(predictor.predict(new double[] {1, 1})).isEqualTo(1.5);
        assertThat(predictor.predict(new double[] {0, 0})).isEqualTo(0.5);
        // Only the overlapping prefix contributes
        assertThat(predictor.predict(new double[] {1})).isEqualTo(2.5);
        assertThat(predictor.predict(new double[] {1, 1, 100})).isEqualTo(1.5);
    }

    @Test
    void testAddToModelAppendsThreeNodes() {
        Model model = new Model();
        InputNode input = model.addNode(new InputNode(2));

        CoordinateList output = predictor.addToModel(model, input.getOutput());

        assertThat(model.size()).isEqualTo(4);
        CoordinatewiseNode weights = model.getNode(1, CoordinatewiseNode.class);
        SumNode sum = model.getNode(2, SumNode.class);
        CoordinatewiseNode bias = model.getNode(3, CoordinatewiseNode.class);

        assertThat(weights.getOperation()).isEqualTo(OperationType.MULTIPLY);
        assertThat(weights.getValues()).containsExactly(2, -1);
        assertThat(weights.getInputs()).isEqualTo(input.getOutput());
        assertThat(sum.getInputs()).isEqualTo(weights.getOutput());
        assertThat(bias.getOperation()).isEqualTo(OperationType.ADD);
        assertThat(bias.getValues()).containsExactly(0.5);
        assertThat(bias.getInputs()).isEqualTo(sum.getOutput());
        assertThat(output).isEqualTo(bias.getOutput());

        double value = new ModelEvaluator(model).setInput(input, new double[] {1, 1}).compute(output.get(0));
        assertThat(value).isEqualTo(1.5);
    }

    @Test
    void testLoweringMatchesPredict() {
        LinearPredictor wide = new LinearPredictor(new double[] {0.25, -3, 1.5, 0}, -2);
        Model model = new Model();
        InputNode input = model.addNode(new InputNode(4));
        CoordinateList output = wide.addToModel(model, input.getOutput());
        double[] values = {4, 1, 2, 9};

        double value = new ModelEvaluator(model).setInput(input, values).compute(output.get(0));

        assertThat(value).isEqualTo(wide.predict(values));
    }

    @Test
    void testLoweringIsDeterministic() {
        MsgPackArchiver archiver = MsgPackArchiver.builder().registry(ModelTypes.createRegistry()).build();
        Model first = new Model();
        Model second = new Model();
        predictor.addToModel(first, first.addNode(new InputNode(2)).getOutput());
        predictor.addToModel(second, second.addNode(new InputNode(2)).getOutput());

        assertThat(archiver.save(first)).isEqualTo(archiver.save(second));
    }

    @Test
    void testAddToModelChecksInputCount() {
        Model model = new Model();
        InputNode input = model.addNode(new InputNode(3));

        assertThatThrownBy(() -> predictor.addToModel(model, input.getOutput()))
                .isInstanceOf(GraphConstructionException.class);
        assertThat(model.size()).isEqualTo(1);
    }

    @Test
    void testWeightedElements() {
        assertThat(predictor.getWeightedElements(new double[] {3, 4})).containsExactly(6, -4);
        assertThat(predictor.getWeightedElements(new double[] {3})).containsExactly(6, 0);
    }

    @Test
    void testScaleAndReset() {
        predictor.scale(2);

        assertThat(predictor.getWeights()).containsExactly(4, -2);
        assertThat(predictor.getBias()).isEqualTo(1.0);

        predictor.reset();

        assertThat(predictor.getWeights()).containsExactly(0, 0);
        assertThat(predictor.getBias()).isEqualTo(0.0);
        assertThat(predictor.getDimension()).isEqualTo(2);
    }

    @Test
    void testDimensionConstructor() {
        LinearPredictor empty = new LinearPredictor(3);

        assertThat(empty.getDimension()).isEqualTo(3);
        assertThat(empty.predict(new double[] {1, 2, 3})).isEqualTo(0.0);
        assertThatThrownBy(() -> new LinearPredictor(-1)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testCopyIsIndependent() {
        LinearPredictor copy = predictor.copy();

        predictor.scale(3);

        assertThat(copy).isEqualTo(new LinearPredictor(new double[] {2, -1}, 0.5));
        assertThat(copy).isNotEqualTo(predictor);
    }

    @Test
    void testSerializeWritesWeightsThenBias() {
        predictor.serialize(serializer);

        InOrder order = inOrder(serializer);
        order.verify(serializer).writeDoubleArray(eq("weights"), aryEq(new double[] {2, -1}));
        order.verify(serializer).writeDouble("bias", 0.5);
        verifyNoMoreInteractions(serializer);
    }

    @Test
    void testDeserializeReadsWeightsThenBias() {
        when(deserializer.readDoubleArray("weights")).thenReturn(new double[] {7, 8, 9});
        when(deserializer.readDouble("bias")).thenReturn(-1.0);
        LinearPredictor loaded = new LinearPredictor();

        loaded.deserialize(deserializer);

        InOrder order = inOrder(deserializer);
        order.verify(deserializer).readDoubleArray("weights");
        order.verify(deserializer).readDouble("bias");
        assertThat(loaded).isEqualTo(new LinearPredictor(new double[] {7, 8, 9}, -1));
    }

    @Test
    void testArchiveRoundTrip() {
        MsgPackArchiver archiver = MsgPackArchiver.builder().registry(ModelTypes.createRegistry()).build();

        LinearPredictor loaded = archiver.load(archiver.save(predictor), LinearPredictor.class);

        assertThat(loaded).isEqualTo(predictor);
        assertThat(loaded.predict(new double[] {1, 1})).isEqualTo(1.5);
    }
}
