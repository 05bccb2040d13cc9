package com.emll.model;

import com.emll.nodes.CoordinatewiseNode;
import com.emll.nodes.CoordinatewiseNode.OperationType;
import com.emll.nodes.SumNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

public class ModelEvaluatorTest {

    private Model model;
    private InputNode input;
    private CoordinatewiseNode doubled;
    private SumNode sum;

    @BeforeEach
    void setUp() {
        model = new Model();
        input = model.addNode(new InputNode(3));
        doubled = model.addNode(new CoordinatewiseNode(new double[] {2, 2, 2}, input.getOutput(), OperationType.MULTIPLY));
        sum = model.addNode(new SumNode(doubled.getOutput()));
    }

    @Test
    void testComputeFollowsInputs() {
        ModelEvaluator evaluator = new ModelEvaluator(model).setInput(input, new double[] {1, 2, 3});

        assertThat(evaluator.compute(doubled.getOutput())).containsExactly(2, 4, 6);
        assertThat(evaluator.compute(sum.getOutput(0))).isCloseTo(12.0, within(1e-12));
    }

    @Test
    void testOutputsMayMixNodes() {
        ModelEvaluator evaluator = new ModelEvaluator(model).setInput(input, new double[] {1, 2, 3});

        double[] values = evaluator.compute(CoordinateList.of(sum.getOutput(0), input.getOutput(1), doubled.getOutput(0)));

        assertThat(values).containsExactly(12, 2, 2);
    }

    @Test
    void testBoundValuesAreCopied() {
        double[] values = {1, 1, 1};
        ModelEvaluator evaluator = new ModelEvaluator(model).setInput(input, values);

        values[0] = 100;

        assertThat(evaluator.compute(sum.getOutput(0))).isEqualTo(6.0);
    }

    @Test
    void testUnboundInputFails() {
        ModelEvaluator evaluator = new ModelEvaluator(model);

        assertThatThrownBy(() -> evaluator.compute(sum.getOutput(0)))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("InputNode#0");
    }

    @Test
    void testUnneededInputsMayStayUnbound() {
        InputNode other = model.addNode(new InputNode(1));
        SumNode otherSum = model.addNode(new SumNode(other.getOutput()));
        ModelEvaluator evaluator = new ModelEvaluator(model).setInput(other, new double[] {5});

        assertThat(evaluator.compute(otherSum.getOutput(0))).isEqualTo(5.0);
    }

    @Test
    void testInvalidBindings() {
        ModelEvaluator evaluator = new ModelEvaluator(model);

        assertThatThrownBy(() -> evaluator.setInput(input, new double[] {1, 2}))
                .isInstanceOf(IllegalArgumentException.class);
        InputNode foreign = new Model().addNode(new InputNode(3));
        assertThatThrownBy(() -> evaluator.setInput(foreign, new double[] {1, 2, 3}))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testUnresolvableOutputFails() {
        ModelEvaluator evaluator = new ModelEvaluator(model).setInput(input, new double[] {1, 2, 3});

        assertThatThrownBy(() -> evaluator.compute(new Coordinate(9, 0)))
                .isInstanceOf(GraphConstructionException.class);
    }
}
