package com.emll.nodes;

import com.emll.model.InputNode;
import com.emll.model.Model;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class SumNodeTest {

    @Test
    void testSumsAllInputs() {
        Model model = new Model();
        SumNode sum = model.addNode(new SumNode(model.addNode(new InputNode(4)).getOutput()));

        assertThat(sum.getOutputSize()).isEqualTo(1);
        assertThat(sum.getInputSize()).isEqualTo(4);
        assertThat(sum.compute(new double[] {1, 2, 3, 4})).containsExactly(10);
    }

    @Test
    void testEmptySumIsZero() {
        assertThat(new SumNode().compute(new double[0])).containsExactly(0);
    }
}
