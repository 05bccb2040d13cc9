package com.emll.model;

import com.emll.serialization.Deserializer;
import com.emll.serialization.MalformedStreamException;
import com.emll.serialization.Serializable;
import com.emll.serialization.Serializer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * A {@link Model} together with named inputs and named outputs, so that external drivers can
 * feed it data and attach further stages to its results.
 */
public class ModelMap implements Serializable {
    private Model model;
    private final List<String> inputNames = new ArrayList<>();
    private final List<InputNode> inputs = new ArrayList<>();
    private final List<String> outputNames = new ArrayList<>();
    private final List<CoordinateList> outputs = new ArrayList<>();

    /**
     * Create an empty map, to be populated by deserialization.
     */
    public ModelMap() {
        this.model = new Model();
    }

    /**
     * Create a map over a model.
     *
     * @param model The model
     * @param inputs Input nodes of the model by name, in order
     * @param outputs Output coordinates of the model by name, in order
     * @throws IllegalArgumentException If an input node belongs to another model
     * @throws GraphConstructionException If an output coordinate does not resolve in the model
     */
    public ModelMap(Model model, Map<String, InputNode> inputs, Map<String, CoordinateList> outputs) {
        if (model == null) {
            throw new IllegalArgumentException("Model cannot be null");
        }
        this.model = model;
        inputs.forEach(this::addInput);
        outputs.forEach(this::addOutput);
    }

    public static String getTypeName() {
        return "ModelMap";
    }

    @Override
    public String getRuntimeTypeName() {
        return getTypeName();
    }

    private void addInput(String name, InputNode node) {
        if (inputNames.contains(name)) {
            throw new IllegalArgumentException("Duplicate input name '" + name + "'");
        }
        if (node.getModel() != model) {
            throw new IllegalArgumentException("Input '" + name + "' is not a node of the mapped model");
        }
        inputNames.add(name);
        inputs.add(node);
    }

    private void addOutput(String name, CoordinateList coordinates) {
        if (outputNames.contains(name)) {
            throw new IllegalArgumentException("Duplicate output name '" + name + "'");
        }
        for (Coordinate coordinate : coordinates) {
            model.resolve(coordinate);
        }
        outputNames.add(name);
        outputs.add(new CoordinateList(coordinates));
    }

    /**
     * Get the mapped model. Nodes added to it become part of this map's model.
     *
     * @return The model
     */
    public Model getModel() {
        return model;
    }

    public int getNumInputs() {
        return inputs.size();
    }

    public int getNumOutputs() {
        return outputs.size();
    }

    public List<String> getInputNames() {
        return Collections.unmodifiableList(inputNames);
    }

    public List<String> getOutputNames() {
        return Collections.unmodifiableList(outputNames);
    }

    public InputNode getInput(int index) {
        return inputs.get(index);
    }

    /**
     * Get an input node by name.
     *
     * @param name Input name
     * @return The input node
     * @throws NoSuchElementException If no input has the given name
     */
    public InputNode getInput(String name) {
        return inputs.get(indexOf(inputNames, name, "input"));
    }

    public int getInputSize(int index) {
        return inputs.get(index).getOutputSize();
    }

    public int getOutputSize(int index) {
        return outputs.get(index).size();
    }

    /**
     * Get the coordinates of an output, for wiring further nodes onto it.
     *
     * @param index Output index
     * @return Copy of the output coordinates
     */
    public CoordinateList getOutputCoordinates(int index) {
        return new CoordinateList(outputs.get(index));
    }

    /**
     * Get the coordinates of an output by name.
     *
     * @param name Output name
     * @return Copy of the output coordinates
     * @throws NoSuchElementException If no output has the given name
     */
    public CoordinateList getOutputCoordinates(String name) {
        return getOutputCoordinates(indexOf(outputNames, name, "output"));
    }

    /**
     * Evaluate every output for the given named inputs.
     *
     * @param inputValues Values per input name; every input must be bound
     * @return Values per output name, in output order
     */
    public Map<String, double[]> compute(Map<String, double[]> inputValues) {
        ModelEvaluator evaluator = new ModelEvaluator(model);
        inputValues.forEach((name, values) -> evaluator.setInput(getInput(name), values));

        Map<String, double[]> result = new LinkedHashMap<>();
        for (int i = 0; i < outputs.size(); i++) {
            result.put(outputNames.get(i), evaluator.compute(outputs.get(i)));
        }
        return result;
    }

    /**
     * Evaluate the first output of a single-input map.
     *
     * @param input Values of the only input
     * @return Values of the first output
     * @throws IllegalStateException If the map does not have exactly one input and at least one output
     */
    public double[] compute(double[] input) {
        if (inputs.size() != 1 || outputs.isEmpty()) {
            throw new IllegalStateException("Map has " + inputs.size() + " inputs and " + outputs.size()
                    + " outputs, expected one input and at least one output");
        }
        return new ModelEvaluator(model)
                .setInput(inputs.get(0), input)
                .compute(outputs.get(0));
    }

    @Override
    public void serialize(Serializer serializer) {
        int[] inputIds = new int[inputs.size()];
        for (int i = 0; i < inputIds.length; i++) {
            inputIds[i] = inputs.get(i).getId();
        }
        serializer.writeObject("model", model);
        serializer.writeStringList("inputNames", inputNames);
        serializer.writeIntArray("inputNodes", inputIds);
        serializer.writeStringList("outputNames", outputNames);
        serializer.writeObjectList("outputs", outputs);
    }

    @Override
    public void deserialize(Deserializer deserializer) {
        Model storedModel = deserializer.readObject("model", Model.class);
        List<String> storedInputNames = deserializer.readStringList("inputNames");
        int[] inputIds = deserializer.readIntArray("inputNodes");
        List<String> storedOutputNames = deserializer.readStringList("outputNames");
        List<CoordinateList> storedOutputs = deserializer.readObjectList("outputs", CoordinateList.class);

        if (storedModel == null) {
            throw new MalformedStreamException("Map has no model");
        }
        if (storedInputNames.size() != inputIds.length || storedOutputNames.size() != storedOutputs.size()) {
            throw new MalformedStreamException("Map names and entries differ in length");
        }

        model = storedModel;
        inputNames.clear();
        inputs.clear();
        outputNames.clear();
        outputs.clear();
        try {
            for (int i = 0; i < inputIds.length; i++) {
                addInput(storedInputNames.get(i), model.getNode(inputIds[i], InputNode.class));
            }
            for (int i = 0; i < storedOutputs.size(); i++) {
                addOutput(storedOutputNames.get(i), storedOutputs.get(i));
            }
        } catch (NoSuchElementException | IllegalArgumentException | GraphConstructionException e) {
            throw new MalformedStreamException("Stored map does not match its model", e);
        }
    }

    private static int indexOf(List<String> names, String name, String kind) {
        int index = names.indexOf(name);
        if (index < 0) {
            throw new NoSuchElementException("No " + kind + " named '" + name + "'");
        }
        return index;
    }
}
