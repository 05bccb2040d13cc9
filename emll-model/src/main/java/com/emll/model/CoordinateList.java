package com.emll.model;

import com.emll.serialization.Deserializer;
import com.emll.serialization.MalformedStreamException;
import com.emll.serialization.Serializable;
import com.emll.serialization.Serializer;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * Ordered sequence of {@link Coordinate}s, used to wire the inputs of multi-input nodes.
 */
public class CoordinateList implements Serializable, Iterable<Coordinate> {
    private final List<Coordinate> coordinates = new ArrayList<>();

    /**
     * Create an empty coordinate list.
     */
    public CoordinateList() {
    }

    /**
     * Create a coordinate list holding the given coordinates.
     *
     * @param coordinates Coordinates in order
     */
    public CoordinateList(Collection<Coordinate> coordinates) {
        coordinates.forEach(this::add);
    }

    /**
     * Create a copy of another coordinate list.
     *
     * @param other List to copy
     */
    public CoordinateList(CoordinateList other) {
        this(other.coordinates);
    }

    public static CoordinateList of(Coordinate... coordinates) {
        return new CoordinateList(Arrays.asList(coordinates));
    }

    public static String getTypeName() {
        return "CoordinateList";
    }

    @Override
    public String getRuntimeTypeName() {
        return getTypeName();
    }

    public CoordinateList add(Coordinate coordinate) {
        if (coordinate == null) {
            throw new IllegalArgumentException("Coordinate cannot be null");
        }
        coordinates.add(coordinate);
        return this;
    }

    public CoordinateList addAll(CoordinateList other) {
        coordinates.addAll(other.coordinates);
        return this;
    }

    public Coordinate get(int index) {
        return coordinates.get(index);
    }

    public int size() {
        return coordinates.size();
    }

    public boolean isEmpty() {
        return coordinates.isEmpty();
    }

    /**
     * Get the coordinates as a list.
     *
     * @return Unmodifiable view of the coordinates
     */
    public List<Coordinate> asList() {
        return Collections.unmodifiableList(coordinates);
    }

    @Override
    public Iterator<Coordinate> iterator() {
        return asList().iterator();
    }

    @Override
    public void serialize(Serializer serializer) {
        int[] nodeIds = new int[coordinates.size()];
        int[] portIndices = new int[coordinates.size()];
        for (int i = 0; i < coordinates.size(); i++) {
            nodeIds[i] = coordinates.get(i).nodeId();
            portIndices[i] = coordinates.get(i).portIndex();
        }
        serializer.writeIntArray("nodes", nodeIds);
        serializer.writeIntArray("ports", portIndices);
    }

    @Override
    public void deserialize(Deserializer deserializer) {
        int[] nodeIds = deserializer.readIntArray("nodes");
        int[] portIndices = deserializer.readIntArray("ports");
        if (nodeIds.length != portIndices.length) {
            throw new MalformedStreamException("Coordinate list has " + nodeIds.length + " node ids but "
                    + portIndices.length + " port indices");
        }

        coordinates.clear();
        try {
            for (int i = 0; i < nodeIds.length; i++) {
                coordinates.add(new Coordinate(nodeIds[i], portIndices[i]));
            }
        } catch (IllegalArgumentException e) {
            throw new MalformedStreamException("Invalid coordinate in coordinate list", e);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return coordinates.equals(((CoordinateList) o).coordinates);
    }

    @Override
    public int hashCode() {
        return coordinates.hashCode();
    }

    @Override
    public String toString() {
        return coordinates.toString();
    }
}
