package com.emll.serialization;

import com.emll.utilities.Variant;

import java.util.List;

/**
 * Append-only sink that a {@link Serializable} writes its named properties into.
 *
 * <p>Property names must be unique within one object. Nested serializable objects are written
 * together with their runtime type name so they can be reconstructed polymorphically.
 */
public interface Serializer {
    void writeBoolean(String name, boolean value);

    void writeInt(String name, int value);

    void writeLong(String name, long value);

    void writeDouble(String name, double value);

    /**
     * Write a string.
     *
     * @param name Property name
     * @param value String to write, may be null
     */
    void writeString(String name, String value);

    /**
     * Write a vector of doubles. Vectors and lists are never null; write an empty one instead.
     *
     * @param name Property name
     * @param values Values to write
     * @throws IllegalArgumentException If the values are null
     */
    void writeDoubleArray(String name, double[] values);

    void writeIntArray(String name, int[] values);

    /**
     * Write a list of strings.
     *
     * @param name Property name
     * @param values Strings to write
     * @throws IllegalArgumentException If the list or one of its elements is null
     */
    void writeStringList(String name, List<String> values);

    /**
     * Write a nested object, tagged with its runtime type name.
     *
     * @param name Property name
     * @param value Object to write, may be null
     */
    void writeObject(String name, Serializable value);

    /**
     * Write an ordered list of nested objects, each tagged with its own runtime type name.
     *
     * @param name Property name
     * @param values Objects to write; the list must not be null, its elements may be
     */
    void writeObjectList(String name, List<? extends Serializable> values);

    /**
     * Write a variant. Primitive values and vectors are written inline, serializable values
     * recursively.
     *
     * @param name Property name
     * @param value Variant to write, may be empty
     * @throws PointerPropertyException If the variant holds a pointer-like value
     * @throws UnsupportedPropertyTypeException If the variant holds any other unsupported value
     */
    void writeVariant(String name, Variant value);

    /**
     * Write a bag of named variants, preserving its order.
     *
     * @param name Property name
     * @param properties Properties to write
     */
    void writeProperties(String name, PropertyBag properties);
}
