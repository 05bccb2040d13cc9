package com.emll.serialization;

import com.emll.utilities.Variant;

import java.util.List;

/**
 * Cursor over the properties of one serialized object. Properties must be read in the order
 * they were written; every read names the property it expects.
 *
 * <p>All read methods throw {@link MalformedStreamException} if the next property has another
 * name or another kind of value.
 */
public interface Deserializer {
    boolean readBoolean(String name);

    int readInt(String name);

    long readLong(String name);

    double readDouble(String name);

    String readString(String name);

    double[] readDoubleArray(String name);

    int[] readIntArray(String name);

    List<String> readStringList(String name);

    /**
     * Read a nested object. Its stored type name is resolved through the registry, a fresh
     * instance is created and populated from the stored properties.
     *
     * @param name Property name
     * @param type Java type the object must be assignable to
     * @param <T> Expected type
     * @return The object, or null if null was written
     * @throws UnregisteredTypeException If the stored type name is not registered
     */
    <T extends Serializable> T readObject(String name, Class<T> type);

    /**
     * Read an ordered list of nested objects.
     *
     * @param name Property name
     * @param type Java type every element must be assignable to
     * @param <T> Expected element type
     * @return Mutable list of objects
     */
    <T extends Serializable> List<T> readObjectList(String name, Class<T> type);

    /**
     * Read a variant written by {@link Serializer#writeVariant(String, Variant)}.
     *
     * @param name Property name
     * @return The variant, empty if an empty variant was written
     */
    Variant readVariant(String name);

    PropertyBag readProperties(String name);

    /**
     * Get the context of the load in progress.
     *
     * @return Deserialization context
     */
    DeserializationContext getContext();
}
