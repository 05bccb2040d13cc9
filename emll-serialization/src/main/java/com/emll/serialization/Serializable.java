package com.emll.serialization;

/**
 * An object that can write its own state into a {@link Serializer} and restore it from a
 * {@link Deserializer}.
 *
 * <p>Every concrete kind reports a stable type name, both through
 * {@link #getRuntimeTypeName()} and through a public static {@code getTypeName()} method
 * returning the same constant. The name is written ahead of the object's properties and is the
 * key used by the {@link TypeRegistry} to construct a fresh instance when reading.
 *
 * <p>{@link #deserialize(Deserializer)} must read exactly the properties that
 * {@link #serialize(Serializer)} wrote, in the same order.
 */
public interface Serializable {
    /**
     * Get the type name of this object's concrete kind.
     *
     * @return Type name
     */
    String getRuntimeTypeName();

    /**
     * Write the state of this object.
     *
     * @param serializer Sink to write properties to
     */
    void serialize(Serializer serializer);

    /**
     * Restore the state of this object. Called on a freshly constructed instance.
     *
     * @param deserializer Cursor positioned at this object's properties
     */
    void deserialize(Deserializer deserializer);
}
