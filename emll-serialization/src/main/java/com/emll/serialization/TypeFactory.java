package com.emll.serialization;

/**
 * Creates an empty instance of a serializable kind, to be populated by
 * {@link Serializable#deserialize(Deserializer)}.
 *
 * @param <T> Type to create
 */
@FunctionalInterface
public interface TypeFactory<T extends Serializable> {
    /**
     * Create a default instance.
     *
     * @param context Context of the deserialization in progress
     * @return New instance
     */
    T create(DeserializationContext context);
}
