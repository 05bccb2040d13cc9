package com.emll.serialization;

/**
 * Exception thrown when an archive names a type that has no factory in the {@link TypeRegistry}.
 */
public class UnregisteredTypeException extends SerializationException {
    /**
     * Create a new unregistered type exception.
     *
     * @param typeName The type name that could not be resolved
     */
    public UnregisteredTypeException(String typeName) {
        super("No factory registered for type '" + typeName + "'", typeName, null);
    }
}
