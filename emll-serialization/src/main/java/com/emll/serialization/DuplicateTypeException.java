package com.emll.serialization;

/**
 * Exception thrown when a type name is registered twice in the same {@link TypeRegistry}.
 */
public class DuplicateTypeException extends SerializationException {
    /**
     * Create a new duplicate type exception.
     *
     * @param typeName The type name that is already registered
     */
    public DuplicateTypeException(String typeName) {
        super("Type '" + typeName + "' is already registered", typeName, null);
    }
}
