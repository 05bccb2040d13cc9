package com.emll.serialization;

/**
 * Exception thrown when a property value holds a reference to another object's identity.
 * Identities do not survive a save/load boundary, so such values are never written.
 */
public class PointerPropertyException extends SerializationException {
    /**
     * Create a new pointer property exception.
     *
     * @param propertyName Name of the offending property
     * @param typeName Type name of the held value
     */
    public PointerPropertyException(String propertyName, String typeName) {
        super("Property '" + propertyName + "' holds pointer-like value of type '" + typeName
                + "', which cannot be serialized", typeName, null);
    }
}
