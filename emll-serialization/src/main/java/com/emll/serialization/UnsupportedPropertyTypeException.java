package com.emll.serialization;

/**
 * Exception thrown when a variant property holds a value that is neither primitive,
 * a supported vector, nor {@link Serializable}.
 */
public class UnsupportedPropertyTypeException extends SerializationException {
    /**
     * Create a new unsupported property type exception.
     *
     * @param propertyName Name of the offending property
     * @param typeName Type name of the held value
     */
    public UnsupportedPropertyTypeException(String propertyName, String typeName) {
        super("Property '" + propertyName + "' holds value of type '" + typeName
                + "', which cannot be serialized", typeName, null);
    }
}
