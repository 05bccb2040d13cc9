package com.emll.serialization;

/**
 * Exception thrown when an object graph cannot be written to or read from an archive.
 *
 * <p>Subclasses distinguish the causes callers usually handle differently: a type name missing
 * from the {@link TypeRegistry}, an archive whose structure does not match what is read, and
 * property values that cannot be archived at all. When the failure concerns one archived kind,
 * its type name is available through {@link #getTypeName()}.
 */
public class SerializationException extends RuntimeException {
    private final String typeName;

    /**
     * Create a new serialization exception with a message.
     *
     * @param message Error message
     */
    public SerializationException(String message) {
        this(message, null, null);
    }

    /**
     * Create a new serialization exception with a message and cause.
     *
     * @param message Error message
     * @param cause Underlying cause
     */
    public SerializationException(String message, Throwable cause) {
        this(message, null, cause);
    }

    /**
     * Create a new serialization exception concerning one archived kind.
     *
     * @param message Error message
     * @param typeName Type name of the kind involved, may be null
     * @param cause Underlying cause, may be null
     */
    protected SerializationException(String message, String typeName, Throwable cause) {
        super(message, cause);
        this.typeName = typeName;
    }

    /**
     * Get the type name of the archived kind this failure concerns.
     *
     * @return Type name, or null if the failure is not tied to one kind
     */
    public String getTypeName() {
        return typeName;
    }
}
