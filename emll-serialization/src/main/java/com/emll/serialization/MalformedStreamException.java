package com.emll.serialization;

/**
 * Exception thrown when the structure of an archive does not match what is being read:
 * a missing or unexpected property, a value of the wrong kind, or leftover data.
 */
public class MalformedStreamException extends SerializationException {
    /**
     * Create a new malformed stream exception with a message.
     *
     * @param message Error message
     */
    public MalformedStreamException(String message) {
        super(message);
    }

    /**
     * Create a new malformed stream exception with a message and cause.
     *
     * @param message Error message
     * @param cause Underlying cause
     */
    public MalformedStreamException(String message, Throwable cause) {
        super(message, cause);
    }
}
