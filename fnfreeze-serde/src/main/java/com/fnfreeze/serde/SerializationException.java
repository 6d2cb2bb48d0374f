package com.fnfreeze.serde;

/**
 * Exception thrown when a value cannot be frozen to or thawed from MessagePack.
 * Root of every error raised by the serializer and its extensions.
 */
public class SerializationException extends RuntimeException {
    /**
     * Create a new serialization exception with a message.
     *
     * @param message Error message
     */
    public SerializationException(String message) {
        super(message);
    }
    
    /**
     * Create a new serialization exception with a message and cause.
     *
     * @param message Error message
     * @param cause Underlying cause
     */
    public SerializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
