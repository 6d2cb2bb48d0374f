package com.fnfreeze.serde;

/**
 * Thrown when the serializer meets a value it has no way to freeze, such as a
 * lambda, an object without a no-arg constructor or a JDK internal whose fields
 * are encapsulated.
 */
public class UnfreezableValueException extends SerializationException {
    private final Class<?> valueType;
    
    /**
     * Create a new exception for a value of the given type.
     *
     * @param valueType Type of the value that could not be frozen
     * @param reason Why the value cannot be frozen
     */
    public UnfreezableValueException(Class<?> valueType, String reason) {
        super("Cannot freeze value of type " + valueType.getName() + ": " + reason);
        this.valueType = valueType;
    }
    
    /**
     * Create a new exception for a value of the given type.
     *
     * @param valueType Type of the value that could not be frozen
     * @param reason Why the value cannot be frozen
     * @param cause Underlying cause
     */
    public UnfreezableValueException(Class<?> valueType, String reason, Throwable cause) {
        super("Cannot freeze value of type " + valueType.getName() + ": " + reason, cause);
        this.valueType = valueType;
    }
    
    /**
     * Get the type of the value that could not be frozen.
     *
     * @return The offending type
     */
    public Class<?> getValueType() {
        return valueType;
    }
}
