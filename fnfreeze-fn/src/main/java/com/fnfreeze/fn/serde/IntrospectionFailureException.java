package com.fnfreeze.fn.serde;

import com.fnfreeze.serde.SerializationException;

/**
 * Thrown when a closure class cannot be taken apart into captured fields or
 * put back together through a constructor.
 */
public class IntrospectionFailureException extends SerializationException {
    private final String className;
    
    public IntrospectionFailureException(String className, String reason) {
        super("Cannot introspect " + className + ": " + reason);
        this.className = className;
    }
    
    public IntrospectionFailureException(String className, String reason, Throwable cause) {
        super("Cannot introspect " + className + ": " + reason, cause);
        this.className = className;
    }
    
    public String getClassName() {
        return className;
    }
}
