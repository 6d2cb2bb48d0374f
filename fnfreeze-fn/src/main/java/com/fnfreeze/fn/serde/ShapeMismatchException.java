package com.fnfreeze.fn.serde;

import com.fnfreeze.serde.SerializationException;

/**
 * Thrown when frozen closure state does not fit the closure class that is
 * loaded now, usually because the class changed between freeze and thaw.
 */
public class ShapeMismatchException extends SerializationException {
    private final String className;
    
    public ShapeMismatchException(String className, String reason) {
        super("Frozen state does not match " + className + ": " + reason);
        this.className = className;
    }
    
    public ShapeMismatchException(String className, String reason, Throwable cause) {
        super("Frozen state does not match " + className + ": " + reason, cause);
        this.className = className;
    }
    
    public String getClassName() {
        return className;
    }
}
