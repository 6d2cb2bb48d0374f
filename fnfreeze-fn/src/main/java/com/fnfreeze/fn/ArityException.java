package com.fnfreeze.fn;

/**
 * Thrown when a callable is invoked with a number of arguments it does not accept.
 */
public class ArityException extends IllegalArgumentException {
    private final int actual;
    
    /**
     * Create a new arity exception.
     *
     * @param actual Number of arguments passed
     * @param name Name of the callable
     */
    public ArityException(int actual, String name) {
        super("Wrong number of args (" + actual + ") passed to: " + name);
        this.actual = actual;
    }
    
    /**
     * Get the number of arguments that was passed.
     *
     * @return Argument count
     */
    public int getActual() {
        return actual;
    }
}
