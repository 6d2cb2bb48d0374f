package com.fnfreeze.fn;

import java.util.List;

/**
 * Base class for callables that capture state in fields.
 *
 * <p>{@link #invoke(Object...)} dispatches on the argument count to
 * {@code invoke0} .. {@code invoke3}, then to {@link #applyTo(Object[])}.
 * Subclasses override the arities they support; the rest throw
 * {@link ArityException}.
 *
 * <p>A subclass meant to be frozen declares its captured values as non-static
 * fields and a constructor that takes them in declaration order:
 * <pre>
 * final class Adder extends AbstractFn {
 *     private final long y;
 *     Adder(long y) { this.y = y; }
 *     public Object invoke1(Object x) { return ((Number) x).longValue() + y; }
 * }
 * </pre>
 */
public abstract class AbstractFn implements Fn {
    
    @Override
    public Object invoke(Object... args) {
        switch (args.length) {
            case 0:
                return invoke0();
            case 1:
                return invoke1(args[0]);
            case 2:
                return invoke2(args[0], args[1]);
            case 3:
                return invoke3(args[0], args[1], args[2]);
            default:
                return applyTo(args);
        }
    }
    
    public Object invoke0() {
        throw arityError(0);
    }
    
    public Object invoke1(Object arg1) {
        throw arityError(1);
    }
    
    public Object invoke2(Object arg1, Object arg2) {
        throw arityError(2);
    }
    
    public Object invoke3(Object arg1, Object arg2, Object arg3) {
        throw arityError(3);
    }
    
    /**
     * Invoke with more than three arguments.
     *
     * @param args Arguments
     * @return Result of the call
     */
    public Object applyTo(Object[] args) {
        throw arityError(args.length);
    }
    
    /**
     * Return a callable taking a single {@link List} whose elements are passed
     * to this callable as its arguments. The returned shim holds nothing but a
     * reference to this callable.
     *
     * @return Apply-style forwarding callable
     */
    public Fn applier() {
        return new Applier();
    }
    
    protected ArityException arityError(int actual) {
        return new ArityException(actual, getClass().getName());
    }
    
    /**
     * Forwarding shim bound to its enclosing callable.
     */
    public final class Applier implements Fn {
        
        private Applier() {
        }
        
        /**
         * Get the callable this shim forwards to.
         *
         * @return The enclosing callable
         */
        public AbstractFn target() {
            return AbstractFn.this;
        }
        
        @Override
        public Object invoke(Object... args) {
            if (args.length != 1) {
                throw new ArityException(args.length, "applier of " + AbstractFn.this.getClass().getName());
            }
            if (!(args[0] instanceof List)) {
                throw new IllegalArgumentException("Applier expects a List of arguments, got: "
                        + (args[0] == null ? "null" : args[0].getClass().getName()));
            }
            return AbstractFn.this.invoke(((List<?>) args[0]).toArray());
        }
        
        @Override
        public String toString() {
            return "Applier[" + AbstractFn.this + "]";
        }
    }
}
