package com.fnfreeze.fn;

/**
 * Interface-dispatch function: selects an implementation by the class of its
 * first argument and calls it with all arguments.
 *
 * <p>A dispatch function is declared for the static field that will hold it,
 * so it always knows its own global name:
 * <pre>
 * public static final DispatchFn AREA = DispatchFn.declare(Shapes.class, "AREA")
 *         .extend(Circle.class, args -&gt; ...);
 * </pre>
 */
public final class DispatchFn extends AbstractFn {
    private final MethodImplCache methodImplCache;
    
    /**
     * Create a dispatch function with no implementations.
     *
     * @param sym Symbol of the binding that will hold it
     */
    public DispatchFn(Symbol sym) {
        this.methodImplCache = new MethodImplCache(sym);
    }
    
    /**
     * Create a dispatch function for a static field of a class.
     *
     * @param owner Class declaring the field
     * @param field Name of the field
     * @return The dispatch function
     */
    public static DispatchFn declare(Class<?> owner, String field) {
        return new DispatchFn(Symbol.of(owner, field));
    }
    
    /**
     * Register the implementation for receivers of a type.
     *
     * @param type Receiver type
     * @param impl Implementation, called with the receiver as its first argument
     * @return This dispatch function
     */
    public DispatchFn extend(Class<?> type, Fn impl) {
        if (type == null || impl == null) {
            throw new IllegalArgumentException("Type and implementation cannot be null");
        }
        methodImplCache.register(type, impl);
        return this;
    }
    
    public MethodImplCache methodImplCache() {
        return methodImplCache;
    }
    
    @Override
    public Object invoke(Object... args) {
        if (args.length == 0) {
            throw arityError(0);
        }
        if (args[0] == null) {
            throw new IllegalArgumentException("No implementation of " + methodImplCache.sym() + " for null");
        }
        Class<?> receiver = args[0].getClass();
        Fn impl = methodImplCache.lookup(receiver)
                .orElseThrow(() -> new IllegalArgumentException(
                        "No implementation of " + methodImplCache.sym() + " for " + receiver.getName()));
        return impl.invoke(args);
    }
    
    @Override
    protected ArityException arityError(int actual) {
        return new ArityException(actual, methodImplCache.sym().toString());
    }
    
    @Override
    public String toString() {
        return "DispatchFn[" + methodImplCache.sym() + "]";
    }
}
