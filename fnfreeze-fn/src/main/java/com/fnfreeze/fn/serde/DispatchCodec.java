package com.fnfreeze.fn.serde;

import com.fnfreeze.fn.DispatchFn;
import com.fnfreeze.fn.Fn;
import com.fnfreeze.fn.Symbol;
import com.fnfreeze.serde.StreamSerializer;
import org.msgpack.core.MessagePacker;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Encoder for dispatch functions. Every dispatch function shares one class,
 * so bindings are resolved per declared symbol and the identity check runs on
 * every call. Thawing goes through the binding decoder.
 */
final class DispatchCodec implements FnEncoder {
    private final BindingResolver resolver;
    private final ClassLoader classLoader;
    private final Map<Symbol, Binding> resolved = new ConcurrentHashMap<>();
    
    /**
     * @param resolver Resolver used to find the binding of each declared symbol
     * @param classLoader Class loader for owner classes
     */
    DispatchCodec(BindingResolver resolver, ClassLoader classLoader) {
        this.resolver = resolver;
        this.classLoader = classLoader;
    }
    
    @Override
    public FnShape shape(Fn fn) {
        bindingOf((DispatchFn) fn);
        return FnShape.DISPATCH;
    }
    
    @Override
    public void encode(Fn fn, MessagePacker out, StreamSerializer engine) throws IOException {
        engine.freezeToOut(out, bindingOf((DispatchFn) fn).getSymbol());
    }
    
    private Binding bindingOf(DispatchFn fn) {
        Symbol declared = fn.methodImplCache().sym();
        Binding binding = resolved.get(declared);
        if (binding != null && binding.currentValue() == fn) {
            return binding;
        }
        
        binding = resolver.resolve(fn, classLoader).orElseThrow(() -> new UnresolvableBindingException(
                declared, "dispatch function is not the current value of its binding"));
        resolved.put(declared, binding);
        return binding;
    }
}
