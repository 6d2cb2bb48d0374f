package com.fnfreeze.fn.serde;

import com.fnfreeze.fn.Symbol;

import java.lang.invoke.MethodHandle;

/**
 * A resolved global binding: a symbol plus a pre-resolved getter for the
 * static field it names. Reading goes through the getter every time, so it
 * always sees the field's current value.
 */
public final class Binding {
    private final Symbol symbol;
    private final MethodHandle getter;
    
    /**
     * @param symbol Symbol of the binding
     * @param getter Static getter adapted to {@code ()Object}
     */
    Binding(Symbol symbol, MethodHandle getter) {
        this.symbol = symbol;
        this.getter = getter;
    }
    
    public Symbol getSymbol() {
        return symbol;
    }
    
    /**
     * Read the value the binding holds right now.
     *
     * @return Current value of the static field
     */
    public Object currentValue() {
        try {
            return (Object) getter.invokeExact();
        } catch (RuntimeException | Error e) {
            throw e;
        } catch (Throwable t) {
            throw new UnresolvableBindingException(symbol, "reading the binding failed", t);
        }
    }
    
    @Override
    public String toString() {
        return "Binding[" + symbol + "]";
    }
}
