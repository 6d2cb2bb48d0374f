package com.fnfreeze.fn.serde;

import com.fnfreeze.fn.Symbol;
import com.fnfreeze.serde.SerializationException;

/**
 * Thrown when a global binding named in frozen data cannot be found, or holds
 * something other than a callable.
 */
public class UnresolvableBindingException extends SerializationException {
    private final Symbol symbol;
    
    public UnresolvableBindingException(Symbol symbol, String reason) {
        super("Cannot resolve binding " + symbol + ": " + reason);
        this.symbol = symbol;
    }
    
    public UnresolvableBindingException(Symbol symbol, String reason, Throwable cause) {
        super("Cannot resolve binding " + symbol + ": " + reason, cause);
        this.symbol = symbol;
    }
    
    /**
     * Get the symbol that could not be resolved.
     *
     * @return The symbol
     */
    public Symbol getSymbol() {
        return symbol;
    }
}
