package com.fnfreeze.fn.serde;

import com.fnfreeze.fn.Fn;
import com.fnfreeze.fn.Symbol;

import java.util.List;

/**
 * Proposes global binding names under which a callable might be stored.
 * Proposals are only candidates; the resolver accepts one only when the
 * binding currently holds the very same instance.
 */
@FunctionalInterface
public interface BindingNameStrategy {
    /**
     * Propose candidate symbols for a callable.
     *
     * @param fn Callable being frozen
     * @param bindings Binding lookup, for strategies that scan an owner class
     * @param loader Class loader for owner classes
     * @return Candidates in preference order, possibly empty
     */
    List<Symbol> candidates(Fn fn, GlobalBindings bindings, ClassLoader loader);
}
