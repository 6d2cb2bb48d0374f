package com.fnfreeze.fn.serde;

import com.fnfreeze.fn.Fn;
import com.fnfreeze.fn.Symbol;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Finds the global binding that holds a callable, trying each
 * {@link BindingNameStrategy} in order. A candidate is accepted only if its
 * binding's current value is the callable itself.
 */
public class BindingResolver {
    private static final Logger log = LoggerFactory.getLogger(BindingResolver.class);
    
    private final GlobalBindings bindings;
    private final List<BindingNameStrategy> strategies;
    
    /**
     * Create a resolver with the default strategy chain.
     *
     * @param bindings Binding lookup
     */
    public BindingResolver(GlobalBindings bindings) {
        this(bindings, BindingNameStrategies.defaults());
    }
    
    /**
     * Create a resolver.
     *
     * @param bindings Binding lookup
     * @param strategies Strategies in resolution order
     */
    public BindingResolver(GlobalBindings bindings, List<BindingNameStrategy> strategies) {
        if (bindings == null || strategies == null) {
            throw new IllegalArgumentException("Bindings and strategies cannot be null");
        }
        this.bindings = bindings;
        this.strategies = List.copyOf(strategies);
    }
    
    /**
     * Resolve the binding holding a callable. Lookup failures of any kind count
     * as "no match".
     *
     * @param fn Callable being frozen
     * @param loader Class loader for owner classes
     * @return The binding, if one currently holds {@code fn}
     */
    public Optional<Binding> resolve(Fn fn, ClassLoader loader) {
        for (BindingNameStrategy strategy : strategies) {
            List<Symbol> candidates;
            try {
                candidates = strategy.candidates(fn, bindings, loader);
            } catch (RuntimeException | LinkageError e) {
                log.debug("Binding name strategy failed for {}", fn.getClass().getName(), e);
                continue;
            }
            for (Symbol candidate : candidates) {
                Optional<Binding> binding = bindings.find(candidate, loader)
                        .filter(found -> holds(found, fn));
                if (binding.isPresent()) {
                    log.debug("Resolved {} to binding {}", fn.getClass().getName(), candidate);
                    return binding;
                }
                log.trace("Candidate {} does not hold {}", candidate, fn.getClass().getName());
            }
        }
        return Optional.empty();
    }
    
    /**
     * Resolve the binding whose current value has the same runtime type as a
     * callable that no binding holds itself. Only the strategies' candidates
     * are consulted, so types named after their binding are found.
     *
     * @param fn Callable being frozen
     * @param loader Class loader for owner classes
     * @return A binding holding another instance of {@code fn}'s type
     */
    public Optional<Binding> resolveByType(Fn fn, ClassLoader loader) {
        Class<?> type = fn.getClass();
        for (BindingNameStrategy strategy : strategies) {
            List<Symbol> candidates;
            try {
                candidates = strategy.candidates(fn, bindings, loader);
            } catch (RuntimeException | LinkageError e) {
                log.debug("Binding name strategy failed for {}", type.getName(), e);
                continue;
            }
            for (Symbol candidate : candidates) {
                Optional<Binding> binding = bindings.find(candidate, loader)
                        .filter(found -> holdsInstanceOf(found, type));
                if (binding.isPresent()) {
                    log.debug("Type {} is bound at {}", type.getName(), candidate);
                    return binding;
                }
            }
        }
        return Optional.empty();
    }
    
    public List<BindingNameStrategy> getStrategies() {
        return strategies;
    }
    
    private static boolean holdsInstanceOf(Binding binding, Class<?> type) {
        try {
            Object value = binding.currentValue();
            return value != null && value.getClass() == type;
        } catch (RuntimeException e) {
            log.trace("Reading {} failed: {}", binding.getSymbol(), e.toString());
            return false;
        }
    }
    
    private static boolean holds(Binding binding, Fn fn) {
        try {
            return binding.currentValue() == fn;
        } catch (RuntimeException e) {
            log.trace("Reading {} failed: {}", binding.getSymbol(), e.toString());
            return false;
        }
    }
}
