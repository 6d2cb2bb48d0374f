package com.fnfreeze.fn;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Implementation table of a {@link DispatchFn}. Knows the symbol of the
 * binding the dispatch function is stored in, and which implementation
 * handles which receiver class.
 */
public final class MethodImplCache {
    private final Symbol sym;
    private final Map<Class<?>, Fn> impls = new ConcurrentHashMap<>();
    private final Map<Class<?>, Optional<Fn>> resolved = new ConcurrentHashMap<>();
    
    /**
     * Create an empty table.
     *
     * @param sym Symbol of the binding that holds the dispatch function
     */
    public MethodImplCache(Symbol sym) {
        if (sym == null) {
            throw new IllegalArgumentException("Symbol cannot be null");
        }
        this.sym = sym;
    }
    
    public Symbol sym() {
        return sym;
    }
    
    void register(Class<?> type, Fn impl) {
        impls.put(type, impl);
        resolved.clear();
    }
    
    /**
     * Find the implementation for a receiver class: the class itself, its
     * superclasses, then its interfaces breadth first.
     *
     * @param type Receiver class
     * @return The implementation, if one is registered
     */
    public Optional<Fn> lookup(Class<?> type) {
        return resolved.computeIfAbsent(type, this::findImpl);
    }
    
    private Optional<Fn> findImpl(Class<?> type) {
        Deque<Class<?>> interfaces = new ArrayDeque<>();
        for (Class<?> current = type; current != null; current = current.getSuperclass()) {
            Fn impl = impls.get(current);
            if (impl != null) {
                return Optional.of(impl);
            }
            interfaces.addAll(Arrays.asList(current.getInterfaces()));
        }
        Set<Class<?>> seen = new HashSet<>();
        while (!interfaces.isEmpty()) {
            Class<?> candidate = interfaces.removeFirst();
            if (seen.add(candidate)) {
                Fn impl = impls.get(candidate);
                if (impl != null) {
                    return Optional.of(impl);
                }
                interfaces.addAll(Arrays.asList(candidate.getInterfaces()));
            }
        }
        return Optional.empty();
    }
}
