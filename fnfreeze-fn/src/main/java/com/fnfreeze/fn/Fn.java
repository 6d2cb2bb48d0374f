package com.fnfreeze.fn;

import java.util.Map;

/**
 * A callable value.
 *
 * <p>Callables can be frozen when they are either stored in a static field
 * (and so have a global name) or are instances of a concrete class whose
 * non-static fields hold everything they captured.
 */
@FunctionalInterface
public interface Fn {
    /**
     * Invoke the callable.
     *
     * @param args Arguments
     * @return Result of the call
     */
    Object invoke(Object... args);
    
    /**
     * Get the metadata attached to this callable.
     *
     * @return Unmodifiable metadata map, empty when none is attached
     */
    default Map<Object, Object> meta() {
        return Map.of();
    }
    
    /**
     * Return a callable that behaves like this one and carries the given metadata.
     *
     * @param meta Metadata to attach
     * @return A metadata-carrying wrapper around this callable
     */
    default Fn withMeta(Map<?, ?> meta) {
        return new MetadataFn(this, meta);
    }
}
