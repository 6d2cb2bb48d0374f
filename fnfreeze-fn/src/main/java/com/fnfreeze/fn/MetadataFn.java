package com.fnfreeze.fn;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A callable decorated with a metadata map. Invocation is forwarded to the
 * wrapped callable; the metadata plays no part in it.
 */
public final class MetadataFn implements Fn {
    private final Fn fn;
    private final Map<Object, Object> meta;
    
    /**
     * Wrap a callable. Wrapping a {@code MetadataFn} replaces its metadata
     * instead of nesting wrappers.
     *
     * @param fn Callable to wrap
     * @param meta Metadata to attach
     */
    public MetadataFn(Fn fn, Map<?, ?> meta) {
        if (fn == null) {
            throw new IllegalArgumentException("Fn cannot be null");
        }
        if (meta == null) {
            throw new IllegalArgumentException("Metadata cannot be null");
        }
        this.fn = fn instanceof MetadataFn ? ((MetadataFn) fn).unwrap() : fn;
        this.meta = Collections.unmodifiableMap(new LinkedHashMap<>(meta));
    }
    
    /**
     * Get the wrapped callable.
     *
     * @return The callable without metadata
     */
    public Fn unwrap() {
        return fn;
    }
    
    @Override
    public Object invoke(Object... args) {
        return fn.invoke(args);
    }
    
    @Override
    public Map<Object, Object> meta() {
        return meta;
    }
    
    @Override
    public Fn withMeta(Map<?, ?> meta) {
        return new MetadataFn(fn, meta);
    }
    
    @Override
    public String toString() {
        return "MetadataFn[" + fn + ", " + meta + "]";
    }
}
