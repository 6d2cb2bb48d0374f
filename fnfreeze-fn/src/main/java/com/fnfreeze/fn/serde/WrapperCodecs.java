package com.fnfreeze.fn.serde;

import com.fnfreeze.fn.AbstractFn;
import com.fnfreeze.fn.Fn;
import com.fnfreeze.fn.MetadataFn;
import com.fnfreeze.serde.SerializationException;
import com.fnfreeze.serde.StreamSerializer;
import org.msgpack.core.MessagePacker;
import org.msgpack.core.MessageUnpacker;

import java.io.IOException;
import java.util.Map;

/**
 * Stream hooks for the two delegating wrappers. Each writes a little of its
 * own state and hands the wrapped callable back to the engine.
 */
final class WrapperCodecs {
    private final StreamSerializer engine;
    
    WrapperCodecs(StreamSerializer engine) {
        this.engine = engine;
    }
    
    /**
     * Write the metadata map, then the unwrapped callable.
     */
    void writeMeta(MessagePacker out, MetadataFn fn) throws IOException {
        engine.freezeToOut(out, fn.meta());
        engine.freezeToOut(out, fn.unwrap());
    }
    
    Object readMeta(MessageUnpacker in) throws IOException {
        Object meta = engine.thawFromIn(in);
        if (!(meta instanceof Map)) {
            throw new SerializationException("Malformed fn metadata: expected a map, got " + describe(meta));
        }
        Object fn = engine.thawFromIn(in);
        if (!(fn instanceof Fn)) {
            throw new SerializationException("Malformed fn metadata: expected a callable, got " + describe(fn));
        }
        return ((Fn) fn).withMeta((Map<?, ?>) meta);
    }
    
    /**
     * Write the enclosing callable. The shim itself has no other state.
     */
    void writeApplier(MessagePacker out, AbstractFn.Applier applier) throws IOException {
        engine.freezeToOut(out, applier.target());
    }
    
    Object readApplier(MessageUnpacker in) throws IOException {
        Object target = engine.thawFromIn(in);
        if (!(target instanceof AbstractFn)) {
            throw new SerializationException("Malformed fn applier: expected an AbstractFn, got " + describe(target));
        }
        return ((AbstractFn) target).applier();
    }
    
    static String describe(Object value) {
        return value == null ? "null" : value.getClass().getName();
    }
}
