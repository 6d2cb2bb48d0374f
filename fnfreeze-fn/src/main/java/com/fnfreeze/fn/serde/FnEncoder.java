package com.fnfreeze.fn.serde;

import com.fnfreeze.fn.Fn;
import com.fnfreeze.serde.StreamSerializer;
import org.msgpack.core.MessagePacker;

import java.io.IOException;

/**
 * Writes the payload of callables of one runtime type. Encoders are
 * immutable and may be shared between threads and engines.
 */
public interface FnEncoder {
    /**
     * Shape this encoder writes for a callable.
     *
     * @param fn Callable of the encoder's type
     * @return The shape
     */
    FnShape shape(Fn fn);
    
    /**
     * Write the payload for a callable.
     *
     * @param fn Callable to write
     * @param out Packer positioned after the extension marker
     * @param engine Engine used for nested values
     * @throws IOException If packing fails
     */
    void encode(Fn fn, MessagePacker out, StreamSerializer engine) throws IOException;
}
